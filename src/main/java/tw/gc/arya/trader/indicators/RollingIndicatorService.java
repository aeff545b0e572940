package tw.gc.arya.trader.indicators;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.arya.trader.history.BarHistory;
import tw.gc.arya.trader.strategy.StrategyParameters;

import java.util.Optional;

/**
 * Computes the strategy's indicators from {@link BarHistory} on demand.
 * Values are recomputed at most once per observed bar.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RollingIndicatorService implements IndicatorService {

    private final BarHistory barHistory;
    private final StrategyParameters parameters;

    private long computedAtBar = -1;
    private Optional<IndicatorPair> stochasticD = Optional.empty();
    private Optional<IndicatorPair> adx = Optional.empty();
    private Optional<IndicatorPair> sma = Optional.empty();

    @Override
    public Optional<IndicatorPair> stochasticD() {
        refresh();
        return stochasticD;
    }

    @Override
    public Optional<IndicatorPair> adx() {
        refresh();
        return adx;
    }

    @Override
    public Optional<IndicatorPair> sma() {
        refresh();
        return sma;
    }

    @Override
    public void reset() {
        computedAtBar = -1;
        stochasticD = Optional.empty();
        adx = Optional.empty();
        sma = Optional.empty();
    }

    private void refresh() {
        long barsSeen = barHistory.getBarsSeen();
        if (barsSeen == computedAtBar) {
            return;
        }
        var highs = barHistory.highs();
        var lows = barHistory.lows();
        var closes = barHistory.closes();

        stochasticD = TechnicalIndicatorCalculator.lastTwo(TechnicalIndicatorCalculator.stochasticDSeries(
                highs, lows, closes,
                parameters.getStochasticPeriod(),
                parameters.getStochasticKSmoothing(),
                parameters.getStochasticDSmoothing()));
        adx = TechnicalIndicatorCalculator.lastTwo(TechnicalIndicatorCalculator.averageDirectionalIndexSeries(
                highs, lows, closes, parameters.getAdxPeriod()));
        sma = TechnicalIndicatorCalculator.lastTwo(TechnicalIndicatorCalculator.simpleMovingAverageSeries(
                closes, parameters.getSmaPeriod()));
        computedAtBar = barsSeen;

        log.trace("Indicators at bar {}: %D={} ADX={} SMA={}", barsSeen, stochasticD, adx, sma);
    }
}
