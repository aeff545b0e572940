package tw.gc.arya.trader.strategy;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tw.gc.arya.trader.indicators.IndicatorPair;

/**
 * Stochastic %D band breakout.
 *
 * <ul>
 *   <li>LONG: long-eligible and %D[1] &lt;= buy level &lt; %D[0]</li>
 *   <li>SHORT: short-eligible and %D[1] &gt;= sell level &gt; %D[0]</li>
 * </ul>
 * Long is checked first and wins if both hold.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SignalDetector {

    private final StrategyParameters parameters;

    public TradeSignal detect(FilterGates gates, IndicatorPair stochasticD) {
        double buyLevel = parameters.getBuyLevel();
        double sellLevel = parameters.getSellLevel();

        if (gates.longEligible() && crossedAbove(stochasticD, buyLevel)) {
            return TradeSignal.longSignal(String.format(
                    "%%D crossed above %.2f (%.2f -> %.2f)", buyLevel, stochasticD.previous(), stochasticD.current()));
        } else if (gates.shortEligible() && crossedBelow(stochasticD, sellLevel)) {
            return TradeSignal.shortSignal(String.format(
                    "%%D crossed below %.2f (%.2f -> %.2f)", sellLevel, stochasticD.previous(), stochasticD.current()));
        }

        log.trace("No entry: gates={} %D={}", gates, stochasticD);
        return TradeSignal.neutral(describeRejection(gates));
    }

    static boolean crossedAbove(IndicatorPair series, double level) {
        return series.previous() <= level && series.current() > level;
    }

    static boolean crossedBelow(IndicatorPair series, double level) {
        return series.previous() >= level && series.current() < level;
    }

    private static String describeRejection(FilterGates gates) {
        if (!gates.flat()) return "Position open";
        if (!gates.dayAllowed()) return "Day disabled";
        if (!gates.timeAllowed()) return "Outside trading window";
        if (!gates.volatilityAllowed()) return "Range below minimum";
        if (!gates.longEligible() && !gates.shortEligible()) return "No qualifying trend";
        return "No %D band cross";
    }
}
