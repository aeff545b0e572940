package tw.gc.arya.trader.strategy;

import tw.gc.arya.trader.entities.Bar;
import tw.gc.arya.trader.history.BarHistory;
import tw.gc.arya.trader.indicators.IndicatorPair;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Optional;
import java.util.Set;

/**
 * Entry filters. Pure functions evaluated fresh on every bar.
 */
public final class EntryFilters {

    private EntryFilters() {
        throw new AssertionError("Utility class");
    }

    /**
     * False only for a day whose trading flag is explicitly disabled.
     */
    public static boolean dayAllowed(DayOfWeek day, Set<DayOfWeek> disabledDays) {
        return !disabledDays.contains(day);
    }

    /**
     * Inclusive session window; {@code start > end} means the window wraps past midnight.
     */
    public static boolean timeAllowed(LocalTime time, LocalTime start, LocalTime end) {
        if (!start.isAfter(end)) {
            return !time.isBefore(start) && !time.isAfter(end);
        }
        return !time.isBefore(start) || !time.isAfter(end);
    }

    /**
     * Highest high minus lowest low of the last {@code lookback} bars must exceed
     * {@code minRange} strictly. Not enough bars yet means not allowed.
     */
    public static boolean volatilityAllowed(BarHistory history, int lookback, BigDecimal minRange) {
        Optional<BigDecimal> highest = history.highestHigh(lookback);
        Optional<BigDecimal> lowest = history.lowestLow(lookback);
        if (highest.isEmpty() || lowest.isEmpty()) {
            return false;
        }
        return highest.get().subtract(lowest.get()).compareTo(minRange) > 0;
    }

    public static boolean trendStrengthAllowed(double adxNow, double minAdx) {
        return adxNow >= minAdx;
    }

    public static boolean trendBullish(double smaNow, double smaPrev) {
        return smaNow > smaPrev;
    }

    public static boolean trendBearish(double smaNow, double smaPrev) {
        return smaNow < smaPrev;
    }

    /**
     * Evaluate every gate for the current bar.
     */
    public static FilterGates evaluate(StrategyParameters parameters, Bar bar, BarHistory history,
                                       IndicatorPair adx, IndicatorPair sma, boolean flat) {
        return new FilterGates(
                dayAllowed(bar.getDayOfWeek(), parameters.getDisabledDays()),
                timeAllowed(bar.getTimeOfDay(), parameters.getSessionStart(), parameters.getSessionEnd()),
                volatilityAllowed(history, parameters.getRangeLookback(), parameters.getMinRange()),
                flat,
                trendStrengthAllowed(adx.current(), parameters.getMinAdxLong()),
                trendBullish(sma.current(), sma.previous()),
                trendStrengthAllowed(adx.current(), parameters.getMinAdxShort()),
                trendBearish(sma.current(), sma.previous()));
    }
}
