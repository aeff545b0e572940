package tw.gc.arya.trader.strategy;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Set;

/**
 * Validated, immutable strategy configuration.
 *
 * Built once at startup (see {@code StrategyProperties#toParameters()}) and shared by
 * the filters, the signal detector and the position manager. {@link #validate()} fails
 * fast on any out-of-domain value; the engine must never run with an invalid set.
 */
@Value
@Builder(toBuilder = true)
public class StrategyParameters {

    public static final double OSCILLATOR_MIN = 0.0;
    public static final double OSCILLATOR_MAX = 100.0;

    /** Days with an explicit "trading disabled" flag. Days not listed are tradable. */
    @Builder.Default
    Set<DayOfWeek> disabledDays = Set.of();

    LocalTime sessionStart;
    LocalTime sessionEnd;

    int rangeLookback;
    BigDecimal minRange;

    int adxPeriod;
    int smaPeriod;
    int stochasticPeriod;
    @Builder.Default
    int stochasticKSmoothing = 3;
    @Builder.Default
    int stochasticDSmoothing = 3;

    double minAdxLong;
    double minAdxShort;

    int stopTicks;
    int profitTicks;
    BigDecimal stopAcceleration;

    double buyLevel;
    double sellLevel;

    public void validate() {
        if (disabledDays == null) {
            throw new IllegalArgumentException("disabledDays must not be null");
        }
        if (sessionStart == null || sessionEnd == null) {
            throw new IllegalArgumentException("Session window start and end must be set");
        }
        requirePositive(rangeLookback, "rangeLookback");
        if (minRange == null || minRange.signum() < 0) {
            throw new IllegalArgumentException("minRange must be non-negative, got " + minRange);
        }
        requirePositive(adxPeriod, "adxPeriod");
        requirePositive(smaPeriod, "smaPeriod");
        requirePositive(stochasticPeriod, "stochasticPeriod");
        requirePositive(stochasticKSmoothing, "stochasticKSmoothing");
        requirePositive(stochasticDSmoothing, "stochasticDSmoothing");
        if (minAdxLong < 0.0 || Double.isNaN(minAdxLong)) {
            throw new IllegalArgumentException("minAdxLong must be >= 0, got " + minAdxLong);
        }
        if (minAdxShort < 0.0 || Double.isNaN(minAdxShort)) {
            throw new IllegalArgumentException("minAdxShort must be >= 0, got " + minAdxShort);
        }
        requirePositive(stopTicks, "stopTicks");
        requirePositive(profitTicks, "profitTicks");
        if (stopAcceleration == null || stopAcceleration.signum() <= 0) {
            throw new IllegalArgumentException("stopAcceleration must be > 0, got " + stopAcceleration);
        }
        requireOscillatorLevel(buyLevel, "buyLevel");
        requireOscillatorLevel(sellLevel, "sellLevel");
        if (buyLevel <= sellLevel) {
            throw new IllegalArgumentException(
                    String.format("buyLevel (%.2f) must be greater than sellLevel (%.2f)", buyLevel, sellLevel));
        }
    }

    /**
     * Bars needed before every indicator and the volatility filter can produce two values.
     */
    public int requiredHistory() {
        int stochastic = stochasticPeriod + stochasticKSmoothing + stochasticDSmoothing - 1;
        int adx = 2 * adxPeriod + 1;
        int sma = smaPeriod + 1;
        return Math.max(rangeLookback, Math.max(stochastic, Math.max(adx, sma)));
    }

    private static void requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }

    private static void requireOscillatorLevel(double value, String name) {
        if (Double.isNaN(value) || value < OSCILLATOR_MIN || value > OSCILLATOR_MAX) {
            throw new IllegalArgumentException(
                    String.format("%s must be within [%.0f, %.0f], got %s", name, OSCILLATOR_MIN, OSCILLATOR_MAX, value));
        }
    }
}
