package tw.gc.arya.trader.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import tw.gc.arya.trader.strategy.StrategyParameters;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.EnumSet;
import java.util.Set;

/**
 * Raw strategy settings bound from {@code arya.strategy.*}.
 *
 * Defaults are the tuned values for 30-minute Euro FX bars. The engine never reads
 * this class directly: {@link #toParameters()} converts it once into a validated
 * {@link StrategyParameters}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "arya.strategy")
public class StrategyProperties {

    private TradingDays tradingDays = new TradingDays();
    private Window window = new Window();

    // Volatility filter
    private int rangeLookback = 10;
    private BigDecimal minRange = new BigDecimal("0.002");

    // Indicator periods
    private int adxPeriod = 14;
    private int smaPeriod = 78;
    private int stochasticPeriod = 68;
    private int stochasticKSmoothing = 3;
    private int stochasticDSmoothing = 3;

    // Trend strength
    private double minAdxLong = 12.0;
    private double minAdxShort = 12.0;

    // Exits
    private int stopTicks = 24;
    private int profitTicks = 77;
    private BigDecimal stopAcceleration = new BigDecimal("0.2");

    // Stochastic %D break levels
    private double buyLevel = 51.0;
    private double sellLevel = 49.0;

    // Bars kept for look-back and indicator warm-up
    private int historyCapacity = 500;

    @Data
    public static class TradingDays {
        private boolean monday = true;
        private boolean tuesday = true;
        private boolean wednesday = false;
        private boolean thursday = false;
        private boolean friday = true;
    }

    @Data
    public static class Window {
        private String start = "18:00";
        private String end = "06:00";
    }

    public StrategyParameters toParameters() {
        StrategyParameters parameters = StrategyParameters.builder()
                .disabledDays(disabledDays())
                .sessionStart(parseTime("arya.strategy.window.start", window.getStart()))
                .sessionEnd(parseTime("arya.strategy.window.end", window.getEnd()))
                .rangeLookback(rangeLookback)
                .minRange(minRange)
                .adxPeriod(adxPeriod)
                .smaPeriod(smaPeriod)
                .stochasticPeriod(stochasticPeriod)
                .stochasticKSmoothing(stochasticKSmoothing)
                .stochasticDSmoothing(stochasticDSmoothing)
                .minAdxLong(minAdxLong)
                .minAdxShort(minAdxShort)
                .stopTicks(stopTicks)
                .profitTicks(profitTicks)
                .stopAcceleration(stopAcceleration)
                .buyLevel(buyLevel)
                .sellLevel(sellLevel)
                .build();
        parameters.validate();
        return parameters;
    }

    private Set<DayOfWeek> disabledDays() {
        Set<DayOfWeek> disabled = EnumSet.noneOf(DayOfWeek.class);
        if (!tradingDays.isMonday()) disabled.add(DayOfWeek.MONDAY);
        if (!tradingDays.isTuesday()) disabled.add(DayOfWeek.TUESDAY);
        if (!tradingDays.isWednesday()) disabled.add(DayOfWeek.WEDNESDAY);
        if (!tradingDays.isThursday()) disabled.add(DayOfWeek.THURSDAY);
        if (!tradingDays.isFriday()) disabled.add(DayOfWeek.FRIDAY);
        return disabled;
    }

    static LocalTime parseTime(String property, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(property + " must be set (HH:mm)");
        }
        try {
            return LocalTime.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(property + " is not a valid time of day: " + value, e);
        }
    }
}
