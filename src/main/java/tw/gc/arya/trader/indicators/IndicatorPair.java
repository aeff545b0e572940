package tw.gc.arya.trader.indicators;

/**
 * Last two values of an indicator series: {@code current} is [0], {@code previous} is [1].
 */
public record IndicatorPair(double current, double previous) {}
