package tw.gc.arya.trader.indicators;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Utility class for calculating technical indicators.
 *
 * All inputs are oldest first. Series methods return one value per computable index,
 * oldest first, and an empty list when there is not enough data.
 */
public final class TechnicalIndicatorCalculator {

    private static final double EPSILON = 1e-12;
    private static final double STOCHASTIC_NEUTRAL = 50.0;

    private TechnicalIndicatorCalculator() {
        throw new AssertionError("Utility class");
    }

    public static List<Double> simpleMovingAverageSeries(List<Double> values, int period) {
        Objects.requireNonNull(values, "values");
        validatePositive(period, "period");
        if (values.size() < period) {
            return Collections.emptyList();
        }
        List<Double> series = new ArrayList<>(values.size() - period + 1);
        double sum = 0.0;
        for (int i = 0; i < values.size(); i++) {
            sum += values.get(i);
            if (i >= period) {
                sum -= values.get(i - period);
            }
            if (i >= period - 1) {
                series.add(sum / period);
            }
        }
        return series;
    }

    /**
     * Slow stochastic %D.
     * Fast %K over {@code period}, smoothed by {@code kSmoothing} into slow %K, then
     * {@code dSmoothing} into %D. A flat high/low range yields a neutral 50.
     */
    public static List<Double> stochasticDSeries(List<Double> highs, List<Double> lows, List<Double> closes,
                                                 int period, int kSmoothing, int dSmoothing) {
        validateSameLength(highs, lows, closes);
        validatePositive(period, "period");
        validatePositive(kSmoothing, "kSmoothing");
        validatePositive(dSmoothing, "dSmoothing");
        if (closes.size() < period) {
            return Collections.emptyList();
        }

        List<Double> fastK = new ArrayList<>(closes.size() - period + 1);
        for (int i = period - 1; i < closes.size(); i++) {
            double highest = Double.NEGATIVE_INFINITY;
            double lowest = Double.POSITIVE_INFINITY;
            for (int j = i - period + 1; j <= i; j++) {
                highest = Math.max(highest, highs.get(j));
                lowest = Math.min(lowest, lows.get(j));
            }
            double range = highest - lowest;
            fastK.add(range < EPSILON ? STOCHASTIC_NEUTRAL : 100.0 * (closes.get(i) - lowest) / range);
        }

        List<Double> slowK = simpleMovingAverageSeries(fastK, kSmoothing);
        return simpleMovingAverageSeries(slowK, dSmoothing);
    }

    /**
     * Wilder's average directional index.
     * First value needs {@code 2 * period} bars.
     */
    public static List<Double> averageDirectionalIndexSeries(List<Double> highs, List<Double> lows,
                                                             List<Double> closes, int period) {
        validateSameLength(highs, lows, closes);
        validatePositive(period, "period");
        int n = closes.size();
        if (n < 2 * period) {
            return Collections.emptyList();
        }

        double[] tr = new double[n];
        double[] plusDm = new double[n];
        double[] minusDm = new double[n];
        for (int i = 1; i < n; i++) {
            double high = highs.get(i);
            double low = lows.get(i);
            double prevClose = closes.get(i - 1);
            tr[i] = Math.max(high - low, Math.max(Math.abs(high - prevClose), Math.abs(low - prevClose)));
            double upMove = high - highs.get(i - 1);
            double downMove = lows.get(i - 1) - low;
            plusDm[i] = (upMove > downMove && upMove > 0) ? upMove : 0.0;
            minusDm[i] = (downMove > upMove && downMove > 0) ? downMove : 0.0;
        }

        // Wilder sums seeded with the first `period` moves
        double smoothedTr = 0.0;
        double smoothedPlus = 0.0;
        double smoothedMinus = 0.0;
        for (int i = 1; i <= period; i++) {
            smoothedTr += tr[i];
            smoothedPlus += plusDm[i];
            smoothedMinus += minusDm[i];
        }

        List<Double> dx = new ArrayList<>(n - period);
        dx.add(directionalIndex(smoothedTr, smoothedPlus, smoothedMinus));
        for (int i = period + 1; i < n; i++) {
            smoothedTr = smoothedTr - (smoothedTr / period) + tr[i];
            smoothedPlus = smoothedPlus - (smoothedPlus / period) + plusDm[i];
            smoothedMinus = smoothedMinus - (smoothedMinus / period) + minusDm[i];
            dx.add(directionalIndex(smoothedTr, smoothedPlus, smoothedMinus));
        }

        List<Double> adx = new ArrayList<>(dx.size() - period + 1);
        double current = average(dx.subList(0, period));
        adx.add(current);
        for (int i = period; i < dx.size(); i++) {
            current = (current * (period - 1) + dx.get(i)) / period;
            adx.add(current);
        }
        return adx;
    }

    /**
     * Last two values of a series, or empty when it has fewer than two.
     */
    public static Optional<IndicatorPair> lastTwo(List<Double> series) {
        Objects.requireNonNull(series, "series");
        if (series.size() < 2) {
            return Optional.empty();
        }
        return Optional.of(new IndicatorPair(series.get(series.size() - 1), series.get(series.size() - 2)));
    }

    private static double directionalIndex(double smoothedTr, double smoothedPlus, double smoothedMinus) {
        if (smoothedTr < EPSILON) {
            return 0.0;
        }
        double plusDi = 100.0 * smoothedPlus / smoothedTr;
        double minusDi = 100.0 * smoothedMinus / smoothedTr;
        double sum = plusDi + minusDi;
        return sum < EPSILON ? 0.0 : 100.0 * Math.abs(plusDi - minusDi) / sum;
    }

    private static double average(List<Double> values) {
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.size();
    }

    private static void validateSameLength(List<Double> highs, List<Double> lows, List<Double> closes) {
        Objects.requireNonNull(highs, "highs");
        Objects.requireNonNull(lows, "lows");
        Objects.requireNonNull(closes, "closes");
        if (highs.size() != lows.size() || lows.size() != closes.size()) {
            throw new IllegalArgumentException("highs, lows and closes must be the same length");
        }
    }

    private static void validatePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
