package tw.gc.arya.trader.indicators;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TechnicalIndicatorCalculatorTest {

    @Test
    void testSimpleMovingAverageInsufficientData() {
        var prices = List.of(1.0, 2.0);
        assertTrue(TechnicalIndicatorCalculator.simpleMovingAverageSeries(prices, 3).isEmpty());
    }

    @Test
    void testSimpleMovingAverageSeries() {
        var prices = List.of(1.0, 2.0, 3.0, 4.0, 5.0);
        var series = TechnicalIndicatorCalculator.simpleMovingAverageSeries(prices, 3);
        assertEquals(3, series.size());
        assertEquals(2.0, series.get(0), 1e-6);
        assertEquals(3.0, series.get(1), 1e-6);
        assertEquals(4.0, series.get(2), 1e-6);
    }

    @Test
    void testStochasticUnsmoothed() {
        var highs = List.of(10.0, 11.0, 12.0, 13.0);
        var lows = List.of(8.0, 9.0, 10.0, 11.0);
        var closes = List.of(9.0, 10.0, 12.0, 11.0);
        var series = TechnicalIndicatorCalculator.stochasticDSeries(highs, lows, closes, 3, 1, 1);
        assertEquals(2, series.size());
        assertEquals(100.0, series.get(0), 1e-6);
        assertEquals(50.0, series.get(1), 1e-6);
    }

    @Test
    void testStochasticSmoothingAveragesFastK() {
        // Fast %K alternates 100, 50, 100, 50 ... with period 1
        var highs = List.of(12.0, 12.0, 12.0, 12.0, 12.0, 12.0);
        var lows = List.of(10.0, 10.0, 10.0, 10.0, 10.0, 10.0);
        var closes = List.of(12.0, 11.0, 12.0, 11.0, 12.0, 11.0);
        var series = TechnicalIndicatorCalculator.stochasticDSeries(highs, lows, closes, 1, 2, 2);
        assertEquals(4, series.size());
        for (double d : series) {
            assertEquals(75.0, d, 1e-6);
        }
    }

    @Test
    void testStochasticCloseAtHighIsHundred() {
        var highs = new ArrayList<Double>();
        var lows = new ArrayList<Double>();
        var closes = new ArrayList<Double>();
        for (int i = 0; i < 10; i++) {
            highs.add(1.10 + i * 0.001);
            lows.add(1.09 + i * 0.001);
            closes.add(1.10 + i * 0.001);
        }
        var pair = TechnicalIndicatorCalculator.lastTwo(
                TechnicalIndicatorCalculator.stochasticDSeries(highs, lows, closes, 5, 3, 3));
        assertTrue(pair.isPresent());
        assertEquals(100.0, pair.get().current(), 1e-6);
        assertEquals(100.0, pair.get().previous(), 1e-6);
    }

    @Test
    void testStochasticFlatRangeIsNeutral() {
        var flat = Collections.nCopies(12, 1.1);
        var series = TechnicalIndicatorCalculator.stochasticDSeries(flat, flat, flat, 5, 3, 3);
        assertFalse(series.isEmpty());
        series.forEach(d -> assertEquals(50.0, d, 1e-6));
    }

    @Test
    void testStochasticWarmup() {
        var values = Collections.nCopies(9, 1.1);
        // 5 + 3 + 3 - 1 = 10 bars for the first two %D values
        var series = TechnicalIndicatorCalculator.stochasticDSeries(values, values, values, 5, 3, 3);
        assertEquals(1, series.size());
        assertTrue(TechnicalIndicatorCalculator.lastTwo(series).isEmpty());
    }

    @Test
    void testAdxSteadyUptrend() {
        var highs = new ArrayList<Double>();
        var lows = new ArrayList<Double>();
        var closes = new ArrayList<Double>();
        for (int i = 0; i < 7; i++) {
            highs.add(i + 1.0);
            lows.add((double) i);
            closes.add(i + 0.5);
        }
        var series = TechnicalIndicatorCalculator.averageDirectionalIndexSeries(highs, lows, closes, 3);
        assertEquals(2, series.size());
        assertEquals(100.0, series.get(0), 1e-6);
        assertEquals(100.0, series.get(1), 1e-6);
    }

    @Test
    void testAdxFlatMarketIsZero() {
        var flat = Collections.nCopies(10, 1.1);
        var series = TechnicalIndicatorCalculator.averageDirectionalIndexSeries(flat, flat, flat, 3);
        assertFalse(series.isEmpty());
        series.forEach(adx -> assertEquals(0.0, adx, 1e-6));
    }

    @Test
    void testAdxChoppyMarketIsWeak() {
        var highs = new ArrayList<Double>();
        var lows = new ArrayList<Double>();
        var closes = new ArrayList<Double>();
        for (int i = 0; i < 20; i++) {
            double base = i % 2 == 0 ? 10.0 : 11.0;
            highs.add(base + 1.0);
            lows.add(base - 1.0);
            closes.add(base);
        }
        var series = TechnicalIndicatorCalculator.averageDirectionalIndexSeries(highs, lows, closes, 5);
        assertFalse(series.isEmpty());
        assertTrue(series.get(series.size() - 1) < 25.0);
    }

    @Test
    void testAdxWarmup() {
        var values = Collections.nCopies(6, 1.1);
        assertEquals(1, TechnicalIndicatorCalculator.averageDirectionalIndexSeries(values, values, values, 3).size());
        assertTrue(TechnicalIndicatorCalculator.averageDirectionalIndexSeries(
                values.subList(0, 5), values.subList(0, 5), values.subList(0, 5), 3).isEmpty());
    }

    @Test
    void testLastTwo() {
        var pair = TechnicalIndicatorCalculator.lastTwo(List.of(1.0, 2.0, 3.0));
        assertTrue(pair.isPresent());
        assertEquals(3.0, pair.get().current(), 1e-6);
        assertEquals(2.0, pair.get().previous(), 1e-6);
        assertTrue(TechnicalIndicatorCalculator.lastTwo(List.of(1.0)).isEmpty());
    }

    @Test
    void testMismatchedLengthsRejected() {
        var three = List.of(1.0, 2.0, 3.0);
        var two = List.of(1.0, 2.0);
        assertThrows(IllegalArgumentException.class,
                () -> TechnicalIndicatorCalculator.stochasticDSeries(three, two, three, 2, 1, 1));
        assertThrows(IllegalArgumentException.class,
                () -> TechnicalIndicatorCalculator.averageDirectionalIndexSeries(three, three, two, 1));
    }

    @Test
    void testNonPositivePeriodRejected() {
        var prices = List.of(1.0, 2.0, 3.0);
        assertThrows(IllegalArgumentException.class,
                () -> TechnicalIndicatorCalculator.simpleMovingAverageSeries(prices, 0));
        assertThrows(IllegalArgumentException.class,
                () -> TechnicalIndicatorCalculator.stochasticDSeries(prices, prices, prices, 2, 0, 1));
    }
}
