package tw.gc.arya.trader.history;

import lombok.extern.slf4j.Slf4j;
import tw.gc.arya.trader.entities.Bar;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Bounded look-back over the most recent bars.
 *
 * Index 0 is the current bar, 1 the previous one, and so on. Every accessor returns an
 * empty {@link Optional} when fewer bars than requested have been observed, so callers
 * treat "not enough history yet" as missing information instead of reading garbage.
 */
@Slf4j
public class BarHistory {

    private final int capacity;
    private final Deque<Bar> bars = new ArrayDeque<>();
    private long barsSeen;

    public BarHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("History capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Append the newest bar. Bars must arrive in strictly increasing timestamp order.
     */
    public void add(Bar bar) {
        Objects.requireNonNull(bar, "bar");
        Objects.requireNonNull(bar.getTimestamp(), "bar.timestamp");
        Bar last = bars.peekLast();
        if (last != null && !bar.getTimestamp().isAfter(last.getTimestamp())) {
            throw new IllegalArgumentException(String.format(
                    "Bar %s is not after previous bar %s", bar.getTimestamp(), last.getTimestamp()));
        }
        bars.addLast(bar);
        if (bars.size() > capacity) {
            bars.removeFirst();
        }
        barsSeen++;
    }

    /**
     * @param barsBack 0 for the current bar, 1 for the previous one
     */
    public Optional<Bar> history(int barsBack) {
        if (barsBack < 0) {
            throw new IllegalArgumentException("barsBack must be >= 0, got " + barsBack);
        }
        if (barsBack >= bars.size()) {
            return Optional.empty();
        }
        Iterator<Bar> newestFirst = bars.descendingIterator();
        for (int i = 0; i < barsBack; i++) {
            newestFirst.next();
        }
        return Optional.of(newestFirst.next());
    }

    public Optional<Bar> current() {
        return Optional.ofNullable(bars.peekLast());
    }

    /** Highest high of the last {@code lookback} bars, current bar included. */
    public Optional<BigDecimal> highestHigh(int lookback) {
        return window(lookback).map(window -> window.stream()
                .map(Bar::getHigh)
                .reduce(BigDecimal::max)
                .orElseThrow());
    }

    /** Lowest low of the last {@code lookback} bars, current bar included. */
    public Optional<BigDecimal> lowestLow(int lookback) {
        return window(lookback).map(window -> window.stream()
                .map(Bar::getLow)
                .reduce(BigDecimal::min)
                .orElseThrow());
    }

    public List<Double> highs() {
        return series(Bar::getHigh);
    }

    public List<Double> lows() {
        return series(Bar::getLow);
    }

    public List<Double> closes() {
        return series(Bar::getClose);
    }

    public int size() {
        return bars.size();
    }

    public int getCapacity() {
        return capacity;
    }

    /** Total bars observed since the last {@link #clear()}, including evicted ones. */
    public long getBarsSeen() {
        return barsSeen;
    }

    public void clear() {
        bars.clear();
        barsSeen = 0;
        log.debug("Bar history cleared");
    }

    private Optional<List<Bar>> window(int lookback) {
        if (lookback <= 0) {
            throw new IllegalArgumentException("lookback must be positive, got " + lookback);
        }
        if (lookback > bars.size()) {
            return Optional.empty();
        }
        List<Bar> window = new ArrayList<>(lookback);
        Iterator<Bar> newestFirst = bars.descendingIterator();
        for (int i = 0; i < lookback; i++) {
            window.add(newestFirst.next());
        }
        return Optional.of(window);
    }

    // Oldest first, as the indicator calculator expects
    private List<Double> series(Function<Bar, BigDecimal> field) {
        List<Double> values = new ArrayList<>(bars.size());
        for (Bar bar : bars) {
            values.add(field.apply(bar).doubleValue());
        }
        return values;
    }
}
