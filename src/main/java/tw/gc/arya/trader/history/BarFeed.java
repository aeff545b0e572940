package tw.gc.arya.trader.history;

import tw.gc.arya.trader.entities.Bar;

import java.util.stream.Stream;

/**
 * Source of bars for one run.
 *
 * Each call to {@link #stream()} starts again from the first bar. Streams are lazy and
 * forward-only and must be closed by the caller.
 */
public interface BarFeed {

    Stream<Bar> stream();

    /** Human-readable description for logging. */
    String describe();
}
