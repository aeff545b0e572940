package tw.gc.arya.trader.indicators;

import java.util.Optional;

/**
 * Indicator values the strategy reads each bar.
 *
 * Every accessor is empty while the indicator is still warming up; callers treat that
 * as "no information" rather than an error.
 */
public interface IndicatorService {

    /** Stochastic %D (0..100). */
    Optional<IndicatorPair> stochasticD();

    /** Average directional index. */
    Optional<IndicatorPair> adx();

    /** Simple moving average of closes. */
    Optional<IndicatorPair> sma();

    /** Drop any cached values (new run). */
    default void reset() {
        // Default: nothing cached
    }
}
