package tw.gc.arya.trader.strategy;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Entry decision for one bar.
 * Contains direction and reasoning.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeSignal {

    /**
     * Signal direction
     */
    private SignalDirection direction;

    /**
     * Human-readable reason for the signal
     */
    private String reason;

    /**
     * Signal direction enum
     */
    public enum SignalDirection {
        LONG,    // Enter long
        SHORT,   // Enter short
        NEUTRAL  // No entry this bar
    }

    /**
     * Create a NEUTRAL signal (no action)
     */
    public static TradeSignal neutral(String reason) {
        return TradeSignal.builder()
                .direction(SignalDirection.NEUTRAL)
                .reason(reason)
                .build();
    }

    /**
     * Create a LONG signal (buy)
     */
    public static TradeSignal longSignal(String reason) {
        return TradeSignal.builder()
                .direction(SignalDirection.LONG)
                .reason(reason)
                .build();
    }

    /**
     * Create a SHORT signal (sell)
     */
    public static TradeSignal shortSignal(String reason) {
        return TradeSignal.builder()
                .direction(SignalDirection.SHORT)
                .reason(reason)
                .build();
    }

    public boolean isEntry() {
        return direction == SignalDirection.LONG || direction == SignalDirection.SHORT;
    }
}
