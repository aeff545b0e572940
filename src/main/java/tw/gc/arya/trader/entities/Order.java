package tw.gc.arya.trader.entities;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Order request sent to the execution venue.
 *
 * The stop and the profit target of a trade name each other in {@code linkedOrderId}:
 * when one fills the venue cancels the other. The link is an identifier only and is
 * never followed for decision logic.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Order {

    /**
     * Client order id, e.g. "ARYA-12"
     */
    private String id;

    private Side side;

    @Builder.Default
    private int quantity = 1;

    private Type type;

    /**
     * Trigger price for STOP, limit price for LIMIT, null for MARKET
     */
    private BigDecimal price;

    private String label;

    /**
     * Id of the one-cancels-other counterpart, null if none
     */
    private String linkedOrderId;

    public enum Side {
        BUY,
        SELL;

        public Side opposite() {
            return this == BUY ? SELL : BUY;
        }
    }

    public enum Type {
        MARKET,
        STOP,
        LIMIT
    }

    public boolean isLinked() {
        return linkedOrderId != null;
    }
}
