package tw.gc.arya.trader.entities;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Execution report pushed by the venue when an order fills.
 */
public record OrderFill(
        String orderId,
        Order.Side side,
        Order.Type type,
        BigDecimal price,
        LocalDateTime timestamp,
        String label
) {}
