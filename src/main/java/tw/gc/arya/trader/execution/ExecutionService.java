package tw.gc.arya.trader.execution;

import tw.gc.arya.trader.entities.Order;

/**
 * Order routing collaborator.
 *
 * Calls are synchronous and non-blocking from the strategy's point of view. Fills come
 * back asynchronously as {@link tw.gc.arya.trader.entities.OrderFill} notifications.
 * Implementations must treat orders carrying a {@code linkedOrderId} as one-cancels-other.
 */
public interface ExecutionService {

    void insertOrder(Order order);

    /**
     * Replace price and label of a working order.
     *
     * @return {@code false} if the venue no longer knows the order
     */
    boolean modifyOrder(Order order);

    /**
     * @return {@code false} if the venue no longer knows the order
     */
    boolean cancelOrder(Order order);
}
