package tw.gc.arya.trader.services;

import tw.gc.arya.trader.entities.Order;
import tw.gc.arya.trader.entities.PositionSide;

/**
 * Everything that exists only while a position is open: the protective pair and the
 * trailing state. The stop order's price is updated in place as the stop trails.
 */
public record OpenTrade(
        PositionSide side,
        Order entryOrder,
        Order stopOrder,
        Order targetOrder,
        TrailingState trailingState
) {

    public boolean isProtectiveOrder(String orderId) {
        return stopOrder.getId().equals(orderId) || targetOrder.getId().equals(orderId);
    }
}
