package tw.gc.arya.trader.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.arya.trader.entities.Order;
import tw.gc.arya.trader.entities.PositionSide;
import tw.gc.arya.trader.execution.ExecutionService;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the single position slot and its linked stop/target pair.
 *
 * <h3>Lifecycle</h3>
 * <ul>
 *   <li>{@link #enter}: FLAT to LONG/SHORT, inserts market, stop, target in that order</li>
 *   <li>{@link #modifyStop}: moves the stop, target untouched</li>
 *   <li>{@link #exit}: cancels stop and target, then inserts the closing market order</li>
 *   <li>{@link #onProtectiveFill}: the venue filled the stop or the target</li>
 * </ul>
 * Preconditions are checked before any request reaches the {@link ExecutionService}, so
 * a rejected call changes nothing.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PositionManager {

    static final String ORDER_ID_PREFIX = "ARYA";

    private final ExecutionService executionService;
    private final AtomicLong idGenerator = new AtomicLong(1);

    private OpenTrade openTrade;

    public PositionSide getPosition() {
        return openTrade == null ? PositionSide.FLAT : openTrade.side();
    }

    public boolean isFlat() {
        return openTrade == null;
    }

    public Optional<OpenTrade> getOpenTrade() {
        return Optional.ofNullable(openTrade);
    }

    /**
     * Open a one-contract position with a catastrophic stop and a profit target.
     */
    public OpenTrade enter(Order.Side side, BigDecimal close, BigDecimal tickSize,
                           int stopTicks, int profitTicks, BigDecimal baseAcceleration) {
        Objects.requireNonNull(side, "side");
        Objects.requireNonNull(close, "close");
        Objects.requireNonNull(tickSize, "tickSize");
        Objects.requireNonNull(baseAcceleration, "baseAcceleration");
        if (openTrade != null) {
            throw new IllegalStateException("Cannot enter " + side + ": position already " + openTrade.side());
        }

        PositionSide position = PositionSide.openedBy(side);
        boolean isLong = position == PositionSide.LONG;
        String direction = isLong ? "long" : "short";
        BigDecimal stopDistance = tickSize.multiply(BigDecimal.valueOf(stopTicks));
        BigDecimal profitDistance = tickSize.multiply(BigDecimal.valueOf(profitTicks));
        BigDecimal stopPrice = isLong ? close.subtract(stopDistance) : close.add(stopDistance);
        BigDecimal targetPrice = isLong ? close.add(profitDistance) : close.subtract(profitDistance);

        Order entry = Order.builder()
                .id(nextId())
                .side(side)
                .type(Order.Type.MARKET)
                .label("Enter " + direction + " position")
                .build();
        String stopId = nextId();
        String targetId = nextId();
        Order stop = Order.builder()
                .id(stopId)
                .side(side.opposite())
                .type(Order.Type.STOP)
                .price(stopPrice)
                .label("Catastrophic stop " + direction + " exit")
                .linkedOrderId(targetId)
                .build();
        Order target = Order.builder()
                .id(targetId)
                .side(side.opposite())
                .type(Order.Type.LIMIT)
                .price(targetPrice)
                .label("Profit stop " + direction + " exit")
                .linkedOrderId(stopId)
                .build();

        executionService.insertOrder(entry);
        executionService.insertOrder(stop);
        executionService.insertOrder(target);

        openTrade = new OpenTrade(position, entry, stop, target, new TrailingState(baseAcceleration, close));
        log.info("📈 ENTER {} @ {} | stop {} | target {}", position, close, stopPrice, targetPrice);
        return openTrade;
    }

    /**
     * Flatten the open position with the default exit label.
     */
    public void exit(Order.Side sideToClose) {
        exit(sideToClose, null);
    }

    /**
     * Cancel the protective pair, then send the closing market order.
     *
     * @param sideToClose side of the closing order: SELL closes a long, BUY a short
     * @param label order label, or null for "Exit long/short position"
     */
    public void exit(Order.Side sideToClose, String label) {
        Objects.requireNonNull(sideToClose, "sideToClose");
        OpenTrade trade = requireOpenTrade("exit");
        if (trade.side().exitSide() != sideToClose) {
            throw new IllegalArgumentException(
                    "Cannot close " + trade.side() + " position with a " + sideToClose + " order");
        }

        String direction = trade.side() == PositionSide.LONG ? "long" : "short";
        Order close = Order.builder()
                .id(nextId())
                .side(sideToClose)
                .type(Order.Type.MARKET)
                .label(label != null ? label : "Exit " + direction + " position")
                .build();

        executionService.cancelOrder(trade.stopOrder());
        executionService.cancelOrder(trade.targetOrder());
        executionService.insertOrder(close);

        openTrade = null;
        log.info("📉 EXIT {} [{}]", trade.side(), close.getLabel());
    }

    /**
     * Move the stop of the open trade. The local stop changes only once the venue
     * has accepted the modification.
     *
     * @return {@code false} if the venue no longer knows the stop
     */
    public boolean modifyStop(BigDecimal newPrice, String newLabel) {
        Objects.requireNonNull(newPrice, "newPrice");
        OpenTrade trade = requireOpenTrade("modify stop");
        Order stop = trade.stopOrder();
        BigDecimal previous = stop.getPrice();

        Order request = stop.toBuilder()
                .price(newPrice)
                .label(newLabel)
                .build();
        if (!executionService.modifyOrder(request)) {
            log.warn("⚠️ Venue rejected stop {} move {} -> {}, keeping {}", stop.getId(), previous, newPrice, previous);
            return false;
        }

        stop.setPrice(newPrice);
        stop.setLabel(newLabel);
        log.info("📌 Stop {} moved {} -> {} [{}]", stop.getId(), previous, newPrice, newLabel);
        return true;
    }

    /**
     * Venue reported a fill. When it is the stop or the target of the open trade the
     * position is closed; the venue has already cancelled the other leg.
     *
     * @return whether the fill closed the position
     */
    public boolean onProtectiveFill(String orderId) {
        if (openTrade == null || !openTrade.isProtectiveOrder(orderId)) {
            return false;
        }
        boolean stopped = openTrade.stopOrder().getId().equals(orderId);
        log.info("🔔 {} position closed by {} {}", openTrade.side(), stopped ? "stop" : "target", orderId);
        openTrade = null;
        return true;
    }

    /**
     * Forget the current trade without sending any request. Used between backtests.
     */
    public void reset() {
        if (openTrade != null) {
            log.warn("⚠️ Discarding open {} trade on reset", openTrade.side());
        }
        openTrade = null;
    }

    private OpenTrade requireOpenTrade(String operation) {
        if (openTrade == null) {
            throw new IllegalStateException("Cannot " + operation + ": no open position");
        }
        return openTrade;
    }

    private String nextId() {
        return ORDER_ID_PREFIX + "-" + idGenerator.getAndIncrement();
    }
}
