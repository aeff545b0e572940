package tw.gc.arya.trader.execution;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.arya.trader.entities.Bar;
import tw.gc.arya.trader.entities.Order;
import tw.gc.arya.trader.entities.OrderFill;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * In-memory execution venue for backtesting.
 *
 * Orders wait in a book and are matched against each new bar in {@link #onBar(Bar)}:
 * <ul>
 *   <li>MARKET fills at the bar open</li>
 *   <li>STOP fills when the bar trades through the trigger (at the open on a gap)</li>
 *   <li>LIMIT fills when the bar reaches the limit (at the open when it gaps beyond)</li>
 * </ul>
 * Stops are matched before limits, so a bar that touches both legs of a pair fills the
 * stop. A fill of a linked order cancels its counterpart.
 */
@Service
@Slf4j
public class SimulatedExecutionService implements ExecutionService {

    private final Map<String, Order> book = new LinkedHashMap<>();
    private Consumer<OrderFill> fillListener;

    /** Register a callback to receive fill notifications. */
    public void setFillListener(Consumer<OrderFill> listener) {
        this.fillListener = listener;
    }

    @Override
    public void insertOrder(Order order) {
        Objects.requireNonNull(order, "order");
        Objects.requireNonNull(order.getId(), "order.id");
        if (order.getType() != Order.Type.MARKET && order.getPrice() == null) {
            throw new IllegalArgumentException(order.getType() + " order requires a price: " + order.getId());
        }
        if (book.containsKey(order.getId())) {
            throw new IllegalArgumentException("Duplicate order id " + order.getId());
        }
        book.put(order.getId(), order.toBuilder().build());
        log.debug("Order accepted: {} {} {} @ {} [{}]",
                order.getId(), order.getSide(), order.getType(), order.getPrice(), order.getLabel());
    }

    @Override
    public boolean modifyOrder(Order order) {
        Order working = book.get(order.getId());
        if (working == null) {
            log.warn("⚠️ Modify rejected, unknown order {}", order.getId());
            return false;
        }
        working.setPrice(order.getPrice());
        working.setLabel(order.getLabel());
        log.debug("Order modified: {} @ {} [{}]", order.getId(), order.getPrice(), order.getLabel());
        return true;
    }

    @Override
    public boolean cancelOrder(Order order) {
        boolean removed = book.remove(order.getId()) != null;
        if (!removed) {
            log.debug("Cancel ignored, order {} no longer working", order.getId());
        }
        return removed;
    }

    /**
     * Match every working order against the bar.
     */
    public void onBar(Bar bar) {
        Objects.requireNonNull(bar, "bar");
        List<OrderFill> fills = new ArrayList<>();

        for (Order order : snapshot(Order.Type.MARKET)) {
            fills.add(fill(order, bar.getOpen(), bar.getTimestamp()));
        }
        for (Order order : snapshot(Order.Type.STOP)) {
            if (book.containsKey(order.getId())) {
                stopFillPrice(order, bar).ifPresent(price -> fills.add(fill(order, price, bar.getTimestamp())));
            }
        }
        for (Order order : snapshot(Order.Type.LIMIT)) {
            if (book.containsKey(order.getId())) {
                limitFillPrice(order, bar).ifPresent(price -> fills.add(fill(order, price, bar.getTimestamp())));
            }
        }

        fills.forEach(this::notifyFill);
    }

    /**
     * Fill all working market orders at {@code price}. Used to settle the final bar of a run.
     */
    public void fillMarketOrders(BigDecimal price, LocalDateTime timestamp) {
        List<OrderFill> fills = new ArrayList<>();
        for (Order order : snapshot(Order.Type.MARKET)) {
            fills.add(fill(order, price, timestamp));
        }
        fills.forEach(this::notifyFill);
    }

    public List<Order> getWorkingOrders() {
        return List.copyOf(book.values());
    }

    public Optional<Order> getWorkingOrder(String orderId) {
        return Optional.ofNullable(book.get(orderId));
    }

    public void reset() {
        if (!book.isEmpty()) {
            log.info("Clearing {} working orders", book.size());
        }
        book.clear();
    }

    private List<Order> snapshot(Order.Type type) {
        List<Order> matching = new ArrayList<>();
        for (Order order : book.values()) {
            if (order.getType() == type) {
                matching.add(order);
            }
        }
        return matching;
    }

    private Optional<BigDecimal> stopFillPrice(Order order, Bar bar) {
        BigDecimal trigger = order.getPrice();
        if (order.getSide() == Order.Side.SELL) {
            return bar.getLow().compareTo(trigger) <= 0
                    ? Optional.of(bar.getOpen().min(trigger))
                    : Optional.empty();
        }
        return bar.getHigh().compareTo(trigger) >= 0
                ? Optional.of(bar.getOpen().max(trigger))
                : Optional.empty();
    }

    private Optional<BigDecimal> limitFillPrice(Order order, Bar bar) {
        BigDecimal limit = order.getPrice();
        if (order.getSide() == Order.Side.SELL) {
            return bar.getHigh().compareTo(limit) >= 0
                    ? Optional.of(bar.getOpen().max(limit))
                    : Optional.empty();
        }
        return bar.getLow().compareTo(limit) <= 0
                ? Optional.of(bar.getOpen().min(limit))
                : Optional.empty();
    }

    private OrderFill fill(Order order, BigDecimal price, LocalDateTime timestamp) {
        book.remove(order.getId());
        if (order.isLinked() && book.remove(order.getLinkedOrderId()) != null) {
            log.debug("OCO: {} filled, cancelled {}", order.getId(), order.getLinkedOrderId());
        }
        log.info("✅ FILLED {} {} {} @ {} [{}]", order.getId(), order.getSide(), order.getType(), price, order.getLabel());
        return new OrderFill(order.getId(), order.getSide(), order.getType(), price, timestamp, order.getLabel());
    }

    private void notifyFill(OrderFill fill) {
        if (fillListener != null) {
            fillListener.accept(fill);
        }
    }
}
