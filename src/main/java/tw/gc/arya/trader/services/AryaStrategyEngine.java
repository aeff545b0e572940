package tw.gc.arya.trader.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.arya.trader.entities.Bar;
import tw.gc.arya.trader.entities.Order;
import tw.gc.arya.trader.entities.OrderFill;
import tw.gc.arya.trader.entities.PositionSide;
import tw.gc.arya.trader.history.BarHistory;
import tw.gc.arya.trader.indicators.IndicatorPair;
import tw.gc.arya.trader.indicators.IndicatorService;
import tw.gc.arya.trader.strategy.EntryFilters;
import tw.gc.arya.trader.strategy.FilterGates;
import tw.gc.arya.trader.strategy.SignalDetector;
import tw.gc.arya.trader.strategy.StrategyParameters;
import tw.gc.arya.trader.strategy.TradeSignal;

import java.util.Objects;
import java.util.Optional;

/**
 * Arya strategy, driven one bar at a time.
 *
 * <ul>
 *   <li>Entry: stochastic %D breaks above the buy level (long) or below the sell level (short)</li>
 *   <li>Filters: day of week, session window, volatility range, ADX minimum, SMA slope</li>
 *   <li>Exit: accelerating trailing stop, profit target, or session close</li>
 * </ul>
 * Every state change goes through {@link PositionManager}. Each call runs to completion
 * on the caller's thread before the next bar is accepted.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AryaStrategyEngine {

    private final StrategyParameters parameters;
    private final BarHistory barHistory;
    private final IndicatorService indicatorService;
    private final SignalDetector signalDetector;
    private final PositionManager positionManager;
    private final TrailingStopController trailingStopController;

    /**
     * Process a new bar.
     *
     * @return the entry decision taken on this bar, NEUTRAL while a position is open
     */
    public TradeSignal onNewBar(Bar bar) {
        requireComplete(bar);
        barHistory.add(bar);

        if (!positionManager.isFlat()) {
            TrailingStopController.Action action = trailingStopController.onBar(bar);
            log.debug("{} {} close={} trailing={}", bar.getTimestamp(), positionManager.getPosition(), bar.getClose(), action);
            return TradeSignal.neutral("Position open, trailing " + action);
        }

        TradeSignal signal = evaluateEntry(bar);
        switch (signal.getDirection()) {
            case LONG -> enter(Order.Side.BUY, bar, signal);
            case SHORT -> enter(Order.Side.SELL, bar, signal);
            default -> log.debug("{} close={} no entry: {}", bar.getTimestamp(), bar.getClose(), signal.getReason());
        }
        return signal;
    }

    /**
     * Execution report from the venue. Only stop and target fills change state here.
     */
    public void onOrderFilled(OrderFill fill) {
        Objects.requireNonNull(fill, "fill");
        if (!positionManager.onProtectiveFill(fill.orderId())) {
            log.debug("Fill {} {} @ {} needs no action", fill.orderId(), fill.label(), fill.price());
        }
    }

    /**
     * Close any open position, e.g. at the end of the trading session.
     *
     * @return whether a position was closed
     */
    public boolean forceFlatten(String reason) {
        PositionSide position = positionManager.getPosition();
        if (position == PositionSide.FLAT) {
            return false;
        }
        log.info("⏰ Force-closing {} position: {}", position, reason);
        positionManager.exit(position.exitSide(), reason + " " + position.name().toLowerCase() + " exit");
        return true;
    }

    public PositionSide getPosition() {
        return positionManager.getPosition();
    }

    /**
     * Forget history, indicator cache and position. Sends no orders.
     */
    public void reset() {
        barHistory.clear();
        indicatorService.reset();
        positionManager.reset();
    }

    private TradeSignal evaluateEntry(Bar bar) {
        Optional<IndicatorPair> stochasticD = indicatorService.stochasticD();
        Optional<IndicatorPair> adx = indicatorService.adx();
        Optional<IndicatorPair> sma = indicatorService.sma();
        if (stochasticD.isEmpty() || adx.isEmpty() || sma.isEmpty()) {
            return TradeSignal.neutral("Warming up indicators");
        }

        FilterGates gates = EntryFilters.evaluate(parameters, bar, barHistory, adx.get(), sma.get(),
                positionManager.isFlat());
        return signalDetector.detect(gates, stochasticD.get());
    }

    /**
     * Reject a bar that could fail half-way through processing. Nothing is recorded
     * for a rejected bar, so a corrected bar with the same timestamp is accepted.
     */
    static void requireComplete(Bar bar) {
        Objects.requireNonNull(bar, "bar");
        if (bar.getTimestamp() == null || bar.getOpen() == null || bar.getHigh() == null
                || bar.getLow() == null || bar.getClose() == null) {
            throw new IllegalArgumentException("Incomplete bar: " + bar);
        }
        if (bar.getTickSize() == null || bar.getTickSize().signum() <= 0) {
            throw new IllegalArgumentException("Bar " + bar.getTimestamp() + " has no positive tick size");
        }
        if (bar.getHigh().compareTo(bar.getLow()) < 0) {
            throw new IllegalArgumentException("Bar " + bar.getTimestamp() + " has high below low");
        }
    }

    private void enter(Order.Side side, Bar bar, TradeSignal signal) {
        log.info("🚦 {} signal at {}: {}", signal.getDirection(), bar.getTimestamp(), signal.getReason());
        positionManager.enter(side, bar.getClose(), bar.getTickSize(),
                parameters.getStopTicks(), parameters.getProfitTicks(), parameters.getStopAcceleration());
    }
}
