package tw.gc.arya.trader.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tw.gc.arya.trader.entities.Bar;
import tw.gc.arya.trader.entities.Order;
import tw.gc.arya.trader.entities.PositionSide;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Accelerating trailing stop.
 *
 * Each bar that closes beyond the furthest close so far, the acceleration is multiplied
 * by the distance between that close and the stop, and the stop moves by the new
 * acceleration. If the moved stop would reach the close, the position is flattened
 * instead. The stop never moves against the position.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TrailingStopController {

    static final String TRAILING_LONG_LABEL = "Trailing stop long exit";
    static final String TRAILING_SHORT_LABEL = "Trailing stop short exit";

    private static final MathContext PRECISION = MathContext.DECIMAL128;

    private final PositionManager positionManager;

    public enum Action {
        NONE,       // No new favorable close, or the venue rejected the move
        TRAILED,    // Stop moved
        FLATTENED   // Stop would cross the market, position closed
    }

    public Action onBar(Bar bar) {
        OpenTrade trade = positionManager.getOpenTrade()
                .orElseThrow(() -> new IllegalStateException("Trailing stop requires an open position"));
        return trade.side() == PositionSide.LONG
                ? trailLong(trade, bar.getClose())
                : trailShort(trade, bar.getClose());
    }

    // Trailing state is committed only after the venue accepted the new stop
    private Action trailLong(OpenTrade trade, BigDecimal close) {
        TrailingState state = trade.trailingState();
        if (close.compareTo(state.getFurthestClose()) <= 0) {
            return Action.NONE;
        }

        BigDecimal stop = trade.stopOrder().getPrice();
        BigDecimal acceleration = state.getAcceleration().multiply(close.subtract(stop), PRECISION);
        BigDecimal newStop = stop.add(acceleration, PRECISION);
        if (newStop.compareTo(close) < 0) {
            if (!positionManager.modifyStop(newStop, TRAILING_LONG_LABEL)) {
                return Action.NONE;
            }
            state.setFurthestClose(close);
            state.setAcceleration(acceleration);
            return Action.TRAILED;
        }

        log.info("⚠️ Trailing stop {} would reach close {}, flattening long", newStop, close);
        positionManager.exit(Order.Side.SELL);
        return Action.FLATTENED;
    }

    private Action trailShort(OpenTrade trade, BigDecimal close) {
        TrailingState state = trade.trailingState();
        if (close.compareTo(state.getFurthestClose()) >= 0) {
            return Action.NONE;
        }

        BigDecimal stop = trade.stopOrder().getPrice();
        BigDecimal acceleration = state.getAcceleration().multiply(stop.subtract(close).abs(), PRECISION);
        BigDecimal newStop = stop.subtract(acceleration, PRECISION);
        if (newStop.compareTo(close) > 0) {
            if (!positionManager.modifyStop(newStop, TRAILING_SHORT_LABEL)) {
                return Action.NONE;
            }
            state.setFurthestClose(close);
            state.setAcceleration(acceleration);
            return Action.TRAILED;
        }

        log.info("⚠️ Trailing stop {} would reach close {}, flattening short", newStop, close);
        positionManager.exit(Order.Side.BUY);
        return Action.FLATTENED;
    }
}
