package tw.gc.arya.trader.services;

import lombok.Data;
import tw.gc.arya.trader.entities.Order;
import tw.gc.arya.trader.entities.OrderFill;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one backtest run, accumulated from venue fills.
 * P&L is in price points for one contract.
 */
@Data
public class BacktestResult {

    private final String source;
    private int barsProcessed;
    private int entries;
    private int forcedCloses;
    private int closedTrades;
    private int winningTrades;
    private BigDecimal realizedPoints = BigDecimal.ZERO;

    private final List<OrderFill> fills = new ArrayList<>();
    private final List<BigDecimal> tradePoints = new ArrayList<>();

    // Running position reconstructed from fills
    private int netContracts;
    private BigDecimal openCashFlow = BigDecimal.ZERO;

    public void recordFill(OrderFill fill) {
        fills.add(fill);
        if (fill.side() == Order.Side.BUY) {
            netContracts++;
            openCashFlow = openCashFlow.subtract(fill.price());
        } else {
            netContracts--;
            openCashFlow = openCashFlow.add(fill.price());
        }
        if (netContracts == 0) {
            addTrade(openCashFlow);
            openCashFlow = BigDecimal.ZERO;
        }
    }

    public void addTrade(BigDecimal points) {
        closedTrades++;
        tradePoints.add(points);
        realizedPoints = realizedPoints.add(points);
        if (points.signum() > 0) winningTrades++;
    }

    public void barProcessed() {
        barsProcessed++;
    }

    public void entryPlaced() {
        entries++;
    }

    public void forcedClose() {
        forcedCloses++;
    }

    public double getWinRate() {
        return closedTrades == 0 ? 0 : (double) winningTrades / closedTrades * 100;
    }
}
