package tw.gc.arya.trader.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.arya.trader.entities.Bar;
import tw.gc.arya.trader.execution.SimulatedExecutionService;
import tw.gc.arya.trader.history.BarFeed;
import tw.gc.arya.trader.strategy.TradeSignal;

import java.util.Iterator;
import java.util.stream.Stream;

/**
 * Replays a bar feed through the engine against the simulated venue.
 *
 * Per bar: session-close flatten if the close was crossed, venue matching, then the
 * engine's decision. Whatever is still open after the last bar is closed at its close.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BacktestService {

    static final String SESSION_CLOSE = "Session close";
    static final String END_OF_DATA = "End of data";

    private final AryaStrategyEngine engine;
    private final SimulatedExecutionService venue;
    private final SessionCloseMonitor sessionCloseMonitor;

    public BacktestResult run(BarFeed feed) {
        log.info("🚀 Starting backtest on {}", feed.describe());
        engine.reset();
        venue.reset();

        BacktestResult result = new BacktestResult(feed.describe());
        venue.setFillListener(fill -> {
            result.recordFill(fill);
            engine.onOrderFilled(fill);
        });

        Bar previous = null;
        try (Stream<Bar> bars = feed.stream()) {
            Iterator<Bar> iterator = bars.iterator();
            while (iterator.hasNext()) {
                Bar bar = iterator.next();
                if (previous != null && sessionCloseMonitor.crossedSessionClose(previous, bar)
                        && engine.forceFlatten(SESSION_CLOSE)) {
                    result.forcedClose();
                }
                venue.onBar(bar);

                TradeSignal signal = engine.onNewBar(bar);
                if (signal.isEntry()) {
                    result.entryPlaced();
                }
                result.barProcessed();
                previous = bar;
            }

            if (previous != null) {
                if (engine.forceFlatten(END_OF_DATA)) {
                    result.forcedClose();
                }
                venue.fillMarketOrders(previous.getClose(), previous.getTimestamp());
            }
        } finally {
            venue.setFillListener(null);
        }

        log.info("✅ Backtest completed: {} bars, {} entries, {} closed trades ({} winners, {} forced), {} points",
                result.getBarsProcessed(), result.getEntries(), result.getClosedTrades(),
                result.getWinningTrades(), result.getForcedCloses(), result.getRealizedPoints());
        return result;
    }
}
