package tw.gc.arya.trader.services;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import tw.gc.arya.trader.config.BacktestProperties;
import tw.gc.arya.trader.config.InstrumentProperties;
import tw.gc.arya.trader.history.JsonBarFeed;

import java.nio.file.Path;

/**
 * Runs a backtest of the configured bar file once the application is up.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "arya.backtest", name = "enabled", havingValue = "true")
public class BacktestRunner {

    private final BacktestService backtestService;
    private final BacktestProperties backtestProperties;
    private final InstrumentProperties instrumentProperties;
    private final ObjectMapper objectMapper;

    @EventListener(ApplicationReadyEvent.class)
    public void runOnStartup() {
        run();
    }

    public BacktestResult run() {
        Path barsFile = Path.of(backtestProperties.getBarsFile());
        log.info("📊 Backtesting {} from {}", instrumentProperties.getSymbol(), barsFile.toAbsolutePath());
        try {
            return backtestService.run(new JsonBarFeed(barsFile, objectMapper, instrumentProperties.getTickSize()));
        } catch (RuntimeException e) {
            log.error("❌ Backtest of {} failed: {}", barsFile, e.getMessage(), e);
            throw e;
        }
    }
}
