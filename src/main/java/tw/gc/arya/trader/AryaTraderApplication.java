package tw.gc.arya.trader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Arya intraday trader.
 *
 * Runs the per-bar stochastic breakout engine. With {@code arya.backtest.enabled=true}
 * a JSON bar file is replayed through the engine and the simulated venue on startup.
 */
@SpringBootApplication
public class AryaTraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(AryaTraderApplication.class, args);
    }
}
