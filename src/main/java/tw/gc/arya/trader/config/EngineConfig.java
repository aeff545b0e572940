package tw.gc.arya.trader.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tw.gc.arya.trader.history.BarHistory;
import tw.gc.arya.trader.strategy.StrategyParameters;

/**
 * Converts the bound properties into the engine's validated parameter set.
 * An invalid configuration fails the application context at startup.
 */
@Configuration
@Slf4j
public class EngineConfig {

    @Bean
    public StrategyParameters strategyParameters(StrategyProperties strategyProperties) {
        StrategyParameters parameters = strategyProperties.toParameters();
        log.info("⚙️ Strategy parameters loaded: {}", parameters);
        return parameters;
    }

    @Bean
    public BarHistory barHistory(StrategyProperties strategyProperties, StrategyParameters parameters) {
        int capacity = strategyProperties.getHistoryCapacity();
        if (capacity < parameters.requiredHistory()) {
            throw new IllegalArgumentException(String.format(
                    "arya.strategy.history-capacity (%d) is below the %d bars the indicators need",
                    capacity, parameters.requiredHistory()));
        }
        return new BarHistory(capacity);
    }
}
