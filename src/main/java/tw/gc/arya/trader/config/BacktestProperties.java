package tw.gc.arya.trader.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "arya.backtest")
public class BacktestProperties {

    private boolean enabled = false;

    /**
     * JSON array of bars, oldest first.
     */
    private String barsFile = "data/bars.json";
}
