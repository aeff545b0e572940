package tw.gc.arya.trader.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalTime;

/**
 * Traded instrument metadata, {@code arya.instrument.*}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "arya.instrument")
public class InstrumentProperties {

    private String symbol = "URO";
    private BigDecimal tickSize = new BigDecimal("0.0001");

    /**
     * Exchange session close. Any open position is flattened when a bar crosses it.
     */
    private String sessionClose = "16:00";

    public LocalTime sessionCloseTime() {
        return StrategyProperties.parseTime("arya.instrument.session-close", sessionClose);
    }
}
