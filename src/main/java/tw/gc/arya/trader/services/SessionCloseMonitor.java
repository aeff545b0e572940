package tw.gc.arya.trader.services;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import tw.gc.arya.trader.config.InstrumentProperties;
import tw.gc.arya.trader.entities.Bar;

import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Detects the end of the exchange session between two consecutive bars.
 * Positions are intraday only and must not be carried across the session close.
 */
@Component
public class SessionCloseMonitor {

    private final LocalTime sessionClose;

    @Autowired
    public SessionCloseMonitor(InstrumentProperties instrumentProperties) {
        this(instrumentProperties.sessionCloseTime());
    }

    SessionCloseMonitor(LocalTime sessionClose) {
        this.sessionClose = sessionClose;
    }

    /**
     * True when the session close time falls in {@code (previous, current]}.
     */
    public boolean crossedSessionClose(Bar previous, Bar current) {
        LocalDateTime from = previous.getTimestamp();
        LocalDateTime to = current.getTimestamp();
        LocalDateTime nextClose = from.toLocalDate().atTime(sessionClose);
        if (!nextClose.isAfter(from)) {
            nextClose = nextClose.plusDays(1);
        }
        return !nextClose.isAfter(to);
    }

    public LocalTime getSessionClose() {
        return sessionClose;
    }
}
