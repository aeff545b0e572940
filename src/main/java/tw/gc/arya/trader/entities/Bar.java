package tw.gc.arya.trader.entities;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * OHLC price bar of the traded instrument.
 * Immutable once produced; bars arrive oldest first in strictly increasing timestamp order.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Bar {

    /**
     * Bar timestamp (exchange local time)
     */
    LocalDateTime timestamp;

    BigDecimal open;
    BigDecimal high;
    BigDecimal low;
    BigDecimal close;

    /**
     * Minimum price increment of the instrument
     */
    BigDecimal tickSize;

    public DayOfWeek getDayOfWeek() {
        return timestamp.getDayOfWeek();
    }

    public LocalTime getTimeOfDay() {
        return timestamp.toLocalTime();
    }
}
