package tw.gc.arya.trader.testutil;

import tw.gc.arya.trader.entities.Bar;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Test factory for bars of a 0.0001-tick FX future.
 */
public class BarTestFactory {

    public static final BigDecimal TICK = new BigDecimal("0.0001");

    /** Monday. */
    public static final LocalDateTime MONDAY_0900 = LocalDateTime.of(2024, 3, 4, 9, 0);

    public static Bar bar(LocalDateTime timestamp, String open, String high, String low, String close) {
        return Bar.builder()
                .timestamp(timestamp)
                .open(new BigDecimal(open))
                .high(new BigDecimal(high))
                .low(new BigDecimal(low))
                .close(new BigDecimal(close))
                .tickSize(TICK)
                .build();
    }

    /**
     * Bar whose open equals its close and whose high/low sit {@code halfRange} away.
     */
    public static Bar bar(LocalDateTime timestamp, String close, String halfRange) {
        BigDecimal c = new BigDecimal(close);
        BigDecimal h = new BigDecimal(halfRange);
        return Bar.builder()
                .timestamp(timestamp)
                .open(c)
                .high(c.add(h))
                .low(c.subtract(h))
                .close(c)
                .tickSize(TICK)
                .build();
    }
}
