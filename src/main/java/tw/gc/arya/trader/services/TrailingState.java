package tw.gc.arya.trader.services;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigDecimal;

/**
 * Per-trade trailing stop state. Created on entry, dropped on exit.
 */
@Data
@AllArgsConstructor
public class TrailingState {

    private BigDecimal acceleration;

    /**
     * Most favorable close since entry: highest for a long, lowest for a short
     */
    private BigDecimal furthestClose;
}
