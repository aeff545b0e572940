package tw.gc.arya.trader.entities;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PositionSideTest {

    @Test
    void contractsAreSigned() {
        assertThat(PositionSide.LONG.contracts()).isEqualTo(1);
        assertThat(PositionSide.SHORT.contracts()).isEqualTo(-1);
        assertThat(PositionSide.FLAT.contracts()).isZero();
    }

    @Test
    void entryAndExitSides() {
        assertThat(PositionSide.LONG.entrySide()).isEqualTo(Order.Side.BUY);
        assertThat(PositionSide.LONG.exitSide()).isEqualTo(Order.Side.SELL);
        assertThat(PositionSide.SHORT.entrySide()).isEqualTo(Order.Side.SELL);
        assertThat(PositionSide.SHORT.exitSide()).isEqualTo(Order.Side.BUY);
    }

    @Test
    void flatHasNoSides() {
        assertThatThrownBy(PositionSide.FLAT::entrySide).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(PositionSide.FLAT::exitSide).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void openedBy() {
        assertThat(PositionSide.openedBy(Order.Side.BUY)).isEqualTo(PositionSide.LONG);
        assertThat(PositionSide.openedBy(Order.Side.SELL)).isEqualTo(PositionSide.SHORT);
    }
}
