package tw.gc.arya.trader.entities;

/**
 * Open position of the strategy. At most one contract is ever held.
 */
public enum PositionSide {
    FLAT(0),
    LONG(1),
    SHORT(-1);

    private final int contracts;

    PositionSide(int contracts) {
        this.contracts = contracts;
    }

    /** Signed contract count: 1 long, -1 short, 0 flat. */
    public int contracts() {
        return contracts;
    }

    /** Side of the market order that opens this position. */
    public Order.Side entrySide() {
        return switch (this) {
            case LONG -> Order.Side.BUY;
            case SHORT -> Order.Side.SELL;
            case FLAT -> throw new IllegalStateException("FLAT has no entry side");
        };
    }

    /** Side of the orders that close this position (stop, target, flatten). */
    public Order.Side exitSide() {
        return entrySide().opposite();
    }

    public static PositionSide openedBy(Order.Side side) {
        return side == Order.Side.BUY ? LONG : SHORT;
    }
}
