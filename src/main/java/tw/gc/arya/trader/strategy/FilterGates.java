package tw.gc.arya.trader.strategy;

/**
 * Entry filter outcomes for one bar. Long and short eligibility are evaluated
 * independently; the signal detector decides which one, if any, is acted on.
 */
public record FilterGates(
        boolean dayAllowed,
        boolean timeAllowed,
        boolean volatilityAllowed,
        boolean flat,
        boolean longTrendStrength,
        boolean bullish,
        boolean shortTrendStrength,
        boolean bearish
) {

    public boolean longEligible() {
        return commonGates() && longTrendStrength && bullish;
    }

    public boolean shortEligible() {
        return commonGates() && shortTrendStrength && bearish;
    }

    private boolean commonGates() {
        return dayAllowed && timeAllowed && volatilityAllowed && flat;
    }
}
