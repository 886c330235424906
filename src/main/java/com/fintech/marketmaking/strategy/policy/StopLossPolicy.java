package com.fintech.marketmaking.strategy.policy;

/**
 * Tracks the cost of the open position and decides when its loss warrants liquidation.
 */
public interface StopLossPolicy {

    /** Updates the cost basis after a fill moved the position. */
    void onPositionChange(long previousPosition, long newPosition, double price);

    /**
     * Unrealized PnL of the position as a percentage of its cost basis.
     *
     * @return 0 when flat or when no basis is tracked
     */
    double unrealizedPnlPct(long position, double markPrice);

    /** True when the loss at the mark price exceeds the threshold. */
    boolean isBreached(long position, double markPrice);

    void reset();
}
