package com.fintech.marketmaking.strategy.policy;

/**
 * Activates a side only when enough visible liquidity rests at the candidate price.
 */
public interface LiquidityGate {

    /**
     * @param price candidate quote price
     * @param ahead visible quantity at that price
     * @param size size we would offer
     * @return true if the quote may be displayed
     */
    boolean permits(double price, long ahead, long size);

    /**
     * True when the gate re-evaluates a resting quote on every event, refreshing
     * its ahead quantity at an unchanged price and zeroing it on withdrawal.
     */
    boolean monitorsContinuously();
}
