package com.fintech.marketmaking.domain;

/**
 * Direction of one of our executions.
 */
public enum TradeSide {

    BUY,
    SELL;

    public TradeSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    /** +1 for buys, -1 for sells. */
    public int sign() {
        return this == BUY ? 1 : -1;
    }

    /**
     * Quote side whose refill timer a fill in this direction restarts.
     * A buy is always our bid being hit, a sell is our ask being lifted.
     */
    public Side quoteSide() {
        return this == BUY ? Side.BID : Side.ASK;
    }
}
