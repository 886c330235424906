package com.fintech.marketmaking.domain;

/**
 * Side of the book, and of our resting quotes.
 */
public enum Side {

    BID,
    ASK;

    public Side opposite() {
        return this == BID ? ASK : BID;
    }

    /** Direction of the fill we receive when a quote on this side executes. */
    public TradeSide fillDirection() {
        return this == BID ? TradeSide.BUY : TradeSide.SELL;
    }
}
