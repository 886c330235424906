package com.fintech.marketmaking.domain;

/**
 * Aggregated price level of the order book.
 *
 * @param price Level price
 * @param quantity Resting quantity, always positive for a level that exists
 */
public record BookLevel(double price, long quantity) {

    /** Returns price * quantity in local currency. */
    public double notional() {
        return price * quantity;
    }
}
