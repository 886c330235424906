package com.fintech.marketmaking.closing;

/**
 * Listing venue, which determines the price tick ladder.
 */
public enum Exchange {

    /** Abu Dhabi Securities Exchange. */
    ADX {
        @Override
        public double tickSize(double price) {
            if (price < 1) {
                return 0.001;
            }
            if (price < 10) {
                return 0.01;
            }
            if (price < 50) {
                return 0.02;
            }
            if (price < 100) {
                return 0.05;
            }
            return 0.1;
        }
    },

    /** Dubai Financial Market. */
    DFM {
        @Override
        public double tickSize(double price) {
            if (price < 1) {
                return 0.001;
            }
            if (price < 10) {
                return 0.01;
            }
            return 0.05;
        }
    };

    /** Minimum price increment for an order at the given price. */
    public abstract double tickSize(double price);
}
