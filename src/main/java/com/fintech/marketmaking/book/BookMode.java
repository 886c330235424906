package com.fintech.marketmaking.book;

/**
 * How quote updates are applied to a book side.
 */
public enum BookMode {

    /** Each update overwrites the quantity at its own price level; other levels are kept. */
    AGGREGATED,

    /** Each update is the new touch: the whole side is replaced by that single level. */
    TOP_OF_BOOK
}
