package com.fintech.marketmaking.domain;

/**
 * Origin of a fill record.
 */
public enum FillType {

    /** Market trade executed against one of our resting quotes. */
    QUOTE,

    /** Synthetic close of the whole position at the end-of-day cutoff. */
    EOD_FLATTEN,

    /** Liquidation after an unrealized-loss trigger. */
    STOP_LOSS,

    /** Closing auction entry order executed at the closing print. */
    AUCTION_ENTRY,

    /** Next-day exit order executed at its VWAP target. */
    VWAP_EXIT,

    /** Unresolved exit order forced closed at the following closing print. */
    EXIT_FLATTEN
}
