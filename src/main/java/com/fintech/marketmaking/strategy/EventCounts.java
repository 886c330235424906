package com.fintech.marketmaking.strategy;

/**
 * Per-session event tallies.
 *
 * @param processed Events applied to the book
 * @param bids Processed bid updates
 * @param asks Processed ask updates
 * @param trades Processed trade prints
 * @param ignored Malformed events discarded
 * @param skipped Well-formed events outside the tradable window or held back by a pending flatten
 */
public record EventCounts(long processed, long bids, long asks, long trades, long ignored, long skipped) {

    public static EventCounts empty() {
        return new EventCounts(0, 0, 0, 0, 0, 0);
    }

    public EventCounts plus(EventCounts other) {
        return new EventCounts(
            processed + other.processed,
            bids + other.bids,
            asks + other.asks,
            trades + other.trades,
            ignored + other.ignored,
            skipped + other.skipped
        );
    }
}
