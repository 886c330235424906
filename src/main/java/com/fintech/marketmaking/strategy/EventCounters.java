package com.fintech.marketmaking.strategy;

import com.fintech.marketmaking.domain.EventType;

/**
 * Mutable event tallies owned by one session.
 */
public class EventCounters {

    private long processed;
    private long bids;
    private long asks;
    private long trades;
    private long ignored;
    private long skipped;

    public void recordProcessed(EventType type) {
        processed++;
        switch (type) {
            case BID -> bids++;
            case ASK -> asks++;
            case TRADE -> trades++;
        }
    }

    public void recordIgnored() {
        ignored++;
    }

    public void recordSkipped() {
        skipped++;
    }

    public EventCounts snapshot() {
        return new EventCounts(processed, bids, asks, trades, ignored, skipped);
    }
}
