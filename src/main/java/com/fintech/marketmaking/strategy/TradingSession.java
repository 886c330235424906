package com.fintech.marketmaking.strategy;

import com.fintech.marketmaking.domain.MarketEvent;

/**
 * Per-security event processor owning its book, position and strategy state.
 *
 * Events must arrive in timestamp order. All state is carried across
 * {@link #processBatch} calls; only a new trading day resets intraday state.
 * Not thread-safe: a session is driven by exactly one thread.
 */
public interface TradingSession {

    String security();

    StrategyVariant variant();

    void onEvent(MarketEvent event);

    default void processBatch(Iterable<MarketEvent> events) {
        for (MarketEvent event : events) {
            onEvent(event);
        }
    }

    /** Current results; may be called repeatedly, also mid-stream. */
    SessionResult result();
}
