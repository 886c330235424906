package com.fintech.marketmaking.domain;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Immutable market data update for a single security.
 * Timestamps are exchange-local wall clock times; the stream is assumed ordered.
 *
 * @param timestamp Event time (exchange local)
 * @param type Update kind, null when the feed label was not recognized
 * @param price Quote or trade price
 * @param quantity Resting quantity for quotes, printed volume for trades
 */
public record MarketEvent(
    LocalDateTime timestamp,
    EventType type,
    double price,
    long quantity
) {

    public static MarketEvent bid(LocalDateTime timestamp, double price, long quantity) {
        return new MarketEvent(timestamp, EventType.BID, price, quantity);
    }

    public static MarketEvent ask(LocalDateTime timestamp, double price, long quantity) {
        return new MarketEvent(timestamp, EventType.ASK, price, quantity);
    }

    public static MarketEvent trade(LocalDateTime timestamp, double price, long quantity) {
        return new MarketEvent(timestamp, EventType.TRADE, price, quantity);
    }

    /** Returns true for trade prints. */
    public boolean isTrade() {
        return type == EventType.TRADE;
    }

    /** Calendar date of the event, used for trading-day boundaries. */
    public LocalDate tradingDate() {
        return timestamp.toLocalDate();
    }

    /** Validates timestamp present, type recognized, price > 0, quantity >= 0. */
    public boolean isValid() {
        return timestamp != null && type != null && price > 0 && quantity >= 0;
    }
}
