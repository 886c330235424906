package com.fintech.marketmaking.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Kind of market data update carried by a {@link MarketEvent}.
 */
public enum EventType {

    BID,
    ASK,
    TRADE;

    /**
     * Parses a feed label such as "bid", "ASK" or "Trade".
     *
     * @param label raw type label, may be null
     * @return the matching type, empty for null or unrecognized labels
     */
    public static Optional<EventType> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "bid" -> Optional.of(BID);
            case "ask" -> Optional.of(ASK);
            case "trade" -> Optional.of(TRADE);
            default -> Optional.empty();
        };
    }
}
