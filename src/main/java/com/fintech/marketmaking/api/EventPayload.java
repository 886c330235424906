package com.fintech.marketmaking.api;

import com.fintech.marketmaking.domain.EventType;
import com.fintech.marketmaking.domain.MarketEvent;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDateTime;

/**
 * One market event in a backtest request.
 * Unrecognized type labels are passed through and discarded by the session as malformed.
 */
@Schema(description = "Market data update: bid, ask or trade")
public record EventPayload(

    @Schema(description = "Exchange-local timestamp", example = "2025-03-03T10:30:00")
    @NotNull(message = "Event timestamp is required")
    LocalDateTime timestamp,

    @Schema(description = "Event type label", example = "trade", allowableValues = {"bid", "ask", "trade"})
    String type,

    @Schema(description = "Quote or trade price", example = "10.00")
    double price,

    @Schema(description = "Resting quantity for quotes, volume for trades", example = "500")
    long quantity
) {

    public MarketEvent toEvent() {
        return new MarketEvent(timestamp, EventType.fromLabel(type).orElse(null), price, quantity);
    }
}
