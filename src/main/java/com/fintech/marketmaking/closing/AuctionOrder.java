package com.fintech.marketmaking.closing;

import com.fintech.marketmaking.domain.TradeSide;

import java.time.LocalDateTime;

/**
 * Entry order resting in the closing auction.
 *
 * @param side Buy below VWAP or sell above it
 * @param price Limit price, on the tick ladder
 * @param quantity Order size
 * @param placedAt Placement time
 * @param vwapReference Pre-close VWAP the price was derived from
 */
public record AuctionOrder(TradeSide side, double price, long quantity, LocalDateTime placedAt, double vwapReference) {

    /** Buy fills when the close is at or below our price, sell when at or above. */
    public boolean isCrossedBy(double closePrice) {
        return side == TradeSide.BUY ? closePrice <= price : closePrice >= price;
    }
}
