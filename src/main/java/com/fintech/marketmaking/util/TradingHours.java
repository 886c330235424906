package com.fintech.marketmaking.util;

import java.time.LocalTime;
import java.util.Objects;

/**
 * Phase boundaries of the exchange trading day (exchange local time).
 *
 * @param openingAuctionStart Start of the opening auction (inclusive)
 * @param silentPeriodStart End of the opening auction, start of the post-auction silent period
 * @param continuousStart End of the silent period, start of continuous trading
 * @param closingAuctionStart End of continuous trading, start of the closing auction
 * @param closingAuctionEnd Last instant of the closing auction (inclusive)
 * @param eodCutoff Time at or after which open positions are flattened
 */
public record TradingHours(
    LocalTime openingAuctionStart,
    LocalTime silentPeriodStart,
    LocalTime continuousStart,
    LocalTime closingAuctionStart,
    LocalTime closingAuctionEnd,
    LocalTime eodCutoff
) {

    public TradingHours {
        Objects.requireNonNull(openingAuctionStart, "openingAuctionStart cannot be null");
        Objects.requireNonNull(silentPeriodStart, "silentPeriodStart cannot be null");
        Objects.requireNonNull(continuousStart, "continuousStart cannot be null");
        Objects.requireNonNull(closingAuctionStart, "closingAuctionStart cannot be null");
        Objects.requireNonNull(closingAuctionEnd, "closingAuctionEnd cannot be null");
        Objects.requireNonNull(eodCutoff, "eodCutoff cannot be null");

        if (openingAuctionStart.isAfter(silentPeriodStart)
                || silentPeriodStart.isAfter(continuousStart)
                || continuousStart.isAfter(closingAuctionStart)
                || closingAuctionStart.isAfter(closingAuctionEnd)) {
            throw new IllegalArgumentException("Trading phase boundaries must be in chronological order");
        }
    }

    /** UAE exchange defaults: auction 09:30, silent 10:00, continuous 10:05, close 14:45-15:00, cutoff 14:55. */
    public static TradingHours defaults() {
        return new TradingHours(
            LocalTime.of(9, 30),
            LocalTime.of(10, 0),
            LocalTime.of(10, 5),
            LocalTime.of(14, 45),
            LocalTime.of(15, 0),
            LocalTime.of(14, 55)
        );
    }
}
