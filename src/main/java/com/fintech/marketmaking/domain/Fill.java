package com.fintech.marketmaking.domain;

import java.time.LocalDateTime;

/**
 * Append-only record of one of our executions with the accounting state after it.
 *
 * @param timestamp Execution time
 * @param side Buy or sell
 * @param price Execution price
 * @param quantity Executed quantity (always positive)
 * @param realizedPnl Realized PnL contributed by this fill
 * @param position Signed position after the fill
 * @param cumulativePnl Cumulative realized PnL after the fill
 * @param type Origin of the fill
 */
public record Fill(
    LocalDateTime timestamp,
    TradeSide side,
    double price,
    long quantity,
    double realizedPnl,
    long position,
    double cumulativePnl,
    FillType type
) {

    /** Signed quantity: positive for buys, negative for sells. */
    public long signedQuantity() {
        return side.sign() * quantity;
    }
}
