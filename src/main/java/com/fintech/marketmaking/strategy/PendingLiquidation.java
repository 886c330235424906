package com.fintech.marketmaking.strategy;

import com.fintech.marketmaking.domain.TradeSide;

import java.time.LocalDateTime;

/**
 * Stop-loss liquidation still waiting for opposite-side depth.
 */
public class PendingLiquidation {

    private final TradeSide side;
    private final long quantity;
    private final LocalDateTime triggeredAt;
    private long remaining;

    public PendingLiquidation(TradeSide side, long quantity, LocalDateTime triggeredAt) {
        this.side = side;
        this.quantity = quantity;
        this.triggeredAt = triggeredAt;
        this.remaining = quantity;
    }

    /** Returns true once nothing is left to liquidate. */
    public boolean reduce(long executed) {
        remaining = Math.max(0, remaining - executed);
        return remaining == 0;
    }

    public TradeSide side() {
        return side;
    }

    public long quantity() {
        return quantity;
    }

    public long remaining() {
        return remaining;
    }

    public LocalDateTime triggeredAt() {
        return triggeredAt;
    }
}
