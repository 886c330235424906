package com.fintech.marketmaking.config;

import com.fintech.marketmaking.book.BookMode;
import com.fintech.marketmaking.domain.Side;

import java.time.Duration;

/**
 * Resolved, validated market-making parameters for one security.
 *
 * @param security Security symbol
 * @param quoteSizeBid Base bid size
 * @param quoteSizeAsk Base ask size
 * @param refillInterval Refill interval (baseline) or cooldown (price-follow variants)
 * @param maxPosition Absolute position limit
 * @param maxNotional Optional notional cap on the position, null when unset
 * @param minLiquidityNotional Minimum price x ahead at our price to display a quote
 * @param stopLossThresholdPct Unrealized loss percentage that triggers liquidation
 * @param bookMode How quote updates are applied to the book
 */
public record SecurityConfig(
    String security,
    long quoteSizeBid,
    long quoteSizeAsk,
    Duration refillInterval,
    long maxPosition,
    Double maxNotional,
    double minLiquidityNotional,
    double stopLossThresholdPct,
    BookMode bookMode
) {

    public SecurityConfig {
        if (security == null || security.isBlank()) {
            throw new InvalidConfigurationException("Security cannot be null or blank");
        }
        if (quoteSizeBid < 0 || quoteSizeAsk < 0) {
            throw new InvalidConfigurationException(
                "Quote sizes must be non-negative for " + security + ": bid=" + quoteSizeBid + ", ask=" + quoteSizeAsk);
        }
        if (refillInterval == null || refillInterval.isNegative() || refillInterval.isZero()) {
            throw new InvalidConfigurationException("Refill interval must be positive for " + security);
        }
        if (maxPosition < 0) {
            throw new InvalidConfigurationException("Max position must be non-negative for " + security);
        }
        if (maxNotional != null && !(maxNotional > 0)) {
            throw new InvalidConfigurationException("Max notional must be positive when set for " + security);
        }
        if (minLiquidityNotional < 0) {
            throw new InvalidConfigurationException("Min liquidity notional must be non-negative for " + security);
        }
        if (!(stopLossThresholdPct > 0)) {
            throw new InvalidConfigurationException("Stop-loss threshold must be positive for " + security);
        }
        if (bookMode == null) {
            throw new InvalidConfigurationException("Book mode cannot be null for " + security);
        }
    }

    public long quoteSize(Side side) {
        return side == Side.BID ? quoteSizeBid : quoteSizeAsk;
    }
}
