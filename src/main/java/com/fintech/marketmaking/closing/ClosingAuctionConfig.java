package com.fintech.marketmaking.closing;

import com.fintech.marketmaking.config.InvalidConfigurationException;

import java.time.Duration;

/**
 * Resolved, validated closing-auction parameters for one security.
 *
 * @param security Security symbol
 * @param vwapWindow Length of the pre-close VWAP window ending at the pre-close boundary
 * @param spreadPct Distance of the entry orders from VWAP, in percent
 * @param orderNotional Entry size in local currency when no fixed quantity is set
 * @param orderQuantity Fixed entry size, null to size from the notional
 * @param tickSize Fixed tick, null to use the exchange ladder
 * @param exchange Listing venue
 * @param stopLossEnabled Whether intraday stop-loss monitoring runs
 * @param stopLossThresholdPct Unrealized loss percentage that triggers liquidation
 * @param trendFilterSellEnabled Skip sell entries in strong uptrends
 * @param trendFilterSellThresholdBpsHr Uptrend threshold for the sell filter
 * @param trendFilterBuyEnabled Skip buy entries in strong downtrends
 * @param trendFilterBuyThresholdBpsHr Downtrend threshold (magnitude) for the buy filter
 * @param auctionFillPct Share of the auction volume we may be filled for, in percent
 */
public record ClosingAuctionConfig(
    String security,
    Duration vwapWindow,
    double spreadPct,
    double orderNotional,
    Long orderQuantity,
    Double tickSize,
    Exchange exchange,
    boolean stopLossEnabled,
    double stopLossThresholdPct,
    boolean trendFilterSellEnabled,
    double trendFilterSellThresholdBpsHr,
    boolean trendFilterBuyEnabled,
    double trendFilterBuyThresholdBpsHr,
    double auctionFillPct
) {

    public ClosingAuctionConfig {
        if (security == null || security.isBlank()) {
            throw new InvalidConfigurationException("Security cannot be null or blank");
        }
        if (vwapWindow == null || vwapWindow.isNegative() || vwapWindow.isZero()) {
            throw new InvalidConfigurationException("VWAP window must be positive for " + security);
        }
        if (spreadPct < 0 || spreadPct >= 100) {
            throw new InvalidConfigurationException("Spread must be in [0, 100) percent for " + security + ": " + spreadPct);
        }
        if (orderQuantity == null && !(orderNotional > 0)) {
            throw new InvalidConfigurationException("Order notional must be positive for " + security);
        }
        if (orderQuantity != null && orderQuantity <= 0) {
            throw new InvalidConfigurationException("Order quantity must be positive when set for " + security);
        }
        if (tickSize != null && !(tickSize > 0)) {
            throw new InvalidConfigurationException("Tick size must be positive when set for " + security);
        }
        if (exchange == null) {
            throw new InvalidConfigurationException("Exchange cannot be null for " + security);
        }
        if (stopLossEnabled && !(stopLossThresholdPct > 0)) {
            throw new InvalidConfigurationException("Stop-loss threshold must be positive for " + security);
        }
        if (!(auctionFillPct > 0) || auctionFillPct > 100) {
            throw new InvalidConfigurationException("Auction fill percentage must be in (0, 100] for " + security);
        }
    }

    /** Entry size at the given VWAP. */
    public long entryQuantity(double vwap) {
        return orderQuantity != null ? orderQuantity : Math.round(orderNotional / vwap);
    }
}
