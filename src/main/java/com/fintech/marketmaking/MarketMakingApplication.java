package com.fintech.marketmaking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Market-Making Backtest Engine
 *
 * Rebuilds per-security limit order books from quote and trade events and runs
 * market-making and closing-auction strategies against them with simulated
 * queue-position fills.
 *
 * Key Features:
 * - Per-security order book reconstruction with trading-phase gating
 * - Refill, price-follow, stop-loss and liquidity-monitor quoting variants
 * - Closing auction VWAP entry with next-day exit
 * - LMAX Disruptor streaming ingestion
 * - Prometheus metrics and OpenAPI-documented REST API
 *
 * @since 1.0.0
 */
@SpringBootApplication
public class MarketMakingApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketMakingApplication.class, args);
    }
}
