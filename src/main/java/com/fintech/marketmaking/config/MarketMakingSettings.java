package com.fintech.marketmaking.config;

import com.fintech.marketmaking.book.BookMode;
import lombok.Data;

import java.time.Duration;

/**
 * Raw market-making parameters as bound from configuration.
 * Unset (null) fields fall back to the configured defaults, then to {@link #builtIn()}.
 */
@Data
public class MarketMakingSettings {

    private Long quoteSize;
    private Long quoteSizeBid;   // Overrides quoteSize on the bid side
    private Long quoteSizeAsk;   // Overrides quoteSize on the ask side
    private Duration refillInterval;
    private Long maxPosition;
    private Double maxNotional;  // Optional dynamic position cap in local currency
    private Double minLiquidityNotional;
    private Double stopLossThresholdPct;
    private BookMode bookMode;

    /** Permissive baseline used for securities without explicit configuration. */
    public static MarketMakingSettings builtIn() {
        MarketMakingSettings settings = new MarketMakingSettings();
        settings.setQuoteSize(50_000L);
        settings.setRefillInterval(Duration.ofSeconds(60));
        settings.setMaxPosition(2_000_000L);
        settings.setMinLiquidityNotional(25_000.0);
        settings.setStopLossThresholdPct(2.0);
        settings.setBookMode(BookMode.AGGREGATED);
        return settings;
    }
}
