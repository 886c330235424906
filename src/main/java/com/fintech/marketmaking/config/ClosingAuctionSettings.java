package com.fintech.marketmaking.config;

import com.fintech.marketmaking.closing.Exchange;
import lombok.Data;

import java.time.Duration;

/**
 * Raw closing-auction parameters as bound from configuration.
 * Unset (null) fields fall back to the configured defaults, then to {@link #builtIn()}.
 */
@Data
public class ClosingAuctionSettings {

    private Duration vwapWindow;
    private Double spreadPct;
    private Double orderNotional;
    private Long orderQuantity;      // Fixed size, overrides orderNotional when set
    private Double tickSize;         // Fixed tick, overrides the exchange table when set
    private Exchange exchange;
    private Boolean stopLossEnabled;
    private Double stopLossThresholdPct;
    private Boolean trendFilterSellEnabled;
    private Double trendFilterSellThresholdBpsHr;
    private Boolean trendFilterBuyEnabled;
    private Double trendFilterBuyThresholdBpsHr;
    private Double auctionFillPct;

    public static ClosingAuctionSettings builtIn() {
        ClosingAuctionSettings settings = new ClosingAuctionSettings();
        settings.setVwapWindow(Duration.ofMinutes(15));
        settings.setSpreadPct(0.5);
        settings.setOrderNotional(250_000.0);
        settings.setExchange(Exchange.ADX);
        settings.setStopLossEnabled(true);
        settings.setStopLossThresholdPct(2.0);
        settings.setTrendFilterSellEnabled(true);
        settings.setTrendFilterSellThresholdBpsHr(10.0);
        settings.setTrendFilterBuyEnabled(false);
        settings.setTrendFilterBuyThresholdBpsHr(10.0);
        settings.setAuctionFillPct(10.0);
        return settings;
    }
}
