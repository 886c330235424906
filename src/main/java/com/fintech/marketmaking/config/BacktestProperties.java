package com.fintech.marketmaking.config;

import com.fintech.marketmaking.strategy.StrategyVariant;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Externalized configuration for the backtest engine.
 * Maps to 'backtest.*' properties in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "backtest")
public class BacktestProperties {

    private StrategyVariant strategy = StrategyVariant.PRICE_FOLLOW_COOLDOWN;
    private Session session = new Session();
    private ClosingSchedule closingSchedule = new ClosingSchedule();
    private MarketMakingSettings defaults = MarketMakingSettings.builtIn();
    private Map<String, MarketMakingSettings> securities = new LinkedHashMap<>();
    private ClosingAuctionSettings closingDefaults = ClosingAuctionSettings.builtIn();
    private Map<String, ClosingAuctionSettings> closing = new LinkedHashMap<>();
    private Execution execution = new Execution();
    private DisruptorConfig disruptor = new DisruptorConfig();
    private Storage storage = new Storage();

    /** Trading-day phase boundaries, "HH:mm[:ss]" exchange local time. */
    @Data
    public static class Session {
        private String openingAuctionStart = "09:30";
        private String silentPeriodStart = "10:00";
        private String continuousStart = "10:05";
        private String closingAuctionStart = "14:45";
        private String closingAuctionEnd = "15:00";
        private String eodCutoff = "14:55";
    }

    /** Closing-auction day schedule, "HH:mm[:ss]" exchange local time. */
    @Data
    public static class ClosingSchedule {
        private String regularStart = "10:00";
        private String preCloseEnd = "14:45";        // VWAP window end, auction orders placed from here
        private String closingPrint = "14:55";       // First trade at/after this is the closing price
        private String stopLossStart = "10:10";
        private String stopLossEnd = "14:44";
    }

    @Data
    public static class Execution {
        private int parallelism = Runtime.getRuntime().availableProcessors();
        private int batchSize = 100_000;
    }

    @Data
    public static class DisruptorConfig {
        private int bufferSize = 8192;
        private String waitStrategy = "BLOCKING";
        private long drainTimeoutMs = 30_000L;
    }

    @Data
    public static class Storage {
        private int maxRuns = 100;  // Oldest run reports are evicted beyond this
    }
}
