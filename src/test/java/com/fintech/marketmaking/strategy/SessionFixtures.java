package com.fintech.marketmaking.strategy;

import com.fintech.marketmaking.config.BacktestProperties;
import com.fintech.marketmaking.config.MarketMakingSettings;
import com.fintech.marketmaking.config.SecurityConfigResolver;
import com.fintech.marketmaking.domain.MarketEvent;
import com.fintech.marketmaking.util.SessionWindowClassifier;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

/**
 * Shared configuration and event streams for session tests.
 */
public final class SessionFixtures {

    public static final LocalDate DAY = LocalDate.of(2025, 3, 3);
    public static final String SECURITY = "TEST";

    private SessionFixtures() {
    }

    public static LocalDateTime at(String time) {
        return at(DAY, time);
    }

    public static LocalDateTime at(LocalDate day, String time) {
        return LocalDateTime.of(day, LocalTime.parse(time));
    }

    /** max position 100, quote size 50, min liquidity notional 1000, 60s refill/cooldown. */
    public static BacktestProperties scenarioProperties() {
        BacktestProperties properties = new BacktestProperties();
        MarketMakingSettings defaults = properties.getDefaults();
        defaults.setQuoteSize(50L);
        defaults.setMaxPosition(100L);
        defaults.setMinLiquidityNotional(1000.0);
        defaults.setRefillInterval(Duration.ofSeconds(60));
        defaults.setStopLossThresholdPct(2.0);
        return properties;
    }

    public static SessionFactory factory(BacktestProperties properties) {
        SecurityConfigResolver resolver = new SecurityConfigResolver(properties);
        return new SessionFactory(resolver, new SessionWindowClassifier(resolver.tradingHours()),
                                  resolver.closingSchedule());
    }

    public static MarketMakingSession marketMaking(StrategyVariant variant) {
        return (MarketMakingSession) factory(scenarioProperties()).create(SECURITY, variant);
    }

    /**
     * Touch 10.00 x 200 / 10.10 x 200, a 300-share print at the bid, then a 210-share
     * print at the ask, which reaches our ask behind the 200 queued ahead.
     */
    public static List<MarketEvent> workedScenario() {
        return List.of(
            MarketEvent.bid(at("10:30:00"), 10.00, 200),
            MarketEvent.ask(at("10:30:01"), 10.10, 200),
            MarketEvent.trade(at("10:30:02"), 10.00, 300),
            MarketEvent.trade(at("10:30:10"), 10.10, 210)
        );
    }
}
