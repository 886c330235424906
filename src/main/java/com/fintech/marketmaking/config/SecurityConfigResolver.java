package com.fintech.marketmaking.config;

import com.fintech.marketmaking.closing.ClosingAuctionConfig;
import com.fintech.marketmaking.closing.ClosingSchedule;
import com.fintech.marketmaking.util.TradingHours;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.function.Function;

/**
 * Merges per-security overrides with configured defaults and built-in values,
 * producing immutable validated configuration.
 *
 * Precedence per field: securities.NAME, then defaults, then the built-in value.
 * Thread-safe - the underlying properties are only read.
 */
public class SecurityConfigResolver {

    private static final Logger log = LoggerFactory.getLogger(SecurityConfigResolver.class);

    private static final MarketMakingSettings BUILT_IN = MarketMakingSettings.builtIn();
    private static final ClosingAuctionSettings CLOSING_BUILT_IN = ClosingAuctionSettings.builtIn();

    private final BacktestProperties properties;

    public SecurityConfigResolver(BacktestProperties properties) {
        this.properties = properties;
    }

    /**
     * Resolves market-making parameters for a security.
     *
     * @throws InvalidConfigurationException if the merged values violate a constraint
     */
    public SecurityConfig resolve(String security) {
        MarketMakingSettings own = lookup(properties.getSecurities(), security);
        MarketMakingSettings defaults = properties.getDefaults();

        Long baseSize = pick(own, defaults, MarketMakingSettings::getQuoteSize);
        Long bidSize = firstNonNull(
            own == null ? null : own.getQuoteSizeBid(),
            own == null ? null : own.getQuoteSize(),
            defaults == null ? null : defaults.getQuoteSizeBid(),
            baseSize);
        Long askSize = firstNonNull(
            own == null ? null : own.getQuoteSizeAsk(),
            own == null ? null : own.getQuoteSize(),
            defaults == null ? null : defaults.getQuoteSizeAsk(),
            baseSize);

        SecurityConfig config = new SecurityConfig(
            security,
            bidSize,
            askSize,
            pick(own, defaults, MarketMakingSettings::getRefillInterval),
            pick(own, defaults, MarketMakingSettings::getMaxPosition),
            pick(own, defaults, MarketMakingSettings::getMaxNotional),
            pick(own, defaults, MarketMakingSettings::getMinLiquidityNotional),
            pick(own, defaults, MarketMakingSettings::getStopLossThresholdPct),
            pick(own, defaults, MarketMakingSettings::getBookMode)
        );
        log.debug("Resolved market-making config: {}", config);
        return config;
    }

    /**
     * Resolves closing-auction parameters for a security.
     *
     * @throws InvalidConfigurationException if the merged values violate a constraint
     */
    public ClosingAuctionConfig resolveClosing(String security) {
        ClosingAuctionSettings own = lookup(properties.getClosing(), security);
        ClosingAuctionSettings defaults = properties.getClosingDefaults();

        ClosingAuctionConfig config = new ClosingAuctionConfig(
            security,
            pickClosing(own, defaults, ClosingAuctionSettings::getVwapWindow),
            pickClosing(own, defaults, ClosingAuctionSettings::getSpreadPct),
            pickClosing(own, defaults, ClosingAuctionSettings::getOrderNotional),
            pickClosing(own, defaults, ClosingAuctionSettings::getOrderQuantity),
            pickClosing(own, defaults, ClosingAuctionSettings::getTickSize),
            pickClosing(own, defaults, ClosingAuctionSettings::getExchange),
            pickClosing(own, defaults, ClosingAuctionSettings::getStopLossEnabled),
            pickClosing(own, defaults, ClosingAuctionSettings::getStopLossThresholdPct),
            pickClosing(own, defaults, ClosingAuctionSettings::getTrendFilterSellEnabled),
            pickClosing(own, defaults, ClosingAuctionSettings::getTrendFilterSellThresholdBpsHr),
            pickClosing(own, defaults, ClosingAuctionSettings::getTrendFilterBuyEnabled),
            pickClosing(own, defaults, ClosingAuctionSettings::getTrendFilterBuyThresholdBpsHr),
            pickClosing(own, defaults, ClosingAuctionSettings::getAuctionFillPct)
        );
        log.debug("Resolved closing-auction config: {}", config);
        return config;
    }

    /** Session phase boundaries from 'backtest.session'. */
    public TradingHours tradingHours() {
        BacktestProperties.Session session = properties.getSession();
        try {
            return new TradingHours(
                time("session.opening-auction-start", session.getOpeningAuctionStart()),
                time("session.silent-period-start", session.getSilentPeriodStart()),
                time("session.continuous-start", session.getContinuousStart()),
                time("session.closing-auction-start", session.getClosingAuctionStart()),
                time("session.closing-auction-end", session.getClosingAuctionEnd()),
                time("session.eod-cutoff", session.getEodCutoff())
            );
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException("Invalid trading session: " + e.getMessage());
        }
    }

    /** Closing-auction day schedule from 'backtest.closing-schedule'. */
    public ClosingSchedule closingSchedule() {
        BacktestProperties.ClosingSchedule schedule = properties.getClosingSchedule();
        try {
            return new ClosingSchedule(
                time("closing-schedule.regular-start", schedule.getRegularStart()),
                time("closing-schedule.pre-close-end", schedule.getPreCloseEnd()),
                time("closing-schedule.closing-print", schedule.getClosingPrint()),
                time("closing-schedule.stop-loss-start", schedule.getStopLossStart()),
                time("closing-schedule.stop-loss-end", schedule.getStopLossEnd())
            );
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException("Invalid closing schedule: " + e.getMessage());
        }
    }

    private static LocalTime time(String key, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidConfigurationException("Missing time for backtest." + key);
        }
        try {
            return LocalTime.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidConfigurationException("Invalid time for backtest." + key + ": '" + value + "'");
        }
    }

    private static <T> T lookup(Map<String, T> bySecurity, String security) {
        return bySecurity == null ? null : bySecurity.get(security);
    }

    private static <T> T pick(MarketMakingSettings own, MarketMakingSettings defaults,
                              Function<MarketMakingSettings, T> getter) {
        return firstNonNull(
            own == null ? null : getter.apply(own),
            defaults == null ? null : getter.apply(defaults),
            getter.apply(BUILT_IN));
    }

    private static <T> T pickClosing(ClosingAuctionSettings own, ClosingAuctionSettings defaults,
                                     Function<ClosingAuctionSettings, T> getter) {
        return firstNonNull(
            own == null ? null : getter.apply(own),
            defaults == null ? null : getter.apply(defaults),
            getter.apply(CLOSING_BUILT_IN));
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... candidates) {
        for (T candidate : candidates) {
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }
}
