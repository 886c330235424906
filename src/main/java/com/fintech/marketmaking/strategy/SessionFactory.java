package com.fintech.marketmaking.strategy;

import com.fintech.marketmaking.closing.ClosingAuctionConfig;
import com.fintech.marketmaking.closing.ClosingAuctionSession;
import com.fintech.marketmaking.closing.ClosingSchedule;
import com.fintech.marketmaking.config.SecurityConfig;
import com.fintech.marketmaking.config.SecurityConfigResolver;
import com.fintech.marketmaking.strategy.policy.CooldownRefillPolicy;
import com.fintech.marketmaking.strategy.policy.CostBasisStopLoss;
import com.fintech.marketmaking.strategy.policy.JoinTouchPricing;
import com.fintech.marketmaking.strategy.policy.LiquidityGate;
import com.fintech.marketmaking.strategy.policy.NotionalLiquidityGate;
import com.fintech.marketmaking.strategy.policy.RefillPolicy;
import com.fintech.marketmaking.strategy.policy.TimedRefillPolicy;
import com.fintech.marketmaking.util.SessionWindowClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a fresh session per security, wiring the policies of the requested variant.
 *
 * <ul>
 *   <li>BASELINE: timed refill, one-shot liquidity check</li>
 *   <li>PRICE_FOLLOW_COOLDOWN: cooldown refill, one-shot liquidity check</li>
 *   <li>STOP_LOSS: price-follow plus cost-basis stop-loss</li>
 *   <li>LIQUIDITY_MONITOR: price-follow plus continuous liquidity monitoring</li>
 *   <li>CLOSING_AUCTION: {@link ClosingAuctionSession}</li>
 * </ul>
 */
public class SessionFactory {

    private static final Logger log = LoggerFactory.getLogger(SessionFactory.class);

    private final SecurityConfigResolver resolver;
    private final SessionWindowClassifier classifier;
    private final ClosingSchedule closingSchedule;

    public SessionFactory(SecurityConfigResolver resolver,
                          SessionWindowClassifier classifier,
                          ClosingSchedule closingSchedule) {
        this.resolver = resolver;
        this.classifier = classifier;
        this.closingSchedule = closingSchedule;
    }

    public TradingSession create(String security, StrategyVariant variant) {
        if (variant == StrategyVariant.CLOSING_AUCTION) {
            ClosingAuctionConfig closing = resolver.resolveClosing(security);
            log.debug("Creating closing-auction session for {}", security);
            return new ClosingAuctionSession(closing, closingSchedule,
                                             new CostBasisStopLoss(closing.stopLossThresholdPct()));
        }

        SecurityConfig config = resolver.resolve(security);
        RefillPolicy refill = variant == StrategyVariant.BASELINE
            ? new TimedRefillPolicy(config.refillInterval())
            : new CooldownRefillPolicy(config.refillInterval());
        LiquidityGate gate = new NotionalLiquidityGate(
            config.minLiquidityNotional(), variant == StrategyVariant.LIQUIDITY_MONITOR);
        CostBasisStopLoss stopLoss = variant == StrategyVariant.STOP_LOSS
            ? new CostBasisStopLoss(config.stopLossThresholdPct())
            : null;

        log.debug("Creating {} session for {}", variant, security);
        return new MarketMakingSession(
            variant,
            config,
            classifier,
            new QuoteGenerator(new JoinTouchPricing(), config.maxPosition(), config.maxNotional()),
            refill,
            gate,
            stopLoss
        );
    }
}
