package com.fintech.marketmaking.strategy;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Available strategy variants.
 */
public enum StrategyVariant {

    BASELINE("v1_baseline",
        "Join the touch; quotes stick for the refill interval, every refill is a new order"),
    PRICE_FOLLOW_COOLDOWN("v2_price_follow_qty_cooldown",
        "Follow the touch on every update; after a fill only the remainder is offered until the cooldown ends"),
    STOP_LOSS("v2_1_stop_loss",
        "Price-follow with cooldown plus liquidation when unrealized loss exceeds the threshold"),
    LIQUIDITY_MONITOR("v3_liquidity_monitor",
        "Price-follow with cooldown plus continuous depth monitoring at the quoted price"),
    CLOSING_AUCTION("closing_auction",
        "Pre-close VWAP entry orders filled in the closing auction, exited at VWAP on a later day");

    private final String code;
    private final String description;

    StrategyVariant(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String code() {
        return code;
    }

    public String description() {
        return description;
    }

    /** Variants that only act within the silent-period-to-closing-auction window. */
    public boolean usesStrictWindow() {
        return this == STOP_LOSS || this == LIQUIDITY_MONITOR;
    }

    /**
     * Resolves a variant from its code ("v1_baseline") or enum name ("BASELINE", "stop-loss").
     */
    public static Optional<StrategyVariant> fromCode(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
            .filter(v -> v.name().equals(normalized) || v.code.equalsIgnoreCase(value.trim()))
            .findFirst();
    }
}
