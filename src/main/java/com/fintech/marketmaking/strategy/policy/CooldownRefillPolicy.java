package com.fintech.marketmaking.strategy.policy;

import com.fintech.marketmaking.strategy.SideState;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Price follows the market on every event; size is rationed after fills.
 *
 * While the cooldown since the side's last fill is running only the unfilled
 * remainder may be offered. Full size returns once it elapses.
 */
public class CooldownRefillPolicy implements RefillPolicy {

    private final Duration cooldown;

    public CooldownRefillPolicy(Duration cooldown) {
        this.cooldown = cooldown;
    }

    @Override
    public boolean mayRequote(SideState state, LocalDateTime now) {
        return true;
    }

    @Override
    public long offerSize(SideState state, LocalDateTime now, long fullSize) {
        return inCooldown(state, now) ? state.ourRemaining() : fullSize;
    }

    @Override
    public boolean keepsQueuePositionAtSamePrice() {
        return true;
    }

    public boolean inCooldown(SideState state, LocalDateTime now) {
        LocalDateTime lastFill = state.lastFill();
        return lastFill != null && Duration.between(lastFill, now).compareTo(cooldown) < 0;
    }

    public Duration cooldown() {
        return cooldown;
    }
}
