package com.fintech.marketmaking.strategy.policy;

import com.fintech.marketmaking.strategy.SideState;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Quotes stick for a fixed interval. A side re-quotes once the interval has elapsed
 * since its last placement or fill, and each re-quote is a brand-new order.
 */
public class TimedRefillPolicy implements RefillPolicy {

    private final Duration interval;

    public TimedRefillPolicy(Duration interval) {
        this.interval = interval;
    }

    @Override
    public boolean mayRequote(SideState state, LocalDateTime now) {
        LocalDateTime start = state.timerStart();
        if (start == null) {
            return true;
        }
        return Duration.between(start, now).compareTo(interval) >= 0;
    }

    @Override
    public long offerSize(SideState state, LocalDateTime now, long fullSize) {
        return fullSize;
    }

    @Override
    public boolean keepsQueuePositionAtSamePrice() {
        return false;
    }

    public Duration interval() {
        return interval;
    }
}
