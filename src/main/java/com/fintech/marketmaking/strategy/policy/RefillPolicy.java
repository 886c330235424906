package com.fintech.marketmaking.strategy.policy;

import com.fintech.marketmaking.strategy.SideState;

import java.time.LocalDateTime;

/**
 * Decides when a side may be re-quoted and with how much size.
 */
public interface RefillPolicy {

    /** Whether the side may place or update its quote at this time. */
    boolean mayRequote(SideState state, LocalDateTime now);

    /**
     * Base size to offer before position headroom is applied.
     *
     * @param fullSize configured quote size for the side
     */
    long offerSize(SideState state, LocalDateTime now, long fullSize);

    /**
     * True if a re-quote at an unchanged price keeps the existing queue position,
     * false if every re-quote is a fresh order at the back of the level.
     */
    boolean keepsQueuePositionAtSamePrice();
}
