package com.fintech.marketmaking.strategy;

import com.fintech.marketmaking.domain.Side;

import java.time.LocalDateTime;

/**
 * Mutable per-side quoting state: our resting order plus its refill timers.
 * Not thread-safe; owned by one session.
 */
public class SideState {

    private final Side side;

    private Double price;            // Last candidate price, tracked even while withdrawn
    private long aheadQuantity;
    private long ourRemaining;
    private boolean displayed;
    private LocalDateTime lastPlacement;
    private LocalDateTime lastFill;

    public SideState(Side side) {
        this.side = side;
    }

    /** New order at price: queue position re-sampled from the visible level. */
    public void place(double price, long ahead, long size, LocalDateTime now) {
        this.price = price;
        this.aheadQuantity = Math.max(0, ahead);
        this.ourRemaining = size;
        this.displayed = true;
        this.lastPlacement = now;
    }

    /** Same price, keep the queue position and only resize our order. */
    public void resize(long size) {
        this.ourRemaining = size;
        this.displayed = true;
    }

    /** Withdraws the order; price and ahead quantity stay tracked. */
    public void withdraw(Double price, long ahead) {
        this.price = price;
        this.aheadQuantity = Math.max(0, ahead);
        this.ourRemaining = 0;
        this.displayed = false;
    }

    public void refreshAhead(long ahead) {
        this.aheadQuantity = Math.max(0, ahead);
    }

    /**
     * Runs a trade print through the queue: ahead liquidity first, then our remainder.
     *
     * @param printed traded volume reaching this price
     * @return consumption split between ahead and own quantity
     */
    public QueueConsumption consume(long printed) {
        long aheadConsumed = Math.min(aheadQuantity, Math.max(0, printed));
        aheadQuantity -= aheadConsumed;
        long left = printed - aheadConsumed;
        long ownConsumed = left > 0 ? Math.min(ourRemaining, left) : 0;
        ourRemaining -= ownConsumed;
        if (ourRemaining == 0) {
            displayed = false;
        }
        return new QueueConsumption(aheadConsumed, ownConsumed);
    }

    public void recordFill(LocalDateTime now) {
        this.lastFill = now;
    }

    /** Clears order and timers (new trading day). */
    public void reset() {
        price = null;
        aheadQuantity = 0;
        ourRemaining = 0;
        displayed = false;
        lastPlacement = null;
        lastFill = null;
    }

    /** Latest of placement and fill time, null if the side never quoted. */
    public LocalDateTime timerStart() {
        if (lastPlacement == null) {
            return lastFill;
        }
        if (lastFill == null) {
            return lastPlacement;
        }
        return lastFill.isAfter(lastPlacement) ? lastFill : lastPlacement;
    }

    public ActiveQuote snapshot() {
        return new ActiveQuote(side, price, aheadQuantity, ourRemaining, displayed);
    }

    public Side side() {
        return side;
    }

    public Double price() {
        return price;
    }

    public long aheadQuantity() {
        return aheadQuantity;
    }

    public long ourRemaining() {
        return ourRemaining;
    }

    public boolean isDisplayed() {
        return displayed;
    }

    public LocalDateTime lastPlacement() {
        return lastPlacement;
    }

    public LocalDateTime lastFill() {
        return lastFill;
    }

    /**
     * Split of a trade print between liquidity queued ahead of us and our own order.
     */
    public record QueueConsumption(long aheadConsumed, long ownConsumed) {

        public long total() {
            return aheadConsumed + ownConsumed;
        }
    }
}
