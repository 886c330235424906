package com.fintech.marketmaking.closing;

import com.fintech.marketmaking.domain.TradeSide;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Order unwinding an auction entry at the entry VWAP on a later trading day.
 * Fills partially by printed volume until nothing remains.
 */
public class ExitOrder {

    private final TradeSide side;
    private final double price;
    private final long quantity;
    private final double entryPrice;
    private final LocalDateTime entryTime;
    private final LocalDate targetDate;
    private long remaining;

    public ExitOrder(TradeSide side, double price, long quantity, double entryPrice,
                     LocalDateTime entryTime, LocalDate targetDate) {
        this.side = side;
        this.price = price;
        this.quantity = quantity;
        this.entryPrice = entryPrice;
        this.entryTime = entryTime;
        this.targetDate = targetDate;
        this.remaining = quantity;
    }

    /** Active from the target date on; never on the entry day itself. */
    public boolean isActiveOn(LocalDate date) {
        return !date.isBefore(targetDate);
    }

    public boolean isCrossedBy(double tradePrice) {
        return side == TradeSide.SELL ? tradePrice >= price : tradePrice <= price;
    }

    /** Returns the executed quantity, bounded by what remains. */
    public long fill(long available) {
        long executed = Math.min(remaining, Math.max(0, available));
        remaining -= executed;
        return executed;
    }

    public boolean isDone() {
        return remaining == 0;
    }

    public TradeSide side() {
        return side;
    }

    public double price() {
        return price;
    }

    public long quantity() {
        return quantity;
    }

    public long remaining() {
        return remaining;
    }

    public double entryPrice() {
        return entryPrice;
    }

    public LocalDateTime entryTime() {
        return entryTime;
    }

    public LocalDate targetDate() {
        return targetDate;
    }

    @Override
    public String toString() {
        return "ExitOrder{" + side + " " + remaining + "/" + quantity + "@" + price + ", target=" + targetDate + "}";
    }
}
