package com.fintech.marketmaking.closing;

/**
 * Rounds order prices to the venue's tick ladder, or to a fixed tick when configured.
 */
public class TickSizeTable {

    private static final double PRICE_SCALE = 1_000_000.0;

    private final Exchange exchange;
    private final Double fixedTick;

    public TickSizeTable(Exchange exchange, Double fixedTick) {
        this.exchange = exchange;
        this.fixedTick = fixedTick;
    }

    public double tickFor(double price) {
        return fixedTick != null ? fixedTick : exchange.tickSize(price);
    }

    /** Nearest multiple of the tick applicable at that price. */
    public double round(double price) {
        double tick = tickFor(price);
        double rounded = Math.round(price / tick) * tick;
        // Strip binary noise such as 9.950000000000001
        return Math.round(rounded * PRICE_SCALE) / PRICE_SCALE;
    }
}
