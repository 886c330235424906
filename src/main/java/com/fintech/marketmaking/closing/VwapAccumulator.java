package com.fintech.marketmaking.closing;

import java.util.Optional;

/**
 * Running volume-weighted average price of trade prints.
 */
public class VwapAccumulator {

    private double priceVolume;
    private long volume;

    /** Adds a print; non-positive price or volume is ignored. */
    public void add(double price, long quantity) {
        if (price > 0 && quantity > 0) {
            priceVolume += price * quantity;
            volume += quantity;
        }
    }

    public Optional<Double> vwap() {
        return volume > 0 ? Optional.of(priceVolume / volume) : Optional.empty();
    }

    public long volume() {
        return volume;
    }

    public void reset() {
        priceVolume = 0.0;
        volume = 0;
    }
}
