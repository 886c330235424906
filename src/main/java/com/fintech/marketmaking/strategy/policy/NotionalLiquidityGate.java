package com.fintech.marketmaking.strategy.policy;

/**
 * Requires price x ahead quantity to reach a minimum notional in local currency.
 */
public class NotionalLiquidityGate implements LiquidityGate {

    private final double minNotional;
    private final boolean continuousMonitoring;

    public NotionalLiquidityGate(double minNotional, boolean continuousMonitoring) {
        this.minNotional = minNotional;
        this.continuousMonitoring = continuousMonitoring;
    }

    @Override
    public boolean permits(double price, long ahead, long size) {
        return size > 0 && price * ahead >= minNotional;
    }

    @Override
    public boolean monitorsContinuously() {
        return continuousMonitoring;
    }

    public double minNotional() {
        return minNotional;
    }
}
