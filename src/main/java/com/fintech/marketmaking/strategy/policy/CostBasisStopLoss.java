package com.fintech.marketmaking.strategy.policy;

/**
 * Stop-loss on a quantity-weighted cost basis kept apart from the accountant's average entry.
 *
 * Opening sets the basis to price x size, adding appends price x added, reducing
 * scales it by the remaining fraction, and a flip restarts it at the new position.
 */
public class CostBasisStopLoss implements StopLossPolicy {

    private static final double EPSILON = 1e-6;

    private final double thresholdPct;

    private double costBasis;
    private long basisQuantity;

    public CostBasisStopLoss(double thresholdPct) {
        this.thresholdPct = thresholdPct;
    }

    @Override
    public void onPositionChange(long previousPosition, long newPosition, double price) {
        long oldAbs = Math.abs(previousPosition);
        long newAbs = Math.abs(newPosition);

        if (previousPosition == 0) {
            costBasis = price * newAbs;
            basisQuantity = newAbs;
        } else if (newPosition == 0) {
            reset();
        } else if (Long.signum(previousPosition) == Long.signum(newPosition)) {
            if (newAbs > oldAbs) {
                costBasis += price * (newAbs - oldAbs);
            } else if (newAbs < oldAbs) {
                costBasis *= (double) newAbs / oldAbs;
            }
            basisQuantity = newAbs;
        } else {
            costBasis = price * newAbs;
            basisQuantity = newAbs;
        }
    }

    @Override
    public double unrealizedPnlPct(long position, double markPrice) {
        if (position == 0 || basisQuantity == 0 || Math.abs(costBasis) < EPSILON) {
            return 0.0;
        }
        double averageEntry = Math.abs(costBasis) / basisQuantity;
        double unrealized = (markPrice - averageEntry) * position;
        return unrealized / Math.abs(costBasis) * 100.0;
    }

    @Override
    public boolean isBreached(long position, double markPrice) {
        return position != 0 && unrealizedPnlPct(position, markPrice) < -thresholdPct;
    }

    @Override
    public void reset() {
        costBasis = 0.0;
        basisQuantity = 0;
    }

    public double costBasis() {
        return costBasis;
    }

    public double thresholdPct() {
        return thresholdPct;
    }
}
