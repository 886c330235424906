package com.fintech.marketmaking.closing;

/**
 * Least-squares slope of intraday trade prices, expressed in basis points per hour
 * of the mean price. Fewer than {@value #MIN_POINTS} points give a flat trend.
 */
public class TrendSlopeEstimator {

    static final int MIN_POINTS = 10;

    private int count;
    private double sumX;
    private double sumY;
    private double sumXY;
    private double sumXX;

    /**
     * @param hours time of the print in hours since the regular session opened
     * @param price trade price
     */
    public void add(double hours, double price) {
        count++;
        sumX += hours;
        sumY += price;
        sumXY += hours * price;
        sumXX += hours * hours;
    }

    public double slopeBpsPerHour() {
        if (count < MIN_POINTS) {
            return 0.0;
        }
        double denominator = count * sumXX - sumX * sumX;
        if (denominator == 0) {
            return 0.0;
        }
        double slope = (count * sumXY - sumX * sumY) / denominator;
        double meanPrice = sumY / count;
        if (meanPrice == 0) {
            return 0.0;
        }
        return slope / meanPrice * 10_000;
    }

    public int count() {
        return count;
    }

    public void reset() {
        count = 0;
        sumX = 0;
        sumY = 0;
        sumXY = 0;
        sumXX = 0;
    }
}
