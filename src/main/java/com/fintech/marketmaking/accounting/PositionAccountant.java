package com.fintech.marketmaking.accounting;

import com.fintech.marketmaking.domain.Fill;
import com.fintech.marketmaking.domain.FillType;
import com.fintech.marketmaking.domain.TradeSide;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Signed position, weighted-average entry price and realized PnL for one security.
 *
 * A fill first closes any opposite position (realizing PnL against the average entry),
 * then opens or extends with the remainder at weighted-average cost. Opening or
 * extending never changes realized PnL. Not thread-safe; owned by one session.
 */
public class PositionAccountant {

    private static final Logger log = LoggerFactory.getLogger(PositionAccountant.class);

    private long position;
    private double averageEntryPrice;
    private double realizedPnl;
    private final List<Fill> fills = new ArrayList<>();

    /**
     * Books an execution and appends its fill record.
     *
     * @param timestamp Execution time
     * @param side Buy or sell
     * @param price Execution price
     * @param quantity Executed quantity; zero or negative is ignored
     * @param type Origin of the fill
     * @return the recorded fill, empty when quantity is not positive
     */
    public Optional<Fill> record(LocalDateTime timestamp, TradeSide side, double price, long quantity, FillType type) {
        if (quantity <= 0) {
            return Optional.empty();
        }

        double fillPnl = 0.0;
        long remaining = quantity;

        // Close the opposite position first
        if (position != 0 && Long.signum(position) != side.sign()) {
            long closeQty = Math.min(remaining, Math.abs(position));
            if (position > 0) {
                fillPnl = (price - averageEntryPrice) * closeQty;
            } else {
                fillPnl = (averageEntryPrice - price) * closeQty;
            }
            realizedPnl += fillPnl;
            position += side.sign() * closeQty;
            remaining -= closeQty;
            if (position == 0) {
                averageEntryPrice = 0.0;
            }
        }

        // Open or extend with the remainder
        if (remaining > 0) {
            long held = Math.abs(position);
            long newSize = held + remaining;
            averageEntryPrice = held == 0
                ? price
                : (averageEntryPrice * held + price * remaining) / newSize;
            position += side.sign() * remaining;
        }

        Fill fill = new Fill(timestamp, side, price, quantity, fillPnl, position, realizedPnl, type);
        fills.add(fill);

        log.debug("Fill {} {} {}@{} type={} -> position={}, realizedPnl={}",
                 timestamp, side, quantity, price, type, position, realizedPnl);
        return Optional.of(fill);
    }

    /**
     * Closes the whole position with a synthetic opposite fill.
     *
     * @return the flatten fill, empty when already flat
     */
    public Optional<Fill> flatten(LocalDateTime timestamp, double price, FillType type) {
        if (position == 0) {
            return Optional.empty();
        }
        TradeSide side = position > 0 ? TradeSide.SELL : TradeSide.BUY;
        return record(timestamp, side, price, Math.abs(position), type);
    }

    /** Unrealized PnL of the open position marked at the given price. */
    public double unrealizedPnl(double markPrice) {
        return position == 0 ? 0.0 : (markPrice - averageEntryPrice) * position;
    }

    /** Realized plus unrealized PnL. */
    public double markToMarket(double markPrice) {
        return realizedPnl + unrealizedPnl(markPrice);
    }

    public long position() {
        return position;
    }

    /** Average entry price; only meaningful while the position is non-zero. */
    public double averageEntryPrice() {
        return averageEntryPrice;
    }

    public double realizedPnl() {
        return realizedPnl;
    }

    public boolean isFlat() {
        return position == 0;
    }

    /** Read-only view of fills in execution order. */
    public List<Fill> fills() {
        return Collections.unmodifiableList(fills);
    }
}
