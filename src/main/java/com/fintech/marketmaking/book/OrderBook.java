package com.fintech.marketmaking.book;

import com.fintech.marketmaking.domain.BookLevel;
import com.fintech.marketmaking.domain.MarketEvent;
import com.fintech.marketmaking.domain.Side;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Aggregated price-to-quantity book for one security, rebuilt from quote events.
 * Levels with non-positive quantity never exist. Not thread-safe; owned by one session.
 */
public class OrderBook {

    private static final Logger log = LoggerFactory.getLogger(OrderBook.class);

    private final BookMode mode;

    // Bids descending so firstEntry() is the best bid, asks ascending
    private final NavigableMap<Double, Long> bids = new TreeMap<>(Collections.reverseOrder());
    private final NavigableMap<Double, Long> asks = new TreeMap<>();

    private Double lastTradePrice;
    private long lastTradeQuantity;

    public OrderBook() {
        this(BookMode.AGGREGATED);
    }

    public OrderBook(BookMode mode) {
        this.mode = mode;
    }

    /**
     * Applies a market update. Quote updates overwrite the quantity at their price;
     * trades only record the last print. Invalid prices and unknown types are ignored.
     *
     * @return true if the event was applied
     */
    public boolean applyUpdate(MarketEvent event) {
        if (event == null || event.type() == null || !(event.price() > 0)) {
            log.trace("Ignoring malformed update: {}", event);
            return false;
        }

        switch (event.type()) {
            case BID -> setLevel(bids, event.price(), event.quantity());
            case ASK -> setLevel(asks, event.price(), event.quantity());
            case TRADE -> {
                lastTradePrice = event.price();
                lastTradeQuantity = event.quantity();
            }
        }
        return true;
    }

    private void setLevel(NavigableMap<Double, Long> levels, double price, long quantity) {
        if (mode == BookMode.TOP_OF_BOOK) {
            levels.clear();
        }
        if (quantity > 0) {
            levels.put(price, quantity);
        } else {
            levels.remove(price);
        }
    }

    /** Highest bid level, empty if no bids. */
    public Optional<BookLevel> bestBid() {
        return best(bids);
    }

    /** Lowest ask level, empty if no asks. */
    public Optional<BookLevel> bestAsk() {
        return best(asks);
    }

    public Optional<BookLevel> best(Side side) {
        return best(levels(side));
    }

    private Optional<BookLevel> best(NavigableMap<Double, Long> levels) {
        Map.Entry<Double, Long> top = levels.firstEntry();
        return top == null ? Optional.empty() : Optional.of(new BookLevel(top.getKey(), top.getValue()));
    }

    /** Resting quantity at an exact price, 0 if the level does not exist. */
    public long quantityAt(Side side, double price) {
        return levels(side).getOrDefault(price, 0L);
    }

    /**
     * Decrements a level by liquidity consumed in a fill, deleting it when exhausted.
     * Unknown levels and non-positive quantities are no-ops.
     */
    public void remove(Side side, double price, long quantity) {
        if (quantity <= 0) {
            return;
        }
        NavigableMap<Double, Long> levels = levels(side);
        Long resting = levels.get(price);
        if (resting == null) {
            return;
        }
        if (resting <= quantity) {
            levels.remove(price);
        } else {
            levels.put(price, resting - quantity);
        }
    }

    /** Mid of best bid and ask, or the single available touch, empty if both sides are empty. */
    public Optional<Double> referencePrice() {
        Optional<BookLevel> bid = bestBid();
        Optional<BookLevel> ask = bestAsk();
        if (bid.isPresent() && ask.isPresent()) {
            return Optional.of((bid.get().price() + ask.get().price()) / 2.0);
        }
        return bid.or(() -> ask).map(BookLevel::price);
    }

    /** Mid price, present only when both sides exist. */
    public Optional<Double> midPrice() {
        Optional<BookLevel> bid = bestBid();
        Optional<BookLevel> ask = bestAsk();
        if (bid.isPresent() && ask.isPresent()) {
            return Optional.of((bid.get().price() + ask.get().price()) / 2.0);
        }
        return Optional.empty();
    }

    /** Drops all levels and the last trade (new trading day). */
    public void clear() {
        bids.clear();
        asks.clear();
        lastTradePrice = null;
        lastTradeQuantity = 0;
    }

    public Optional<Double> lastTradePrice() {
        return Optional.ofNullable(lastTradePrice);
    }

    public long lastTradeQuantity() {
        return lastTradeQuantity;
    }

    public int depth(Side side) {
        return levels(side).size();
    }

    public boolean isEmpty() {
        return bids.isEmpty() && asks.isEmpty();
    }

    public BookMode mode() {
        return mode;
    }

    private NavigableMap<Double, Long> levels(Side side) {
        return side == Side.BID ? bids : asks;
    }

    @Override
    public String toString() {
        return "OrderBook{bids=" + bids.size() + " levels, asks=" + asks.size()
            + " levels, lastTrade=" + lastTradePrice + "}";
    }
}
