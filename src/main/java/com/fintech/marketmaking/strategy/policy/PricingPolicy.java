package com.fintech.marketmaking.strategy.policy;

import com.fintech.marketmaking.book.OrderBook;
import com.fintech.marketmaking.domain.Side;

import java.util.Optional;

/**
 * Chooses the price at which to quote one side of the book.
 */
public interface PricingPolicy {

    /**
     * @return candidate price, empty when this side cannot be priced
     */
    Optional<Double> quotePrice(Side side, OrderBook book);
}
