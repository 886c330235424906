package com.fintech.marketmaking.strategy.policy;

import com.fintech.marketmaking.book.OrderBook;
import com.fintech.marketmaking.domain.BookLevel;
import com.fintech.marketmaking.domain.Side;

import java.util.Optional;

/**
 * Joins the current best bid / best ask exactly.
 */
public class JoinTouchPricing implements PricingPolicy {

    @Override
    public Optional<Double> quotePrice(Side side, OrderBook book) {
        return book.best(side).map(BookLevel::price);
    }
}
