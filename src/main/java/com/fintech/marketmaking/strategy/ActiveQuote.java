package com.fintech.marketmaking.strategy;

import com.fintech.marketmaking.domain.Side;

/**
 * Immutable view of one side's resting quote.
 *
 * @param side Bid or ask
 * @param price Quote price, null if the side never had a candidate
 * @param aheadQuantity Visible quantity queued ahead of our order
 * @param ourRemaining Unfilled size of our order
 * @param displayed Whether the quote is live and can be hit
 */
public record ActiveQuote(Side side, Double price, long aheadQuantity, long ourRemaining, boolean displayed) {
}
