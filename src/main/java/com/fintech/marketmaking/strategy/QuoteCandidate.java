package com.fintech.marketmaking.strategy;

import com.fintech.marketmaking.domain.Side;

/**
 * Proposed quote for one side before the liquidity gate.
 *
 * @param side Bid or ask
 * @param price Quote price
 * @param size Size after position headroom, may be 0
 */
public record QuoteCandidate(Side side, double price, long size) {
}
