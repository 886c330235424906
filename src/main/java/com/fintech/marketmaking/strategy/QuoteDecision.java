package com.fintech.marketmaking.strategy;

import com.fintech.marketmaking.domain.Side;

import java.util.Optional;

/**
 * Candidates for both sides; a side is absent when its touch is missing.
 */
public record QuoteDecision(QuoteCandidate bid, QuoteCandidate ask) {

    public Optional<QuoteCandidate> side(Side side) {
        return Optional.ofNullable(side == Side.BID ? bid : ask);
    }
}
