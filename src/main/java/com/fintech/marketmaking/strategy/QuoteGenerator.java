package com.fintech.marketmaking.strategy;

import com.fintech.marketmaking.book.OrderBook;
import com.fintech.marketmaking.domain.Side;
import com.fintech.marketmaking.strategy.policy.PricingPolicy;

import java.util.Optional;

/**
 * Builds per-side quote candidates from the touch, bounded by position headroom.
 *
 * Headroom is {@code maxPosition - position} on the bid and {@code maxPosition + position}
 * on the ask, never negative. With a notional cap the limit shrinks to
 * {@code floor(maxNotional / reference)} where reference is the mid, or the single touch.
 */
public class QuoteGenerator {

    private final PricingPolicy pricing;
    private final long maxPosition;
    private final Double maxNotional;

    public QuoteGenerator(PricingPolicy pricing, long maxPosition, Double maxNotional) {
        this.pricing = pricing;
        this.maxPosition = maxPosition;
        this.maxNotional = maxNotional;
    }

    /**
     * @param book current book
     * @param position signed position
     * @param bidBaseSize size the refill policy allows on the bid
     * @param askBaseSize size the refill policy allows on the ask
     * @return candidates, empty only when both sides of the book are empty
     */
    public Optional<QuoteDecision> generate(OrderBook book, long position, long bidBaseSize, long askBaseSize) {
        if (book.bestBid().isEmpty() && book.bestAsk().isEmpty()) {
            return Optional.empty();
        }

        long limit = effectiveMaxPosition(book);
        long bidHeadroom = Math.max(0, limit - position);
        long askHeadroom = Math.max(0, limit + position);

        QuoteCandidate bid = pricing.quotePrice(Side.BID, book)
            .map(price -> new QuoteCandidate(Side.BID, price, Math.max(0, Math.min(bidBaseSize, bidHeadroom))))
            .orElse(null);
        QuoteCandidate ask = pricing.quotePrice(Side.ASK, book)
            .map(price -> new QuoteCandidate(Side.ASK, price, Math.max(0, Math.min(askBaseSize, askHeadroom))))
            .orElse(null);

        return Optional.of(new QuoteDecision(bid, ask));
    }

    long effectiveMaxPosition(OrderBook book) {
        if (maxNotional == null) {
            return maxPosition;
        }
        return book.referencePrice()
            .map(reference -> Math.min(maxPosition, (long) Math.floor(maxNotional / reference)))
            .orElse(maxPosition);
    }
}
