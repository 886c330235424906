package com.fintech.marketmaking.strategy;

import com.fintech.marketmaking.book.OrderBook;
import com.fintech.marketmaking.domain.Side;
import com.fintech.marketmaking.domain.TradeSide;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Queue-position fill model for our resting quotes.
 *
 * A print at or above our ask lifts it, a print at or below our bid hits it. The printed
 * volume first consumes the visible quantity queued ahead of us, then our remainder;
 * only the second part is our fill. We join at the back of the visible level, which
 * does not include our own size. Everything consumed is taken out of the book level.
 *
 * Stateless - all state lives in the {@link SideState}s and the book passed in.
 */
public class FillSimulator {

    private static final Logger log = LoggerFactory.getLogger(FillSimulator.class);

    /**
     * Matches a trade print against both displayed quotes.
     *
     * @return our executions, at the trade price, ask side first
     */
    public List<QuoteFill> onTrade(double tradePrice, long tradeQuantity,
                                   SideState bid, SideState ask, OrderBook book) {
        List<QuoteFill> fills = new ArrayList<>(2);

        if (isHit(ask, tradePrice)) {
            match(ask, tradePrice, tradeQuantity, book, fills);
        }
        if (isHit(bid, tradePrice)) {
            match(bid, tradePrice, tradeQuantity, book, fills);
        }
        return fills;
    }

    /** Inclusive on both sides. */
    boolean isHit(SideState state, double tradePrice) {
        if (!state.isDisplayed() || state.price() == null) {
            return false;
        }
        return state.side() == Side.ASK
            ? tradePrice >= state.price()
            : tradePrice <= state.price();
    }

    private void match(SideState state, double tradePrice, long tradeQuantity,
                       OrderBook book, List<QuoteFill> fills) {
        double quotePrice = state.price();
        SideState.QueueConsumption consumed = state.consume(tradeQuantity);
        book.remove(state.side(), quotePrice, consumed.total());

        log.trace("{} quote @{} hit by {}x{}: ahead consumed={}, own consumed={}",
                  state.side(), quotePrice, tradeQuantity, tradePrice,
                  consumed.aheadConsumed(), consumed.ownConsumed());

        if (consumed.ownConsumed() > 0) {
            fills.add(new QuoteFill(state.side().fillDirection(), tradePrice, consumed.ownConsumed()));
        }
    }

    /**
     * One execution of our quote.
     */
    public record QuoteFill(TradeSide side, double price, long quantity) {
    }
}
