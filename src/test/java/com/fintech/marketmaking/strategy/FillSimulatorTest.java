package com.fintech.marketmaking.strategy;

import com.fintech.marketmaking.book.OrderBook;
import com.fintech.marketmaking.domain.MarketEvent;
import com.fintech.marketmaking.domain.Side;
import com.fintech.marketmaking.domain.TradeSide;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FillSimulator Tests")
class FillSimulatorTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2025, 3, 3, 10, 30);

    private final FillSimulator simulator = new FillSimulator();

    private OrderBook book;
    private SideState bid;
    private SideState ask;

    @BeforeEach
    void setUp() {
        book = new OrderBook();
        bid = new SideState(Side.BID);
        ask = new SideState(Side.ASK);
    }

    @ParameterizedTest(name = "trade @{0} hits bid @10.00: {1}")
    @CsvSource({
        "10.00, true",
        "9.95, true",
        "10.01, false"
    })
    @DisplayName("Bid is hit by prints at or below its price")
    void testBidBoundary(double tradePrice, boolean expectedHit) {
        bid.place(10.00, 0, 50, T0);

        List<FillSimulator.QuoteFill> fills = simulator.onTrade(tradePrice, 30, bid, ask, book);

        assertThat(fills).hasSize(expectedHit ? 1 : 0);
        if (expectedHit) {
            assertThat(fills.get(0)).isEqualTo(new FillSimulator.QuoteFill(TradeSide.BUY, tradePrice, 30));
        }
    }

    @ParameterizedTest(name = "trade @{0} lifts ask @10.10: {1}")
    @CsvSource({
        "10.10, true",
        "10.15, true",
        "10.09, false"
    })
    @DisplayName("Ask is lifted by prints at or above its price")
    void testAskBoundary(double tradePrice, boolean expectedHit) {
        ask.place(10.10, 0, 50, T0);

        List<FillSimulator.QuoteFill> fills = simulator.onTrade(tradePrice, 30, bid, ask, book);

        assertThat(fills).hasSize(expectedHit ? 1 : 0);
        if (expectedHit) {
            assertThat(fills.get(0).side()).isEqualTo(TradeSide.SELL);
            assertThat(fills.get(0).quantity()).isEqualTo(30);
        }
    }

    @Test
    @DisplayName("Volume first consumes the quantity queued ahead, then our order")
    void testAheadConsumedFirst() {
        // Given - we join behind 200 at the bid
        bid.place(10.00, 200, 50, T0);

        // When - 150 prints, all absorbed by the queue ahead
        List<FillSimulator.QuoteFill> first = simulator.onTrade(10.00, 150, bid, ask, book);

        // Then
        assertThat(first).isEmpty();
        assertThat(bid.aheadQuantity()).isEqualTo(50);
        assertThat(bid.ourRemaining()).isEqualTo(50);

        // When - 80 more prints: 50 ahead, 30 ours
        List<FillSimulator.QuoteFill> second = simulator.onTrade(10.00, 80, bid, ask, book);

        // Then
        assertThat(second).containsExactly(new FillSimulator.QuoteFill(TradeSide.BUY, 10.00, 30));
        assertThat(bid.aheadQuantity()).isZero();
        assertThat(bid.ourRemaining()).isEqualTo(20);
        assertThat(bid.isDisplayed()).isTrue();
    }

    @Test
    @DisplayName("A fully filled quote is no longer displayed")
    void testFullFillHidesQuote() {
        ask.place(10.10, 0, 50, T0);

        simulator.onTrade(10.10, 500, bid, ask, book);

        assertThat(ask.ourRemaining()).isZero();
        assertThat(ask.isDisplayed()).isFalse();
        assertThat(simulator.onTrade(10.10, 500, bid, ask, book)).isEmpty();
    }

    @Test
    @DisplayName("Withdrawn quotes are never filled")
    void testWithdrawnQuoteNotFilled() {
        bid.withdraw(10.00, 200);

        assertThat(simulator.onTrade(9.00, 10_000, bid, ask, book)).isEmpty();
    }

    @Test
    @DisplayName("Consumed liquidity is taken out of the book level")
    void testBookRemoval() {
        book.applyUpdate(MarketEvent.bid(T0, 10.00, 500));
        bid.place(10.00, 500, 50, T0);

        simulator.onTrade(10.00, 100, bid, ask, book);
        assertThat(book.quantityAt(Side.BID, 10.00)).isEqualTo(400);

        simulator.onTrade(10.00, 420, bid, ask, book);
        assertThat(book.quantityAt(Side.BID, 10.00)).isZero();
    }
}
