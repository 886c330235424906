package com.fintech.marketmaking.closing;

import com.fintech.marketmaking.domain.Fill;
import com.fintech.marketmaking.domain.FillType;
import com.fintech.marketmaking.domain.MarketEvent;
import com.fintech.marketmaking.domain.TradeSide;
import com.fintech.marketmaking.strategy.SessionResult;
import com.fintech.marketmaking.strategy.policy.CostBasisStopLoss;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("ClosingAuctionSession Tests")
class ClosingAuctionSessionTest {

    private static final LocalDate DAY_1 = LocalDate.of(2025, 3, 3);
    private static final LocalDate DAY_2 = DAY_1.plusDays(1);
    private static final LocalDate DAY_3 = DAY_2.plusDays(1);

    private static LocalDateTime at(LocalDate day, String time) {
        return LocalDateTime.of(day, LocalTime.parse(time));
    }

    private static ClosingAuctionSession session(boolean stopLoss, boolean sellFilter) {
        return session(0.5, stopLoss, sellFilter);
    }

    private static ClosingAuctionSession session(double spreadPct, boolean stopLoss, boolean sellFilter) {
        ClosingAuctionConfig config = new ClosingAuctionConfig(
            "TEST", Duration.ofMinutes(15), spreadPct, 250_000, 1000L, null, Exchange.ADX,
            stopLoss, 2.0, sellFilter, 10, false, 10, 10.0);
        return new ClosingAuctionSession(config, ClosingSchedule.defaults(), new CostBasisStopLoss(2.0));
    }

    /** Pre-close VWAP 10.10, entries at 10.04 / 10.16, close 10.00 on 10000 shares. */
    private static List<MarketEvent> entryDay() {
        return List.of(
            MarketEvent.trade(at(DAY_1, "14:35:00"), 10.00, 1000),
            MarketEvent.trade(at(DAY_1, "14:40:00"), 10.20, 1000),
            MarketEvent.bid(at(DAY_1, "14:46:00"), 10.00, 100),
            MarketEvent.trade(at(DAY_1, "14:50:00"), 10.00, 5000),
            MarketEvent.trade(at(DAY_1, "14:55:00"), 10.00, 5000)
        );
    }

    @Test
    @DisplayName("Entry orders straddle the pre-close VWAP on the tick ladder")
    void testOrderPlacement() {
        ClosingAuctionSession session = session(false, false);
        session.processBatch(entryDay().subList(0, 3));

        assertThat(session.auctionOrders()).hasSize(2);
        AuctionOrder buy = session.auctionOrders().get(0);
        AuctionOrder sell = session.auctionOrders().get(1);
        assertThat(buy.side()).isEqualTo(TradeSide.BUY);
        assertThat(buy.price()).isEqualTo(10.04);
        assertThat(buy.quantity()).isEqualTo(1000);
        assertThat(sell.side()).isEqualTo(TradeSide.SELL);
        assertThat(sell.price()).isEqualTo(10.16);
        assertThat(buy.vwapReference()).isCloseTo(10.1, within(1e-9));
    }

    @Test
    @DisplayName("Closing print fills the crossed entry and books an exit at VWAP for the next day")
    void testClosingPrintEntry() {
        ClosingAuctionSession session = session(false, false);
        session.processBatch(entryDay());

        SessionResult result = session.result();
        assertThat(result.fills()).hasSize(1);
        Fill entry = result.fills().get(0);
        assertThat(entry.type()).isEqualTo(FillType.AUCTION_ENTRY);
        assertThat(entry.side()).isEqualTo(TradeSide.BUY);
        assertThat(entry.quantity()).isEqualTo(1000);
        assertThat(entry.price()).isEqualTo(10.00);

        assertThat(session.exitOrders()).hasSize(1);
        ExitOrder exit = session.exitOrders().get(0);
        assertThat(exit.side()).isEqualTo(TradeSide.SELL);
        assertThat(exit.price()).isEqualTo(10.10);
        assertThat(exit.targetDate()).isEqualTo(DAY_2);
        assertThat(session.auctionOrders()).isEmpty();
        assertThat(result.closingSummary().buyEntries()).isEqualTo(1);
        assertThat(result.closingSummary().openExitOrders()).isEqualTo(1);
    }

    @Test
    @DisplayName("Entry fill is capped by the share of auction volume")
    void testAuctionVolumeCap() {
        ClosingAuctionSession session = session(false, false);
        List<MarketEvent> events = new ArrayList<>(entryDay().subList(0, 3));
        events.add(MarketEvent.trade(at(DAY_1, "14:55:00"), 10.00, 3000));

        session.processBatch(events);

        assertThat(session.position()).isEqualTo(300);
        assertThat(session.exitOrders().get(0).quantity()).isEqualTo(300);
    }

    @Test
    @DisplayName("Exit fills partially by printed volume on later days")
    void testVwapExits() {
        ClosingAuctionSession session = session(false, false);
        session.processBatch(entryDay());

        session.onEvent(MarketEvent.trade(at(DAY_2, "10:30:00"), 10.05, 100));
        assertThat(session.position()).isEqualTo(1000);

        session.onEvent(MarketEvent.trade(at(DAY_2, "10:31:00"), 10.12, 400));
        session.onEvent(MarketEvent.trade(at(DAY_2, "10:32:00"), 10.15, 1000));

        SessionResult result = session.result();
        List<Fill> exits = result.fills().stream().filter(f -> f.type() == FillType.VWAP_EXIT).toList();
        assertThat(exits).extracting(Fill::quantity).containsExactly(400L, 600L);
        assertThat(exits).extracting(Fill::price).containsExactly(10.12, 10.15);
        assertThat(result.finalPosition()).isZero();
        assertThat(result.realizedPnl()).isCloseTo(400 * 0.12 + 600 * 0.15, within(1e-6));
        assertThat(result.closingSummary().vwapExits()).isEqualTo(2);
        assertThat(session.exitOrders()).isEmpty();
    }

    @Test
    @DisplayName("An exit still open at a later close is flattened at the print")
    void testExitFlatten() {
        ClosingAuctionSession session = session(false, false);
        session.processBatch(entryDay());

        session.onEvent(MarketEvent.trade(at(DAY_2, "14:55:00"), 9.90, 100));

        SessionResult result = session.result();
        Fill flatten = result.fills().get(result.fills().size() - 1);
        assertThat(flatten.type()).isEqualTo(FillType.EXIT_FLATTEN);
        assertThat(flatten.quantity()).isEqualTo(1000);
        assertThat(flatten.price()).isEqualTo(9.90);
        assertThat(result.finalPosition()).isZero();
        assertThat(result.realizedPnl()).isCloseTo(-100.0, within(1e-6));
        assertThat(result.closingSummary().exitFlattens()).isEqualTo(1);
    }

    @Test
    @DisplayName("A strong uptrend suppresses the sell entry")
    void testTrendFilter() {
        ClosingAuctionSession session = session(false, true);
        List<MarketEvent> events = new ArrayList<>();
        LocalTime t = LocalTime.of(10, 0);
        // Roughly +90 bps per hour
        for (int i = 0; i < 12; i++) {
            events.add(MarketEvent.trade(LocalDateTime.of(DAY_1, t.plusMinutes(20L * i)), 10.00 + 0.03 * i, 100));
        }
        // Pre-close prints continue the trend
        events.add(MarketEvent.trade(at(DAY_1, "14:35:00"), 10.40, 1000));
        events.add(MarketEvent.trade(at(DAY_1, "14:40:00"), 10.42, 1000));
        events.add(MarketEvent.bid(at(DAY_1, "14:46:00"), 10.40, 100));

        session.processBatch(events);

        assertThat(session.trendSlopeBpsPerHour()).isGreaterThan(10.0);
        assertThat(session.auctionOrders()).extracting(AuctionOrder::side).containsExactly(TradeSide.BUY);
        assertThat(session.result().closingSummary().filteredSellEntries()).isEqualTo(1);
    }

    @Test
    @DisplayName("Stop-loss liquidates the carried position and cancels its exit")
    void testStopLoss() {
        ClosingAuctionSession session = session(true, false);
        session.processBatch(entryDay());

        session.onEvent(MarketEvent.bid(at(DAY_2, "10:15:00"), 9.70, 500));
        // Mid 9.71: -2.9% on a 10.00 basis
        session.onEvent(MarketEvent.ask(at(DAY_2, "10:15:01"), 9.72, 500));
        assertThat(session.position()).isEqualTo(500);
        assertThat(session.exitOrders()).isEmpty();

        session.onEvent(MarketEvent.bid(at(DAY_2, "10:15:02"), 9.69, 800));

        SessionResult result = session.result();
        assertThat(result.finalPosition()).isZero();
        assertThat(result.stopLossTriggers()).isEqualTo(1);
        assertThat(result.fills().stream().filter(f -> f.type() == FillType.STOP_LOSS))
            .extracting(Fill::quantity).containsExactly(500L, 500L);
        assertThat(result.closingSummary().stopLosses()).isEqualTo(2);
    }

    @Test
    @DisplayName("An unfinished liquidation carries over and closes at the next closing print")
    void testStopLossCarriedAcrossDays() {
        ClosingAuctionSession session = session(true, false);
        session.processBatch(entryDay());

        // Given: stop-loss fills half against a 500 lot, and the day has no closing print
        session.onEvent(MarketEvent.bid(at(DAY_2, "10:15:00"), 9.70, 500));
        session.onEvent(MarketEvent.ask(at(DAY_2, "10:15:01"), 9.72, 500));
        assertThat(session.position()).isEqualTo(500);
        assertThat(session.exitOrders()).isEmpty();

        // When: the next day trades through its close
        session.onEvent(MarketEvent.trade(at(DAY_3, "11:00:00"), 10.11, 200));
        session.onEvent(MarketEvent.trade(at(DAY_3, "14:55:00"), 10.11, 200));

        // Then: the remainder is closed at the print
        SessionResult result = session.result();
        assertThat(result.finalPosition()).isZero();
        assertThat(result.stopLossTriggers()).isEqualTo(1);
        Fill last = result.fills().get(result.fills().size() - 1);
        assertThat(last.type()).isEqualTo(FillType.STOP_LOSS);
        assertThat(last.side()).isEqualTo(TradeSide.SELL);
        assertThat(last.quantity()).isEqualTo(500);
        assertThat(last.price()).isEqualTo(10.11);
        assertThat(last.timestamp()).isEqualTo(at(DAY_3, "14:55:00"));
    }

    @Test
    @DisplayName("Entries on both sides of one print offset and leave no exits")
    void testOffsettingEntries() {
        ClosingAuctionSession session = session(0.0, false, false);
        List<MarketEvent> events = new ArrayList<>(entryDay().subList(0, 4));
        events.add(MarketEvent.trade(at(DAY_1, "14:55:00"), 10.10, 5000));

        session.processBatch(events);

        assertThat(session.result().fills()).extracting(Fill::side)
            .containsExactlyInAnyOrder(TradeSide.BUY, TradeSide.SELL);
        assertThat(session.position()).isZero();
        assertThat(session.exitOrders()).isEmpty();

        // A rally the next day opens nothing
        session.onEvent(MarketEvent.trade(at(DAY_2, "10:30:00"), 10.20, 5000));
        assertThat(session.position()).isZero();
        assertThat(session.result().fills()).hasSize(2);
    }

    @Test
    @DisplayName("Stop-loss stays off when disabled")
    void testStopLossDisabled() {
        ClosingAuctionSession session = session(false, false);
        session.processBatch(entryDay());

        session.onEvent(MarketEvent.bid(at(DAY_2, "10:15:00"), 9.70, 500));
        session.onEvent(MarketEvent.ask(at(DAY_2, "10:15:01"), 9.72, 500));

        assertThat(session.position()).isEqualTo(1000);
        assertThat(session.exitOrders()).hasSize(1);
    }

    @Test
    @DisplayName("No VWAP, no entry orders")
    void testNoVwap() {
        ClosingAuctionSession session = session(false, false);
        session.onEvent(MarketEvent.bid(at(DAY_1, "14:46:00"), 10.00, 100));
        session.onEvent(MarketEvent.trade(at(DAY_1, "14:55:00"), 10.00, 5000));

        assertThat(session.result().fills()).isEmpty();
        assertThat(session.result().marketDates()).containsExactly(DAY_1);
    }
}
