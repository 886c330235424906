package com.fintech.marketmaking.closing;

import com.fintech.marketmaking.accounting.PositionAccountant;
import com.fintech.marketmaking.book.OrderBook;
import com.fintech.marketmaking.domain.BookLevel;
import com.fintech.marketmaking.domain.Fill;
import com.fintech.marketmaking.domain.FillType;
import com.fintech.marketmaking.domain.MarketEvent;
import com.fintech.marketmaking.domain.Side;
import com.fintech.marketmaking.domain.TradeSide;
import com.fintech.marketmaking.strategy.EventCounters;
import com.fintech.marketmaking.strategy.PendingLiquidation;
import com.fintech.marketmaking.strategy.SessionResult;
import com.fintech.marketmaking.strategy.StrategyVariant;
import com.fintech.marketmaking.strategy.TradingSession;
import com.fintech.marketmaking.strategy.policy.StopLossPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Closing-auction strategy for one security.
 *
 * Each day: accumulate the pre-close VWAP, place a buy below and a sell above it once
 * the pre-close window ends, fill whichever the closing print crosses (capped by auction
 * volume), then unwind at the entry VWAP during regular hours of later days. Exits
 * still open at a later closing print are flattened there.
 */
public class ClosingAuctionSession implements TradingSession {

    private static final Logger log = LoggerFactory.getLogger(ClosingAuctionSession.class);

    private static final double NANOS_PER_HOUR = 3_600_000_000_000.0;

    private final String security;
    private final ClosingAuctionConfig config;
    private final ClosingSchedule schedule;
    private final TickSizeTable ticks;
    private final StopLossPolicy stopLoss;     // null when stop-loss is disabled
    private final LocalTime vwapStart;

    private final OrderBook book = new OrderBook();
    private final PositionAccountant accountant = new PositionAccountant();
    private final VwapAccumulator vwap = new VwapAccumulator();
    private final TrendSlopeEstimator trend = new TrendSlopeEstimator();
    private final List<AuctionOrder> auctionOrders = new ArrayList<>(2);
    private final List<ExitOrder> exitOrders = new ArrayList<>();
    private final EventCounters counters = new EventCounters();
    private final SortedSet<LocalDate> marketDates = new TreeSet<>();
    private final SortedSet<LocalDate> strategyDates = new TreeSet<>();

    private LocalDate currentDate;
    private boolean ordersPlaced;
    private boolean closeProcessed;
    private long auctionVolume;
    private PendingLiquidation pendingLiquidation;
    private Double lastTradePrice;
    private int stopLossTriggers;
    private int filteredSellEntries;
    private int filteredBuyEntries;

    public ClosingAuctionSession(ClosingAuctionConfig config, ClosingSchedule schedule, StopLossPolicy stopLoss) {
        this.security = config.security();
        this.config = config;
        this.schedule = schedule;
        this.ticks = new TickSizeTable(config.exchange(), config.tickSize());
        this.stopLoss = config.stopLossEnabled() ? stopLoss : null;
        this.vwapStart = schedule.preCloseEnd().minus(config.vwapWindow());
    }

    @Override
    public void onEvent(MarketEvent event) {
        if (event == null || !event.isValid()) {
            counters.recordIgnored();
            log.trace("{}: ignoring malformed event {}", security, event);
            return;
        }

        LocalDateTime ts = event.timestamp();
        LocalTime t = ts.toLocalTime();
        rollTradingDay(event.tradingDate());

        book.applyUpdate(event);
        counters.recordProcessed(event.type());
        if (event.isTrade()) {
            marketDates.add(currentDate);
            lastTradePrice = event.price();
        }

        // Phase 0: intraday stop-loss on the carried position
        if (stopLoss != null && schedule.isStopLossWindow(t)) {
            monitorStopLoss(ts);
        }

        if (event.isTrade()) {
            // Phase 1: exits from earlier days and trend sampling, regular hours only
            if (schedule.isRegularHours(t)) {
                trend.add(Duration.between(schedule.regularStart(), t).toNanos() / NANOS_PER_HOUR, event.price());
                processExits(ts, event.price(), event.quantity());
            }

            // Phase 2: pre-close VWAP window
            if (!t.isBefore(vwapStart) && t.isBefore(schedule.preCloseEnd())) {
                vwap.add(event.price(), event.quantity());
            }

            // Auction volume runs from the pre-close boundary through the closing print
            if (!t.isBefore(schedule.preCloseEnd()) && !closeProcessed) {
                auctionVolume += event.quantity();
            }
        }

        // Phase 3: entry orders, once per day
        if (!ordersPlaced && schedule.isOrderPlacementWindow(t)) {
            vwap.vwap().ifPresent(reference -> placeAuctionOrders(ts, reference));
        }

        // Phase 4: closing print
        if (event.isTrade() && !closeProcessed && schedule.isAtOrAfterClosingPrint(t)) {
            processClosingPrint(ts, event.price());
        }
    }

    private void rollTradingDay(LocalDate date) {
        if (date.equals(currentDate)) {
            return;
        }
        if (currentDate != null) {
            if (pendingLiquidation != null) {
                log.warn("{}: stop-loss liquidation of {} left unfinished on {}, carried into {}",
                         security, pendingLiquidation.remaining(), currentDate, date);
            }
            log.debug("{}: new trading day {}, position={}, open exits={}",
                     security, date, accountant.position(), exitOrders.size());
        }
        book.clear();
        vwap.reset();
        trend.reset();
        auctionOrders.clear();
        ordersPlaced = false;
        closeProcessed = false;
        auctionVolume = 0;
        // An unfinished liquidation keeps working until depth or a closing print absorbs it
        currentDate = date;
    }

    private void processExits(LocalDateTime ts, double price, long volume) {
        long available = volume;
        Iterator<ExitOrder> it = exitOrders.iterator();
        while (it.hasNext() && available > 0) {
            ExitOrder exit = it.next();
            if (!exit.isActiveOn(ts.toLocalDate()) || !exit.isCrossedBy(price)) {
                continue;
            }
            long executed = exit.fill(available);
            available -= executed;
            bookFill(ts, exit.side(), price, executed, FillType.VWAP_EXIT);
            if (exit.isDone()) {
                it.remove();
                log.debug("{}: exit {} completed at {}", security, exit, ts);
            }
        }
    }

    private void placeAuctionOrders(LocalDateTime ts, double reference) {
        ordersPlaced = true;
        long quantity = config.entryQuantity(reference);
        double buyPrice = ticks.round(reference * (1 - config.spreadPct() / 100.0));
        double sellPrice = ticks.round(reference * (1 + config.spreadPct() / 100.0));
        double slope = trend.slopeBpsPerHour();

        boolean skipBuy = config.trendFilterBuyEnabled() && slope < -config.trendFilterBuyThresholdBpsHr();
        boolean skipSell = config.trendFilterSellEnabled() && slope > config.trendFilterSellThresholdBpsHr();
        if (skipBuy) {
            filteredBuyEntries++;
        }
        if (skipSell) {
            filteredSellEntries++;
        }

        if (quantity > 0 && !skipBuy) {
            auctionOrders.add(new AuctionOrder(TradeSide.BUY, buyPrice, quantity, ts, reference));
        }
        if (quantity > 0 && !skipSell) {
            auctionOrders.add(new AuctionOrder(TradeSide.SELL, sellPrice, quantity, ts, reference));
        }

        log.debug("{}: auction orders at {} vwap={} buy={} sell={} qty={} slope={}bps/h skipBuy={} skipSell={}",
                 security, ts, reference, buyPrice, sellPrice, quantity, slope, skipBuy, skipSell);
    }

    private void processClosingPrint(LocalDateTime ts, double closePrice) {
        closeProcessed = true;
        LocalDate today = ts.toLocalDate();

        // Unresolved exits from earlier days close at the print before any new entry
        Iterator<ExitOrder> it = exitOrders.iterator();
        while (it.hasNext()) {
            ExitOrder exit = it.next();
            if (exit.isActiveOn(today)) {
                long quantity = exit.fill(exit.remaining());
                bookFill(ts, exit.side(), closePrice, quantity, FillType.EXIT_FLATTEN);
                it.remove();
                log.debug("{}: flattened unresolved {} at close {}", security, exit, closePrice);
            }
        }

        // A liquidation that never found depth closes at the print as well
        if (pendingLiquidation != null) {
            bookFill(ts, pendingLiquidation.side(), closePrice, pendingLiquidation.remaining(), FillType.STOP_LOSS);
            pendingLiquidation = null;
        }

        long cap = (long) Math.floor(auctionVolume * config.auctionFillPct() / 100.0);
        List<ExitOrder> entered = new ArrayList<>(2);
        for (AuctionOrder order : auctionOrders) {
            if (!order.isCrossedBy(closePrice)) {
                continue;
            }
            long quantity = Math.min(order.quantity(), cap);
            if (quantity <= 0) {
                log.debug("{}: {} entry crossed at {} but auction volume {} leaves no fill",
                         security, order.side(), closePrice, auctionVolume);
                continue;
            }
            bookFill(ts, order.side(), closePrice, quantity, FillType.AUCTION_ENTRY);
            entered.add(new ExitOrder(
                order.side().opposite(),
                ticks.round(order.vwapReference()),
                quantity,
                closePrice,
                ts,
                today.plusDays(1)
            ));
            log.info("{}: auction {} {}@{} filled", security, order.side(), quantity, closePrice);
        }
        auctionOrders.clear();

        // Both entries crossing one print offset each other; only the net size needs unwinding
        long offset = entered.size() == 2
            ? Math.min(entered.get(0).quantity(), entered.get(1).quantity())
            : 0;
        for (ExitOrder exit : entered) {
            long quantity = exit.quantity() - offset;
            if (quantity <= 0) {
                log.debug("{}: {} entry offset by the opposite entry, no exit", security, exit.side().opposite());
                continue;
            }
            ExitOrder net = offset == 0 ? exit : new ExitOrder(
                exit.side(), exit.price(), quantity, exit.entryPrice(), exit.entryTime(), exit.targetDate());
            exitOrders.add(net);
            log.info("{}: exit {}", security, net);
        }
    }

    private void monitorStopLoss(LocalDateTime ts) {
        Optional<Double> mid = book.midPrice();
        if (pendingLiquidation == null && !accountant.isFlat() && mid.isPresent()
                && stopLoss.isBreached(accountant.position(), mid.get())) {
            long position = accountant.position();
            pendingLiquidation = new PendingLiquidation(
                position > 0 ? TradeSide.SELL : TradeSide.BUY, Math.abs(position), ts);
            stopLossTriggers++;
            if (!exitOrders.isEmpty()) {
                log.debug("{}: cancelling {} exit order(s) on stop-loss", security, exitOrders.size());
                exitOrders.clear();
            }
            log.info("{}: stop-loss triggered at {} on position {} (mid {})", security, ts, position, mid.get());
        }

        if (pendingLiquidation == null) {
            return;
        }
        Side liquiditySide = pendingLiquidation.side() == TradeSide.SELL ? Side.BID : Side.ASK;
        Optional<BookLevel> level = book.best(liquiditySide);
        if (level.isEmpty()) {
            return;
        }
        long quantity = Math.min(pendingLiquidation.remaining(), level.get().quantity());
        bookFill(ts, pendingLiquidation.side(), level.get().price(), quantity, FillType.STOP_LOSS);
        if (pendingLiquidation.reduce(quantity)) {
            pendingLiquidation = null;
        }
    }

    private void bookFill(LocalDateTime ts, TradeSide side, double price, long quantity, FillType type) {
        long previous = accountant.position();
        accountant.record(ts, side, price, quantity, type).ifPresent(fill -> onFill(fill, previous));
    }

    private void onFill(Fill fill, long previousPosition) {
        if (stopLoss != null) {
            stopLoss.onPositionChange(previousPosition, fill.position(), fill.price());
        }
        strategyDates.add(fill.timestamp().toLocalDate());
    }

    @Override
    public SessionResult result() {
        double totalPnl = lastTradePrice == null
            ? accountant.realizedPnl()
            : accountant.markToMarket(lastTradePrice);

        return new SessionResult(
            security,
            StrategyVariant.CLOSING_AUCTION,
            accountant.position(),
            accountant.realizedPnl(),
            accountant.isFlat() ? 0.0 : accountant.averageEntryPrice(),
            lastTradePrice,
            totalPnl,
            List.copyOf(accountant.fills()),
            counters.snapshot(),
            Collections.unmodifiableSortedSet(new TreeSet<>(marketDates)),
            Collections.unmodifiableSortedSet(new TreeSet<>(strategyDates)),
            stopLossTriggers,
            false,
            summary()
        );
    }

    ClosingSummary summary() {
        List<Fill> fills = accountant.fills();
        int buyEntries = count(fills, FillType.AUCTION_ENTRY, TradeSide.BUY);
        int sellEntries = count(fills, FillType.AUCTION_ENTRY, TradeSide.SELL);
        return new ClosingSummary(
            buyEntries + sellEntries,
            buyEntries,
            sellEntries,
            count(fills, FillType.VWAP_EXIT, null),
            count(fills, FillType.STOP_LOSS, null),
            count(fills, FillType.EXIT_FLATTEN, null),
            filteredSellEntries,
            filteredBuyEntries,
            exitOrders.size()
        );
    }

    private static int count(List<Fill> fills, FillType type, TradeSide side) {
        return (int) fills.stream()
            .filter(f -> f.type() == type && (side == null || f.side() == side))
            .count();
    }

    @Override
    public String security() {
        return security;
    }

    @Override
    public StrategyVariant variant() {
        return StrategyVariant.CLOSING_AUCTION;
    }

    public List<ExitOrder> exitOrders() {
        return Collections.unmodifiableList(exitOrders);
    }

    public List<AuctionOrder> auctionOrders() {
        return Collections.unmodifiableList(auctionOrders);
    }

    public long position() {
        return accountant.position();
    }

    public double trendSlopeBpsPerHour() {
        return trend.slopeBpsPerHour();
    }
}
