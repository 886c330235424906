package com.fintech.marketmaking.strategy;

import com.fintech.marketmaking.accounting.PositionAccountant;
import com.fintech.marketmaking.book.OrderBook;
import com.fintech.marketmaking.config.SecurityConfig;
import com.fintech.marketmaking.domain.BookLevel;
import com.fintech.marketmaking.domain.Fill;
import com.fintech.marketmaking.domain.FillType;
import com.fintech.marketmaking.domain.MarketEvent;
import com.fintech.marketmaking.domain.SessionPhase;
import com.fintech.marketmaking.domain.Side;
import com.fintech.marketmaking.domain.TradeSide;
import com.fintech.marketmaking.strategy.policy.LiquidityGate;
import com.fintech.marketmaking.strategy.policy.RefillPolicy;
import com.fintech.marketmaking.strategy.policy.StopLossPolicy;
import com.fintech.marketmaking.util.SessionWindowClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Event-driven market-making session for one security.
 *
 * Per event: new-day reset, end-of-day flatten handling, phase gate, book update,
 * optional stop-loss monitoring, quote maintenance, then fill simulation for trades.
 * Variants differ only in the policies injected and in the tradable window.
 */
public class MarketMakingSession implements TradingSession {

    private static final Logger log = LoggerFactory.getLogger(MarketMakingSession.class);

    private final String security;
    private final StrategyVariant variant;
    private final SecurityConfig config;
    private final SessionWindowClassifier classifier;
    private final boolean strictWindow;
    private final OrderBook book;
    private final QuoteGenerator quoteGenerator;
    private final RefillPolicy refillPolicy;
    private final LiquidityGate liquidityGate;
    private final StopLossPolicy stopLoss;     // null when the variant has no stop-loss
    private final FillSimulator fillSimulator = new FillSimulator();
    private final PositionAccountant accountant = new PositionAccountant();

    private final SideState bid = new SideState(Side.BID);
    private final SideState ask = new SideState(Side.ASK);
    private final EventCounters counters = new EventCounters();
    private final SortedSet<LocalDate> marketDates = new TreeSet<>();
    private final SortedSet<LocalDate> strategyDates = new TreeSet<>();

    private LocalDate currentDate;
    private boolean closedForDay;
    private boolean pendingFlatten;
    private PendingLiquidation pendingLiquidation;
    private int stopLossTriggers;
    private Double lastTradePrice;
    private boolean unresolvedFlattenReported;

    public MarketMakingSession(
            StrategyVariant variant,
            SecurityConfig config,
            SessionWindowClassifier classifier,
            QuoteGenerator quoteGenerator,
            RefillPolicy refillPolicy,
            LiquidityGate liquidityGate,
            StopLossPolicy stopLoss) {
        this.security = config.security();
        this.variant = variant;
        this.config = config;
        this.classifier = classifier;
        this.strictWindow = variant.usesStrictWindow();
        this.book = new OrderBook(config.bookMode());
        this.quoteGenerator = quoteGenerator;
        this.refillPolicy = refillPolicy;
        this.liquidityGate = liquidityGate;
        this.stopLoss = stopLoss;
    }

    @Override
    public void onEvent(MarketEvent event) {
        if (event == null || !event.isValid()) {
            counters.recordIgnored();
            log.trace("{}: ignoring malformed event {}", security, event);
            return;
        }

        LocalDateTime ts = event.timestamp();
        rollTradingDay(event.tradingDate());
        if (event.isTrade()) {
            marketDates.add(currentDate);
        }

        // 1) End-of-day cutoff: flatten on a trade, otherwise wait for the next one
        if (!closedForDay && classifier.isAtOrAfterEodCutoff(ts)) {
            closedForDay = true;
            if (!accountant.isFlat()) {
                if (event.isTrade()) {
                    flattenAtEndOfDay(event);
                } else {
                    pendingFlatten = true;
                    counters.recordSkipped();
                    log.debug("{}: EOD cutoff reached at {} with position {}, flatten pending until next trade",
                             security, ts, accountant.position());
                }
                return;
            }
        }

        // 2) Pending flatten holds back everything until a trade prints
        if (pendingFlatten) {
            if (event.isTrade()) {
                flattenAtEndOfDay(event);
                pendingFlatten = false;
            } else {
                counters.recordSkipped();
            }
            return;
        }

        // 3) Phase gate
        SessionPhase phase = classifier.classify(ts);
        if (!isTradable(phase)) {
            counters.recordSkipped();
            return;
        }

        book.applyUpdate(event);
        counters.recordProcessed(event.type());
        if (event.isTrade()) {
            lastTradePrice = event.price();
        }

        // 4) Stop-loss monitor; an unfinished liquidation suspends quoting and fills
        if (stopLoss != null && !monitorStopLoss(ts)) {
            return;
        }

        // 5) Quote maintenance
        updateQuotes(ts, phase);

        // 6) Fills
        if (event.isTrade() && fillsAllowed(phase)) {
            List<FillSimulator.QuoteFill> fills =
                fillSimulator.onTrade(event.price(), event.quantity(), bid, ask, book);
            for (FillSimulator.QuoteFill fill : fills) {
                bookFill(ts, fill.side(), fill.price(), fill.quantity(), FillType.QUOTE);
            }
        }
    }

    private boolean isTradable(SessionPhase phase) {
        if (strictWindow) {
            return phase == SessionPhase.SILENT_PERIOD || phase == SessionPhase.CONTINUOUS;
        }
        return phase.allowsQuoting();
    }

    private boolean fillsAllowed(SessionPhase phase) {
        return strictWindow || phase.allowsFills();
    }

    private void rollTradingDay(LocalDate date) {
        if (date.equals(currentDate)) {
            return;
        }
        if (currentDate != null) {
            if (pendingFlatten) {
                log.warn("{}: pending EOD flatten for {} was never executed, position {} carried into {}",
                         security, currentDate, accountant.position(), date);
            }
            book.clear();
            bid.reset();
            ask.reset();
            pendingFlatten = false;
            pendingLiquidation = null;
            log.debug("{}: new trading day {}, book and quote state reset, position={}",
                     security, date, accountant.position());
        }
        closedForDay = false;
        currentDate = date;
    }

    private void flattenAtEndOfDay(MarketEvent trade) {
        lastTradePrice = trade.price();
        long position = accountant.position();
        flatten(trade.timestamp(), trade.price(), FillType.EOD_FLATTEN);
        log.debug("{}: EOD flatten of {} @ {} at {}", security, position, trade.price(), trade.timestamp());
    }

    private void flatten(LocalDateTime ts, double price, FillType type) {
        long previous = accountant.position();
        accountant.flatten(ts, price, type).ifPresent(fill -> onFill(fill, previous));
        pendingLiquidation = null;
    }

    /**
     * Triggers and works a stop-loss liquidation.
     *
     * @return true when normal quoting may continue on this event
     */
    private boolean monitorStopLoss(LocalDateTime ts) {
        Optional<Double> mid = book.midPrice();
        if (pendingLiquidation == null && !accountant.isFlat() && mid.isPresent()
                && stopLoss.isBreached(accountant.position(), mid.get())) {
            long position = accountant.position();
            TradeSide side = position > 0 ? TradeSide.SELL : TradeSide.BUY;
            pendingLiquidation = new PendingLiquidation(side, Math.abs(position), ts);
            stopLossTriggers++;
            log.info("{}: stop-loss triggered at {} on position {} (unrealized {}% at mid {})",
                     security, ts, position,
                     String.format("%.2f", stopLoss.unrealizedPnlPct(position, mid.get())), mid.get());
        }

        if (pendingLiquidation == null) {
            return true;
        }

        // Sell into the best bid, buy from the best ask, as much as rests there
        Side liquiditySide = pendingLiquidation.side() == TradeSide.SELL ? Side.BID : Side.ASK;
        Optional<BookLevel> level = book.best(liquiditySide);
        if (level.isEmpty()) {
            return false;
        }
        long quantity = Math.min(pendingLiquidation.remaining(), level.get().quantity());
        bookFill(ts, pendingLiquidation.side(), level.get().price(), quantity, FillType.STOP_LOSS);
        if (pendingLiquidation != null && pendingLiquidation.reduce(quantity)) {
            log.debug("{}: stop-loss liquidation complete at {}", security, ts);
            pendingLiquidation = null;
        }
        return pendingLiquidation == null;
    }

    private void updateQuotes(LocalDateTime ts, SessionPhase phase) {
        long bidBase = refillPolicy.offerSize(bid, ts, config.quoteSize(Side.BID));
        long askBase = refillPolicy.offerSize(ask, ts, config.quoteSize(Side.ASK));

        quoteGenerator.generate(book, accountant.position(), bidBase, askBase).ifPresent(decision -> {
            decision.side(Side.BID).ifPresent(candidate -> updateSide(bid, candidate, ts, phase));
            decision.side(Side.ASK).ifPresent(candidate -> updateSide(ask, candidate, ts, phase));
        });
    }

    private void updateSide(SideState state, QuoteCandidate candidate, LocalDateTime ts, SessionPhase phase) {
        if (!refillPolicy.mayRequote(state, ts)) {
            return;
        }

        long ahead = book.quantityAt(candidate.side(), candidate.price());
        boolean monitored = liquidityGate.monitorsContinuously();
        boolean windowOpen = !monitored || phase == SessionPhase.CONTINUOUS;

        if (windowOpen && liquidityGate.permits(candidate.price(), ahead, candidate.size())) {
            boolean samePrice = state.price() != null && Double.compare(state.price(), candidate.price()) == 0;
            if (samePrice && refillPolicy.keepsQueuePositionAtSamePrice()) {
                state.resize(candidate.size());
                if (monitored) {
                    state.refreshAhead(ahead);
                }
            } else {
                state.place(candidate.price(), ahead, candidate.size(), ts);
                log.trace("{}: placed {} {}@{} ahead={}", security, candidate.side(),
                          candidate.size(), candidate.price(), ahead);
            }
        } else {
            state.withdraw(candidate.price(), monitored ? 0 : ahead);
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
        // A buy always restarts the bid timer, a sell the ask timer
        sideState(fill.side().quoteSide()).recordFill(fill.timestamp());
        strategyDates.add(fill.timestamp().toLocalDate());
    }

    private SideState sideState(Side side) {
        return side == Side.BID ? bid : ask;
    }

    @Override
    public SessionResult result() {
        if (pendingFlatten && !unresolvedFlattenReported) {
            unresolvedFlattenReported = true;
            log.warn("{}: stream ended with EOD flatten pending on {}, position {} left open",
                     security, currentDate, accountant.position());
        }
        double totalPnl = lastTradePrice == null
            ? accountant.realizedPnl()
            : accountant.markToMarket(lastTradePrice);

        return new SessionResult(
            security,
            variant,
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
            pendingFlatten,
            null
        );
    }

    @Override
    public String security() {
        return security;
    }

    @Override
    public StrategyVariant variant() {
        return variant;
    }

    public ActiveQuote activeQuote(Side side) {
        return sideState(side).snapshot();
    }

    public long position() {
        return accountant.position();
    }

    public boolean isFlattenPending() {
        return pendingFlatten;
    }

    public boolean isLiquidationPending() {
        return pendingLiquidation != null;
    }

    public OrderBook book() {
        return book;
    }

    PositionAccountant accountant() {
        return accountant;
    }
}
