package com.fintech.marketmaking.strategy;

import com.fintech.marketmaking.closing.ClosingSummary;
import com.fintech.marketmaking.domain.Fill;

import java.time.LocalDate;
import java.util.List;
import java.util.SortedSet;

/**
 * Outcome of running one security through a session.
 *
 * @param security Security symbol
 * @param strategy Variant that produced the result
 * @param finalPosition Signed position at end of stream
 * @param realizedPnl Cumulative realized PnL
 * @param averageEntryPrice Average entry of the open position, 0 when flat
 * @param lastTradePrice Last processed trade print, null if none
 * @param totalPnl Realized PnL plus the open position marked at the last trade
 * @param fills All our executions in order
 * @param events Event tallies
 * @param marketDates Dates with at least one trade print
 * @param strategyDates Dates with at least one of our fills
 * @param stopLossTriggers Number of stop-loss triggers
 * @param unresolvedFlatten True if the stream ended with an end-of-day flatten still waiting for a trade
 * @param closingSummary Closing-auction counters, null for the market-making variants
 */
public record SessionResult(
    String security,
    StrategyVariant strategy,
    long finalPosition,
    double realizedPnl,
    double averageEntryPrice,
    Double lastTradePrice,
    double totalPnl,
    List<Fill> fills,
    EventCounts events,
    SortedSet<LocalDate> marketDates,
    SortedSet<LocalDate> strategyDates,
    int stopLossTriggers,
    boolean unresolvedFlatten,
    ClosingSummary closingSummary
) {

    public int fillCount() {
        return fills.size();
    }

    /** Sum of signed fill quantities; equals the final position. */
    public long netFilledQuantity() {
        return fills.stream().mapToLong(Fill::signedQuantity).sum();
    }
}
