package com.fintech.marketmaking.service;

import com.fintech.marketmaking.strategy.EventCounts;
import com.fintech.marketmaking.strategy.SessionResult;
import com.fintech.marketmaking.strategy.StrategyVariant;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Results of one backtest run across securities.
 *
 * @param runId Identifier assigned when the run starts
 * @param strategy Variant applied to every security
 * @param mode How sessions were driven
 * @param startedAt Wall clock start of the run
 * @param durationMs Elapsed run time in milliseconds
 * @param results Per-security results, in input order
 * @param totals Aggregates over all results
 */
public record BacktestReport(
    UUID runId,
    StrategyVariant strategy,
    ExecutionMode mode,
    Instant startedAt,
    long durationMs,
    List<SessionResult> results,
    Totals totals
) {

    public static BacktestReport of(UUID runId, StrategyVariant strategy, ExecutionMode mode,
                                    Instant startedAt, long durationMs, List<SessionResult> results) {
        return new BacktestReport(runId, strategy, mode, startedAt, durationMs,
                                  List.copyOf(results), Totals.of(results));
    }

    /**
     * Aggregates across securities.
     */
    public record Totals(
        int securities,
        long fills,
        double realizedPnl,
        double totalPnl,
        int stopLossTriggers,
        int unresolvedFlattens,
        EventCounts events
    ) {

        static Totals of(List<SessionResult> results) {
            long fills = 0;
            double realized = 0.0;
            double total = 0.0;
            int stopLosses = 0;
            int unresolved = 0;
            EventCounts events = EventCounts.empty();
            for (SessionResult result : results) {
                fills += result.fillCount();
                realized += result.realizedPnl();
                total += result.totalPnl();
                stopLosses += result.stopLossTriggers();
                if (result.unresolvedFlatten()) {
                    unresolved++;
                }
                events = events.plus(result.events());
            }
            return new Totals(results.size(), fills, realized, total, stopLosses, unresolved, events);
        }
    }
}
