package com.fintech.marketmaking.service;

import com.fintech.marketmaking.config.BacktestProperties;
import com.fintech.marketmaking.domain.MarketEvent;
import com.fintech.marketmaking.ingestion.DisruptorEventPublisher;
import com.fintech.marketmaking.ingestion.InMemoryMarketEventSource;
import com.fintech.marketmaking.ingestion.MarketEventSource;
import com.fintech.marketmaking.storage.BacktestRunRepository;
import com.fintech.marketmaking.strategy.SessionFactory;
import com.fintech.marketmaking.strategy.SessionResult;
import com.fintech.marketmaking.strategy.StrategyVariant;
import com.fintech.marketmaking.strategy.TradingSession;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs backtests over many securities and keeps the resulting reports.
 *
 * Responsibilities:
 * - Request validation (known strategy, non-empty and time-ordered events)
 * - Dispatch of one independent session per security, on the worker pool or the ring buffer
 * - Metrics and logging for runs and sessions
 */
@Service
public class BacktestService {

    private static final Logger log = LoggerFactory.getLogger(BacktestService.class);

    private final SessionFactory sessionFactory;
    private final DisruptorEventPublisher publisher;
    private final BacktestRunRepository repository;
    private final BacktestProperties properties;
    private final MeterRegistry meterRegistry;
    private final ExecutorService workers;

    // Streaming sessions are keyed by security on the shared ring buffer
    private final ReentrantLock streamingLock = new ReentrantLock();

    private final AtomicLong validationErrors = new AtomicLong(0);
    private final AtomicLong serviceErrors = new AtomicLong(0);
    private final AtomicLong activeRuns = new AtomicLong(0);

    private final Counter eventsProcessed;
    private final Counter fillsRecorded;

    public BacktestService(SessionFactory sessionFactory,
                           DisruptorEventPublisher publisher,
                           BacktestRunRepository repository,
                           BacktestProperties properties,
                           MeterRegistry meterRegistry) {
        this.sessionFactory = sessionFactory;
        this.publisher = publisher;
        this.repository = repository;
        this.properties = properties;
        this.meterRegistry = meterRegistry;

        int parallelism = Math.max(1, properties.getExecution().getParallelism());
        this.workers = Executors.newFixedThreadPool(parallelism, new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r);
                thread.setName("backtest-worker-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            }
        });

        meterRegistry.gauge("backtest.service.validation.errors", validationErrors);
        meterRegistry.gauge("backtest.service.errors", serviceErrors);
        meterRegistry.gauge("backtest.runs.active", activeRuns);
        this.eventsProcessed = Counter.builder("backtest.events.processed")
            .description("Market events applied by sessions")
            .register(meterRegistry);
        this.fillsRecorded = Counter.builder("backtest.fills")
            .description("Simulated executions across sessions")
            .register(meterRegistry);

        log.info("Backtest service ready: parallelism={}, batchSize={}",
            parallelism, properties.getExecution().getBatchSize());
    }

    /**
     * Validates a request and runs it.
     *
     * @param strategy variant code or name, e.g. "v1_baseline" or "STOP_LOSS"; the configured default when blank
     * @param mode execution mode, PARALLEL when null
     * @param events time-ordered events per security
     * @throws ValidationException if the request is unusable
     * @throws BacktestException if a security's session fails
     */
    public BacktestReport runBacktest(String strategy, ExecutionMode mode,
                                      Map<String, List<MarketEvent>> events) {
        StrategyVariant variant = strategy == null || strategy.isBlank()
            ? properties.getStrategy()
            : StrategyVariant.fromCode(strategy)
                .orElseThrow(() -> validationError("Unknown strategy: " + strategy));
        validateEvents(events);
        return run(variant, mode == null ? ExecutionMode.PARALLEL : mode, new InMemoryMarketEventSource(events));
    }

    /**
     * Runs one session per security from the source and stores the report.
     */
    public BacktestReport run(StrategyVariant variant, ExecutionMode mode, MarketEventSource source) {
        UUID runId = UUID.randomUUID();
        Instant startedAt = Instant.now();
        List<String> securities = source.securities();

        log.info("Starting backtest run {}: strategy={}, mode={}, securities={}",
            runId, variant.code(), mode, securities.size());

        activeRuns.incrementAndGet();
        Timer.Sample sample = Timer.start(meterRegistry);
        List<SessionResult> results;
        try {
            results = mode == ExecutionMode.STREAMING
                ? runStreaming(variant, securities, source)
                : runParallel(variant, securities, source);
        } finally {
            sample.stop(Timer.builder("backtest.run.duration")
                .tag("strategy", variant.code())
                .tag("mode", mode.name())
                .register(meterRegistry));
            activeRuns.decrementAndGet();
        }

        long durationMs = Duration.between(startedAt, Instant.now()).toMillis();
        BacktestReport report = BacktestReport.of(runId, variant, mode, startedAt, durationMs, results);
        repository.save(report);
        meterRegistry.counter("backtest.runs", "strategy", variant.code()).increment();

        log.info("Completed backtest run {} in {}ms: fills={}, realizedPnl={}, totalPnl={}",
            runId, durationMs, report.totals().fills(),
            String.format("%.4f", report.totals().realizedPnl()),
            String.format("%.4f", report.totals().totalPnl()));
        return report;
    }

    public Optional<BacktestReport> findRun(UUID runId) {
        return repository.findById(runId);
    }

    public List<BacktestReport> recentRuns() {
        return repository.findAll();
    }

    public List<StrategyVariant> strategies() {
        return List.of(StrategyVariant.values());
    }

    private List<SessionResult> runParallel(StrategyVariant variant, List<String> securities,
                                            MarketEventSource source) {
        int batchSize = properties.getExecution().getBatchSize();
        Map<String, Future<SessionResult>> futures = new LinkedHashMap<>();
        for (String security : securities) {
            futures.put(security, workers.submit(() -> runSession(variant, security, source, batchSize)));
        }

        List<SessionResult> results = new ArrayList<>(securities.size());
        for (Map.Entry<String, Future<SessionResult>> entry : futures.entrySet()) {
            try {
                results.add(entry.getValue().get());
            } catch (ExecutionException e) {
                futures.values().forEach(f -> f.cancel(true));
                serviceErrors.incrementAndGet();
                log.error("Session failed for security={}", entry.getKey(), e.getCause());
                throw new BacktestException(entry.getKey(), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.values().forEach(f -> f.cancel(true));
                throw new BacktestException(entry.getKey(), e);
            }
        }
        return results;
    }

    private SessionResult runSession(StrategyVariant variant, String security,
                                     MarketEventSource source, int batchSize) {
        Timer.Sample sample = Timer.start(meterRegistry);
        TradingSession session = sessionFactory.create(security, variant);
        for (List<MarketEvent> batch : source.batches(security, batchSize)) {
            session.processBatch(batch);
        }
        SessionResult result = session.result();
        sample.stop(Timer.builder("backtest.session.duration")
            .tag("strategy", variant.code())
            .register(meterRegistry));
        recordSessionMetrics(result);
        log.debug("Session finished for {}: position={}, fills={}, realizedPnl={}",
            security, result.finalPosition(), result.fillCount(), result.realizedPnl());
        return result;
    }

    private List<SessionResult> runStreaming(StrategyVariant variant, List<String> securities,
                                             MarketEventSource source) {
        int batchSize = properties.getExecution().getBatchSize();
        Duration drainTimeout = Duration.ofMillis(properties.getDisruptor().getDrainTimeoutMs());

        streamingLock.lock();
        try {
            List<String> opened = new ArrayList<>();
            try {
                for (String security : securities) {
                    publisher.openSession(security, variant);
                    opened.add(security);
                }
                for (String security : securities) {
                    for (List<MarketEvent> batch : source.batches(security, batchSize)) {
                        for (MarketEvent event : batch) {
                            publisher.publish(security, event);
                        }
                    }
                }
                publisher.awaitDrained(drainTimeout);

                List<SessionResult> results = new ArrayList<>(securities.size());
                for (String security : securities) {
                    try {
                        SessionResult result = publisher.closeSession(security);
                        opened.remove(security);
                        recordSessionMetrics(result);
                        results.add(result);
                    } catch (IllegalStateException e) {
                        opened.remove(security);
                        serviceErrors.incrementAndGet();
                        throw new BacktestException(security, e.getCause() != null ? e.getCause() : e);
                    }
                }
                return results;
            } catch (TimeoutException e) {
                serviceErrors.incrementAndGet();
                log.error("Streaming run did not drain within {}", drainTimeout);
                throw new BacktestException(String.join(",", securities), e);
            } finally {
                for (String security : opened) {
                    try {
                        publisher.closeSession(security);
                    } catch (IllegalStateException e) {
                        log.warn("Discarding streaming session for {}: {}", security, e.getMessage());
                    }
                }
            }
        } finally {
            streamingLock.unlock();
        }
    }

    private void recordSessionMetrics(SessionResult result) {
        eventsProcessed.increment(result.events().processed());
        fillsRecorded.increment(result.fillCount());
        if (result.unresolvedFlatten()) {
            log.warn("Security {} ended with an unresolved end-of-day flatten, position={}",
                result.security(), result.finalPosition());
        }
    }

    private void validateEvents(Map<String, List<MarketEvent>> events) {
        if (events == null || events.isEmpty()) {
            throw validationError("At least one security with events is required");
        }
        for (Map.Entry<String, List<MarketEvent>> entry : events.entrySet()) {
            String security = entry.getKey();
            if (security == null || security.isBlank()) {
                throw validationError("Security cannot be blank");
            }
            List<MarketEvent> list = entry.getValue();
            if (list == null || list.isEmpty()) {
                throw validationError("No events for security " + security);
            }
            LocalDateTime previous = null;
            for (int i = 0; i < list.size(); i++) {
                MarketEvent event = list.get(i);
                if (event == null || event.timestamp() == null) {
                    continue;  // Discarded as malformed by the session
                }
                if (previous != null && event.timestamp().isBefore(previous)) {
                    throw validationError("Events for " + security + " are out of order at index " + i
                        + ": " + event.timestamp() + " precedes " + previous);
                }
                previous = event.timestamp();
            }
        }
    }

    private ValidationException validationError(String message) {
        validationErrors.incrementAndGet();
        return new ValidationException(message);
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
    }

    /**
     * Request validation failure.
     */
    public static class ValidationException extends RuntimeException {
        public ValidationException(String message) {
            super(message);
        }
    }

    /**
     * A security's session failed; wraps the underlying cause.
     */
    public static class BacktestException extends RuntimeException {
        private final String security;

        public BacktestException(String security, Throwable cause) {
            super("Backtest failed for " + security + ": " + (cause == null ? "unknown" : cause.getMessage()), cause);
            this.security = security;
        }

        public String getSecurity() {
            return security;
        }
    }
}
