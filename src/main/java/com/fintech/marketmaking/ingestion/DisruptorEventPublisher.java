package com.fintech.marketmaking.ingestion;

import com.fintech.marketmaking.config.BacktestProperties;
import com.fintech.marketmaking.domain.MarketEvent;
import com.fintech.marketmaking.strategy.SessionFactory;
import com.fintech.marketmaking.strategy.SessionResult;
import com.fintech.marketmaking.strategy.StrategyVariant;
import com.fintech.marketmaking.strategy.TradingSession;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.EventFactory;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.LockSupport;

/**
 * Streams market events into open sessions through an LMAX Disruptor ring buffer.
 *
 * A single consumer thread drives every session, so each session sees its events
 * in publish order without locking. Producers may publish from any thread.
 * Typical use: {@link #openSession}, publish the security's events, {@link #awaitDrained},
 * then {@link #closeSession}.
 */
@Component
public class DisruptorEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(DisruptorEventPublisher.class);

    private final SessionFactory sessionFactory;
    private final BacktestProperties properties;

    private final Map<String, TradingSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, Throwable> failures = new ConcurrentHashMap<>();

    private final AtomicLong ringBufferEventsDropped = new AtomicLong(0);
    private final AtomicLong unroutedEvents = new AtomicLong(0);
    private final AtomicLong staleEvents = new AtomicLong(0);
    private final AtomicLong processedSequence = new AtomicLong(-1);

    private Disruptor<MarketEventWrapper> disruptor;
    private RingBuffer<MarketEventWrapper> ringBuffer;

    public DisruptorEventPublisher(SessionFactory sessionFactory,
                                   BacktestProperties properties,
                                   MeterRegistry meterRegistry) {
        this.sessionFactory = sessionFactory;
        this.properties = properties;

        meterRegistry.gauge("disruptor.ringbuffer.events.dropped", ringBufferEventsDropped);
        meterRegistry.gauge("disruptor.events.unrouted", unroutedEvents);
        meterRegistry.gauge("disruptor.events.stale", staleEvents);
        meterRegistry.gauge("disruptor.sessions.open", sessions, Map::size);
    }

    @PostConstruct
    public void start() {
        int bufferSize = properties.getDisruptor().getBufferSize();

        EventFactory<MarketEventWrapper> eventFactory = MarketEventWrapper::new;

        ThreadFactory threadFactory = new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r);
                thread.setName("backtest-stream-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            }
        };

        WaitStrategy waitStrategy = createWaitStrategy();

        disruptor = new Disruptor<>(
            eventFactory,
            bufferSize,
            threadFactory,
            ProducerType.MULTI,
            waitStrategy
        );

        // One consumer keeps per-session ordering
        disruptor.handleEventsWith(this::handleEvent);

        disruptor.setDefaultExceptionHandler(new ExceptionHandler<MarketEventWrapper>() {
            @Override
            public void handleEventException(Throwable ex, long sequence, MarketEventWrapper event) {
                log.error("Exception processing event at sequence {}: {} {}",
                    sequence, event.security, event.event, ex);
                processedSequence.set(sequence);
            }

            @Override
            public void handleOnStartException(Throwable ex) {
                log.error("Exception during Disruptor startup", ex);
            }

            @Override
            public void handleOnShutdownException(Throwable ex) {
                log.error("Exception during Disruptor shutdown", ex);
            }
        });

        ringBuffer = disruptor.start();

        log.info("Disruptor started: bufferSize={}, waitStrategy={}",
            bufferSize, waitStrategy.getClass().getSimpleName());
    }

    /**
     * Opens a fresh session for a security. Events published for it are routed there
     * until {@link #closeSession} is called.
     *
     * @throws IllegalStateException if a session for the security is already open
     */
    public void openSession(String security, StrategyVariant variant) {
        TradingSession session = sessionFactory.create(security, variant);
        if (sessions.putIfAbsent(security, session) != null) {
            throw new IllegalStateException("Session already open for " + security);
        }
        failures.remove(security);
        log.debug("Opened {} stream session for {}", variant, security);
    }

    /**
     * Publishes an event for processing. Blocks while the ring buffer is full.
     * The event is bound to the session open for the security at publish time;
     * if that session is closed before the event is handled, the event is dropped.
     *
     * @return the ring buffer sequence assigned to the event
     */
    public long publish(String security, MarketEvent event) {
        long sequence = ringBuffer.next();
        try {
            fill(ringBuffer.get(sequence), security, event);
        } finally {
            ringBuffer.publish(sequence);
        }
        return sequence;
    }

    /**
     * Attempts to publish without blocking.
     *
     * @return true if published, false if the buffer was full
     */
    public boolean tryPublish(String security, MarketEvent event) {
        try {
            long sequence = ringBuffer.tryNext();
            try {
                fill(ringBuffer.get(sequence), security, event);
                return true;
            } finally {
                ringBuffer.publish(sequence);
            }
        } catch (InsufficientCapacityException e) {
            ringBufferEventsDropped.incrementAndGet();
            return false;
        }
    }

    /**
     * Waits until every event published so far has been handled.
     *
     * @throws TimeoutException if the consumer has not caught up within the timeout
     */
    public void awaitDrained(Duration timeout) throws TimeoutException {
        long target = ringBuffer.getCursor();
        long deadline = System.nanoTime() + timeout.toNanos();
        while (processedSequence.get() < target) {
            if (System.nanoTime() > deadline) {
                throw new TimeoutException("Stream not drained: processed=" + processedSequence.get()
                    + ", published=" + target);
            }
            LockSupport.parkNanos(100_000L);
        }
    }

    /**
     * Removes a session and returns its result. Call after {@link #awaitDrained}.
     *
     * @throws IllegalStateException if no session is open or the session failed mid-stream
     */
    public SessionResult closeSession(String security) {
        TradingSession session = sessions.remove(security);
        if (session == null) {
            throw new IllegalStateException("No open session for " + security);
        }
        Throwable failure = failures.remove(security);
        if (failure != null) {
            throw new IllegalStateException("Session for " + security + " failed", failure);
        }
        return session.result();
    }

    private void fill(MarketEventWrapper wrapper, String security, MarketEvent event) {
        wrapper.security = security;
        wrapper.event = event;
        wrapper.session = sessions.get(security);
    }

    private void handleEvent(MarketEventWrapper wrapper, long sequence, boolean endOfBatch) {
        try {
            if (wrapper.event == null) {
                return;
            }
            TradingSession session = wrapper.session;
            if (session == null) {
                unroutedEvents.incrementAndGet();
                log.warn("Dropping event for {} with no open session", wrapper.security);
                return;
            }
            if (sessions.get(wrapper.security) != session) {
                staleEvents.incrementAndGet();
                log.debug("Dropping event for {} published to a closed session", wrapper.security);
                return;
            }
            if (failures.containsKey(wrapper.security)) {
                return;
            }
            try {
                session.onEvent(wrapper.event);
            } catch (RuntimeException e) {
                log.error("Session for {} failed at {}", wrapper.security, wrapper.event, e);
                failures.put(wrapper.security, e);
            }
            if (endOfBatch && log.isTraceEnabled()) {
                log.trace("Processed event at sequence {}, end of batch", sequence);
            }
        } finally {
            wrapper.event = null;
            wrapper.security = null;
            wrapper.session = null;
            processedSequence.set(sequence);
        }
    }

    @PreDestroy
    public void shutdown() {
        if (disruptor != null) {
            log.info("Shutting down Disruptor...");
            disruptor.shutdown();
            log.info("Disruptor shutdown complete");
        }
    }

    private WaitStrategy createWaitStrategy() {
        String strategy = properties.getDisruptor().getWaitStrategy();

        return switch (strategy.toUpperCase()) {
            case "BLOCKING" -> new BlockingWaitStrategy();
            case "SLEEPING" -> new SleepingWaitStrategy();
            case "YIELDING" -> new YieldingWaitStrategy();
            case "BUSY_SPIN" -> new BusySpinWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy: {}, using BLOCKING", strategy);
                yield new BlockingWaitStrategy();
            }
        };
    }

    /**
     * Pre-allocated ring buffer slot.
     */
    private static class MarketEventWrapper {
        String security;
        MarketEvent event;
        TradingSession session;
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public long getBufferSize() {
        return ringBuffer.getBufferSize();
    }

    public long getRingBufferEventsDropped() {
        return ringBufferEventsDropped.get();
    }

    public long getStaleEvents() {
        return staleEvents.get();
    }

    public int getOpenSessionCount() {
        return sessions.size();
    }
}
