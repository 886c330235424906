package com.fintech.marketmaking.service;

import com.fintech.marketmaking.config.BacktestProperties;
import com.fintech.marketmaking.config.InvalidConfigurationException;
import com.fintech.marketmaking.domain.MarketEvent;
import com.fintech.marketmaking.ingestion.DisruptorEventPublisher;
import com.fintech.marketmaking.storage.InMemoryBacktestRunRepository;
import com.fintech.marketmaking.strategy.SessionFactory;
import com.fintech.marketmaking.strategy.SessionFixtures;
import com.fintech.marketmaking.strategy.SessionResult;
import com.fintech.marketmaking.strategy.StrategyVariant;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.fintech.marketmaking.strategy.SessionFixtures.at;
import static com.fintech.marketmaking.strategy.SessionFixtures.workedScenario;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("BacktestService Tests")
class BacktestServiceTest {

    private BacktestProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private DisruptorEventPublisher publisher;
    private InMemoryBacktestRunRepository repository;
    private BacktestService service;

    @BeforeEach
    void setUp() {
        properties = SessionFixtures.scenarioProperties();
        properties.getExecution().setParallelism(2);
        properties.getExecution().setBatchSize(2);
        properties.getDisruptor().setBufferSize(256);
        meterRegistry = new SimpleMeterRegistry();

        SessionFactory factory = SessionFixtures.factory(properties);
        publisher = new DisruptorEventPublisher(factory, properties, meterRegistry);
        publisher.start();
        repository = new InMemoryBacktestRunRepository(properties);
        service = new BacktestService(factory, publisher, repository, properties, meterRegistry);
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
        publisher.shutdown();
    }

    private static Map<String, List<MarketEvent>> twoSecurities() {
        Map<String, List<MarketEvent>> events = new LinkedHashMap<>();
        events.put("EMAAR", workedScenario());
        events.put("ADNOCGAS", workedScenario().subList(0, 3));
        return events;
    }

    @ParameterizedTest
    @EnumSource(ExecutionMode.class)
    @DisplayName("Should run every security independently and aggregate totals")
    void testRun(ExecutionMode mode) {
        // When
        BacktestReport report = service.runBacktest("v2_price_follow_qty_cooldown", mode, twoSecurities());

        // Then
        assertThat(report.strategy()).isEqualTo(StrategyVariant.PRICE_FOLLOW_COOLDOWN);
        assertThat(report.mode()).isEqualTo(mode);
        assertThat(report.results()).extracting(SessionResult::security).containsExactly("EMAAR", "ADNOCGAS");
        assertThat(report.results()).extracting(SessionResult::finalPosition).containsExactly(40L, 50L);
        assertThat(report.totals().securities()).isEqualTo(2);
        assertThat(report.totals().fills()).isEqualTo(3);
        assertThat(report.totals().realizedPnl()).isCloseTo(1.0, within(1e-9));
        assertThat(report.totals().events().processed()).isEqualTo(7);
    }

    @Test
    @DisplayName("Should produce the same results streaming as in parallel")
    void testStreamingMatchesParallel() {
        BacktestReport parallel = service.runBacktest("STOP_LOSS", ExecutionMode.PARALLEL, twoSecurities());
        BacktestReport streaming = service.runBacktest("STOP_LOSS", ExecutionMode.STREAMING, twoSecurities());

        assertThat(streaming.results()).hasSameSizeAs(parallel.results());
        for (int i = 0; i < parallel.results().size(); i++) {
            assertThat(streaming.results().get(i).fills()).isEqualTo(parallel.results().get(i).fills());
        }
        assertThat(publisher.getOpenSessionCount()).isZero();
    }

    @Test
    @DisplayName("Should fall back to the configured strategy and parallel mode")
    void testDefaults() {
        properties.setStrategy(StrategyVariant.BASELINE);

        BacktestReport report = service.runBacktest(" ", null, twoSecurities());

        assertThat(report.strategy()).isEqualTo(StrategyVariant.BASELINE);
        assertThat(report.mode()).isEqualTo(ExecutionMode.PARALLEL);
    }

    @Test
    @DisplayName("Should store reports and list them most recent first")
    void testStoredReports() {
        BacktestReport first = service.runBacktest("v1_baseline", ExecutionMode.PARALLEL, twoSecurities());
        BacktestReport second = service.runBacktest("v1_baseline", ExecutionMode.PARALLEL, twoSecurities());

        assertThat(service.findRun(first.runId())).contains(first);
        assertThat(service.recentRuns()).containsExactly(second, first);
        assertThat(service.strategies()).hasSize(5);
    }

    @Test
    @DisplayName("Should record run and fill metrics")
    void testMetrics() {
        service.runBacktest("v1_baseline", ExecutionMode.PARALLEL, twoSecurities());

        assertThat(meterRegistry.get("backtest.runs").tag("strategy", "v1_baseline").counter().count())
            .isEqualTo(1.0);
        assertThat(meterRegistry.get("backtest.fills").counter().count()).isEqualTo(3.0);
        assertThat(meterRegistry.get("backtest.run.duration").tag("mode", "PARALLEL").timer().count())
            .isEqualTo(1L);
        assertThat(meterRegistry.get("backtest.runs.active").gauge().value()).isZero();
    }

    @Test
    @DisplayName("Should wrap a failing session with its security")
    void testSessionFailure() {
        properties.getClosingDefaults().setSpreadPct(100.0);

        assertThatThrownBy(() -> service.runBacktest("closing_auction", ExecutionMode.PARALLEL, twoSecurities()))
            .hasCauseInstanceOf(InvalidConfigurationException.class)
            .isInstanceOfSatisfying(BacktestService.BacktestException.class,
                e -> assertThat(e.getSecurity()).isEqualTo("EMAAR"));
        assertThat(meterRegistry.get("backtest.service.errors").gauge().value()).isEqualTo(1.0);
    }

    @Nested
    @DisplayName("Request validation")
    class Validation {

        @Test
        @DisplayName("Should reject an unknown strategy")
        void testUnknownStrategy() {
            assertThatThrownBy(() -> service.runBacktest("v9_magic", ExecutionMode.PARALLEL, twoSecurities()))
                .isInstanceOf(BacktestService.ValidationException.class)
                .hasMessageContaining("v9_magic");
            assertThat(meterRegistry.get("backtest.service.validation.errors").gauge().value()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should reject a request without events")
        void testNoEvents() {
            assertThatThrownBy(() -> service.runBacktest("v1_baseline", ExecutionMode.PARALLEL, Map.of()))
                .isInstanceOf(BacktestService.ValidationException.class);
        }

        @Test
        @DisplayName("Should reject a security with an empty event list")
        void testEmptySecurity() {
            Map<String, List<MarketEvent>> events = Map.of("EMAAR", List.of());

            assertThatThrownBy(() -> service.runBacktest("v1_baseline", ExecutionMode.PARALLEL, events))
                .isInstanceOf(BacktestService.ValidationException.class)
                .hasMessageContaining("EMAAR");
        }

        @Test
        @DisplayName("Should reject out-of-order events")
        void testOutOfOrder() {
            List<MarketEvent> events = new ArrayList<>(workedScenario());
            events.add(MarketEvent.trade(at("10:00:00"), 10.00, 100));

            assertThatThrownBy(() -> service.runBacktest("v1_baseline", ExecutionMode.PARALLEL,
                                                         Map.of("EMAAR", events)))
                .isInstanceOf(BacktestService.ValidationException.class)
                .hasMessageContaining("out of order");
            assertThat(repository.count()).isZero();
        }
    }
}
