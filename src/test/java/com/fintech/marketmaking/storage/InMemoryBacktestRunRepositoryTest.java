package com.fintech.marketmaking.storage;

import com.fintech.marketmaking.config.BacktestProperties;
import com.fintech.marketmaking.service.BacktestReport;
import com.fintech.marketmaking.service.ExecutionMode;
import com.fintech.marketmaking.strategy.StrategyVariant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("InMemoryBacktestRunRepository Tests")
class InMemoryBacktestRunRepositoryTest {

    private InMemoryBacktestRunRepository repository;

    @BeforeEach
    void setUp() {
        BacktestProperties properties = new BacktestProperties();
        properties.getStorage().setMaxRuns(2);
        repository = new InMemoryBacktestRunRepository(properties);
    }

    private static BacktestReport report() {
        return BacktestReport.of(UUID.randomUUID(), StrategyVariant.BASELINE, ExecutionMode.PARALLEL,
                                 Instant.now(), 5L, List.of());
    }

    @Test
    @DisplayName("Should save and find a report by id")
    void testSaveAndFind() {
        // Given
        BacktestReport report = report();

        // When
        repository.save(report);

        // Then
        assertThat(repository.findById(report.runId())).contains(report);
        assertThat(repository.findById(UUID.randomUUID())).isEmpty();
        assertThat(repository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should list most recent first and evict the oldest beyond the limit")
    void testEviction() {
        // Given
        BacktestReport first = report();
        BacktestReport second = report();
        BacktestReport third = report();

        // When
        repository.save(first);
        repository.save(second);
        repository.save(third);

        // Then
        assertThat(repository.count()).isEqualTo(2);
        assertThat(repository.findById(first.runId())).isEmpty();
        assertThat(repository.findAll()).containsExactly(third, second);
    }

    @Test
    @DisplayName("Should report empty totals for an empty run")
    void testEmptyTotals() {
        BacktestReport report = report();

        assertThat(report.totals().securities()).isZero();
        assertThat(report.totals().fills()).isZero();
        assertThat(report.totals().realizedPnl()).isZero();
    }
}
