package com.fintech.marketmaking.storage;

import com.fintech.marketmaking.config.BacktestProperties;
import com.fintech.marketmaking.service.BacktestReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Bounded in-memory report store. The oldest report is evicted once
 * 'backtest.storage.max-runs' is exceeded.
 */
@Repository
public class InMemoryBacktestRunRepository implements BacktestRunRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBacktestRunRepository.class);

    private final int maxRuns;
    private final Map<UUID, BacktestReport> reports;

    public InMemoryBacktestRunRepository(BacktestProperties properties) {
        this.maxRuns = Math.max(1, properties.getStorage().getMaxRuns());
        this.reports = Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<UUID, BacktestReport> eldest) {
                boolean evict = size() > maxRuns;
                if (evict) {
                    log.debug("Evicting backtest run {}", eldest.getKey());
                }
                return evict;
            }
        });
        log.info("In-memory run repository initialized: maxRuns={}", maxRuns);
    }

    @Override
    public void save(BacktestReport report) {
        reports.put(report.runId(), report);
    }

    @Override
    public Optional<BacktestReport> findById(UUID runId) {
        return Optional.ofNullable(reports.get(runId));
    }

    @Override
    public List<BacktestReport> findAll() {
        List<BacktestReport> all;
        synchronized (reports) {
            all = new ArrayList<>(reports.values());
        }
        Collections.reverse(all);
        return all;
    }

    @Override
    public long count() {
        return reports.size();
    }
}
