package com.fintech.marketmaking.storage;

import com.fintech.marketmaking.service.BacktestReport;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for completed backtest reports.
 * Abstracts the storage mechanism so the service does not depend on where reports live.
 */
public interface BacktestRunRepository {

    /**
     * Stores a report under its run id. Saving the same run twice replaces the earlier copy.
     *
     * @param report the completed report
     */
    void save(BacktestReport report);

    /**
     * Looks up a report by run id.
     *
     * @param runId the run identifier
     * @return Optional containing the report if still stored
     */
    Optional<BacktestReport> findById(UUID runId);

    /**
     * Returns stored reports, most recent first.
     */
    List<BacktestReport> findAll();

    /**
     * Returns the number of reports currently stored.
     */
    long count();
}
