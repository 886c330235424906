package com.fintech.marketmaking.ingestion;

import com.fintech.marketmaking.domain.MarketEvent;

import java.util.List;

/**
 * Supplies time-ordered market events per security, in bounded batches.
 * File formats and columnar conversion live behind implementations of this interface.
 */
public interface MarketEventSource {

    /** Securities available from this source, in a stable order. */
    List<String> securities();

    /**
     * Events for one security in timestamp order, split into consecutive batches.
     *
     * @param batchSize maximum events per batch, must be positive
     */
    Iterable<List<MarketEvent>> batches(String security, int batchSize);

    /** Total number of events for a security. */
    long eventCount(String security);
}
