package com.fintech.marketmaking.ingestion;

import com.fintech.marketmaking.domain.MarketEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Event source backed by lists already held in memory.
 */
public class InMemoryMarketEventSource implements MarketEventSource {

    private final Map<String, List<MarketEvent>> events;

    public InMemoryMarketEventSource(Map<String, List<MarketEvent>> events) {
        this.events = new LinkedHashMap<>();
        events.forEach((security, list) -> this.events.put(security, List.copyOf(list)));
    }

    @Override
    public List<String> securities() {
        return List.copyOf(events.keySet());
    }

    @Override
    public Iterable<List<MarketEvent>> batches(String security, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        List<MarketEvent> all = events.getOrDefault(security, Collections.emptyList());
        List<List<MarketEvent>> batches = new ArrayList<>();
        for (int from = 0; from < all.size(); from += batchSize) {
            batches.add(all.subList(from, Math.min(all.size(), from + batchSize)));
        }
        return batches;
    }

    @Override
    public long eventCount(String security) {
        return events.getOrDefault(security, Collections.emptyList()).size();
    }
}
