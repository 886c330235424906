package com.fintech.marketmaking.api;

import java.util.UUID;

/**
 * No stored report for the requested run id.
 */
public class RunNotFoundException extends RuntimeException {

    public RunNotFoundException(UUID runId) {
        super("Backtest run not found: " + runId);
    }
}
