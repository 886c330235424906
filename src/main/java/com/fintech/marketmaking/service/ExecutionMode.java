package com.fintech.marketmaking.service;

/**
 * How a backtest run drives its sessions.
 */
public enum ExecutionMode {

    /** One worker per security on the execution pool. */
    PARALLEL,

    /** All events through the Disruptor ring buffer on a single consumer. */
    STREAMING
}
