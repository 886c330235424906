package com.fintech.marketmaking.domain;

/**
 * Phase of the exchange trading day.
 */
public enum SessionPhase {

    PRE_OPEN,
    OPENING_AUCTION,
    SILENT_PERIOD,
    CONTINUOUS,
    CLOSING_AUCTION,
    POST_CLOSE;

    /** Book updates and quoting are allowed. */
    public boolean allowsQuoting() {
        return this == OPENING_AUCTION || this == CONTINUOUS;
    }

    /** Trade prints may fill our quotes (auction prints never do). */
    public boolean allowsFills() {
        return this == CONTINUOUS;
    }
}
