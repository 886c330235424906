package com.fintech.marketmaking.util;

import com.fintech.marketmaking.domain.SessionPhase;

import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Maps timestamps to trading-day phases and detects the end-of-day cutoff.
 *
 * Thread-safe and stateless - all methods are pure functions.
 */
public class SessionWindowClassifier {

    private final TradingHours hours;

    public SessionWindowClassifier(TradingHours hours) {
        this.hours = hours;
    }

    /**
     * Classifies a timestamp into its session phase.
     * The closing auction end is inclusive; every other boundary starts its phase.
     *
     * @param timestamp Event time (exchange local)
     * @return The phase in effect at that time
     */
    public SessionPhase classify(LocalDateTime timestamp) {
        return classify(timestamp.toLocalTime());
    }

    public SessionPhase classify(LocalTime t) {
        if (t.isBefore(hours.openingAuctionStart())) {
            return SessionPhase.PRE_OPEN;
        }
        if (t.isBefore(hours.silentPeriodStart())) {
            return SessionPhase.OPENING_AUCTION;
        }
        if (t.isBefore(hours.continuousStart())) {
            return SessionPhase.SILENT_PERIOD;
        }
        if (t.isBefore(hours.closingAuctionStart())) {
            return SessionPhase.CONTINUOUS;
        }
        if (!t.isAfter(hours.closingAuctionEnd())) {
            return SessionPhase.CLOSING_AUCTION;
        }
        return SessionPhase.POST_CLOSE;
    }

    /**
     * Checks if positions must be flattened (at or after the cutoff).
     *
     * @param timestamp Event time
     * @return true once the cutoff has been reached on that day
     */
    public boolean isAtOrAfterEodCutoff(LocalDateTime timestamp) {
        return !timestamp.toLocalTime().isBefore(hours.eodCutoff());
    }

    public TradingHours hours() {
        return hours;
    }
}
