package com.fintech.marketmaking.closing;

import java.time.LocalTime;
import java.util.Objects;

/**
 * Intraday boundaries used by the closing-auction strategy (exchange local time).
 *
 * @param regularStart Start of regular trading; exits and trend sampling begin here
 * @param preCloseEnd End of regular trading and of the VWAP window; entry orders are placed from here
 * @param closingPrint The first trade at or after this time is the closing price
 * @param stopLossStart Start of intraday stop-loss monitoring (inclusive)
 * @param stopLossEnd End of intraday stop-loss monitoring (exclusive)
 */
public record ClosingSchedule(
    LocalTime regularStart,
    LocalTime preCloseEnd,
    LocalTime closingPrint,
    LocalTime stopLossStart,
    LocalTime stopLossEnd
) {

    public ClosingSchedule {
        Objects.requireNonNull(regularStart, "regularStart cannot be null");
        Objects.requireNonNull(preCloseEnd, "preCloseEnd cannot be null");
        Objects.requireNonNull(closingPrint, "closingPrint cannot be null");
        Objects.requireNonNull(stopLossStart, "stopLossStart cannot be null");
        Objects.requireNonNull(stopLossEnd, "stopLossEnd cannot be null");

        if (!regularStart.isBefore(preCloseEnd) || preCloseEnd.isAfter(closingPrint)) {
            throw new IllegalArgumentException("Closing schedule must satisfy regularStart < preCloseEnd <= closingPrint");
        }
        if (stopLossStart.isAfter(stopLossEnd)) {
            throw new IllegalArgumentException("Stop-loss window start must not be after its end");
        }
    }

    /** 10:00 open, 14:45 pre-close end, 14:55 closing print, stop-loss 10:10-14:44. */
    public static ClosingSchedule defaults() {
        return new ClosingSchedule(
            LocalTime.of(10, 0),
            LocalTime.of(14, 45),
            LocalTime.of(14, 55),
            LocalTime.of(10, 10),
            LocalTime.of(14, 44)
        );
    }

    public boolean isRegularHours(LocalTime t) {
        return !t.isBefore(regularStart) && t.isBefore(preCloseEnd);
    }

    public boolean isOrderPlacementWindow(LocalTime t) {
        return !t.isBefore(preCloseEnd) && t.isBefore(closingPrint);
    }

    public boolean isAtOrAfterClosingPrint(LocalTime t) {
        return !t.isBefore(closingPrint);
    }

    public boolean isStopLossWindow(LocalTime t) {
        return !t.isBefore(stopLossStart) && t.isBefore(stopLossEnd);
    }
}
