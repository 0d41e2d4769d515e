package com.hubsync.ingestion.reconcile;

/**
 * Optional inclusive bounds in seconds. Either bound may be null.
 */
record TimeRange(Long start, Long stop) {

    static TimeRange of(Long start, Long stop) {
        if (start != null && start < 0) {
            throw new InvalidTimeRangeException("start " + start + " is negative");
        }
        if (stop != null && stop < 0) {
            throw new InvalidTimeRangeException("stop " + stop + " is negative");
        }
        if (start != null && stop != null && start > stop) {
            throw new InvalidTimeRangeException("start " + start + " is after stop " + stop);
        }
        return new TimeRange(start, stop);
    }

    boolean contains(long seconds) {
        return (start == null || seconds >= start) && (stop == null || seconds <= stop);
    }
}
