package org.multibench.scheduler;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Intervals between successive status polls of a blocking wait; the last interval repeats.
 */
public record PollSchedule(List<Duration> intervals) {
    public PollSchedule {
        Objects.requireNonNull(intervals, "intervals");
        if (intervals.isEmpty()) {
            throw new IllegalArgumentException("intervals must not be empty");
        }
        for (final Duration interval : intervals) {
            if (interval.isNegative()) {
                throw new IllegalArgumentException("intervals must not be negative: " + interval);
            }
        }
        intervals = List.copyOf(intervals);
    }

    /**
     * 5, 10, 15, 30 and then every 60 seconds.
     */
    public static PollSchedule backOff() {
        return new PollSchedule(List.of(
            Duration.ofSeconds(5),
            Duration.ofSeconds(10),
            Duration.ofSeconds(15),
            Duration.ofSeconds(30),
            Duration.ofSeconds(60)));
    }

    public static PollSchedule fixed(final Duration interval) {
        return new PollSchedule(List.of(interval));
    }

    /**
     * Interval to wait after the poll with zero-based index {@code pollIndex}.
     */
    public Duration intervalAfter(final int pollIndex) {
        if (pollIndex < 0) {
            throw new IllegalArgumentException("pollIndex must be >= 0");
        }
        return intervals.get(Math.min(pollIndex, intervals.size() - 1));
    }
}
