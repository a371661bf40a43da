package io.periodic4j.core;

import java.util.Objects;

/**
 * Fixed-period recurrence: every {@code every} units of {@code period}.
 *
 * <p>{@code id} is null until the store persists the rule.
 */
public record IntervalSchedule(
        String id,
        long every,
        IntervalPeriod period
) {

    public IntervalSchedule {
        Objects.requireNonNull(period, "period must not be null");
        if (every < 0) {
            throw new IllegalArgumentException("every must not be negative: " + every);
        }
    }

    public static IntervalSchedule of(long every, IntervalPeriod period) {
        return new IntervalSchedule(null, every, period);
    }

    public boolean isPersisted() {
        return id != null;
    }

    public IntervalSchedule withId(String id) {
        return new IntervalSchedule(id, every, period);
    }

    public Recurrence schedule() {
        return new IntervalRecurrence(period.toDuration(every));
    }

    /**
     * True when both rules describe the same recurrence, ignoring ids.
     */
    public boolean sameRecurrence(IntervalSchedule other) {
        return other != null && every == other.every && period == other.period;
    }
}
