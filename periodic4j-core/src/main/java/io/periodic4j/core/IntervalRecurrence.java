package io.periodic4j.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Fires every {@code every}, measured from the previous run. A zero interval is due on every check.
 */
public record IntervalRecurrence(Duration every) implements Recurrence {

    public IntervalRecurrence {
        Objects.requireNonNull(every, "every must not be null");
        if (every.isNegative()) {
            throw new IllegalArgumentException("every must not be negative: " + every);
        }
    }

    @Override
    public Optional<Instant> nextRunAfter(Instant after) {
        Objects.requireNonNull(after, "after must not be null");
        return Optional.of(after.plus(every));
    }
}
