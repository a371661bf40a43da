package io.periodic4j.core;

import java.time.Instant;
import java.util.Optional;

/**
 * Answers "when does this schedule fire next".
 *
 * <p>Produced by {@link IntervalSchedule#schedule()} and {@link CrontabSchedule#schedule()};
 * consumed by the execution engine, which owns the firing itself.
 */
public interface Recurrence {

    /**
     * Next fire time strictly after {@code after}, or empty when the rule never fires again.
     */
    Optional<Instant> nextRunAfter(Instant after);

    /**
     * True when an entry last run at {@code lastRunAt} should fire at {@code now}.
     * An entry that never ran is always due.
     */
    default boolean isDue(Instant lastRunAt, Instant now) {
        if (lastRunAt == null) {
            return true;
        }
        return nextRunAfter(lastRunAt)
                .map(next -> !next.isAfter(now))
                .orElse(false);
    }
}
