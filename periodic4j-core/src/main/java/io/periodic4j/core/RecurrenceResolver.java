package io.periodic4j.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Find-or-create for recurrence rules, so entries sharing "every hour" share one row.
 *
 * <p>Outcomes of the lookup:
 * <ul>
 *   <li>no match: a new unsaved rule; the store persists it with the entry that references it</li>
 *   <li>one match: that row</li>
 *   <li>several matches: all of them are deleted and a new unsaved rule is returned</li>
 * </ul>
 *
 * <p>When entries still reference the deleted duplicates, the replacement is saved in the same
 * transaction, those entries are moved onto it, and the saved rule is returned instead.
 */
public class RecurrenceResolver {

    private static final Logger log = LoggerFactory.getLogger(RecurrenceResolver.class);

    private final ScheduleStore store;

    public RecurrenceResolver(ScheduleStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    /**
     * Interval of {@code every} whole seconds; negative durations become 0.
     */
    public IntervalSchedule resolveInterval(Duration every) {
        return resolveInterval(every, IntervalPeriod.SECONDS);
    }

    /**
     * Interval of {@code every} in whole seconds (negative becomes 0), labelled with {@code period}.
     * The period does not rescale the amount.
     */
    public IntervalSchedule resolveInterval(Duration every, IntervalPeriod period) {
        Objects.requireNonNull(every, "every must not be null");
        Objects.requireNonNull(period, "period must not be null");

        long seconds = Math.max(every.getSeconds(), 0L);
        return resolveInterval(seconds, period);
    }

    public IntervalSchedule resolveInterval(long every, IntervalPeriod period) {
        Objects.requireNonNull(period, "period must not be null");
        long amount = Math.max(every, 0L);

        List<IntervalSchedule> existing = store.findIntervals(amount, period);
        if (existing.isEmpty()) {
            return IntervalSchedule.of(amount, period);
        }
        if (existing.size() == 1) {
            return existing.get(0);
        }

        log.warn("Found {} duplicate interval rules every={} period={}; replacing them",
                existing.size(), amount, period.key());
        List<String> duplicateIds = existing.stream().map(IntervalSchedule::id).toList();
        return store.inTransaction(() -> {
            List<ScheduleEntry> referencing = store.findEntriesByInterval(duplicateIds);
            long deleted = store.deleteIntervals(amount, period);
            log.debug("Deleted {} interval rules every={} period={}", deleted, amount, period.key());

            IntervalSchedule replacement = IntervalSchedule.of(amount, period);
            for (ScheduleEntry entry : referencing) {
                entry.setInterval(replacement);
                store.saveEntry(entry);
                replacement = entry.getInterval();
            }
            if (!referencing.isEmpty()) {
                log.info("Moved {} schedule entries onto interval id={}", referencing.size(), replacement.id());
            }
            return replacement;
        });
    }

    /**
     * Crontab rule with exactly the five fields of {@code pattern}; no normalization is applied.
     */
    public CrontabSchedule resolveCrontab(CrontabSchedule pattern) {
        Objects.requireNonNull(pattern, "pattern must not be null");
        CrontabSchedule fresh = pattern.withId(null);

        List<CrontabSchedule> existing = store.findCrontabs(fresh);
        if (existing.isEmpty()) {
            return fresh;
        }
        if (existing.size() == 1) {
            return existing.get(0);
        }

        log.warn("Found {} duplicate crontab rules '{}'; replacing them", existing.size(), fresh.toCrontab());
        List<String> duplicateIds = existing.stream().map(CrontabSchedule::id).toList();
        return store.inTransaction(() -> {
            List<ScheduleEntry> referencing = store.findEntriesByCrontab(duplicateIds);
            long deleted = store.deleteCrontabs(fresh);
            log.debug("Deleted {} crontab rules '{}'", deleted, fresh.toCrontab());

            CrontabSchedule replacement = fresh;
            for (ScheduleEntry entry : referencing) {
                entry.setCrontab(replacement);
                store.saveEntry(entry);
                replacement = entry.getCrontab();
            }
            if (!referencing.isEmpty()) {
                log.info("Moved {} schedule entries onto crontab id={}", referencing.size(), replacement.id());
            }
            return replacement;
        });
    }
}
