package io.periodic4j;

import io.periodic4j.core.CrontabSchedule;
import io.periodic4j.core.IntervalPeriod;
import io.periodic4j.core.IntervalSchedule;
import io.periodic4j.core.ScheduleEntry;
import io.periodic4j.core.TaskAssociation;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Engine-facing API: what is scheduled, who owns it, and run bookkeeping.
 */
public interface ScheduleCatalog {

    /**
     * Enabled entries with a resolvable schedule. Entries without a rule are skipped.
     */
    List<ScheduleEntry> enabledEntries();

    Optional<ScheduleEntry> findEntry(String id);

    List<TaskAssociation> associations(ScheduleEntry entry);

    /**
     * Owners of {@code entry}; associations whose owner cannot be resolved are skipped.
     */
    List<ScheduleOwner> parents(ScheduleEntry entry);

    Optional<ScheduleOwner> parent(TaskAssociation association);

    ScheduleEntry update(ScheduleEntry entry);

    /**
     * Record one firing: {@code lastRunAt = ranAt}, run count incremented.
     */
    ScheduleEntry recordRun(ScheduleEntry entry, Instant ranAt);

    IntervalSchedule resolveInterval(Duration every);

    IntervalSchedule resolveInterval(Duration every, IntervalPeriod period);

    CrontabSchedule resolveCrontab(CrontabSchedule pattern);
}
