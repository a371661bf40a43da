package io.periodic4j.core;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Persistence SPI for schedules.
 *
 * <p>Implementations must:
 * <ul>
 *   <li>stamp {@code dateChanged} with the current UTC time on every entry insert and update</li>
 *   <li>persist unsaved recurrence rules (id == null) referenced by an entry before the entry itself,
 *       converging on an existing row with the same defining fields</li>
 *   <li>insert unsaved associations in the entry's collection after the entry, with {@code taskId} set</li>
 * </ul>
 */
public interface ScheduleStore {

    List<IntervalSchedule> findIntervals(long every, IntervalPeriod period);

    /**
     * @return deleted count
     */
    long deleteIntervals(long every, IntervalPeriod period);

    /**
     * Rows whose five fields equal those of {@code pattern}, matched verbatim.
     */
    List<CrontabSchedule> findCrontabs(CrontabSchedule pattern);

    long deleteCrontabs(CrontabSchedule pattern);

    /**
     * Insert or update the entry, cascading unsaved rules and associations. Ids and
     * {@code dateChanged} are written back into {@code entry}.
     */
    ScheduleEntry saveEntry(ScheduleEntry entry);

    Optional<ScheduleEntry> findEntry(String id);

    List<ScheduleEntry> findEnabledEntries();

    /**
     * Entries whose interval reference is one of {@code intervalIds}, in insertion order.
     */
    List<ScheduleEntry> findEntriesByInterval(Collection<String> intervalIds);

    List<ScheduleEntry> findEntriesByCrontab(Collection<String> crontabIds);

    /**
     * Associations held by {@code owner}, optionally narrowed to one attribute (null = any),
     * in insertion order.
     */
    List<TaskAssociation> findAssociations(OwnerKey owner, String attribute);

    /**
     * All associations pointing at one entry, in insertion order.
     */
    List<TaskAssociation> findAssociationsByTask(String taskId);

    long deleteAssociation(String id);

    /**
     * Run {@code work} as one unit. Joins the caller's transaction when one is active.
     */
    <R> R inTransaction(Supplier<R> work);
}
