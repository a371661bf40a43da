package io.periodic4j;

import io.periodic4j.core.ScheduleEntry;

import java.util.List;

/**
 * Owner-facing API: attach schedule entries to an owner and switch them on or off.
 *
 * <p>Typical usage:
 * <pre>{@code
 * ScheduleEntry entry = new ScheduleEntry("nightly-report", "reports.build");
 * entry.setCrontab(catalog.resolveCrontab(CrontabSchedule.parse("0 2 * * *")));
 * ownership.createScheduleTask(campaign, entry, "report");
 *
 * ownership.disableTasks(campaign, "report");
 * }</pre>
 */
public interface ScheduleOwnership {

    /**
     * Every entry reachable through the owner's associations.
     */
    List<ScheduleEntry> scheduleTasks(ScheduleOwner owner);

    void createScheduleTask(ScheduleOwner owner, ScheduleEntry entry, String attribute);

    void createScheduleTask(ScheduleOwner owner, ScheduleEntry entry, String attribute, String description);

    /**
     * Tag {@code entry} with the owner's identity and save it with the new association.
     *
     * @param commit true to run in a transaction of its own; false to run inside the caller's
     */
    void createScheduleTask(ScheduleOwner owner, ScheduleEntry entry, String attribute, String description, boolean commit);

    /**
     * Entries reachable through the owner's associations carrying exactly {@code attribute}.
     * A null or blank attribute matches all.
     */
    List<ScheduleEntry> getScheduleTasks(ScheduleOwner owner, String attribute);

    /**
     * Enable the matching entries. Associations are left alone.
     */
    List<ScheduleEntry> enableTasks(ScheduleOwner owner, String attribute);

    /**
     * Disable the matching entries and detach one association from each.
     */
    List<ScheduleEntry> disableTasks(ScheduleOwner owner, String attribute);
}
