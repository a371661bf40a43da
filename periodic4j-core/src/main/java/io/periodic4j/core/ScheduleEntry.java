package io.periodic4j.core;

import io.periodic4j.utils.TaskArgumentCodec;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A named, schedulable unit of work bound to at most one recurrence rule.
 *
 * <p>{@code dateChanged} is maintained by the store on every insert and update; whatever a caller
 * sets here is overwritten on save.
 */
public class ScheduleEntry {

    private String id;
    private String name;
    private String task;

    private IntervalSchedule interval;
    private CrontabSchedule crontab;

    private String arguments = TaskArgumentCodec.EMPTY_ARGS;
    private String keywordArguments = TaskArgumentCodec.EMPTY_KWARGS;

    private String queue;
    private String exchange;
    private String routingKey;
    private Instant expires;

    private boolean enabled = true;
    private Instant lastRunAt;
    private int totalRunCount;
    private Instant dateChanged;

    private final List<TaskAssociation> associations = new ArrayList<>();

    public ScheduleEntry() {
    }

    public ScheduleEntry(String name, String task) {
        this.name = name;
        this.task = task;
    }

    /**
     * The interval rule when set, else the crontab rule, else empty (never fires).
     */
    public Optional<Recurrence> schedule() {
        if (interval != null) {
            return Optional.of(interval.schedule());
        }
        if (crontab != null) {
            return Optional.of(crontab.schedule());
        }
        return Optional.empty();
    }

    /**
     * Both rules set; {@link #schedule()} then uses the interval.
     */
    public boolean hasAmbiguousSchedule() {
        return interval != null && crontab != null;
    }

    public List<Object> getArgs() {
        return TaskArgumentCodec.defaults().decodeArgs(arguments);
    }

    public void setArgs(List<?> args) {
        this.arguments = TaskArgumentCodec.defaults().encodeArgs(args);
    }

    public Map<String, Object> getKwargs() {
        return TaskArgumentCodec.defaults().decodeKwargs(keywordArguments);
    }

    public void setKwargs(Map<String, ?> kwargs) {
        this.keywordArguments = TaskArgumentCodec.defaults().encodeKwargs(kwargs);
    }

    public boolean isPersisted() {
        return id != null;
    }

    /**
     * Associations attached to this entry. New (unsaved) ones are inserted when the entry is saved.
     */
    public List<TaskAssociation> getAssociations() {
        return associations;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getTask() {
        return task;
    }

    public void setTask(String task) {
        this.task = task;
    }

    public IntervalSchedule getInterval() {
        return interval;
    }

    public void setInterval(IntervalSchedule interval) {
        this.interval = interval;
    }

    public CrontabSchedule getCrontab() {
        return crontab;
    }

    public void setCrontab(CrontabSchedule crontab) {
        this.crontab = crontab;
    }

    public String getArguments() {
        return arguments;
    }

    public void setArguments(String arguments) {
        this.arguments = arguments;
    }

    public String getKeywordArguments() {
        return keywordArguments;
    }

    public void setKeywordArguments(String keywordArguments) {
        this.keywordArguments = keywordArguments;
    }

    public String getQueue() {
        return queue;
    }

    public void setQueue(String queue) {
        this.queue = queue;
    }

    public String getExchange() {
        return exchange;
    }

    public void setExchange(String exchange) {
        this.exchange = exchange;
    }

    public String getRoutingKey() {
        return routingKey;
    }

    public void setRoutingKey(String routingKey) {
        this.routingKey = routingKey;
    }

    public Instant getExpires() {
        return expires;
    }

    public void setExpires(Instant expires) {
        this.expires = expires;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Instant getLastRunAt() {
        return lastRunAt;
    }

    public void setLastRunAt(Instant lastRunAt) {
        this.lastRunAt = lastRunAt;
    }

    public int getTotalRunCount() {
        return totalRunCount;
    }

    public void setTotalRunCount(int totalRunCount) {
        this.totalRunCount = totalRunCount;
    }

    public Instant getDateChanged() {
        return dateChanged;
    }

    public void setDateChanged(Instant dateChanged) {
        this.dateChanged = dateChanged;
    }

    @Override
    public String toString() {
        return "ScheduleEntry{id=" + id
                + ", name=" + name
                + ", task=" + task
                + ", enabled=" + enabled
                + ", dateChanged=" + dateChanged
                + "}";
    }
}
