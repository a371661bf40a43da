package io.periodic4j.core;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Map-backed {@link ScheduleStore} for tests. Entries are copied in and out so callers never share
 * state with the stored rows.
 */
public class InMemoryScheduleStore implements ScheduleStore {

    private final Clock clock;
    private final AtomicLong ids = new AtomicLong();
    private final AtomicInteger transactions = new AtomicInteger();

    private final Map<String, IntervalSchedule> intervals = new LinkedHashMap<>();
    private final Map<String, CrontabSchedule> crontabs = new LinkedHashMap<>();
    private final Map<String, ScheduleEntry> entries = new LinkedHashMap<>();
    private final Map<String, TaskAssociation> associations = new LinkedHashMap<>();

    public InMemoryScheduleStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Bypasses the dedup path, for seeding duplicate rows.
     */
    public IntervalSchedule insertRawInterval(long every, IntervalPeriod period) {
        IntervalSchedule row = new IntervalSchedule(nextId("interval"), every, period);
        intervals.put(row.id(), row);
        return row;
    }

    public CrontabSchedule insertRawCrontab(CrontabSchedule pattern) {
        CrontabSchedule row = pattern.withId(nextId("crontab"));
        crontabs.put(row.id(), row);
        return row;
    }

    public int intervalCount() {
        return intervals.size();
    }

    public int crontabCount() {
        return crontabs.size();
    }

    public int associationCount() {
        return associations.size();
    }

    public int transactionCount() {
        return transactions.get();
    }

    @Override
    public List<IntervalSchedule> findIntervals(long every, IntervalPeriod period) {
        IntervalSchedule wanted = IntervalSchedule.of(every, period);
        return intervals.values().stream().filter(wanted::sameRecurrence).toList();
    }

    @Override
    public long deleteIntervals(long every, IntervalPeriod period) {
        List<IntervalSchedule> matches = findIntervals(every, period);
        matches.forEach(i -> intervals.remove(i.id()));
        return matches.size();
    }

    @Override
    public List<CrontabSchedule> findCrontabs(CrontabSchedule pattern) {
        return crontabs.values().stream().filter(pattern::sameRecurrence).toList();
    }

    @Override
    public long deleteCrontabs(CrontabSchedule pattern) {
        List<CrontabSchedule> matches = findCrontabs(pattern);
        matches.forEach(c -> crontabs.remove(c.id()));
        return matches.size();
    }

    @Override
    public ScheduleEntry saveEntry(ScheduleEntry entry) {
        if (entry.getInterval() != null && !entry.getInterval().isPersisted()) {
            entry.setInterval(persist(entry.getInterval()));
        }
        if (entry.getCrontab() != null && !entry.getCrontab().isPersisted()) {
            entry.setCrontab(persist(entry.getCrontab()));
        }
        if (entry.getId() == null) {
            entry.setId(nextId("entry"));
        }
        entry.setDateChanged(Instant.now(clock));
        entries.put(entry.getId(), copy(entry));

        for (TaskAssociation association : entry.getAssociations()) {
            if (!association.isPersisted()) {
                association.setId(nextId("association"));
                association.setTaskId(entry.getId());
                associations.put(association.getId(), copy(association));
            }
        }
        return entry;
    }

    @Override
    public Optional<ScheduleEntry> findEntry(String id) {
        ScheduleEntry stored = entries.get(id);
        if (stored == null) {
            return Optional.empty();
        }
        ScheduleEntry loaded = copy(stored);
        if (loaded.getInterval() != null) {
            loaded.setInterval(intervals.get(loaded.getInterval().id()));
        }
        if (loaded.getCrontab() != null) {
            loaded.setCrontab(crontabs.get(loaded.getCrontab().id()));
        }
        loaded.getAssociations().addAll(findAssociationsByTask(id));
        return Optional.of(loaded);
    }

    @Override
    public List<ScheduleEntry> findEnabledEntries() {
        List<ScheduleEntry> result = new ArrayList<>();
        for (ScheduleEntry stored : entries.values()) {
            if (stored.isEnabled()) {
                findEntry(stored.getId()).ifPresent(result::add);
            }
        }
        return result;
    }

    @Override
    public List<ScheduleEntry> findEntriesByInterval(Collection<String> intervalIds) {
        List<ScheduleEntry> result = new ArrayList<>();
        for (ScheduleEntry stored : entries.values()) {
            if (stored.getInterval() != null && intervalIds.contains(stored.getInterval().id())) {
                findEntry(stored.getId()).ifPresent(result::add);
            }
        }
        return result;
    }

    @Override
    public List<ScheduleEntry> findEntriesByCrontab(Collection<String> crontabIds) {
        List<ScheduleEntry> result = new ArrayList<>();
        for (ScheduleEntry stored : entries.values()) {
            if (stored.getCrontab() != null && crontabIds.contains(stored.getCrontab().id())) {
                findEntry(stored.getId()).ifPresent(result::add);
            }
        }
        return result;
    }

    @Override
    public List<TaskAssociation> findAssociations(OwnerKey owner, String attribute) {
        return associations.values().stream()
                .filter(a -> a.belongsTo(owner))
                .filter(a -> attribute == null || attribute.equals(a.getAttribute()))
                .map(this::copy)
                .toList();
    }

    @Override
    public List<TaskAssociation> findAssociationsByTask(String taskId) {
        return associations.values().stream()
                .filter(a -> Objects.equals(taskId, a.getTaskId()))
                .map(this::copy)
                .toList();
    }

    @Override
    public long deleteAssociation(String id) {
        return associations.remove(id) == null ? 0 : 1;
    }

    @Override
    public <R> R inTransaction(Supplier<R> work) {
        transactions.incrementAndGet();
        return work.get();
    }

    private IntervalSchedule persist(IntervalSchedule rule) {
        List<IntervalSchedule> existing = findIntervals(rule.every(), rule.period());
        if (!existing.isEmpty()) {
            return existing.get(0);
        }
        IntervalSchedule row = rule.withId(nextId("interval"));
        intervals.put(row.id(), row);
        return row;
    }

    private CrontabSchedule persist(CrontabSchedule rule) {
        List<CrontabSchedule> existing = findCrontabs(rule);
        if (!existing.isEmpty()) {
            return existing.get(0);
        }
        CrontabSchedule row = rule.withId(nextId("crontab"));
        crontabs.put(row.id(), row);
        return row;
    }

    private String nextId(String prefix) {
        return prefix + "-" + ids.incrementAndGet();
    }

    private ScheduleEntry copy(ScheduleEntry source) {
        ScheduleEntry target = new ScheduleEntry(source.getName(), source.getTask());
        target.setId(source.getId());
        target.setInterval(source.getInterval());
        target.setCrontab(source.getCrontab());
        target.setArguments(source.getArguments());
        target.setKeywordArguments(source.getKeywordArguments());
        target.setQueue(source.getQueue());
        target.setExchange(source.getExchange());
        target.setRoutingKey(source.getRoutingKey());
        target.setExpires(source.getExpires());
        target.setEnabled(source.isEnabled());
        target.setLastRunAt(source.getLastRunAt());
        target.setTotalRunCount(source.getTotalRunCount());
        target.setDateChanged(source.getDateChanged());
        return target;
    }

    private TaskAssociation copy(TaskAssociation source) {
        TaskAssociation target = new TaskAssociation();
        target.setId(source.getId());
        target.setTaskId(source.getTaskId());
        target.setDiscriminator(source.getDiscriminator());
        target.setDiscriminatorId(source.getDiscriminatorId());
        target.setAttribute(source.getAttribute());
        target.setDescription(source.getDescription());
        return target;
    }
}
