package io.periodic4j.internal;

import io.periodic4j.ScheduleCatalog;
import io.periodic4j.ScheduleOwner;
import io.periodic4j.core.CrontabSchedule;
import io.periodic4j.core.IntervalPeriod;
import io.periodic4j.core.IntervalSchedule;
import io.periodic4j.core.OwnerRegistry;
import io.periodic4j.core.RecurrenceResolver;
import io.periodic4j.core.ScheduleEntry;
import io.periodic4j.core.ScheduleStore;
import io.periodic4j.core.TaskAssociation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ScheduleCatalog} over any {@link ScheduleStore}.
 */
public class DefaultScheduleCatalog implements ScheduleCatalog {

    private static final Logger log = LoggerFactory.getLogger(DefaultScheduleCatalog.class);

    private final ScheduleStore store;
    private final OwnerRegistry ownerRegistry;
    private final RecurrenceResolver recurrenceResolver;

    public DefaultScheduleCatalog(ScheduleStore store, OwnerRegistry ownerRegistry, RecurrenceResolver recurrenceResolver) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.ownerRegistry = Objects.requireNonNull(ownerRegistry, "ownerRegistry must not be null");
        this.recurrenceResolver = Objects.requireNonNull(recurrenceResolver, "recurrenceResolver must not be null");
    }

    @Override
    public List<ScheduleEntry> enabledEntries() {
        List<ScheduleEntry> result = new ArrayList<>();
        for (ScheduleEntry entry : store.findEnabledEntries()) {
            if (!entry.isEnabled()) {
                continue;
            }
            if (entry.getInterval() == null && entry.getCrontab() == null) {
                log.debug("Skipping unscheduled entry id={} name={}", entry.getId(), entry.getName());
                continue;
            }
            if (entry.hasAmbiguousSchedule()) {
                log.warn("Entry id={} name={} has both interval and crontab; using the interval",
                        entry.getId(), entry.getName());
            }
            result.add(entry);
        }
        return result;
    }

    @Override
    public Optional<ScheduleEntry> findEntry(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return store.findEntry(id);
    }

    @Override
    public List<TaskAssociation> associations(ScheduleEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        if (!entry.isPersisted()) {
            return List.copyOf(entry.getAssociations());
        }
        return store.findAssociationsByTask(entry.getId());
    }

    @Override
    public List<ScheduleOwner> parents(ScheduleEntry entry) {
        List<ScheduleOwner> owners = new ArrayList<>();
        for (TaskAssociation association : associations(entry)) {
            parent(association).ifPresent(owners::add);
        }
        return owners;
    }

    @Override
    public Optional<ScheduleOwner> parent(TaskAssociation association) {
        Objects.requireNonNull(association, "association must not be null");
        String type = association.getDiscriminator();
        if (type == null || type.isBlank()) {
            return Optional.empty();
        }
        if (!ownerRegistry.isRegistered(type)) {
            log.debug("Association id={} names unregistered owner type={}", association.getId(), type);
            return Optional.empty();
        }
        return ownerRegistry.resolve(association.ownerKey());
    }

    @Override
    public ScheduleEntry update(ScheduleEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        return store.inTransaction(() -> store.saveEntry(entry));
    }

    @Override
    public ScheduleEntry recordRun(ScheduleEntry entry, Instant ranAt) {
        Objects.requireNonNull(entry, "entry must not be null");
        Objects.requireNonNull(ranAt, "ranAt must not be null");

        entry.setLastRunAt(ranAt);
        entry.setTotalRunCount(entry.getTotalRunCount() + 1);
        return update(entry);
    }

    @Override
    public IntervalSchedule resolveInterval(Duration every) {
        return recurrenceResolver.resolveInterval(every);
    }

    @Override
    public IntervalSchedule resolveInterval(Duration every, IntervalPeriod period) {
        return recurrenceResolver.resolveInterval(every, period);
    }

    @Override
    public CrontabSchedule resolveCrontab(CrontabSchedule pattern) {
        return recurrenceResolver.resolveCrontab(pattern);
    }
}
