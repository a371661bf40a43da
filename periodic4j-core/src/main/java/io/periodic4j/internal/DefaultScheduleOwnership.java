package io.periodic4j.internal;

import io.periodic4j.ScheduleOwner;
import io.periodic4j.ScheduleOwnership;
import io.periodic4j.core.DetachPolicy;
import io.periodic4j.core.OwnerKey;
import io.periodic4j.core.ScheduleEntry;
import io.periodic4j.core.ScheduleStore;
import io.periodic4j.core.TaskAssociation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ScheduleOwnership} over any {@link ScheduleStore}.
 */
public class DefaultScheduleOwnership implements ScheduleOwnership {

    private static final Logger log = LoggerFactory.getLogger(DefaultScheduleOwnership.class);

    private final ScheduleStore store;
    private final DetachPolicy detachPolicy;

    public DefaultScheduleOwnership(ScheduleStore store, DetachPolicy detachPolicy) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.detachPolicy = Objects.requireNonNull(detachPolicy, "detachPolicy must not be null");
    }

    @Override
    public List<ScheduleEntry> scheduleTasks(ScheduleOwner owner) {
        return getScheduleTasks(owner, null);
    }

    @Override
    public void createScheduleTask(ScheduleOwner owner, ScheduleEntry entry, String attribute) {
        createScheduleTask(owner, entry, attribute, null, true);
    }

    @Override
    public void createScheduleTask(ScheduleOwner owner, ScheduleEntry entry, String attribute, String description) {
        createScheduleTask(owner, entry, attribute, description, true);
    }

    @Override
    public void createScheduleTask(ScheduleOwner owner, ScheduleEntry entry, String attribute, String description,
                                   boolean commit) {
        Objects.requireNonNull(owner, "owner must not be null");
        Objects.requireNonNull(entry, "entry must not be null");

        OwnerKey key = owner.ownerKey();
        entry.getAssociations().add(TaskAssociation.forOwner(key, attribute, description));

        if (commit) {
            store.inTransaction(() -> store.saveEntry(entry));
        } else {
            store.saveEntry(entry);
        }

        log.debug("Schedule task attached owner={}#{} attribute={} entryId={} commit={}",
                key.discriminator(), key.discriminatorId(), attribute, entry.getId(), commit);
    }

    @Override
    public List<ScheduleEntry> getScheduleTasks(ScheduleOwner owner, String attribute) {
        Objects.requireNonNull(owner, "owner must not be null");

        List<ScheduleEntry> entries = new ArrayList<>();
        for (TaskAssociation association : firstAssociationPerEntry(owner, attribute).values()) {
            loadEntry(association).ifPresent(entries::add);
        }
        return entries;
    }

    @Override
    public List<ScheduleEntry> enableTasks(ScheduleOwner owner, String attribute) {
        Objects.requireNonNull(owner, "owner must not be null");

        List<ScheduleEntry> entries = store.inTransaction(() -> {
            List<ScheduleEntry> tasks = getScheduleTasks(owner, attribute);
            for (ScheduleEntry task : tasks) {
                task.setEnabled(true);
                store.saveEntry(task);
            }
            return tasks;
        });

        log.info("Enabled {} schedule tasks owner={} attribute={}", entries.size(), owner.ownerKey(), attribute);
        return entries;
    }

    @Override
    public List<ScheduleEntry> disableTasks(ScheduleOwner owner, String attribute) {
        Objects.requireNonNull(owner, "owner must not be null");

        List<ScheduleEntry> entries = store.inTransaction(() -> {
            List<ScheduleEntry> tasks = new ArrayList<>();
            for (TaskAssociation association : firstAssociationPerEntry(owner, attribute).values()) {
                Optional<ScheduleEntry> loaded = loadEntry(association);
                if (loaded.isEmpty()) {
                    continue;
                }
                ScheduleEntry task = loaded.get();
                task.setEnabled(false);
                store.saveEntry(task);
                detach(task, association);
                tasks.add(task);
            }
            return tasks;
        });

        log.info("Disabled {} schedule tasks owner={} attribute={} detachPolicy={}",
                entries.size(), owner.ownerKey(), attribute, detachPolicy);
        return entries;
    }

    private void detach(ScheduleEntry task, TaskAssociation matched) {
        TaskAssociation victim = switch (detachPolicy) {
            case OWNER -> matched;
            case FIRST_FOUND -> task.getAssociations().isEmpty() ? null : task.getAssociations().get(0);
        };
        if (victim == null || victim.getId() == null) {
            log.warn("No association to detach for entryId={}", task.getId());
            return;
        }

        store.deleteAssociation(victim.getId());
        task.getAssociations().removeIf(a -> victim.getId().equals(a.getId()));
        if (!victim.getId().equals(matched.getId())) {
            log.warn("Detached association id={} of owner={} while disabling through owner={} entryId={}",
                    victim.getId(), victim.ownerKey(), matched.ownerKey(), task.getId());
        }
    }

    /**
     * The owner's matching associations keyed by entry id, keeping the earliest per entry.
     * An owner linked to one entry under several attributes still yields that entry once.
     */
    private Map<String, TaskAssociation> firstAssociationPerEntry(ScheduleOwner owner, String attribute) {
        String filter = (attribute == null || attribute.isBlank()) ? null : attribute;
        Map<String, TaskAssociation> byEntry = new LinkedHashMap<>();
        for (TaskAssociation association : store.findAssociations(owner.ownerKey(), filter)) {
            byEntry.putIfAbsent(association.getTaskId(), association);
        }
        return byEntry;
    }

    private Optional<ScheduleEntry> loadEntry(TaskAssociation association) {
        Optional<ScheduleEntry> entry = store.findEntry(association.getTaskId());
        if (entry.isEmpty()) {
            log.warn("Association id={} points at missing schedule entry taskId={}",
                    association.getId(), association.getTaskId());
        }
        return entry;
    }
}
