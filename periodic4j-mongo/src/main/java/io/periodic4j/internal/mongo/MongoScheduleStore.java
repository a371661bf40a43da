package io.periodic4j.internal.mongo;

import io.periodic4j.core.CrontabSchedule;
import io.periodic4j.core.IntervalPeriod;
import io.periodic4j.core.IntervalSchedule;
import io.periodic4j.core.OwnerKey;
import io.periodic4j.core.ScheduleEntry;
import io.periodic4j.core.ScheduleStore;
import io.periodic4j.core.TaskAssociation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.transaction.support.TransactionOperations;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * MongoDB persistence layer for schedules.
 *
 * <p>Collections:
 * <ul>
 *   <li>{@code schedule_intervals}, {@code schedule_crontabs}: recurrence rules, one row per distinct rule</li>
 *   <li>{@code schedule_entries}: entries referencing a rule by id</li>
 *   <li>{@code schedule_task_associations}: owner links, many per entry</li>
 * </ul>
 *
 * <p>Unsaved rules are persisted with an atomic upsert keyed on their defining fields, so concurrent
 * writers of the same rule converge on one row. With the unique indexes from
 * {@code PeriodicMongoIndexConfig} in place this cannot produce duplicates.
 */
public class MongoScheduleStore implements ScheduleStore {

    private static final Logger log = LoggerFactory.getLogger(MongoScheduleStore.class);

    private static final Sort INSERTION_ORDER = Sort.by(Sort.Order.asc("_id"));

    private final MongoTemplate mongoTemplate;
    private final TransactionOperations transactionOperations;

    public MongoScheduleStore(MongoTemplate mongoTemplate) {
        this(mongoTemplate, TransactionOperations.withoutTransaction());
    }

    public MongoScheduleStore(MongoTemplate mongoTemplate, TransactionOperations transactionOperations) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.transactionOperations = Objects.requireNonNull(transactionOperations, "transactionOperations must not be null");
    }

    @Override
    public List<IntervalSchedule> findIntervals(long every, IntervalPeriod period) {
        Objects.requireNonNull(period, "period must not be null");
        List<IntervalScheduleDocument> docs = mongoTemplate.find(intervalQuery(every, period), IntervalScheduleDocument.class);
        List<IntervalSchedule> rules = new ArrayList<>(docs.size());
        for (IntervalScheduleDocument doc : docs) {
            rules.add(toInterval(doc));
        }
        return rules;
    }

    @Override
    public long deleteIntervals(long every, IntervalPeriod period) {
        Objects.requireNonNull(period, "period must not be null");
        return mongoTemplate.remove(intervalQuery(every, period), IntervalScheduleDocument.class).getDeletedCount();
    }

    @Override
    public List<CrontabSchedule> findCrontabs(CrontabSchedule pattern) {
        Objects.requireNonNull(pattern, "pattern must not be null");
        List<CrontabScheduleDocument> docs = mongoTemplate.find(crontabQuery(pattern), CrontabScheduleDocument.class);
        List<CrontabSchedule> rules = new ArrayList<>(docs.size());
        for (CrontabScheduleDocument doc : docs) {
            rules.add(toCrontab(doc));
        }
        return rules;
    }

    @Override
    public long deleteCrontabs(CrontabSchedule pattern) {
        Objects.requireNonNull(pattern, "pattern must not be null");
        return mongoTemplate.remove(crontabQuery(pattern), CrontabScheduleDocument.class).getDeletedCount();
    }

    /**
     * Persist an entry.
     *
     * <p>Order: unsaved rules (upsert), the entry itself ({@code dateChanged} stamped by
     * {@link DateChangedCallback}), then unsaved associations with {@code taskId} set.
     */
    @Override
    public ScheduleEntry saveEntry(ScheduleEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");

        if (entry.getInterval() != null && !entry.getInterval().isPersisted()) {
            entry.setInterval(upsertInterval(entry.getInterval()));
        }
        if (entry.getCrontab() != null && !entry.getCrontab().isPersisted()) {
            entry.setCrontab(upsertCrontab(entry.getCrontab()));
        }

        ScheduleEntryDocument saved = mongoTemplate.save(toDocument(entry));
        entry.setId(saved.getId());
        entry.setDateChanged(saved.getDateChanged());

        for (TaskAssociation association : entry.getAssociations()) {
            if (association.isPersisted()) {
                continue;
            }
            association.setTaskId(saved.getId());
            ScheduleTaskAssociationDocument inserted = mongoTemplate.insert(toDocument(association));
            association.setId(inserted.getId());
        }

        log.debug("Saved schedule entry id={} name={} enabled={}", entry.getId(), entry.getName(), entry.isEnabled());
        return entry;
    }

    @Override
    public Optional<ScheduleEntry> findEntry(String id) {
        Objects.requireNonNull(id, "id must not be null");
        ScheduleEntryDocument doc = mongoTemplate.findById(id, ScheduleEntryDocument.class);
        return Optional.ofNullable(doc).map(this::toEntry);
    }

    @Override
    public List<ScheduleEntry> findEnabledEntries() {
        return findEntries(new Query(Criteria.where("enabled").is(true)));
    }

    @Override
    public List<ScheduleEntry> findEntriesByInterval(Collection<String> intervalIds) {
        Objects.requireNonNull(intervalIds, "intervalIds must not be null");
        return findEntries(new Query(Criteria.where("intervalId").in(intervalIds)));
    }

    @Override
    public List<ScheduleEntry> findEntriesByCrontab(Collection<String> crontabIds) {
        Objects.requireNonNull(crontabIds, "crontabIds must not be null");
        return findEntries(new Query(Criteria.where("crontabId").in(crontabIds)));
    }

    private List<ScheduleEntry> findEntries(Query q) {
        List<ScheduleEntryDocument> docs = mongoTemplate.find(q.with(INSERTION_ORDER), ScheduleEntryDocument.class);
        List<ScheduleEntry> entries = new ArrayList<>(docs.size());
        for (ScheduleEntryDocument doc : docs) {
            entries.add(toEntry(doc));
        }
        return entries;
    }

    @Override
    public List<TaskAssociation> findAssociations(OwnerKey owner, String attribute) {
        Objects.requireNonNull(owner, "owner must not be null");

        Criteria c = Criteria.where("discriminator").is(owner.discriminator())
                .and("discriminatorId").is(owner.discriminatorId());
        if (attribute != null) {
            c = c.and("attribute").is(attribute);
        }
        return findAssociations(new Query(c));
    }

    @Override
    public List<TaskAssociation> findAssociationsByTask(String taskId) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        return findAssociations(new Query(Criteria.where("taskId").is(taskId)));
    }

    @Override
    public long deleteAssociation(String id) {
        Objects.requireNonNull(id, "id must not be null");
        Query q = new Query(Criteria.where("_id").is(id));
        return mongoTemplate.remove(q, ScheduleTaskAssociationDocument.class).getDeletedCount();
    }

    @Override
    public <R> R inTransaction(Supplier<R> work) {
        Objects.requireNonNull(work, "work must not be null");
        return transactionOperations.execute(status -> work.get());
    }

    private List<TaskAssociation> findAssociations(Query q) {
        q.with(INSERTION_ORDER);
        List<ScheduleTaskAssociationDocument> docs = mongoTemplate.find(q, ScheduleTaskAssociationDocument.class);
        List<TaskAssociation> associations = new ArrayList<>(docs.size());
        for (ScheduleTaskAssociationDocument doc : docs) {
            associations.add(toAssociation(doc));
        }
        return associations;
    }

    private IntervalSchedule upsertInterval(IntervalSchedule rule) {
        Update u = new Update()
                .setOnInsert("every", rule.every())
                .setOnInsert("period", rule.period().key());

        IntervalScheduleDocument doc = mongoTemplate.findAndModify(
                intervalQuery(rule.every(), rule.period()),
                u,
                FindAndModifyOptions.options().upsert(true).returnNew(true),
                IntervalScheduleDocument.class
        );
        if (doc == null) {
            throw new IllegalStateException("Interval upsert returned no document: " + rule);
        }
        return toInterval(doc);
    }

    private CrontabSchedule upsertCrontab(CrontabSchedule rule) {
        Update u = new Update()
                .setOnInsert("minute", rule.minute())
                .setOnInsert("hour", rule.hour())
                .setOnInsert("dayOfWeek", rule.dayOfWeek())
                .setOnInsert("dayOfMonth", rule.dayOfMonth())
                .setOnInsert("monthOfYear", rule.monthOfYear());

        CrontabScheduleDocument doc = mongoTemplate.findAndModify(
                crontabQuery(rule),
                u,
                FindAndModifyOptions.options().upsert(true).returnNew(true),
                CrontabScheduleDocument.class
        );
        if (doc == null) {
            throw new IllegalStateException("Crontab upsert returned no document: " + rule);
        }
        return toCrontab(doc);
    }

    private static Query intervalQuery(long every, IntervalPeriod period) {
        return new Query(Criteria.where("every").is(every).and("period").is(period.key()));
    }

    private static Query crontabQuery(CrontabSchedule pattern) {
        return new Query(Criteria.where("minute").is(pattern.minute())
                .and("hour").is(pattern.hour())
                .and("dayOfWeek").is(pattern.dayOfWeek())
                .and("dayOfMonth").is(pattern.dayOfMonth())
                .and("monthOfYear").is(pattern.monthOfYear()));
    }

    private ScheduleEntryDocument toDocument(ScheduleEntry entry) {
        ScheduleEntryDocument doc = new ScheduleEntryDocument();
        doc.setId(entry.getId());
        doc.setName(entry.getName());
        doc.setTask(entry.getTask());
        doc.setIntervalId(entry.getInterval() == null ? null : entry.getInterval().id());
        doc.setCrontabId(entry.getCrontab() == null ? null : entry.getCrontab().id());
        doc.setArguments(entry.getArguments());
        doc.setKeywordArguments(entry.getKeywordArguments());
        doc.setQueue(entry.getQueue());
        doc.setExchange(entry.getExchange());
        doc.setRoutingKey(entry.getRoutingKey());
        doc.setExpires(entry.getExpires());
        doc.setEnabled(entry.isEnabled());
        doc.setLastRunAt(entry.getLastRunAt());
        doc.setTotalRunCount(entry.getTotalRunCount());
        doc.setDateChanged(entry.getDateChanged());
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(ScheduleEntry)}: resolves the rule references and loads the
     * entry's associations. A reference to a rule that no longer exists resolves to no rule.
     */
    private ScheduleEntry toEntry(ScheduleEntryDocument doc) {
        ScheduleEntry entry = new ScheduleEntry(doc.getName(), doc.getTask());
        entry.setId(doc.getId());

        if (doc.getIntervalId() != null) {
            IntervalScheduleDocument interval = mongoTemplate.findById(doc.getIntervalId(), IntervalScheduleDocument.class);
            if (interval == null) {
                log.warn("Schedule entry id={} references missing interval id={}", doc.getId(), doc.getIntervalId());
            } else {
                entry.setInterval(toInterval(interval));
            }
        }
        if (doc.getCrontabId() != null) {
            CrontabScheduleDocument crontab = mongoTemplate.findById(doc.getCrontabId(), CrontabScheduleDocument.class);
            if (crontab == null) {
                log.warn("Schedule entry id={} references missing crontab id={}", doc.getId(), doc.getCrontabId());
            } else {
                entry.setCrontab(toCrontab(crontab));
            }
        }

        entry.setArguments(doc.getArguments());
        entry.setKeywordArguments(doc.getKeywordArguments());
        entry.setQueue(doc.getQueue());
        entry.setExchange(doc.getExchange());
        entry.setRoutingKey(doc.getRoutingKey());
        entry.setExpires(doc.getExpires());
        entry.setEnabled(doc.isEnabled());
        entry.setLastRunAt(doc.getLastRunAt());
        entry.setTotalRunCount(doc.getTotalRunCount());
        entry.setDateChanged(doc.getDateChanged());

        if (doc.getId() != null) {
            entry.getAssociations().addAll(findAssociationsByTask(doc.getId()));
        }
        return entry;
    }

    private static ScheduleTaskAssociationDocument toDocument(TaskAssociation association) {
        ScheduleTaskAssociationDocument doc = new ScheduleTaskAssociationDocument();
        doc.setId(association.getId());
        doc.setTaskId(association.getTaskId());
        doc.setDiscriminator(association.getDiscriminator());
        doc.setDiscriminatorId(association.getDiscriminatorId());
        doc.setAttribute(association.getAttribute());
        doc.setDescription(association.getDescription());
        return doc;
    }

    private static TaskAssociation toAssociation(ScheduleTaskAssociationDocument doc) {
        TaskAssociation association = new TaskAssociation();
        association.setId(doc.getId());
        association.setTaskId(doc.getTaskId());
        association.setDiscriminator(doc.getDiscriminator());
        association.setDiscriminatorId(doc.getDiscriminatorId());
        association.setAttribute(doc.getAttribute());
        association.setDescription(doc.getDescription());
        return association;
    }

    private static IntervalSchedule toInterval(IntervalScheduleDocument doc) {
        return new IntervalSchedule(doc.getId(), doc.getEvery(), IntervalPeriod.fromKey(doc.getPeriod()));
    }

    private static CrontabSchedule toCrontab(CrontabScheduleDocument doc) {
        return new CrontabSchedule(
                doc.getId(),
                doc.getMinute(),
                doc.getHour(),
                doc.getDayOfWeek(),
                doc.getDayOfMonth(),
                doc.getMonthOfYear()
        );
    }
}
