package io.periodic4j.config;

import io.periodic4j.internal.mongo.CrontabScheduleDocument;
import io.periodic4j.internal.mongo.IntervalScheduleDocument;
import io.periodic4j.internal.mongo.ScheduleEntryDocument;
import io.periodic4j.internal.mongo.ScheduleTaskAssociationDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.Objects;

/**
 * MongoDB index definitions for periodic4j.
 *
 * <p>Indexes are <b>not</b> created at startup unless {@code periodic.ensure-indexes-on-startup=true}.
 * Manage them with migrations in production; {@link #ensureIndexes()} is the manual entrypoint.
 *
 * <p>The two unique indexes guarantee one row per recurrence rule under concurrent upserts.
 *
 * <h3>Indexes</h3>
 * <ul>
 *   <li><b>ux_interval_rule</b> (unique) on {@code schedule_intervals}: { every: 1, period: 1 }</li>
 *   <li><b>ux_crontab_rule</b> (unique) on {@code schedule_crontabs}:
 *       { minute: 1, hour: 1, dayOfWeek: 1, dayOfMonth: 1, monthOfYear: 1 }</li>
 *   <li><b>idx_assoc_owner</b> on {@code schedule_task_associations}:
 *       { discriminator: 1, discriminatorId: 1, attribute: 1 }
 *       <br/>Owner lookups, with or without the attribute filter.</li>
 *   <li><b>idx_assoc_task</b> on {@code schedule_task_associations}: { taskId: 1 }</li>
 *   <li><b>idx_entry_enabled</b> on {@code schedule_entries}: { enabled: 1 }</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.schedule_intervals.createIndex({ every: 1, period: 1 }, { name: "ux_interval_rule", unique: true });
 * db.schedule_crontabs.createIndex(
 *   { minute: 1, hour: 1, dayOfWeek: 1, dayOfMonth: 1, monthOfYear: 1 },
 *   { name: "ux_crontab_rule", unique: true }
 * );
 * db.schedule_task_associations.createIndex({ discriminator: 1, discriminatorId: 1, attribute: 1 }, { name: "idx_assoc_owner" });
 * db.schedule_task_associations.createIndex({ taskId: 1 }, { name: "idx_assoc_task" });
 * db.schedule_entries.createIndex({ enabled: 1 }, { name: "idx_entry_enabled" });
 * </pre>
 */
public class PeriodicMongoIndexConfig {

    public static final String UX_INTERVAL_RULE = "ux_interval_rule";
    public static final String UX_CRONTAB_RULE = "ux_crontab_rule";
    public static final String IDX_ASSOC_OWNER = "idx_assoc_owner";
    public static final String IDX_ASSOC_TASK = "idx_assoc_task";
    public static final String IDX_ENTRY_ENABLED = "idx_entry_enabled";

    private final MongoTemplate mongoTemplate;

    public PeriodicMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    /**
     * Create all indexes listed above. Existing indexes with the same definition are left as they are.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(IntervalScheduleDocument.class).createIndex(intervalRuleIndex());
        mongoTemplate.indexOps(CrontabScheduleDocument.class).createIndex(crontabRuleIndex());
        mongoTemplate.indexOps(ScheduleTaskAssociationDocument.class).createIndex(associationOwnerIndex());
        mongoTemplate.indexOps(ScheduleTaskAssociationDocument.class).createIndex(associationTaskIndex());
        mongoTemplate.indexOps(ScheduleEntryDocument.class).createIndex(entryEnabledIndex());
    }

    public static Index intervalRuleIndex() {
        return new Index()
                .on("every", Sort.Direction.ASC)
                .on("period", Sort.Direction.ASC)
                .unique()
                .named(UX_INTERVAL_RULE);
    }

    public static Index crontabRuleIndex() {
        return new Index()
                .on("minute", Sort.Direction.ASC)
                .on("hour", Sort.Direction.ASC)
                .on("dayOfWeek", Sort.Direction.ASC)
                .on("dayOfMonth", Sort.Direction.ASC)
                .on("monthOfYear", Sort.Direction.ASC)
                .unique()
                .named(UX_CRONTAB_RULE);
    }

    /**
     * Keys: discriminator ASC, discriminatorId ASC, attribute ASC
     */
    public static Index associationOwnerIndex() {
        return new Index()
                .on("discriminator", Sort.Direction.ASC)
                .on("discriminatorId", Sort.Direction.ASC)
                .on("attribute", Sort.Direction.ASC)
                .named(IDX_ASSOC_OWNER);
    }

    public static Index associationTaskIndex() {
        return new Index()
                .on("taskId", Sort.Direction.ASC)
                .named(IDX_ASSOC_TASK);
    }

    public static Index entryEnabledIndex() {
        return new Index()
                .on("enabled", Sort.Direction.ASC)
                .named(IDX_ENTRY_ENABLED);
    }
}
