package io.periodic4j.internal.mongo;

import com.mongodb.client.MongoClients;
import io.periodic4j.ScheduleCatalog;
import io.periodic4j.ScheduleOwner;
import io.periodic4j.ScheduleOwnership;
import io.periodic4j.core.CrontabSchedule;
import io.periodic4j.core.DetachPolicy;
import io.periodic4j.core.IntervalPeriod;
import io.periodic4j.core.IntervalSchedule;
import io.periodic4j.core.OwnerRegistry;
import io.periodic4j.core.RecurrenceResolver;
import io.periodic4j.core.ScheduleEntry;
import io.periodic4j.core.TaskAssociation;
import io.periodic4j.internal.DefaultScheduleCatalog;
import io.periodic4j.internal.DefaultScheduleOwnership;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mapping.callback.EntityCallbacks;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoScheduleIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private static final Instant NOW = Instant.parse("2026-02-10T08:00:00Z");

    private MongoTemplate mongoTemplate;
    private MongoScheduleStore store;
    private RecurrenceResolver resolver;
    private ScheduleOwnership ownership;
    private ScheduleCatalog catalog;

    record Campaign(long ownerId) implements ScheduleOwner {
    }

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "periodic4j_test");
        mongoTemplate.setEntityCallbacks(EntityCallbacks.create(new DateChangedCallback(Clock.fixed(NOW, ZoneOffset.UTC))));
        dropCollections();
        for (Class<?> type : List.of(IntervalScheduleDocument.class, CrontabScheduleDocument.class,
                ScheduleEntryDocument.class, ScheduleTaskAssociationDocument.class)) {
            mongoTemplate.createCollection(type);
        }

        TransactionTemplate transactions = new TransactionTemplate(
                new MongoTransactionManager(mongoTemplate.getMongoDatabaseFactory()));
        store = new MongoScheduleStore(mongoTemplate, transactions);
        resolver = new RecurrenceResolver(store);
        ownership = new DefaultScheduleOwnership(store, DetachPolicy.OWNER);
        catalog = new DefaultScheduleCatalog(store, new OwnerRegistry(List.of()), resolver);
    }

    @AfterEach
    void tearDown() {
        dropCollections();
    }

    @Test
    void resolvedIntervalShouldBeReusedOnceSaved() {
        IntervalSchedule first = resolver.resolveInterval(Duration.ofSeconds(30));
        assertFalse(first.isPersisted());

        ScheduleEntry entry = new ScheduleEntry("sync", "mail.sync");
        entry.setInterval(first);
        store.saveEntry(entry);

        IntervalSchedule second = resolver.resolveInterval(Duration.ofSeconds(30));
        assertTrue(second.isPersisted());
        assertEquals(entry.getInterval().id(), second.id());
        assertEquals(1, mongoTemplate.count(new Query(), IntervalScheduleDocument.class));
    }

    @Test
    void duplicateIntervalsShouldCollapseIntoOne() {
        mongoTemplate.insert(intervalDoc(5, "minutes"));
        mongoTemplate.insert(intervalDoc(5, "minutes"));

        IntervalSchedule resolved = resolver.resolveInterval(5, IntervalPeriod.MINUTES);
        assertFalse(resolved.isPersisted());
        assertEquals(0, mongoTemplate.count(new Query(), IntervalScheduleDocument.class));

        ScheduleEntry entry = new ScheduleEntry("poll", "feeds.poll");
        entry.setInterval(resolved);
        store.saveEntry(entry);

        assertEquals(1, mongoTemplate.count(new Query(), IntervalScheduleDocument.class));
        assertEquals(entry.getInterval().id(), resolver.resolveInterval(5, IntervalPeriod.MINUTES).id());
    }

    @Test
    void duplicateIntervalsShouldMoveReferencingEntriesOntoOneRow() {
        mongoTemplate.insert(intervalDoc(5, "minutes"));
        IntervalScheduleDocument referenced = mongoTemplate.insert(intervalDoc(5, "minutes"));
        ScheduleEntryDocument poll = new ScheduleEntryDocument();
        poll.setName("poll");
        poll.setTask("feeds.poll");
        poll.setIntervalId(referenced.getId());
        poll = mongoTemplate.insert(poll);

        IntervalSchedule resolved = resolver.resolveInterval(5, IntervalPeriod.MINUTES);

        assertTrue(resolved.isPersisted());
        assertEquals(1, mongoTemplate.count(new Query(), IntervalScheduleDocument.class));
        ScheduleEntry reloaded = store.findEntry(poll.getId()).orElseThrow();
        assertEquals(resolved.id(), reloaded.getInterval().id());
        assertTrue(reloaded.schedule().isPresent());
    }

    @Test
    void unsavedCrontabsWithSamePatternsShouldShareOneRow() {
        ScheduleEntry a = new ScheduleEntry("a", "reports.build");
        a.setCrontab(CrontabSchedule.parse("0 2 * * mon-fri"));
        ScheduleEntry b = new ScheduleEntry("b", "reports.mail");
        b.setCrontab(CrontabSchedule.parse("0 2 * * mon-fri"));

        store.saveEntry(a);
        store.saveEntry(b);

        assertEquals(a.getCrontab().id(), b.getCrontab().id());
        assertEquals(1, mongoTemplate.count(new Query(), CrontabScheduleDocument.class));
    }

    @Test
    void saveShouldStampDateChangedAndKeepArguments() {
        ScheduleEntry entry = new ScheduleEntry("sync", "mail.sync");
        entry.setInterval(resolver.resolveInterval(Duration.ofMinutes(1)));
        entry.setArgs(List.of(1, "two"));
        entry.setKwargs(Map.of("mailbox", "inbox"));
        entry.setDateChanged(Instant.parse("2000-01-01T00:00:00Z"));

        store.saveEntry(entry);

        assertEquals(NOW, entry.getDateChanged());
        ScheduleEntry reloaded = store.findEntry(entry.getId()).orElseThrow();
        assertEquals(NOW, reloaded.getDateChanged());
        assertEquals(List.of(1, "two"), reloaded.getArgs());
        assertEquals("inbox", reloaded.getKwargs().get("mailbox"));
        assertEquals(60, reloaded.getInterval().every());
    }

    @Test
    void ownerShouldCreateFilterAndDisableItsTasks() {
        Campaign campaign = new Campaign(42L);

        ScheduleEntry report = new ScheduleEntry("report", "reports.build");
        report.setCrontab(resolver.resolveCrontab(CrontabSchedule.parse("0 6 * * *")));
        ownership.createScheduleTask(campaign, report, "report", "daily report");

        ScheduleEntry cleanup = new ScheduleEntry("cleanup", "storage.cleanup");
        cleanup.setInterval(resolver.resolveInterval(Duration.ofHours(1)));
        ownership.createScheduleTask(campaign, cleanup, "cleanup");

        assertEquals(2, ownership.scheduleTasks(campaign).size());
        List<ScheduleEntry> reports = ownership.getScheduleTasks(campaign, "report");
        assertEquals(1, reports.size());
        assertEquals("report", reports.get(0).getName());

        TaskAssociation association = reports.get(0).getAssociations().get(0);
        assertEquals("Campaign", association.getDiscriminator());
        assertEquals(42L, association.getDiscriminatorId());
        assertEquals("daily report", association.getDescription());

        List<ScheduleEntry> disabled = ownership.disableTasks(campaign, "report");
        assertEquals(1, disabled.size());

        ScheduleEntry reloaded = store.findEntry(report.getId()).orElseThrow();
        assertFalse(reloaded.isEnabled());
        assertTrue(reloaded.getAssociations().isEmpty());
        assertEquals(1, ownership.scheduleTasks(campaign).size());
        assertEquals(1, catalog.enabledEntries().size());
    }

    @Test
    void enableShouldReactivateWithoutTouchingAssociations() {
        Campaign campaign = new Campaign(7L);
        ScheduleEntry entry = new ScheduleEntry("digest", "mail.digest");
        entry.setInterval(resolver.resolveInterval(Duration.ofMinutes(15)));
        entry.setEnabled(false);
        ownership.createScheduleTask(campaign, entry, "digest");

        assertTrue(catalog.enabledEntries().isEmpty());

        ownership.enableTasks(campaign, "digest");

        ScheduleEntry reloaded = store.findEntry(entry.getId()).orElseThrow();
        assertTrue(reloaded.isEnabled());
        assertEquals(1, reloaded.getAssociations().size());
    }

    @Test
    void recordRunShouldPersistRunState() {
        ScheduleEntry entry = new ScheduleEntry("sync", "mail.sync");
        entry.setInterval(resolver.resolveInterval(Duration.ofSeconds(10)));
        store.saveEntry(entry);
        assertNull(entry.getLastRunAt());

        Instant ranAt = Instant.parse("2026-02-10T08:05:00Z");
        catalog.recordRun(entry, ranAt);

        ScheduleEntry reloaded = catalog.findEntry(entry.getId()).orElseThrow();
        assertNotNull(reloaded.getLastRunAt());
        assertEquals(ranAt, reloaded.getLastRunAt());
        assertEquals(1, reloaded.getTotalRunCount());
    }

    private void dropCollections() {
        mongoTemplate.dropCollection(ScheduleTaskAssociationDocument.class);
        mongoTemplate.dropCollection(ScheduleEntryDocument.class);
        mongoTemplate.dropCollection(CrontabScheduleDocument.class);
        mongoTemplate.dropCollection(IntervalScheduleDocument.class);
    }

    private static IntervalScheduleDocument intervalDoc(long every, String period) {
        IntervalScheduleDocument doc = new IntervalScheduleDocument();
        doc.setEvery(every);
        doc.setPeriod(period);
        return doc;
    }
}
