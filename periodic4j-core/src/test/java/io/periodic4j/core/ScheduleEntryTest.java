package io.periodic4j.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduleEntryTest {

    @Test
    void newEntryShouldHaveDefaults() {
        ScheduleEntry entry = new ScheduleEntry("sync", "tasks.sync");

        assertTrue(entry.isEnabled());
        assertEquals(0, entry.getTotalRunCount());
        assertEquals("[]", entry.getArguments());
        assertEquals("{}", entry.getKeywordArguments());
        assertTrue(entry.getArgs().isEmpty());
        assertTrue(entry.getKwargs().isEmpty());
    }

    @Test
    void entryWithoutRuleShouldHaveNoSchedule() {
        ScheduleEntry entry = new ScheduleEntry("sync", "tasks.sync");

        assertTrue(entry.schedule().isEmpty());
        assertFalse(entry.hasAmbiguousSchedule());
    }

    @Test
    void intervalShouldTakePriorityOverCrontab() {
        ScheduleEntry entry = new ScheduleEntry("sync", "tasks.sync");
        entry.setCrontab(CrontabSchedule.parse("0 * * * *"));
        assertInstanceOf(CronRecurrence.class, entry.schedule().orElseThrow());

        entry.setInterval(IntervalSchedule.of(30, IntervalPeriod.SECONDS));

        assertTrue(entry.hasAmbiguousSchedule());
        assertInstanceOf(IntervalRecurrence.class, entry.schedule().orElseThrow());
    }

    @Test
    void argsAndKwargsShouldRoundTripThroughStoredText() {
        ScheduleEntry entry = new ScheduleEntry("sync", "tasks.sync");

        entry.setArgs(List.of("a", 1, false));
        entry.setKwargs(Map.of("limit", 50));

        assertEquals("[\"a\",1,false]", entry.getArguments());
        assertEquals(List.of("a", 1, false), entry.getArgs());
        assertEquals(Map.of("limit", 50), entry.getKwargs());
    }

    @Test
    void corruptedArgumentsShouldFailOnRead() {
        ScheduleEntry entry = new ScheduleEntry("sync", "tasks.sync");
        entry.setArguments("not json");

        assertThrows(IllegalStateException.class, entry::getArgs);
    }
}
