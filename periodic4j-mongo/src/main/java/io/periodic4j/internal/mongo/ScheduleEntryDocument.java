package io.periodic4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * Mongo document model for schedule entries.
 *
 * <p>{@code intervalId} / {@code crontabId} reference {@link IntervalScheduleDocument} /
 * {@link CrontabScheduleDocument}; at most one is expected to be set.
 */
@Document(collection = "schedule_entries")
public class ScheduleEntryDocument {

    @Id
    private String id;

    private String name;
    private String task;

    @Field(write = Field.Write.ALWAYS)
    private String intervalId;

    @Field(write = Field.Write.ALWAYS)
    private String crontabId;

    private String arguments = "[]";
    private String keywordArguments = "{}";

    private String queue;
    private String exchange;
    private String routingKey;
    private Instant expires;

    private boolean enabled = true;
    private Instant lastRunAt;
    private int totalRunCount;

    // Stamped by DateChangedCallback on every save.
    private Instant dateChanged;

    public ScheduleEntryDocument() {
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

    public String getIntervalId() {
        return intervalId;
    }

    public void setIntervalId(String intervalId) {
        this.intervalId = intervalId;
    }

    public String getCrontabId() {
        return crontabId;
    }

    public void setCrontabId(String crontabId) {
        this.crontabId = crontabId;
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
}
