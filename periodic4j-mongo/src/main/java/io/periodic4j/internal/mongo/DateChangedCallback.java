package io.periodic4j.internal.mongo;

import org.springframework.core.Ordered;
import org.springframework.data.mongodb.core.mapping.event.BeforeConvertCallback;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Stamps {@code dateChanged} on every insert and save of a {@link ScheduleEntryDocument}, replacing any
 * value the caller set.
 *
 * <p>Registered automatically when declared as a bean; a standalone {@code MongoTemplate} needs
 * {@code setEntityCallbacks(EntityCallbacks.create(callback))}.
 */
public class DateChangedCallback implements BeforeConvertCallback<ScheduleEntryDocument>, Ordered {

    private final Clock clock;

    public DateChangedCallback(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public ScheduleEntryDocument onBeforeConvert(ScheduleEntryDocument entity, String collection) {
        entity.setDateChanged(Instant.now(clock));
        return entity;
    }

    @Override
    public int getOrder() {
        return Ordered.LOWEST_PRECEDENCE;
    }
}
