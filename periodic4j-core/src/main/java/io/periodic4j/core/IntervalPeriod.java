package io.periodic4j.core;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * Unit of an {@link IntervalSchedule}. Persisted as the lowercase {@link #key()}.
 */
public enum IntervalPeriod {

    DAYS("days", ChronoUnit.DAYS),
    HOURS("hours", ChronoUnit.HOURS),
    MINUTES("minutes", ChronoUnit.MINUTES),
    SECONDS("seconds", ChronoUnit.SECONDS),
    MICROSECONDS("microseconds", ChronoUnit.MICROS);

    private final String key;
    private final ChronoUnit unit;

    IntervalPeriod(String key, ChronoUnit unit) {
        this.key = key;
        this.unit = unit;
    }

    public String key() {
        return key;
    }

    public Duration toDuration(long amount) {
        return Duration.of(amount, unit);
    }

    public static IntervalPeriod fromKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("period must not be blank");
        }
        String k = key.trim().toLowerCase(Locale.ROOT);
        for (IntervalPeriod p : values()) {
            if (p.key.equals(k)) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unsupported interval period: " + key);
    }
}
