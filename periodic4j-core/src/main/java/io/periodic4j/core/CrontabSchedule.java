package io.periodic4j.core;

import java.util.Objects;

/**
 * Crontab-style recurrence. Each field is a crontab pattern and defaults to {@code "*"}.
 *
 * <p>{@code id} is null until the store persists the rule.
 */
public record CrontabSchedule(
        String id,
        String minute,
        String hour,
        String dayOfWeek,
        String dayOfMonth,
        String monthOfYear
) {

    public static final String ANY = "*";

    public CrontabSchedule {
        minute = orAny(minute);
        hour = orAny(hour);
        dayOfWeek = orAny(dayOfWeek);
        dayOfMonth = orAny(dayOfMonth);
        monthOfYear = orAny(monthOfYear);
    }

    /**
     * Parse a standard five-field crontab line: {@code minute hour day-of-month month day-of-week}.
     */
    public static CrontabSchedule parse(String line) {
        Objects.requireNonNull(line, "line must not be null");
        String[] parts = line.trim().split("\\s+");
        if (parts.length != 5) {
            throw new IllegalArgumentException("Expected five crontab fields: " + line);
        }
        return new CrontabSchedule(null, parts[0], parts[1], parts[4], parts[2], parts[3]);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isPersisted() {
        return id != null;
    }

    public CrontabSchedule withId(String id) {
        return new CrontabSchedule(id, minute, hour, dayOfWeek, dayOfMonth, monthOfYear);
    }

    public Recurrence schedule() {
        return CronRecurrence.of(this);
    }

    /**
     * True when both rules carry the same five patterns, ignoring ids.
     */
    public boolean sameRecurrence(CrontabSchedule other) {
        return other != null
                && minute.equals(other.minute)
                && hour.equals(other.hour)
                && dayOfWeek.equals(other.dayOfWeek)
                && dayOfMonth.equals(other.dayOfMonth)
                && monthOfYear.equals(other.monthOfYear);
    }

    /**
     * Same fields in crontab order, e.g. {@code "0 12 * * mon-fri"}.
     */
    public String toCrontab() {
        return String.join(" ", minute, hour, dayOfMonth, monthOfYear, dayOfWeek);
    }

    private static String orAny(String field) {
        return (field == null || field.isBlank()) ? ANY : field.trim();
    }

    public static final class Builder {
        private String minute = ANY;
        private String hour = ANY;
        private String dayOfWeek = ANY;
        private String dayOfMonth = ANY;
        private String monthOfYear = ANY;

        public Builder minute(String minute) {
            this.minute = minute;
            return this;
        }

        public Builder hour(String hour) {
            this.hour = hour;
            return this;
        }

        public Builder dayOfWeek(String dayOfWeek) {
            this.dayOfWeek = dayOfWeek;
            return this;
        }

        public Builder dayOfMonth(String dayOfMonth) {
            this.dayOfMonth = dayOfMonth;
            return this;
        }

        public Builder monthOfYear(String monthOfYear) {
            this.monthOfYear = monthOfYear;
            return this;
        }

        public CrontabSchedule build() {
            return new CrontabSchedule(null, minute, hour, dayOfWeek, dayOfMonth, monthOfYear);
        }
    }
}
