package io.periodic4j.core;

import io.periodic4j.utils.CrontabTranslator;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.Objects;
import java.util.Optional;
import java.util.TimeZone;

/**
 * Crontab recurrence evaluated with Quartz.
 *
 * <p>Quartz cannot restrict day-of-month and day-of-week in one expression. When a rule restricts both,
 * the day-of-month expression drives the search and every candidate must also satisfy the
 * day-of-week expression.
 */
public final class CronRecurrence implements Recurrence {

    // Cap on candidate days rejected by the day-of-week filter.
    private static final int MAX_REJECTED_DAYS = 11_000;

    private final String expression;
    private final ZoneId zone;
    private final CronExpression primary;
    private final CronExpression dayOfWeekFilter;

    private CronRecurrence(String expression, ZoneId zone, CronExpression primary, CronExpression dayOfWeekFilter) {
        this.expression = expression;
        this.zone = zone;
        this.primary = primary;
        this.dayOfWeekFilter = dayOfWeekFilter;
    }

    public static CronRecurrence of(CrontabSchedule crontab) {
        return of(crontab, ZoneOffset.UTC);
    }

    public static CronRecurrence of(CrontabSchedule crontab, ZoneId zone) {
        Objects.requireNonNull(crontab, "crontab must not be null");
        Objects.requireNonNull(zone, "zone must not be null");

        if (CrontabTranslator.restrictsBothDays(crontab)) {
            String byDayOfMonth = CrontabTranslator.dayOfMonthExpression(crontab);
            String byDayOfWeek = CrontabTranslator.dayOfWeekExpression(crontab);
            return new CronRecurrence(
                    byDayOfMonth + " & " + byDayOfWeek,
                    zone,
                    compile(byDayOfMonth, zone),
                    compile(byDayOfWeek, zone)
            );
        }

        String quartz = CrontabTranslator.toQuartz(crontab);
        return new CronRecurrence(quartz, zone, compile(quartz, zone), null);
    }

    @Override
    public Optional<Instant> nextRunAfter(Instant after) {
        Objects.requireNonNull(after, "after must not be null");

        Date cursor = Date.from(after);
        for (int rejected = 0; rejected < MAX_REJECTED_DAYS; rejected++) {
            Date next = primary.getNextValidTimeAfter(cursor);
            if (next == null) {
                return Optional.empty();
            }
            if (dayOfWeekFilter == null || dayOfWeekFilter.isSatisfiedBy(next)) {
                return Optional.of(next.toInstant());
            }
            cursor = Date.from(lastSecondOfDay(next.toInstant()));
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "CronRecurrence[" + expression + "]";
    }

    // The whole day fails the day-of-week filter, so skip the rest of its candidates.
    private Instant lastSecondOfDay(Instant candidate) {
        LocalDate day = candidate.atZone(zone).toLocalDate();
        return day.plusDays(1).atStartOfDay(zone).toInstant().minusSeconds(1);
    }

    private static CronExpression compile(String quartz, ZoneId zone) {
        if (!CronExpression.isValidExpression(quartz)) {
            throw new IllegalArgumentException("Invalid cron expression: " + quartz);
        }
        try {
            CronExpression exp = new CronExpression(quartz);
            exp.setTimeZone(TimeZone.getTimeZone(zone));
            return exp;
        } catch (ParseException ex) {
            throw new IllegalArgumentException("Invalid cron expression: " + quartz, ex);
        }
    }
}
