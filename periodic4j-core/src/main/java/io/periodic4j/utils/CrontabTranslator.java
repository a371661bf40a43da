package io.periodic4j.utils;

import io.periodic4j.core.CrontabSchedule;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts crontab fields into Quartz cron syntax.
 * <p>
 * Differences handled here:
 * <ul>
 *   <li>Quartz has a leading seconds field; crontab rules always fire at second 0.</li>
 *   <li>Quartz requires {@code ?} in one of the two day fields.</li>
 *   <li>Crontab numbers days of week 0-6 from Sunday (7 is Sunday too); Quartz uses 1-7 from Sunday.</li>
 * </ul>
 */
public final class CrontabTranslator {

    private static final String ANY = "*";
    private static final String NO_VALUE = "?";
    private static final Pattern LEADING_NUMBER = Pattern.compile("^(\\d+)(.*)$");

    private CrontabTranslator() {
    }

    /**
     * Single Quartz expression for a rule that restricts at most one of the day fields.
     *
     * @throws IllegalArgumentException when both day fields are restricted
     */
    public static String toQuartz(CrontabSchedule crontab) {
        Objects.requireNonNull(crontab, "crontab must not be null");
        if (restrictsBothDays(crontab)) {
            throw new IllegalArgumentException(
                    "Quartz cannot restrict both day_of_month and day_of_week in one expression: "
                            + crontab.toCrontab());
        }
        if (isAny(crontab.dayOfWeek())) {
            return dayOfMonthExpression(crontab);
        }
        return dayOfWeekExpression(crontab);
    }

    public static boolean restrictsBothDays(CrontabSchedule crontab) {
        return !isAny(crontab.dayOfMonth()) && !isAny(crontab.dayOfWeek());
    }

    /**
     * Expression driven by day-of-month; day-of-week is left open.
     */
    public static String dayOfMonthExpression(CrontabSchedule crontab) {
        return String.join(" ",
                "0",
                crontab.minute(),
                crontab.hour(),
                crontab.dayOfMonth(),
                crontab.monthOfYear(),
                NO_VALUE);
    }

    /**
     * Expression driven by day-of-week; day-of-month is left open.
     */
    public static String dayOfWeekExpression(CrontabSchedule crontab) {
        return String.join(" ",
                "0",
                crontab.minute(),
                crontab.hour(),
                NO_VALUE,
                crontab.monthOfYear(),
                translateDayOfWeek(crontab.dayOfWeek()));
    }

    /**
     * Rewrites numeric crontab days of week into Quartz numbering. Names, steps and
     * Quartz suffixes ({@code L}, {@code #n}) are kept.
     */
    public static String translateDayOfWeek(String field) {
        Objects.requireNonNull(field, "field must not be null");
        String s = field.trim();
        if (isAny(s)) {
            return s;
        }

        String[] parts = s.split(",");
        StringBuilder out = new StringBuilder(s.length() + 4);
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                out.append(',');
            }
            out.append(translateDayOfWeekPart(parts[i].trim()));
        }
        return out.toString();
    }

    private static String translateDayOfWeekPart(String part) {
        String base = part;
        String step = null;
        int slash = part.indexOf('/');
        if (slash >= 0) {
            base = part.substring(0, slash);
            step = part.substring(slash + 1);
        }

        String translated;
        if (ANY.equals(base)) {
            translated = base;
        } else {
            int dash = base.indexOf('-');
            if (dash > 0) {
                translated = translateDay(base.substring(0, dash)) + "-" + translateDay(base.substring(dash + 1));
            } else {
                translated = translateDay(base);
            }
        }

        return step == null ? translated : translated + "/" + step;
    }

    private static String translateDay(String token) {
        Matcher m = LEADING_NUMBER.matcher(token);
        if (!m.matches()) {
            return token.toUpperCase(Locale.ROOT);
        }
        int day = Integer.parseInt(m.group(1));
        if (day > 7) {
            throw new IllegalArgumentException("day_of_week out of range: " + token);
        }
        return (day % 7 + 1) + m.group(2);
    }

    private static boolean isAny(String field) {
        return field == null || ANY.equals(field.trim());
    }
}
