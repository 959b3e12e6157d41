package com.concierge.scheduler;

import com.concierge.core.exception.InvalidCronExpressionException;
import com.concierge.core.model.ScheduledJob;
import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * A validated five-field cron expression evaluated in UTC, or the {@code @once} sentinel.
 *
 * Fields: minute, hour, day-of-month, month, day-of-week (0 or 7 = Sunday).
 * Evaluation is delegated to Spring's {@link CronExpression}, which takes six fields;
 * a seconds field of {@code 0} is prepended.
 */
public final class CronSchedule {

    public static final ZoneId ZONE = ZoneOffset.UTC;

    static final String[] FIELD_NAMES = {"minute", "hour", "day-of-month", "month", "day-of-week"};

    private static final Map<String, String> DAY_NAMES = Map.ofEntries(
        Map.entry("0", "Sunday"), Map.entry("1", "Monday"), Map.entry("2", "Tuesday"),
        Map.entry("3", "Wednesday"), Map.entry("4", "Thursday"), Map.entry("5", "Friday"),
        Map.entry("6", "Saturday"), Map.entry("7", "Sunday"),
        Map.entry("sun", "Sunday"), Map.entry("mon", "Monday"), Map.entry("tue", "Tuesday"),
        Map.entry("wed", "Wednesday"), Map.entry("thu", "Thursday"), Map.entry("fri", "Friday"),
        Map.entry("sat", "Saturday")
    );

    private final String expression;
    private final String[] fields;
    private final CronExpression cron;

    private CronSchedule(String expression, String[] fields, CronExpression cron) {
        this.expression = expression;
        this.fields = fields;
        this.cron = cron;
    }

    /**
     * Parse and validate an expression.
     *
     * @throws InvalidCronExpressionException naming the field count or the offending field
     */
    public static CronSchedule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidCronExpressionException(String.valueOf(expression), "expression is empty");
        }

        String trimmed = expression.trim();
        if (ScheduledJob.ONCE.equals(trimmed)) {
            return new CronSchedule(trimmed, new String[0], null);
        }

        String[] fields = trimmed.split("\\s+");
        if (fields.length != FIELD_NAMES.length) {
            throw new InvalidCronExpressionException(trimmed,
                "Expected 5 fields (minute hour day month weekday), got " + fields.length);
        }

        for (int i = 0; i < fields.length; i++) {
            try {
                CronExpression.parse(isolate(i, fields[i]));
            } catch (IllegalArgumentException e) {
                throw new InvalidCronExpressionException(trimmed,
                    "invalid " + FIELD_NAMES[i] + " field '" + fields[i] + "'", e);
            }
        }

        try {
            return new CronSchedule(trimmed, fields, CronExpression.parse("0 " + String.join(" ", fields)));
        } catch (IllegalArgumentException e) {
            throw new InvalidCronExpressionException(trimmed, e.getMessage(), e);
        }
    }

    /**
     * Check an expression without keeping the result.
     *
     * @throws InvalidCronExpressionException if it does not parse
     */
    public static void validate(String expression) {
        parse(expression);
    }

    /**
     * Six-field expression testing one field alone, every other field left wide open.
     */
    private static String isolate(int index, String field) {
        String[] probe = {"0", "*", "*", "*", "*", "*"};
        probe[index + 1] = field;
        return String.join(" ", probe);
    }

    public String expression() {
        return expression;
    }

    public boolean isOnce() {
        return cron == null;
    }

    /**
     * Six-field form understood by Spring's cron support. Not defined for {@code @once}.
     */
    public String springExpression() {
        if (isOnce()) {
            throw new IllegalStateException("@once schedules have no cron form");
        }
        return "0 " + String.join(" ", fields);
    }

    /**
     * First fire time strictly after the given instant; empty for {@code @once}
     * or for an expression that never fires (e.g. February 30th).
     */
    public Optional<Instant> nextFireAfter(Instant after) {
        if (isOnce()) {
            return Optional.empty();
        }
        ZonedDateTime next = cron.next(ZonedDateTime.ofInstant(after, ZONE));
        return Optional.ofNullable(next).map(ZonedDateTime::toInstant);
    }

    /**
     * Human-readable rendering, e.g. "Weekdays at 9:00 UTC". Falls back to the raw
     * expression for shapes without a phrase.
     */
    public String describe() {
        if (isOnce()) {
            return "Once";
        }

        String minute = fields[0];
        String hour = fields[1];
        String day = fields[2];
        String month = fields[3];
        String dow = fields[4];

        if (allWild(minute, hour, day, month, dow)) {
            return "Every minute";
        }
        if (minute.startsWith("*/") && allWild(hour, day, month, dow)) {
            return "Every " + minute.substring(2) + " minutes";
        }
        if (hour.startsWith("*/") && minute.equals("0") && allWild(day, month, dow)) {
            return "Every " + hour.substring(2) + " hours";
        }

        Optional<String> time = timeOfDay(hour, minute);
        if (time.isEmpty()) {
            return expression;
        }

        if (allWild(day, month)) {
            if (dow.equals("*")) {
                return "Every day at " + time.get();
            }
            if (dow.equals("1-5")) {
                return "Weekdays at " + time.get();
            }
            if (dow.equals("0,6") || dow.equals("6,0")) {
                return "Weekends at " + time.get();
            }
            String dayName = DAY_NAMES.get(dow.toLowerCase(Locale.ROOT));
            return "Every " + (dayName != null ? dayName : dow) + " at " + time.get();
        }

        if (!day.equals("*") && allWild(month, dow)) {
            try {
                return ordinal(Integer.parseInt(day)) + " of every month at " + time.get();
            } catch (NumberFormatException e) {
                return expression;
            }
        }

        return expression;
    }

    private static boolean allWild(String... fields) {
        for (String field : fields) {
            if (!field.equals("*")) {
                return false;
            }
        }
        return true;
    }

    private static Optional<String> timeOfDay(String hour, String minute) {
        try {
            return Optional.of(String.format("%d:%02d UTC", Integer.parseInt(hour), Integer.parseInt(minute)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    static String ordinal(int n) {
        if (n % 100 >= 11 && n % 100 <= 13) {
            return n + "th";
        }
        return switch (n % 10) {
            case 1 -> n + "st";
            case 2 -> n + "nd";
            case 3 -> n + "rd";
            default -> n + "th";
        };
    }

    @Override
    public String toString() {
        return expression;
    }
}
