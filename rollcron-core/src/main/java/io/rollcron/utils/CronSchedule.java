package io.rollcron.utils;

import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Date;
import java.util.Objects;
import java.util.TimeZone;

/**
 * A cron schedule evaluated with Quartz {@link CronExpression}.
 * <p>
 * Accepted input:
 * <ul>
 *   <li>5 fields (minute hour day-of-month month day-of-week), seconds fixed to 0</li>
 *   <li>6 fields (second first) and 7 fields (trailing year)</li>
 * </ul>
 * <p>
 * Day-of-week numbers follow classic cron (0 or 7 = Sunday) and are translated to Quartz numbering.
 * Setting both day-of-month and day-of-week is rejected since Quartz cannot express their union.
 */
public final class CronSchedule {

    private final String source;
    private final String quartzExpression;

    private CronSchedule(String source, String quartzExpression) {
        this.source = source;
        this.quartzExpression = quartzExpression;
    }

    public static CronSchedule parse(String expression) {
        String quartz = normalizeCron(expression);
        if (!CronExpression.isValidExpression(quartz)) {
            throw new IllegalArgumentException("Invalid cron expression: " + expression);
        }
        return new CronSchedule(expression.trim(), quartz);
    }

    /**
     * Returns true if the string can be parsed as a schedule.
     */
    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (IllegalArgumentException ignored) {
            return false;
        }
    }

    /**
     * Next fire time strictly after {@code from}, evaluated in {@code zone}.
     *
     * @return next occurrence, or {@code null} if the expression has none left
     */
    public Instant nextAfter(Instant from, ZoneId zone) {
        Objects.requireNonNull(from, "from must not be null");
        CronExpression exp;
        try {
            exp = new CronExpression(quartzExpression);
        } catch (ParseException ex) {
            throw new IllegalStateException("Cron expression became invalid: " + source, ex);
        }
        exp.setTimeZone(TimeZone.getTimeZone(zone != null ? zone : ZoneId.systemDefault()));
        Date next = exp.getNextValidTimeAfter(Date.from(from));
        return next == null ? null : next.toInstant();
    }

    public String source() {
        return source;
    }

    public String quartzExpression() {
        return quartzExpression;
    }

    /**
     * Normalize cron expressions into Quartz syntax:
     * - 5-field cron gets a leading seconds "0".
     * - one of day-of-month/day-of-week becomes "?".
     * - day-of-week numbers are shifted from 0-7 (Sunday = 0/7) to 1-7 (Sunday = 1).
     */
    public static String normalizeCron(String expression) {
        if (expression == null) {
            throw new IllegalArgumentException("expression must not be null");
        }
        String s = expression.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("expression must not be empty");
        }

        String[] parts = s.split("\\s+");
        return switch (parts.length) {
            case 5 -> toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4], null);
            case 6 -> toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5], null);
            case 7 -> toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5], parts[6]);
            default -> throw new IllegalArgumentException(
                    "Cron expression must have 5, 6 or 7 fields: " + expression);
        };
    }

    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth,
                                       String month, String dayOfWeek, String year) {
        String dom = dayOfMonth;
        String dow = dayOfWeek;

        boolean domAny = "*".equals(dom) || "?".equals(dom);
        boolean dowAny = "*".equals(dow) || "?".equals(dow);

        if (dowAny) {
            dow = "?";
            if ("?".equals(dom)) {
                dom = "*";
            }
        } else if (domAny) {
            dom = "?";
            dow = translateDayOfWeek(dow);
        } else {
            throw new IllegalArgumentException(
                    "Cron expressions restricting both day-of-month and day-of-week are not supported");
        }

        String joined = String.join(" ", sec, min, hour, dom, month, dow);
        return year == null ? joined : joined + " " + year;
    }

    private static String translateDayOfWeek(String field) {
        StringBuilder out = new StringBuilder();
        for (String item : field.split(",", -1)) {
            if (out.length() > 0) {
                out.append(',');
            }
            int slash = item.indexOf('/');
            String base = slash >= 0 ? item.substring(0, slash) : item;
            String step = slash >= 0 ? item.substring(slash) : "";

            int hash = base.indexOf('#');
            String nth = "";
            if (hash >= 0) {
                nth = base.substring(hash);
                base = base.substring(0, hash);
            }

            StringBuilder translated = new StringBuilder();
            StringBuilder digits = new StringBuilder();
            for (char c : base.toCharArray()) {
                if (Character.isDigit(c)) {
                    digits.append(c);
                    continue;
                }
                flushDay(digits, translated);
                translated.append(c);
            }
            flushDay(digits, translated);
            out.append(translated).append(nth).append(step);
        }
        return out.toString();
    }

    private static void flushDay(StringBuilder digits, StringBuilder out) {
        if (digits.length() == 0) {
            return;
        }
        int day = Integer.parseInt(digits.toString());
        if (day > 7) {
            throw new IllegalArgumentException("Day-of-week out of range: " + day);
        }
        out.append(day % 7 + 1);
        digits.setLength(0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CronSchedule other)) return false;
        return quartzExpression.equals(other.quartzExpression);
    }

    @Override
    public int hashCode() {
        return quartzExpression.hashCode();
    }

    @Override
    public String toString() {
        return source;
    }
}
