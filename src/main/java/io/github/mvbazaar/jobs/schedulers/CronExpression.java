package io.github.mvbazaar.jobs.schedulers;

import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.BitSet;
import java.util.Objects;
import java.util.Optional;

/**
 * Five-field cron expression evaluated in UTC.
 * <pre>
 * minute hour day-of-month month day-of-week
 * </pre>
 * Fields accept {@code *}, values, ranges {@code a-b}, lists {@code a,b} and steps ({@code *}/n, {@code a-b/n}).
 * Day-of-week is 0..7 where both 0 and 7 mean Sunday. Day-of-month and day-of-week must both match.
 */
public final class CronExpression {
    private final String source;
    private final BitSet minutes = new BitSet(60);
    private final BitSet hours = new BitSet(24);
    private final BitSet dom = new BitSet(32);  // 1..31
    private final BitSet months = new BitSet(13); // 1..12
    private final BitSet dow = new BitSet(7);  // 0..6 (0=Sunday)

    private CronExpression(String source) {
        this.source = source;
    }

    public static @NotNull CronExpression parse(@NotNull String s) {
        Objects.requireNonNull(s, "cron expression");
        String[] p = s.trim().split("\\s+");
        if (p.length != 5) {
            throw new IllegalArgumentException("Cron must have exactly 5 fields (minute hour day-of-month month day-of-week): " + s);
        }

        CronExpression ce = new CronExpression(s.trim());
        ce.parseField(p[0], 0, 59, ce.minutes);
        ce.parseField(p[1], 0, 23, ce.hours);
        ce.parseField(p[2], 1, 31, ce.dom);
        ce.parseField(p[3], 1, 12, ce.months);

        BitSet rawDow = new BitSet(8);
        ce.parseField(p[4], 0, 7, rawDow);
        if (rawDow.get(7)) {
            rawDow.set(0);
        }
        ce.dow.or(rawDow.get(0, 7));

        if (ce.minutes.isEmpty() || ce.hours.isEmpty() || ce.dom.isEmpty()
                || ce.months.isEmpty() || ce.dow.isEmpty()) {
            throw new IllegalArgumentException("Cron field parsed to empty set: " + s);
        }
        return ce;
    }

    public static boolean isValid(String s) {
        if (s == null) return false;
        try {
            parse(s);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private void parseField(String f, int min, int max, BitSet out) {
        if (f.equals("*")) {
            out.set(min, max + 1);
            return;
        }
        for (String part : f.split(",", -1)) {
            if (part.isEmpty()) {
                throw new IllegalArgumentException("Empty list element in field: " + f);
            }
            String stepPart = part;
            int step = 1;
            if (part.contains("/")) {
                String[] ar = part.split("/", -1);
                if (ar.length != 2) {
                    throw new IllegalArgumentException("Malformed step: " + part);
                }
                stepPart = ar[0];
                step = number(ar[1], part);
                if (step <= 0) {
                    throw new IllegalArgumentException("Step must be positive: " + part);
                }
            }
            int start, end;
            if (stepPart.equals("*")) {
                start = min;
                end = max;
            } else if (stepPart.contains("-")) {
                String[] r = stepPart.split("-", -1);
                if (r.length != 2) {
                    throw new IllegalArgumentException("Malformed range: " + part);
                }
                start = number(r[0], part);
                end = number(r[1], part);
            } else {
                start = number(stepPart, part);
                // "5/15" means from 5 to max
                end = part.contains("/") ? max : start;
            }
            if (start < min || end > max || start > end) {
                throw new IllegalArgumentException("Out of range: " + part);
            }
            for (int v = start; v <= end; v += step) out.set(v);
        }
    }

    private static int number(String s, String part) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a number in cron field: " + part, e);
        }
    }

    /**
     * Next fire time strictly after {@code from}, or empty if none within four years.
     */
    public @NotNull Optional<Instant> next(@NotNull Instant from) {
        ZonedDateTime z = ZonedDateTime.ofInstant(from, ZoneOffset.UTC)
                .truncatedTo(ChronoUnit.MINUTES)
                .plusMinutes(1);
        ZonedDateTime limit = z.plusYears(4);

        while (z.isBefore(limit)) {
            if (!months.get(z.getMonthValue())) {
                z = z.plusMonths(1).withDayOfMonth(1).withHour(0).withMinute(0);
                continue;
            }
            if (!dom.get(z.getDayOfMonth())) {
                z = z.plusDays(1).withHour(0).withMinute(0);
                continue;
            }
            if (!dow.get(z.getDayOfWeek().getValue() % 7)) {
                z = z.plusDays(1).withHour(0).withMinute(0);
                continue;
            }
            if (!hours.get(z.getHour())) {
                z = z.plusHours(1).withMinute(0);
                continue;
            }
            if (!minutes.get(z.getMinute())) {
                z = z.plusMinutes(1);
                continue;
            }
            return Optional.of(z.toInstant());
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return source.equals(((CronExpression) o).source);
    }

    @Override
    public int hashCode() {
        return source.hashCode();
    }

    @Override
    public String toString() {
        return source;
    }
}
