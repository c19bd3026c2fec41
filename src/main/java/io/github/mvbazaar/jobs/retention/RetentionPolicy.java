package io.github.mvbazaar.jobs.retention;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.time.Period;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Age-based retention rule: records older than {@code now - retention} are eligible.
 * The period is applied on the UTC calendar, so a one-year policy honours leap years.
 */
public final class RetentionPolicy {
    private final String name;
    private final Period retention;

    public RetentionPolicy(@NotNull String name, @NotNull Period retention) {
        this.name = Objects.requireNonNull(name, "name");
        this.retention = Objects.requireNonNull(retention, "retention");
        if (retention.isNegative() || retention.isZero()) {
            throw new IllegalArgumentException("Retention must be positive: " + retention);
        }
    }

    public static RetentionPolicy ofDays(String name, int days) {
        return new RetentionPolicy(name, Period.ofDays(days));
    }

    public static RetentionPolicy ofYears(String name, int years) {
        return new RetentionPolicy(name, Period.ofYears(years));
    }

    public @NotNull Instant cutoff(@NotNull Instant now) {
        return now.atOffset(ZoneOffset.UTC).minus(retention).toInstant();
    }

    /**
     * Selection predicate: a record stamped strictly before the cutoff is eligible.
     * An absent timestamp is never eligible. Stores apply the same rule to {@link #cutoff(Instant)}.
     */
    boolean isEligible(@Nullable Instant recordedAt, @NotNull Instant now) {
        return recordedAt != null && recordedAt.isBefore(cutoff(now));
    }

    /**
     * The instant at which a record stamped {@code from} stops being protected, e.g. the end of a grace period.
     */
    public @NotNull Instant expiry(@NotNull Instant from) {
        return from.atOffset(ZoneOffset.UTC).plus(retention).toInstant();
    }

    public @NotNull String getName() {
        return name;
    }

    public @NotNull Period getRetention() {
        return retention;
    }

    @Override
    public String toString() {
        return "RetentionPolicy{" + name + ", " + retention + '}';
    }
}
