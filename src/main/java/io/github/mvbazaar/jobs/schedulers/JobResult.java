package io.github.mvbazaar.jobs.schedulers;

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableMap;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one job execution.
 * {@code details} is an open payload for observability and is never interpreted by the scheduler.
 */
public final class JobResult {
    public static final String ALREADY_RUNNING = "Job is already running";

    private final boolean success;
    private final String message;
    private final Map<String, Object> details;
    private final boolean rejected;

    private JobResult(Builder builder) {
        this.success = builder.success;
        this.rejected = builder.rejected;
        this.message = builder.message;
        this.details = ImmutableMap.copyOf(builder.details);
    }

    public static Builder newBuilder(boolean success) {
        return new Builder(success);
    }

    public static Builder success(@NotNull String message) {
        return new Builder(true).message(message);
    }

    public static Builder failure(@NotNull String message) {
        return new Builder(false).message(message);
    }

    /**
     * Result for an execution attempt rejected because the same job is in flight.
     */
    public static @NotNull JobResult alreadyRunning() {
        Builder builder = failure(ALREADY_RUNNING);
        builder.rejected = true;
        return builder.build();
    }

    /**
     * Result for a handler that threw.
     */
    public static @NotNull JobResult fromError(@NotNull Throwable error) {
        String text = error.getMessage() != null ? error.getMessage() : error.getClass().getName();
        return failure(text)
                .detail("error", Throwables.getStackTraceAsString(error))
                .build();
    }

    public boolean isSuccess() {
        return success;
    }

    public @NotNull String getMessage() {
        return message;
    }

    public @NotNull Map<String, Object> getDetails() {
        return details;
    }

    public @Nullable Object getDetail(String key) {
        return details.get(key);
    }

    /**
     * True when the execution never started because of the single-flight rule.
     * Distinct from a failed execution.
     */
    public boolean isRejection() {
        return rejected;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        JobResult that = (JobResult) o;
        return success == that.success && rejected == that.rejected && message.equals(that.message) && details.equals(that.details);
    }

    @Override
    public int hashCode() {
        return Objects.hash(success, rejected, message, details);
    }

    @Override
    public String toString() {
        return "JobResult{" +
                "success=" + success +
                ", message='" + message + '\'' +
                ", details=" + details +
                '}';
    }

    /**
     * {@code JobResult} builder static inner class.
     */
    public static final class Builder {
        private final boolean success;
        private String message = "";
        private boolean rejected = false;
        private final Map<String, Object> details = new LinkedHashMap<>();

        private Builder(boolean success) {
            this.success = success;
        }

        public Builder message(@NotNull String message) {
            this.message = Objects.requireNonNull(message, "message");
            return this;
        }

        /**
         * Adds a detail entry. {@code null} values are skipped so absent data stays absent.
         */
        public Builder detail(@NotNull String key, @Nullable Object value) {
            if (value != null) {
                details.put(Objects.requireNonNull(key, "key"), value);
            }
            return this;
        }

        public JobResult build() {
            return new JobResult(this);
        }
    }
}
