package io.github.mvbazaar.jobs.deletion;

import io.github.mvbazaar.jobs.base_exceptions.DeletionStateException;
import io.github.mvbazaar.jobs.retention.RetentionPolicies;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Objects;

/**
 * Account deletion request with its grace period. Immutable: transitions return a new instance.
 */
public final class DeletionRequest {
    private final String id;
    private final String userId;
    private final Instant requestedAt;
    private final Instant scheduledFor;
    private final DeletionOptions options;
    private final DeletionStatus status;
    private final Instant completedAt;

    public DeletionRequest(@NotNull String id, @NotNull String userId, @NotNull Instant requestedAt, @NotNull Instant scheduledFor,
                           @Nullable DeletionOptions options, @NotNull DeletionStatus status, @Nullable Instant completedAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.userId = Objects.requireNonNull(userId, "userId");
        this.requestedAt = Objects.requireNonNull(requestedAt, "requestedAt");
        this.scheduledFor = Objects.requireNonNull(scheduledFor, "scheduledFor");
        this.options = options == null ? DeletionOptions.ANONYMIZE : options;
        this.status = Objects.requireNonNull(status, "status");
        this.completedAt = completedAt;
    }

    /**
     * New PENDING request whose grace period starts at {@code requestedAt}.
     */
    public static @NotNull DeletionRequest pending(@NotNull String id, @NotNull String userId, @NotNull Instant requestedAt,
                                                   @Nullable DeletionOptions options) {
        Instant scheduledFor = RetentionPolicies.ACCOUNT_DELETION_GRACE.expiry(requestedAt);
        return new DeletionRequest(id, userId, requestedAt, scheduledFor, options, DeletionStatus.PENDING, null);
    }

    /**
     * Grace period is over at {@code now}; inclusive of the boundary.
     */
    public boolean isDue(@NotNull Instant now) {
        return status == DeletionStatus.PENDING && !scheduledFor.isAfter(now);
    }

    public @NotNull DeletionRequest cancel(@NotNull Instant at) throws DeletionStateException {
        return transition(DeletionStatus.CANCELLED, at);
    }

    /**
     * @throws DeletionStateException if the request is not PENDING or the grace period has not elapsed at {@code at}
     */
    public @NotNull DeletionRequest complete(@NotNull Instant at) throws DeletionStateException {
        if (status == DeletionStatus.PENDING && scheduledFor.isAfter(at)) {
            throw new DeletionStateException("Deletion request " + id + " is in its grace period until " + scheduledFor);
        }
        return transition(DeletionStatus.COMPLETED, at);
    }

    private DeletionRequest transition(DeletionStatus target, Instant at) throws DeletionStateException {
        if (!status.canTransitionTo(target)) {
            throw new DeletionStateException("Deletion request " + id + " cannot move from " + status + " to " + target);
        }
        return new DeletionRequest(id, userId, requestedAt, scheduledFor, options, target, Objects.requireNonNull(at, "at"));
    }

    public @NotNull String getId() {
        return id;
    }

    public @NotNull String getUserId() {
        return userId;
    }

    public @NotNull Instant getRequestedAt() {
        return requestedAt;
    }

    public @NotNull Instant getScheduledFor() {
        return scheduledFor;
    }

    public @NotNull DeletionOptions getOptions() {
        return options;
    }

    public @NotNull DeletionStatus getStatus() {
        return status;
    }

    /**
     * When the request reached its terminal state.
     */
    public @Nullable Instant getCompletedAt() {
        return completedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DeletionRequest that = (DeletionRequest) o;
        return id.equals(that.id) && userId.equals(that.userId) && requestedAt.equals(that.requestedAt)
                && scheduledFor.equals(that.scheduledFor) && options.equals(that.options) && status == that.status
                && Objects.equals(completedAt, that.completedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, userId, requestedAt, scheduledFor, options, status, completedAt);
    }

    @Override
    public String toString() {
        return "DeletionRequest{" +
                "id='" + id + '\'' +
                ", userId='" + userId + '\'' +
                ", scheduledFor=" + scheduledFor +
                ", status=" + status +
                ", options=" + options +
                '}';
    }
}
