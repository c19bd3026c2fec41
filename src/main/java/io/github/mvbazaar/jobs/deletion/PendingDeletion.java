package io.github.mvbazaar.jobs.deletion;

import java.time.Duration;
import java.time.Instant;

/**
 * What a user sees of their own pending deletion.
 */
public final class PendingDeletion {
    public final DeletionRequest request;
    public final long daysRemaining;

    PendingDeletion(DeletionRequest request, Instant now) {
        this.request = request;
        long seconds = Math.max(0, Duration.between(now, request.getScheduledFor()).getSeconds());
        // partial days count as a full day
        this.daysRemaining = (seconds + 86_399) / 86_400;
    }

    @Override
    public String toString() {
        return "PendingDeletion{scheduledFor=" + request.getScheduledFor() + ", daysRemaining=" + daysRemaining + '}';
    }
}
