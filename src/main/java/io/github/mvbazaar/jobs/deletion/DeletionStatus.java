package io.github.mvbazaar.jobs.deletion;

/**
 * Lifecycle of an account deletion request. CANCELLED and COMPLETED are terminal.
 */
public enum DeletionStatus {
    PENDING,
    CANCELLED,
    COMPLETED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    public boolean canTransitionTo(DeletionStatus target) {
        return this == PENDING && target != PENDING;
    }
}
