package io.github.mvbazaar.jobs.deletion;

import java.util.Objects;

/**
 * Finalization choice made when the deletion was requested.
 */
public final class DeletionOptions {
    public static final DeletionOptions ANONYMIZE = new DeletionOptions(true);
    public static final DeletionOptions DELETE_ALL = new DeletionOptions(false);

    private final boolean anonymizeContributions;

    private DeletionOptions(boolean anonymizeContributions) {
        this.anonymizeContributions = anonymizeContributions;
    }

    public static DeletionOptions of(boolean anonymizeContributions) {
        return anonymizeContributions ? ANONYMIZE : DELETE_ALL;
    }

    /**
     * true: keep authored content under a de-identified label; false: delete the user and their data.
     */
    public boolean isAnonymizeContributions() {
        return anonymizeContributions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return anonymizeContributions == ((DeletionOptions) o).anonymizeContributions;
    }

    @Override
    public int hashCode() {
        return Objects.hash(anonymizeContributions);
    }

    @Override
    public String toString() {
        return "DeletionOptions{anonymizeContributions=" + anonymizeContributions + '}';
    }
}
