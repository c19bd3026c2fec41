package io.github.mvbazaar.jobs.store;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A user's role on a project together with the project aggregates karma depends on.
 */
public final class Collaboration {
    private final String projectId;
    private final CollaboratorRole role;
    private final int projectUpvotes;
    private final boolean projectFeatured;

    public Collaboration(@NotNull String projectId, @Nullable CollaboratorRole role, int projectUpvotes, boolean projectFeatured) {
        this.projectId = Objects.requireNonNull(projectId, "projectId");
        this.role = role;
        this.projectUpvotes = projectUpvotes;
        this.projectFeatured = projectFeatured;
    }

    public @NotNull String getProjectId() {
        return projectId;
    }

    /**
     * {@code null} for a role this version does not know.
     */
    public @Nullable CollaboratorRole getRole() {
        return role;
    }

    public int getProjectUpvotes() {
        return projectUpvotes;
    }

    public boolean isProjectFeatured() {
        return projectFeatured;
    }

    @Override
    public String toString() {
        return "Collaboration{projectId='" + projectId + "', role=" + role + ", upvotes=" + projectUpvotes + ", featured=" + projectFeatured + '}';
    }
}
