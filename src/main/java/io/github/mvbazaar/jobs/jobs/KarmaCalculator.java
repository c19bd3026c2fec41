package io.github.mvbazaar.jobs.jobs;

import io.github.mvbazaar.jobs.store.Collaboration;
import io.github.mvbazaar.jobs.store.CollaboratorRole;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Karma of a user from their collaborations:
 * <pre>
 * sum(floor(projectUpvotes * roleMultiplier)) + FEATURED_BONUS * (featured projects the user created)
 * </pre>
 */
public final class KarmaCalculator {
    public static final int FEATURED_BONUS = 100;

    private static final Map<CollaboratorRole, Double> ROLE_MULTIPLIERS = new EnumMap<>(CollaboratorRole.class);

    static {
        ROLE_MULTIPLIERS.put(CollaboratorRole.CREATOR, 1.0);
        ROLE_MULTIPLIERS.put(CollaboratorRole.CONTRIBUTOR, 0.5);
        ROLE_MULTIPLIERS.put(CollaboratorRole.ADVISOR, 0.25);
    }

    private KarmaCalculator() {
    }

    public static double multiplier(CollaboratorRole role) {
        if (role == null) return 0.0;
        return ROLE_MULTIPLIERS.getOrDefault(role, 0.0);
    }

    public static int contribution(Collaboration collaboration) {
        return (int) Math.floor(collaboration.getProjectUpvotes() * multiplier(collaboration.getRole()));
    }

    public static int karma(Collection<Collaboration> collaborations) {
        int fromUpvotes = 0;
        int featuredCreated = 0;
        for (Collaboration c : collaborations) {
            fromUpvotes += contribution(c);
            if (c.getRole() == CollaboratorRole.CREATOR && c.isProjectFeatured()) {
                featuredCreated++;
            }
        }
        return fromUpvotes + featuredCreated * FEATURED_BONUS;
    }
}
