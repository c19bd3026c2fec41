package io.github.mvbazaar.jobs.store;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Active user with the karma value currently stored for them.
 */
public final class KarmaCandidate {
    private final String userId;
    private final int karma;

    public KarmaCandidate(@NotNull String userId, int karma) {
        this.userId = Objects.requireNonNull(userId, "userId");
        this.karma = karma;
    }

    public @NotNull String getUserId() {
        return userId;
    }

    public int getKarma() {
        return karma;
    }
}
