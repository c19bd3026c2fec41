package io.github.mvbazaar.jobs.store;

import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.util.Objects;

/**
 * Replacement identity written over a user record when their contributions are kept.
 * Bio and avatar are cleared, visibility flags are switched off.
 */
public final class AnonymizedProfile {
    public static final String DISPLAY_NAME = "[Deleted User]";
    public static final String EMAIL_DOMAIN = "deleted.local";

    private final String email;
    private final String displayName;
    private final Instant anonymizedAt;

    private AnonymizedProfile(String email, String displayName, Instant anonymizedAt) {
        this.email = email;
        this.displayName = displayName;
        this.anonymizedAt = anonymizedAt;
    }

    public static @NotNull AnonymizedProfile forUser(@NotNull String userId, @NotNull Instant at) {
        Objects.requireNonNull(userId, "userId");
        return new AnonymizedProfile("deleted-" + userId + "@" + EMAIL_DOMAIN, DISPLAY_NAME, Objects.requireNonNull(at, "at"));
    }

    public @NotNull String getEmail() {
        return email;
    }

    public @NotNull String getDisplayName() {
        return displayName;
    }

    /**
     * Also used as the user's deletion timestamp.
     */
    public @NotNull Instant getAnonymizedAt() {
        return anonymizedAt;
    }
}
