package io.github.mvbazaar.jobs.store;

import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.util.Objects;

/**
 * Uploaded file record. {@code filename} is relative to the uploads root.
 */
public final class Upload {
    public static final String PUBLIC_PREFIX = "/uploads/";

    private final String id;
    private final String filename;
    private final Instant createdAt;

    public Upload(@NotNull String id, @NotNull String filename, @NotNull Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.filename = Objects.requireNonNull(filename, "filename");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    public @NotNull String getId() {
        return id;
    }

    public @NotNull String getFilename() {
        return filename;
    }

    public @NotNull Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * URL under which avatars and project images reference this file.
     */
    public @NotNull String publicUrl() {
        return PUBLIC_PREFIX + filename;
    }

    @Override
    public String toString() {
        return "Upload{id='" + id + "', filename='" + filename + "', createdAt=" + createdAt + '}';
    }
}
