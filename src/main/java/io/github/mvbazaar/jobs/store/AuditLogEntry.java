package io.github.mvbazaar.jobs.store;

import com.google.common.collect.ImmutableMap;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Audit row as seen by the retention jobs. Metadata is a flat JSON-like object.
 */
public final class AuditLogEntry {
    private final String id;
    private final Instant createdAt;
    private final String userId;
    private final String ipAddress;
    private final String userAgent;
    private final Map<String, Object> metadata;

    public AuditLogEntry(@NotNull String id, @NotNull Instant createdAt, @Nullable String userId,
                         @Nullable String ipAddress, @Nullable String userAgent, @Nullable Map<String, Object> metadata) {
        this.id = Objects.requireNonNull(id, "id");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.userId = userId;
        this.ipAddress = ipAddress;
        this.userAgent = userAgent;
        this.metadata = metadata == null ? null : ImmutableMap.copyOf(metadata);
    }

    public @NotNull String getId() {
        return id;
    }

    public @NotNull Instant getCreatedAt() {
        return createdAt;
    }

    public @Nullable String getUserId() {
        return userId;
    }

    public @Nullable String getIpAddress() {
        return ipAddress;
    }

    public @Nullable String getUserAgent() {
        return userAgent;
    }

    public @Nullable Map<String, Object> getMetadata() {
        return metadata;
    }

    public boolean hasIdentity() {
        return userId != null || ipAddress != null || userAgent != null;
    }

    @Override
    public String toString() {
        return "AuditLogEntry{id='" + id + "', createdAt=" + createdAt + ", userId=" + userId + '}';
    }
}
