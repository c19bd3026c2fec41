package io.github.mvbazaar.jobs.jobs;

import com.google.common.collect.ImmutableSet;
import io.github.mvbazaar.jobs.retention.RetentionPolicies;
import io.github.mvbazaar.jobs.schedulers.JobResult;
import io.github.mvbazaar.jobs.store.AuditLogEntry;
import io.github.mvbazaar.jobs.store.AuditLogStore;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Strips identity from audit rows older than one year. Rows are kept, only their PII goes:
 * user id, IP address and user agent columns, plus the PII keys of the metadata object.
 */
public class AnonymizeAuditLogsJob implements MaintenanceJob {
    private final static Logger logger = LoggerFactory.getLogger(AnonymizeAuditLogsJob.class);

    public static final String NAME = "anonymize-audit-logs";

    /** Metadata keys that carry personal data. */
    public static final Set<String> PII_METADATA_KEYS = ImmutableSet.of("email", "name", "phoneNumber", "address");

    private final AuditLogStore auditLogs;
    private final Clock clock;

    public AnonymizeAuditLogsJob(@NotNull AuditLogStore auditLogs, @NotNull Clock clock) {
        this.auditLogs = Objects.requireNonNull(auditLogs, "auditLogs");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public @NotNull String name() {
        return NAME;
    }

    @Override
    public @NotNull String description() {
        return "Anonymize audit logs older than " + RetentionPolicies.AUDIT_LOG_ANONYMIZE_YEARS + " year";
    }

    @Override
    public @NotNull String defaultSchedule() {
        return "0 3 * * *";
    }

    @Override
    public JobResult execute() throws Exception {
        logger.info("Starting anonymization of old audit logs");
        Instant cutoff = RetentionPolicies.AUDIT_LOG_ANONYMIZATION.cutoff(clock.instant());

        int anonymized = auditLogs.anonymizeCreatedBefore(cutoff);

        int metadataAnonymized = 0;
        List<String> errors = new ArrayList<>();
        for (AuditLogEntry entry : auditLogs.findWithMetadataCreatedBefore(cutoff)) {
            Map<String, Object> metadata = entry.getMetadata();
            if (metadata == null || !containsPii(metadata)) {
                continue;
            }
            try {
                auditLogs.replaceMetadata(entry.getId(), sanitize(metadata));
                metadataAnonymized++;
            } catch (Exception e) {
                String msg = "Failed to sanitize metadata of audit log " + entry.getId() + ": " + e.getMessage();
                errors.add(msg);
                logger.error(msg, e);
            }
        }

        logger.info("Audit log anonymization completed: anonymizedCount={}, metadataAnonymized={}, cutoffDate={}",
                anonymized, metadataAnonymized, cutoff);
        return JobResult.newBuilder(errors.isEmpty())
                .message("Anonymized " + anonymized + " audit logs, sanitized metadata in " + metadataAnonymized + " logs")
                .detail("anonymizedCount", anonymized)
                .detail("metadataAnonymized", metadataAnonymized)
                .detail("cutoffDate", cutoff.toString())
                .detail("retentionYears", RetentionPolicies.AUDIT_LOG_ANONYMIZE_YEARS)
                .detail("errors", errors.isEmpty() ? null : List.copyOf(errors))
                .build();
    }

    static boolean containsPii(Map<String, Object> metadata) {
        for (String key : PII_METADATA_KEYS) {
            if (metadata.containsKey(key)) return true;
        }
        return false;
    }

    static Map<String, Object> sanitize(Map<String, Object> metadata) {
        Map<String, Object> copy = new LinkedHashMap<>(metadata);
        copy.keySet().removeAll(PII_METADATA_KEYS);
        return copy;
    }
}
