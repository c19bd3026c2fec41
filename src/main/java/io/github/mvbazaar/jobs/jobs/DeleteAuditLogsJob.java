package io.github.mvbazaar.jobs.jobs;

import io.github.mvbazaar.jobs.retention.RetentionPolicies;
import io.github.mvbazaar.jobs.schedulers.JobResult;
import io.github.mvbazaar.jobs.store.AuditLogStore;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Permanently removes audit rows past the three-year retention.
 */
public class DeleteAuditLogsJob implements MaintenanceJob {
    private final static Logger logger = LoggerFactory.getLogger(DeleteAuditLogsJob.class);

    public static final String NAME = "delete-audit-logs";

    private final AuditLogStore auditLogs;
    private final Clock clock;

    public DeleteAuditLogsJob(@NotNull AuditLogStore auditLogs, @NotNull Clock clock) {
        this.auditLogs = Objects.requireNonNull(auditLogs, "auditLogs");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public @NotNull String name() {
        return NAME;
    }

    @Override
    public @NotNull String description() {
        return "Delete audit logs older than " + RetentionPolicies.AUDIT_LOG_DELETE_YEARS + " years";
    }

    @Override
    public @NotNull String defaultSchedule() {
        return "30 3 * * 0";
    }

    @Override
    public JobResult execute() throws Exception {
        logger.info("Starting deletion of very old audit logs");
        Instant cutoff = RetentionPolicies.AUDIT_LOG_DELETION.cutoff(clock.instant());

        int deleted = auditLogs.deleteCreatedBefore(cutoff);

        logger.info("Audit log deletion completed: deletedCount={}, cutoffDate={}", deleted, cutoff);
        return JobResult.success("Deleted " + deleted + " audit logs older than " + RetentionPolicies.AUDIT_LOG_DELETE_YEARS + " years")
                .detail("deletedCount", deleted)
                .detail("cutoffDate", cutoff.toString())
                .detail("retentionYears", RetentionPolicies.AUDIT_LOG_DELETE_YEARS)
                .build();
    }
}
