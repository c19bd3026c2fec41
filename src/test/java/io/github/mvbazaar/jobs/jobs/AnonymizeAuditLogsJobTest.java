package io.github.mvbazaar.jobs.jobs;

import io.github.mvbazaar.jobs.schedulers.JobResult;
import io.github.mvbazaar.jobs.store.AuditLogEntry;
import io.github.mvbazaar.jobs.store.InMemoryRetentionStore;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AnonymizeAuditLogsJobTest {
    private static final Instant NOW = Instant.parse("2025-06-15T12:00:00Z");
    private static final Instant OLD = Instant.parse("2024-01-10T08:00:00Z");
    private static final Instant RECENT = Instant.parse("2025-03-01T08:00:00Z");

    private final InMemoryRetentionStore store = new InMemoryRetentionStore();
    private final AnonymizeAuditLogsJob job = new AnonymizeAuditLogsJob(store.auditLogs(), Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void stripsIdentityAndPiiMetadataFromOldRows() throws Exception {
        store.addAudit(AuditFixtures.entry("a1", OLD, "u1",
                Map.of("email", "ann@example.com", "name", "Ann", "action", "login", "projectId", "p9")));
        store.addAudit(AuditFixtures.entry("a2", OLD, "u2", Map.of("action", "logout")));
        store.addAudit(AuditFixtures.entry("a3", OLD, "u3"));
        store.addAudit(AuditFixtures.entry("r1", RECENT, "u1", Map.of("email", "ann@example.com")));

        JobResult result = job.execute();

        assertTrue(result.isSuccess());
        assertEquals(3, result.getDetail("anonymizedCount"));
        assertEquals(1, result.getDetail("metadataAnonymized"));
        assertEquals(1, result.getDetail("retentionYears"));
        assertEquals("2024-06-15T12:00:00Z", result.getDetail("cutoffDate"));

        AuditLogEntry a1 = store.auditRows.get("a1");
        assertNull(a1.getUserId());
        assertNull(a1.getIpAddress());
        assertNull(a1.getUserAgent());
        assertEquals(Map.of("action", "login", "projectId", "p9"), a1.getMetadata());

        AuditLogEntry r1 = store.auditRows.get("r1");
        assertEquals("u1", r1.getUserId());
        assertEquals("ann@example.com", r1.getMetadata().get("email"));
    }

    @Test
    void secondRunChangesNothing() throws Exception {
        store.addAudit(AuditFixtures.entry("a1", OLD, "u1", Map.of("phoneNumber", "+100", "address", "Main St 1")));
        job.execute();
        Map<String, AuditLogEntry> afterFirst = Map.copyOf(store.auditRows);

        JobResult second = job.execute();

        assertTrue(second.isSuccess());
        assertEquals(0, second.getDetail("anonymizedCount"));
        assertEquals(0, second.getDetail("metadataAnonymized"));
        assertEquals(afterFirst, Map.copyOf(store.auditRows));
        assertEquals(Map.of(), store.auditRows.get("a1").getMetadata());
    }

    @Test
    void failedMetadataWriteIsReportedAndOthersContinue() throws Exception {
        store.addAudit(AuditFixtures.entry("bad", OLD, "u1", Map.of("email", "a@example.com")));
        store.addAudit(AuditFixtures.entry("good", OLD, "u2", Map.of("email", "b@example.com")));
        store.failingAuditRows.add("bad");

        JobResult result = job.execute();

        assertFalse(result.isSuccess());
        assertEquals(1, result.getDetail("metadataAnonymized"));
        assertEquals(1, ((List<?>) result.getDetail("errors")).size());
        assertFalse(store.auditRows.get("good").getMetadata().containsKey("email"));
    }

    @Test
    void sanitizeKeepsNonPiiKeys() {
        assertTrue(AnonymizeAuditLogsJob.containsPii(Map.of("name", "x")));
        assertFalse(AnonymizeAuditLogsJob.containsPii(Map.of("action", "x")));
        assertEquals(Map.of("action", "x"), AnonymizeAuditLogsJob.sanitize(Map.of("action", "x", "email", "y")));
    }
}
