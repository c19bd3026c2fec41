package io.github.mvbazaar.jobs;

import io.github.mvbazaar.jobs.base_exceptions.JobConfigurationException;
import io.github.mvbazaar.jobs.jobs.CleanupInvitationsJob;
import io.github.mvbazaar.jobs.jobs.RecalculateKarmaJob;
import io.github.mvbazaar.jobs.schedulers.JobResult;
import io.github.mvbazaar.jobs.schedulers.JobResultLog;
import io.github.mvbazaar.jobs.schedulers.JobScheduler;
import io.github.mvbazaar.jobs.schedulers.JobStatistics;
import io.github.mvbazaar.jobs.schedulers.JobStatus;
import io.github.mvbazaar.jobs.store.InMemoryRetentionStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JobsSetupTest {
    private static final Instant NOW = Instant.parse("2025-06-15T12:00:00Z");

    @TempDir
    Path uploads;

    JobScheduler scheduler;
    private final InMemoryRetentionStore store = new InMemoryRetentionStore();

    @AfterEach
    void tearDown() {
        if (scheduler != null) scheduler.close();
    }

    private JobsConfiguration.Builder config() {
        return JobsConfiguration.newBuilder()
                .uploadsRoot(uploads)
                .clock(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void registersAllJobsAndStarts() throws Exception {
        scheduler = JobsSetup.setup(store, config().build());

        assertEquals(List.of(
                "cleanup-invitations",
                "cleanup-push-tokens",
                "anonymize-audit-logs",
                "delete-audit-logs",
                "cleanup-orphaned-files",
                "finalize-deletions",
                "recalculate-karma"), scheduler.getJobNames());

        JobStatistics stats = scheduler.getStatus();
        assertEquals(7, stats.totalJobs);
        assertEquals(7, stats.enabledJobs);
        for (JobStatus status : stats.jobs) {
            assertNotNull(status.nextRun, status.name + " should be scheduled");
            assertFalse(status.description.isEmpty());
        }
        assertEquals("30 4 * * *", scheduler.getJobStatus("finalize-deletions").orElseThrow().schedule);
    }

    @Test
    void createDoesNotStart() throws Exception {
        scheduler = JobsSetup.create(store, config().build());
        assertNull(scheduler.getJobStatus("cleanup-invitations").orElseThrow().nextRun);
        scheduler.close();

        scheduler = JobsSetup.setup(store, config().autoStart(false).build());
        assertNull(scheduler.getJobStatus("cleanup-invitations").orElseThrow().nextRun);
    }

    @Test
    void overridesApply() throws Exception {
        scheduler = JobsSetup.create(store, config()
                .schedule(CleanupInvitationsJob.NAME, "15 1 * * *")
                .enabled(RecalculateKarmaJob.NAME, false)
                .build());

        assertEquals("15 1 * * *", scheduler.getJobStatus(CleanupInvitationsJob.NAME).orElseThrow().schedule);
        assertFalse(scheduler.getJobStatus(RecalculateKarmaJob.NAME).orElseThrow().enabled);
        assertEquals(6, scheduler.getStatus().enabledJobs);
    }

    @Test
    void badOverridesFail() {
        assertThrows(JobConfigurationException.class,
                () -> JobsSetup.create(store, config().schedule(CleanupInvitationsJob.NAME, "99 * * *").build()));
        assertThrows(JobConfigurationException.class,
                () -> JobsSetup.create(store, config().enabled("no-such-job", false).build()));
    }

    @Test
    void manualRunUsesStoreAndFeedsListeners() throws Exception {
        JobResultLog log = new JobResultLog();
        store.invitationRows.put("i1", new InMemoryRetentionStore.Invitation("i1", NOW.minus(Duration.ofDays(40)), true));
        scheduler = JobsSetup.create(store, config().addListener(log).build());

        JobResult result = scheduler.runNow(CleanupInvitationsJob.NAME);

        assertTrue(result.isSuccess());
        assertEquals(1, result.getDetail("deletedCount"));
        assertTrue(store.invitationRows.isEmpty());
        assertEquals(1, log.size(CleanupInvitationsJob.NAME));
        assertEquals(result, scheduler.getJobStatus(CleanupInvitationsJob.NAME).orElseThrow().lastResult);
    }
}
