package io.github.mvbazaar.jobs.deletion;

import io.github.mvbazaar.jobs.base_exceptions.DeletionConflictException;
import io.github.mvbazaar.jobs.base_exceptions.DeletionStateException;
import io.github.mvbazaar.jobs.store.InMemoryRetentionStore;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class DeletionWorkflowTest {
    private static final Instant NOW = Instant.parse("2025-06-01T10:00:00Z");

    private final InMemoryRetentionStore store = new InMemoryRetentionStore();

    private DeletionWorkflow at(Instant instant) {
        return new DeletionWorkflow(store.deletionRequests(), Clock.fixed(instant, ZoneOffset.UTC));
    }

    @Test
    void requestCreatesPendingRequestWithGracePeriod() throws Exception {
        DeletionRequest request = at(NOW).request("u1", DeletionOptions.DELETE_ALL);

        assertEquals(DeletionStatus.PENDING, request.getStatus());
        assertEquals(NOW.plus(Duration.ofDays(30)), request.getScheduledFor());
        assertFalse(request.getOptions().isAnonymizeContributions());
        assertEquals(request, store.deletionRows.get(request.getId()));
    }

    @Test
    void secondRequestWhilePendingIsAConflict() throws Exception {
        DeletionRequest first = at(NOW).request("u1", DeletionOptions.ANONYMIZE);

        assertThrows(DeletionConflictException.class, () -> at(NOW.plusSeconds(5)).request("u1", DeletionOptions.DELETE_ALL));
        assertEquals(1, store.deletionRows.size());
        assertEquals(first, at(NOW).status("u1").orElseThrow().request);
    }

    @Test
    void newRequestAllowedAfterCancel() throws Exception {
        DeletionWorkflow workflow = at(NOW);
        workflow.request("u1", DeletionOptions.ANONYMIZE);
        workflow.cancelForUser("u1");

        DeletionRequest again = workflow.request("u1", DeletionOptions.ANONYMIZE);
        assertEquals(DeletionStatus.PENDING, again.getStatus());
        assertEquals(2, store.deletionRows.size());
    }

    @Test
    void cancelMovesToCancelled() throws Exception {
        DeletionRequest request = at(NOW).request("u1", DeletionOptions.ANONYMIZE);

        DeletionRequest cancelled = at(NOW.plus(Duration.ofDays(3))).cancel(request.getId());

        assertEquals(DeletionStatus.CANCELLED, cancelled.getStatus());
        assertEquals(NOW.plus(Duration.ofDays(3)), cancelled.getCompletedAt());
        assertEquals(DeletionStatus.CANCELLED, store.deletionRows.get(request.getId()).getStatus());
        assertTrue(at(NOW).status("u1").isEmpty());
    }

    @Test
    void completedRequestCannotBeCancelled() throws Exception {
        DeletionRequest request = at(NOW).request("u1", DeletionOptions.ANONYMIZE);
        store.deletionRows.put(request.getId(), request.complete(request.getScheduledFor()));

        assertThrows(DeletionStateException.class, () -> at(NOW).cancel(request.getId()));
        assertThrows(DeletionStateException.class, () -> at(NOW).cancelForUser("u1"));
        assertEquals(DeletionStatus.COMPLETED, store.deletionRows.get(request.getId()).getStatus());
    }

    @Test
    void unknownRequestCannotBeCancelled() {
        assertThrows(DeletionStateException.class, () -> at(NOW).cancel("nope"));
    }

    @Test
    void statusReportsDaysRemaining() throws Exception {
        at(NOW).request("u1", DeletionOptions.ANONYMIZE);

        assertEquals(30, at(NOW).status("u1").orElseThrow().daysRemaining);
        assertEquals(20, at(NOW.plus(Duration.ofDays(10))).status("u1").orElseThrow().daysRemaining);
        assertEquals(1, at(NOW.plus(Duration.ofDays(29)).plusSeconds(1)).status("u1").orElseThrow().daysRemaining);
        assertEquals(0, at(NOW.plus(Duration.ofDays(31))).status("u1").orElseThrow().daysRemaining);
        assertTrue(at(NOW).status("u2").isEmpty());
    }
}
