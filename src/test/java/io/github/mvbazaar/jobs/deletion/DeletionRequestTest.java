package io.github.mvbazaar.jobs.deletion;

import io.github.mvbazaar.jobs.base_exceptions.DeletionStateException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class DeletionRequestTest {
    private static final Instant REQUESTED = Instant.parse("2025-06-01T10:00:00Z");
    private static final Instant DUE = Instant.parse("2025-07-01T10:00:00Z");

    @Test
    void pendingRequestIsScheduledAfterGracePeriod() {
        DeletionRequest request = DeletionRequest.pending("r1", "u1", REQUESTED, null);
        assertEquals(DeletionStatus.PENDING, request.getStatus());
        assertEquals(DUE, request.getScheduledFor());
        assertTrue(request.getOptions().isAnonymizeContributions());
        assertNull(request.getCompletedAt());
    }

    @Test
    void dueExactlyAtScheduledInstant() {
        DeletionRequest request = DeletionRequest.pending("r1", "u1", REQUESTED, DeletionOptions.DELETE_ALL);
        assertFalse(request.isDue(DUE.minusSeconds(1)));
        assertTrue(request.isDue(DUE));
        assertTrue(request.isDue(DUE.plusSeconds(1)));
    }

    @Test
    void completeBeforeGraceEndsIsRefused() {
        DeletionRequest request = DeletionRequest.pending("r1", "u1", REQUESTED, null);
        assertThrows(DeletionStateException.class, () -> request.complete(DUE.minusSeconds(1)));
    }

    @Test
    void terminalStatesAreFinal() throws Exception {
        DeletionRequest request = DeletionRequest.pending("r1", "u1", REQUESTED, null);

        DeletionRequest cancelled = request.cancel(REQUESTED.plusSeconds(60));
        assertEquals(DeletionStatus.CANCELLED, cancelled.getStatus());
        assertEquals(REQUESTED.plusSeconds(60), cancelled.getCompletedAt());
        assertFalse(cancelled.isDue(DUE));
        assertThrows(DeletionStateException.class, () -> cancelled.complete(DUE));
        assertThrows(DeletionStateException.class, () -> cancelled.cancel(DUE));

        DeletionRequest completed = request.complete(DUE);
        assertEquals(DeletionStatus.COMPLETED, completed.getStatus());
        assertThrows(DeletionStateException.class, () -> completed.cancel(DUE));
        assertThrows(DeletionStateException.class, () -> completed.complete(DUE));
    }

    @Test
    void transitionTable() {
        assertTrue(DeletionStatus.PENDING.canTransitionTo(DeletionStatus.CANCELLED));
        assertTrue(DeletionStatus.PENDING.canTransitionTo(DeletionStatus.COMPLETED));
        assertFalse(DeletionStatus.PENDING.canTransitionTo(DeletionStatus.PENDING));
        assertFalse(DeletionStatus.COMPLETED.canTransitionTo(DeletionStatus.CANCELLED));
        assertTrue(DeletionStatus.CANCELLED.isTerminal());
    }
}
