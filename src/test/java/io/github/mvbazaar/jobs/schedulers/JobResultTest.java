package io.github.mvbazaar.jobs.schedulers;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JobResultTest {

    @Test
    void nullDetailsAreSkipped() {
        JobResult result = JobResult.success("ok")
                .detail("deletedCount", 2)
                .detail("errors", null)
                .build();

        assertEquals(1, result.getDetails().size());
        assertFalse(result.getDetails().containsKey("errors"));
        assertNull(result.getDetail("errors"));
    }

    @Test
    void detailsAreImmutable() {
        JobResult result = JobResult.failure("bad").detail("errors", List.of("x")).build();
        assertThrows(UnsupportedOperationException.class, () -> result.getDetails().put("k", "v"));
    }

    @Test
    void rejectionIsDistinctFromFailure() {
        assertTrue(JobResult.alreadyRunning().isRejection());
        assertFalse(JobResult.alreadyRunning().isSuccess());
        assertFalse(JobResult.failure(JobResult.ALREADY_RUNNING).build().isRejection());
        assertNotEquals(JobResult.alreadyRunning(), JobResult.failure(JobResult.ALREADY_RUNNING).build());
    }

    @Test
    void fromErrorCarriesStackTrace() {
        JobResult result = JobResult.fromError(new IllegalArgumentException("no such table"));
        assertEquals("no such table", result.getMessage());
        assertTrue(((String) result.getDetail("error")).startsWith("java.lang.IllegalArgumentException: no such table"));
    }
}
