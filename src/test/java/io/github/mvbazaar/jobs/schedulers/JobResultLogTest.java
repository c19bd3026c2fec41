package io.github.mvbazaar.jobs.schedulers;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JobResultLogTest {
    private static final Instant T0 = Instant.parse("2025-06-15T02:00:00Z");

    @Test
    void keepsNewestEntriesPerJob() {
        JobResultLog log = new JobResultLog(3);
        for (int i = 0; i < 5; i++) {
            log.onComplete("a", T0.plusSeconds(i * 60L), T0.plusSeconds(i * 60L + 5), JobResult.success("run " + i).build());
        }
        log.onComplete("b", T0, T0, JobResult.failure("broken").build());

        List<JobExecution> history = log.history("a");
        assertEquals(3, history.size());
        assertEquals("run 2", history.get(0).getResult().getMessage());
        assertEquals("run 4", history.get(2).getResult().getMessage());
        assertEquals(Duration.ofSeconds(5), history.get(2).getDuration());
        assertEquals(1, log.size("b"));
        assertTrue(log.history("c").isEmpty());
    }

    @Test
    void historyIsASnapshot() {
        JobResultLog log = new JobResultLog();
        log.onComplete("a", T0, T0, JobResult.success("one").build());
        List<JobExecution> snapshot = log.history("a");
        log.onComplete("a", T0, T0, JobResult.success("two").build());

        assertEquals(1, snapshot.size());
        assertEquals(2, log.size("a"));
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(null));
    }

    @Test
    void capacityMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new JobResultLog(0));
    }
}
