package io.github.mvbazaar.jobs.schedulers;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class JobRunnerTest {
    private final Clock clock = Clock.fixed(Instant.parse("2025-06-15T12:00:00Z"), ZoneOffset.UTC);
    private final JobRunner runner = new JobRunner(clock);

    private static JobDefinition job(JobHandler handler) {
        return JobDefinition.newBuilder().setName("job").setSchedule("0 2 * * *").setHandler(handler).build();
    }

    @Test
    void returnsHandlerResult() {
        JobExecution execution = runner.run(job(() -> JobResult.success("Deleted 4 rows").detail("deletedCount", 4).build()));

        assertEquals("job", execution.getJobName());
        assertTrue(execution.getResult().isSuccess());
        assertEquals(4, execution.getResult().getDetail("deletedCount"));
        assertNull(execution.getError());
        assertEquals(Instant.parse("2025-06-15T12:00:00Z"), execution.getStartedAt());
        assertFalse(execution.getDuration().isNegative());
    }

    @Test
    void checkedExceptionIsContained() {
        JobExecution execution = runner.run(job(() -> {
            throw new java.io.IOException("disk full");
        }));

        assertFalse(execution.getResult().isSuccess());
        assertEquals("disk full", execution.getResult().getMessage());
        assertTrue(execution.getError() instanceof java.io.IOException);
        assertTrue(String.valueOf(execution.getResult().getDetail("error")).contains("disk full"));
    }

    @Test
    void errorWithoutMessageUsesClassName() {
        JobExecution execution = runner.run(job(() -> {
            throw new NullPointerException();
        }));
        assertEquals(NullPointerException.class.getName(), execution.getResult().getMessage());
    }

    @Test
    void interruptRestoresFlag() {
        JobExecution execution = runner.run(job(() -> {
            throw new InterruptedException("stop");
        }));
        assertFalse(execution.getResult().isSuccess());
        assertTrue(Thread.interrupted(), "interrupt flag must be restored");
    }

    @Test
    void nullResultIsAnError() {
        JobExecution execution = runner.run(job(() -> null));
        assertFalse(execution.getResult().isSuccess());
        assertTrue(execution.getError() instanceof IllegalStateException);
    }
}
