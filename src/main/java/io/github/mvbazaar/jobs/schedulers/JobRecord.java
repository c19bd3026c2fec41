package io.github.mvbazaar.jobs.schedulers;

import java.time.Duration;
import java.time.Instant;

final class JobRecord {
    final JobDefinition job;
    final CronExpression cron;

    volatile Instant lastRun = null;
    volatile Duration lastDuration = null;
    volatile JobResult lastResult = null;
    volatile Instant nextRun = null;

    JobRecord(JobDefinition job, CronExpression cron) {
        this.job = job;
        this.cron = cron;
    }
}
