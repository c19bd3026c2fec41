package io.github.mvbazaar.jobs.schedulers;

import java.time.Clock;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;

final class ScheduledEntry implements Delayed {
    final String jobName;
    final long triggerAtMillis;
    final long generation;
    private final Clock clock;

    ScheduledEntry(String jobName, long triggerAtMillis, long generation, Clock clock) {
        this.jobName = jobName;
        this.triggerAtMillis = triggerAtMillis;
        this.generation = generation;
        this.clock = clock;
    }

    @Override
    public long getDelay(TimeUnit unit) {
        long diff = triggerAtMillis - clock.millis();
        return unit.convert(diff, TimeUnit.MILLISECONDS);
    }

    @Override
    public int compareTo(Delayed o) {
        return Long.compare(this.triggerAtMillis, ((ScheduledEntry) o).triggerAtMillis);
    }
}
