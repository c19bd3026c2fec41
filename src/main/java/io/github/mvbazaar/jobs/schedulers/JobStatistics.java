package io.github.mvbazaar.jobs.schedulers;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Scheduler-wide status: counts plus one {@link JobStatus} per registered job, in registration order.
 */
public final class JobStatistics {
    public final int totalJobs;
    public final int enabledJobs;
    public final int runningJobs;
    public final List<JobStatus> jobs;

    JobStatistics(int totalJobs, int enabledJobs, int runningJobs, List<JobStatus> jobs) {
        this.totalJobs = totalJobs;
        this.enabledJobs = enabledJobs;
        this.runningJobs = runningJobs;
        this.jobs = ImmutableList.copyOf(jobs);
    }

    @Override
    public String toString() {
        return "JobStatistics{totalJobs=" + totalJobs + ", enabledJobs=" + enabledJobs + ", runningJobs=" + runningJobs + '}';
    }
}
