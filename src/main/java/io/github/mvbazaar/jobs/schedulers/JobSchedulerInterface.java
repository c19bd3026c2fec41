package io.github.mvbazaar.jobs.schedulers;

import io.github.mvbazaar.jobs.base_exceptions.JobConfigurationException;
import io.github.mvbazaar.jobs.base_exceptions.JobNotFoundException;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

public interface JobSchedulerInterface extends AutoCloseable {
    void addListener(JobEventListener l);

    void removeListener(JobEventListener l);

    void register(JobDefinition job) throws JobConfigurationException;

    void start();

    void stop();

    JobResult runNow(String jobName) throws JobNotFoundException;

    CompletableFuture<JobResult> runNowAsync(String jobName) throws JobNotFoundException;

    JobStatistics getStatus();

    Optional<JobStatus> getJobStatus(String jobName);

    @Override
    void close();
}
