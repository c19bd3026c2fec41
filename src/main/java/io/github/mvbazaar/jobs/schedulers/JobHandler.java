package io.github.mvbazaar.jobs.schedulers;

/**
 * Body of a job. Takes no external input: collaborators are captured when the handler is created.
 * Item-level failures should be folded into the returned result; anything thrown is contained by {@link JobRunner}.
 */
@FunctionalInterface
public interface JobHandler {
    JobResult execute() throws Exception;
}
