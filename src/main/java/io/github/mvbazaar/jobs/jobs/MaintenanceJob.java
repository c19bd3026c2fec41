package io.github.mvbazaar.jobs.jobs;

import io.github.mvbazaar.jobs.schedulers.JobDefinition;
import io.github.mvbazaar.jobs.schedulers.JobHandler;
import org.jetbrains.annotations.NotNull;

/**
 * A job handler that knows its own name, description and default UTC schedule.
 */
public interface MaintenanceJob extends JobHandler {
    @NotNull String name();

    @NotNull String description();

    @NotNull String defaultSchedule();

    default @NotNull JobDefinition definition() {
        return definition(defaultSchedule(), true);
    }

    default @NotNull JobDefinition definition(@NotNull String schedule, boolean enabled) {
        return JobDefinition.newBuilder()
                .setName(name())
                .setDescription(description())
                .setSchedule(schedule)
                .setEnabled(enabled)
                .setHandler(this)
                .build();
    }
}
