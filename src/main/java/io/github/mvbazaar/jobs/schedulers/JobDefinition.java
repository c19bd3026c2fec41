package io.github.mvbazaar.jobs.schedulers;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Named, described unit of recurring work with its cron schedule and enabled flag.
 * Immutable; runtime state such as the last run lives in the scheduler.
 */
public final class JobDefinition {
    private final String name;
    private final String description;
    private final String schedule;
    private final boolean enabled;
    private final JobHandler handler;

    private JobDefinition(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name");
        this.description = builder.description == null ? "" : builder.description;
        this.schedule = Objects.requireNonNull(builder.schedule, "schedule");
        this.enabled = builder.enabled;
        this.handler = Objects.requireNonNull(builder.handler, "handler");
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static Builder newBuilder(JobDefinition copy) {
        Builder builder = new Builder();
        builder.name = copy.name;
        builder.description = copy.description;
        builder.schedule = copy.schedule;
        builder.enabled = copy.enabled;
        builder.handler = copy.handler;
        return builder;
    }

    public @NotNull String getName() {
        return name;
    }

    public @NotNull String getDescription() {
        return description;
    }

    public @NotNull String getSchedule() {
        return schedule;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public @NotNull JobHandler getHandler() {
        return handler;
    }

    @Override
    public String toString() {
        return "JobDefinition{" +
                "name='" + name + '\'' +
                ", schedule='" + schedule + '\'' +
                ", enabled=" + enabled +
                '}';
    }

    /**
     * {@code JobDefinition} builder static inner class.
     */
    public static final class Builder {
        private String name;
        private String description;
        private String schedule;
        private boolean enabled = true;
        private JobHandler handler;

        private Builder() {
        }

        public Builder setName(String name) {
            this.name = name;
            return this;
        }

        public Builder setDescription(String description) {
            this.description = description;
            return this;
        }

        /**
         * Sets the five-field UTC cron expression. Validated when the job is registered.
         */
        public Builder setSchedule(String schedule) {
            this.schedule = schedule;
            return this;
        }

        public Builder setEnabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder setHandler(JobHandler handler) {
            this.handler = handler;
            return this;
        }

        public JobDefinition build() {
            return new JobDefinition(this);
        }
    }
}
