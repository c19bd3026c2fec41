package io.github.mvbazaar.jobs;

import io.github.mvbazaar.jobs.base_exceptions.JobConfigurationException;
import io.github.mvbazaar.jobs.jobs.CleanupOrphanedFilesJob;
import io.github.mvbazaar.jobs.jobs.RecalculateKarmaJob;
import io.github.mvbazaar.jobs.schedulers.JobEventListener;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Options of {@link JobsSetup}. Built in code or read from flat properties:
 * <pre>
 * jobs.uploads-root=/var/uploads
 * jobs.auto-start=true
 * jobs.karma.batch-size=50
 * jobs.karma.batch-pause-ms=100
 * jobs.&lt;job-name&gt;.schedule=0 2 * * *
 * jobs.&lt;job-name&gt;.enabled=false
 * </pre>
 */
public final class JobsConfiguration {
    public static final String PREFIX = "jobs.";
    public static final String UPLOADS_ROOT = PREFIX + "uploads-root";
    public static final String AUTO_START = PREFIX + "auto-start";
    public static final String KARMA_BATCH_SIZE = PREFIX + "karma.batch-size";
    public static final String KARMA_BATCH_PAUSE_MS = PREFIX + "karma.batch-pause-ms";
    private static final String SCHEDULE_SUFFIX = ".schedule";
    private static final String ENABLED_SUFFIX = ".enabled";

    private final Path uploadsRoot;
    private final boolean autoStart;
    private final Clock clock;
    private final int karmaBatchSize;
    private final Duration karmaBatchPause;
    private final Map<String, String> scheduleOverrides;
    private final Map<String, Boolean> enabledOverrides;
    private final List<JobEventListener> listeners;

    private JobsConfiguration(Builder builder) {
        this.uploadsRoot = builder.uploadsRoot;
        this.autoStart = builder.autoStart;
        this.clock = builder.clock;
        this.karmaBatchSize = builder.karmaBatchSize;
        this.karmaBatchPause = builder.karmaBatchPause;
        this.scheduleOverrides = Map.copyOf(builder.scheduleOverrides);
        this.enabledOverrides = Map.copyOf(builder.enabledOverrides);
        this.listeners = List.copyOf(builder.listeners);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static @NotNull JobsConfiguration defaults() {
        return new Builder().build();
    }

    /**
     * Reads the {@code jobs.*} keys; unknown keys outside that prefix are ignored.
     *
     * @throws JobConfigurationException on a malformed value
     */
    public static @NotNull JobsConfiguration fromProperties(@NotNull Properties properties) throws JobConfigurationException {
        Builder builder = new Builder();
        for (String key : properties.stringPropertyNames()) {
            if (!key.startsWith(PREFIX)) continue;
            String value = properties.getProperty(key).trim();
            switch (key) {
                case UPLOADS_ROOT:
                    try {
                        builder.uploadsRoot(Path.of(value));
                    } catch (InvalidPathException e) {
                        throw new JobConfigurationException("Invalid " + key + ": " + value, e);
                    }
                    break;
                case AUTO_START:
                    builder.autoStart(parseBoolean(key, value));
                    break;
                case KARMA_BATCH_SIZE:
                    int size = parseInt(key, value);
                    if (size <= 0) {
                        throw new JobConfigurationException(key + " must be positive: " + value);
                    }
                    builder.karmaBatchSize(size);
                    break;
                case KARMA_BATCH_PAUSE_MS:
                    int pause = parseInt(key, value);
                    if (pause < 0) {
                        throw new JobConfigurationException(key + " must not be negative: " + value);
                    }
                    builder.karmaBatchPause(Duration.ofMillis(pause));
                    break;
                default:
                    if (key.endsWith(SCHEDULE_SUFFIX)) {
                        builder.schedule(jobName(key, SCHEDULE_SUFFIX), value);
                    } else if (key.endsWith(ENABLED_SUFFIX)) {
                        builder.enabled(jobName(key, ENABLED_SUFFIX), parseBoolean(key, value));
                    } else {
                        throw new JobConfigurationException("Unknown job configuration key: " + key);
                    }
            }
        }
        return builder.build();
    }

    private static String jobName(String key, String suffix) throws JobConfigurationException {
        String name = key.substring(PREFIX.length(), key.length() - suffix.length());
        if (name.isEmpty()) {
            throw new JobConfigurationException("Missing job name in key: " + key);
        }
        return name;
    }

    private static boolean parseBoolean(String key, String value) throws JobConfigurationException {
        if ("true".equalsIgnoreCase(value)) return true;
        if ("false".equalsIgnoreCase(value)) return false;
        throw new JobConfigurationException("Invalid boolean for " + key + ": " + value);
    }

    private static int parseInt(String key, String value) throws JobConfigurationException {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new JobConfigurationException("Invalid number for " + key + ": " + value, e);
        }
    }

    public @NotNull Path getUploadsRoot() {
        return uploadsRoot;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public @NotNull Clock getClock() {
        return clock;
    }

    public int getKarmaBatchSize() {
        return karmaBatchSize;
    }

    public @NotNull Duration getKarmaBatchPause() {
        return karmaBatchPause;
    }

    public @NotNull Optional<String> scheduleOverride(@NotNull String jobName) {
        return Optional.ofNullable(scheduleOverrides.get(jobName));
    }

    public @Nullable Boolean enabledOverride(@NotNull String jobName) {
        return enabledOverrides.get(jobName);
    }

    /**
     * Job names that carry an override of any kind.
     */
    @NotNull List<String> overriddenJobNames() {
        List<String> names = new ArrayList<>(scheduleOverrides.keySet());
        for (String name : enabledOverrides.keySet()) {
            if (!names.contains(name)) names.add(name);
        }
        return names;
    }

    public @NotNull List<JobEventListener> getListeners() {
        return listeners;
    }

    /**
     * {@code JobsConfiguration} builder static inner class.
     */
    public static final class Builder {
        private Path uploadsRoot = CleanupOrphanedFilesJob.DEFAULT_UPLOADS_ROOT;
        private boolean autoStart = true;
        private Clock clock = Clock.systemUTC();
        private int karmaBatchSize = RecalculateKarmaJob.DEFAULT_BATCH_SIZE;
        private Duration karmaBatchPause = RecalculateKarmaJob.DEFAULT_BATCH_PAUSE;
        private final Map<String, String> scheduleOverrides = new LinkedHashMap<>();
        private final Map<String, Boolean> enabledOverrides = new LinkedHashMap<>();
        private final List<JobEventListener> listeners = new ArrayList<>();

        private Builder() {
        }

        public Builder uploadsRoot(Path uploadsRoot) {
            this.uploadsRoot = Objects.requireNonNull(uploadsRoot);
            return this;
        }

        public Builder autoStart(boolean autoStart) {
            this.autoStart = autoStart;
            return this;
        }

        /**
         * Clock used by the jobs for cutoffs and timestamps.
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        public Builder karmaBatchSize(int karmaBatchSize) {
            if (karmaBatchSize <= 0) {
                throw new IllegalArgumentException("karmaBatchSize must be positive: " + karmaBatchSize);
            }
            this.karmaBatchSize = karmaBatchSize;
            return this;
        }

        public Builder karmaBatchPause(Duration karmaBatchPause) {
            Objects.requireNonNull(karmaBatchPause);
            if (karmaBatchPause.isNegative()) {
                throw new IllegalArgumentException("karmaBatchPause must not be negative: " + karmaBatchPause);
            }
            this.karmaBatchPause = karmaBatchPause;
            return this;
        }

        public Builder schedule(String jobName, String cron) {
            scheduleOverrides.put(Objects.requireNonNull(jobName), Objects.requireNonNull(cron));
            return this;
        }

        public Builder enabled(String jobName, boolean enabled) {
            enabledOverrides.put(Objects.requireNonNull(jobName), enabled);
            return this;
        }

        public Builder addListener(JobEventListener listener) {
            listeners.add(Objects.requireNonNull(listener));
            return this;
        }

        public JobsConfiguration build() {
            return new JobsConfiguration(this);
        }
    }
}
