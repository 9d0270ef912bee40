package com.qualitysentinel.flink;

import java.io.Serializable;
import java.util.Objects;

/**
 * Typed, immutable settings for the Quality Sentinel Flink job.
 *
 * <p>
 * Values are resolved from environment variables with defaults, so the job
 * can be configured from a Kubernetes Deployment, Docker {@code -e} flags or
 * a shell. Detection, alerting and baseline tuning live in
 * {@code sentinel.yml}; this class only covers the streaming shell.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} in production or the {@link Builder} in
 * tests. The builder validates ranges in {@link Builder#build()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String kafkaInputTopic;
    private final String kafkaAlertTopic;
    private final String kafkaGroupId;

    // ---------------------------------------------------------------
    // Flink
    // ---------------------------------------------------------------
    private final int parallelism;
    private final long checkpointIntervalMs;

    // ---------------------------------------------------------------
    // Detection shell
    // ---------------------------------------------------------------
    private final String sentinelConfigPath;
    private final int historySize;
    private final int baselineRebuildInterval;
    private final long cleanupIntervalMs;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaInputTopic = b.kafkaInputTopic;
        this.kafkaAlertTopic = b.kafkaAlertTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.sentinelConfigPath = b.sentinelConfigPath;
        this.historySize = b.historySize;
        this.baselineRebuildInterval = b.baselineRebuildInterval;
        this.cleanupIntervalMs = b.cleanupIntervalMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaInputTopic(env("KAFKA_INPUT_TOPIC", "quality-metrics"))
                    .kafkaAlertTopic(env("KAFKA_ALERT_TOPIC", "quality-alerts"))
                    .kafkaGroupId(env("KAFKA_GROUP_ID", "quality-sentinel"))
                    .parallelism(parseIntEnv("FLINK_PARALLELISM", "1"))
                    .checkpointIntervalMs(parseLongEnv("FLINK_CHECKPOINT_INTERVAL_MS", "60000"))
                    .sentinelConfigPath(env("SENTINEL_CONFIG_PATH", ""))
                    .historySize(parseIntEnv("METRIC_HISTORY_SIZE", "100"))
                    .baselineRebuildInterval(parseIntEnv("BASELINE_REBUILD_INTERVAL", "20"))
                    .cleanupIntervalMs(parseLongEnv("ALERT_CLEANUP_INTERVAL_MS", "60000"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaInputTopic() {
        return kafkaInputTopic;
    }

    public String getKafkaAlertTopic() {
        return kafkaAlertTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    /** Empty when the YAML file should be resolved by the loader's own lookup order. */
    public String getSentinelConfigPath() {
        return sentinelConfigPath;
    }

    /** Number of recent values kept per metric. */
    public int getHistorySize() {
        return historySize;
    }

    /** A metric's baseline is refit after this many new samples. */
    public int getBaselineRebuildInterval() {
        return baselineRebuildInterval;
    }

    public long getCleanupIntervalMs() {
        return cleanupIntervalMs;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * {@link #build()} checks that topic names are non-blank, parallelism and
     * intervals are positive, and the history can hold at least one rebuild
     * interval of samples.
     * </p>
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaInputTopic = "quality-metrics";
        private String kafkaAlertTopic = "quality-alerts";
        private String kafkaGroupId = "quality-sentinel";
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private String sentinelConfigPath = "";
        private int historySize = 100;
        private int baselineRebuildInterval = 20;
        private long cleanupIntervalMs = 60_000;

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaInputTopic(String v) {
            this.kafkaInputTopic = v;
            return this;
        }

        public Builder kafkaAlertTopic(String v) {
            this.kafkaAlertTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder checkpointIntervalMs(long v) {
            this.checkpointIntervalMs = v;
            return this;
        }

        public Builder sentinelConfigPath(String v) {
            this.sentinelConfigPath = v;
            return this;
        }

        public Builder historySize(int v) {
            this.historySize = v;
            return this;
        }

        public Builder baselineRebuildInterval(int v) {
            this.baselineRebuildInterval = v;
            return this;
        }

        public Builder cleanupIntervalMs(long v) {
            this.cleanupIntervalMs = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            requireNonBlank(kafkaInputTopic, "kafkaInputTopic");
            requireNonBlank(kafkaAlertTopic, "kafkaAlertTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");
            if (sentinelConfigPath == null) {
                sentinelConfigPath = "";
            }

            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (checkpointIntervalMs < 1) {
                throw new IllegalArgumentException(
                        "checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
            }
            if (baselineRebuildInterval < 1) {
                throw new IllegalArgumentException(
                        "baselineRebuildInterval must be >= 1, got: " + baselineRebuildInterval);
            }
            if (historySize < baselineRebuildInterval) {
                throw new IllegalArgumentException("historySize must be >= baselineRebuildInterval ("
                        + baselineRebuildInterval + "), got: " + historySize);
            }
            if (cleanupIntervalMs < 1) {
                throw new IllegalArgumentException(
                        "cleanupIntervalMs must be >= 1, got: " + cleanupIntervalMs);
            }
            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Env helpers
    // ---------------------------------------------------------------

    private static String env(String key, String defaultValue) {
        String value = System.getenv(key);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    private static int parseIntEnv(String key, String defaultValue) {
        return Integer.parseInt(env(key, defaultValue));
    }

    private static long parseLongEnv(String key, String defaultValue) {
        return Long.parseLong(env(key, defaultValue));
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "kafka=" + kafkaBootstrapServers +
                ", input=" + kafkaInputTopic +
                ", alerts=" + kafkaAlertTopic +
                ", group=" + kafkaGroupId +
                ", parallelism=" + parallelism +
                ", checkpointMs=" + checkpointIntervalMs +
                ", sentinelConfig='" + sentinelConfigPath + '\'' +
                ", historySize=" + historySize +
                ", rebuildEvery=" + baselineRebuildInterval +
                ", cleanupMs=" + cleanupIntervalMs +
                '}';
    }
}
