package com.qualitysentinel.flink;

import com.qualitysentinel.core.config.SentinelConfig;
import com.qualitysentinel.core.config.SentinelConfigLoader;
import com.qualitysentinel.core.model.AnomalyAlert;
import com.qualitysentinel.core.model.MetricSample;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Main entry point for the Quality Sentinel Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (metrics topic)
 *     → Deserialize JSON → MetricSample
 *     → Key by metric name
 *     → MetricAnomalyProcessFunction (detection, severity, alerting)
 *     → Serialize AnomalyAlert → JSON
 *     → Kafka (alerts topic)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Streaming settings come from environment variables via {@link JobConfig};
 * detection and alerting settings from {@code sentinel.yml} via
 * {@link SentinelConfigLoader}. Both are validated before the job is built.
 * </p>
 *
 * <h3>Checkpointing</h3>
 * <p>
 * Exactly-once checkpointing keeps the per-metric history consistent across
 * restarts.
 * </p>
 *
 * @since 1.0.0
 */
public final class QualitySentinelJob {

        private static final Logger LOG = LoggerFactory.getLogger(QualitySentinelJob.class);

        private QualitySentinelJob() {
                // entry-point class, not instantiable
        }

        public static void main(String[] args) throws Exception {
                JobConfig config = JobConfig.fromEnvironment();
                LOG.info("Starting Quality Sentinel with config: {}", config);

                SentinelConfig sentinelConfig = loadSentinelConfig(config);

                StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
                env.setParallelism(config.getParallelism());
                configureCheckpointing(env, config);

                buildPipeline(env, config, sentinelConfig);

                env.execute("Quality Sentinel - Test Metric Anomaly Detection");
        }

        // ---------------------------------------------------------------
        // Pipeline assembly
        // ---------------------------------------------------------------

        /**
         * Build the full Kafka → Flink → Kafka pipeline.
         */
        static void buildPipeline(StreamExecutionEnvironment env,
                        JobConfig config,
                        SentinelConfig sentinelConfig) {
                KafkaSource<MetricSample> kafkaSource = KafkaSource.<MetricSample>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setTopics(config.getKafkaInputTopic())
                                .setGroupId(config.getKafkaGroupId())
                                .setStartingOffsets(OffsetsInitializer.earliest())
                                .setValueOnlyDeserializer(new MetricSampleDeserializationSchema())
                                .build();

                DataStream<MetricSample> samples = env.fromSource(
                                kafkaSource,
                                WatermarkStrategy.<MetricSample>forBoundedOutOfOrderness(Duration.ofSeconds(5))
                                                .withTimestampAssigner((sample, ts) -> sample.getTimestamp())
                                                .withIdleness(Duration.ofMinutes(1)),
                                "kafka-metrics-source");

                DataStream<AnomalyAlert> alerts = samples
                                .filter(Objects::nonNull) // drop deserialization failures
                                .keyBy(MetricSample::getMetricName)
                                .process(new MetricAnomalyProcessFunction(sentinelConfig, config))
                                .name("anomaly-detection");

                KafkaSink<AnomalyAlert> kafkaSink = KafkaSink.<AnomalyAlert>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setRecordSerializer(
                                                KafkaRecordSerializationSchema.builder()
                                                                .setTopic(config.getKafkaAlertTopic())
                                                                .setValueSerializationSchema(
                                                                                new AlertSerializationSchema())
                                                                .build())
                                .build();

                alerts.sinkTo(kafkaSink).name("kafka-alerts-sink");
        }

        // ---------------------------------------------------------------
        // Helpers
        // ---------------------------------------------------------------

        static SentinelConfig loadSentinelConfig(JobConfig config) {
                String path = config.getSentinelConfigPath();
                if (path != null && !path.isBlank()) {
                        return SentinelConfigLoader.fromFile(path);
                }
                return SentinelConfigLoader.load();
        }

        private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
                long interval = config.getCheckpointIntervalMs();
                env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

                CheckpointConfig cpConfig = env.getCheckpointConfig();
                cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
                cpConfig.setCheckpointTimeout(interval * 2);
                cpConfig.setMaxConcurrentCheckpoints(1);
                // retain checkpoints on cancellation so state can be restored
                cpConfig.setExternalizedCheckpointCleanup(
                                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
        }
}
