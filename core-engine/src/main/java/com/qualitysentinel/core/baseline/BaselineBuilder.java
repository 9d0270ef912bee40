package com.qualitysentinel.core.baseline;

import com.qualitysentinel.core.model.Baseline;
import com.qualitysentinel.core.model.DataPoint;
import com.qualitysentinel.core.seasonality.SeasonalAnalysisResult;
import com.qualitysentinel.core.seasonality.SeasonalityAnalyzer;
import com.qualitysentinel.core.seasonality.SeasonalityConfig;
import com.qualitysentinel.core.stats.DataPreprocessor;
import com.qualitysentinel.core.stats.PreprocessConfig;
import com.qualitysentinel.core.stats.PreprocessResult;
import com.qualitysentinel.core.stats.Statistics;
import com.qualitysentinel.core.stats.SummaryStats;
import com.qualitysentinel.core.storage.AnomalyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Fits and persists one {@link Baseline} per metric.
 *
 * <h3>Build steps</h3>
 * <ol>
 * <li>preprocess: sort, optional 3σ outlier removal
 * ({@link BaselineConfig#isExcludeAnomalies()}), linear gap filling</li>
 * <li>optionally auto-detect seasonality when the config has none</li>
 * <li>deseasonalize ({@code value / adjustment(timestamp)}) when seasonality
 * is active</li>
 * <li>fit with the configured {@link BaselineMethod}</li>
 * <li>replace the stored {@link BaselineRecord}</li>
 * </ol>
 *
 * <p>
 * A build with no valid points left returns a failed {@link BaselineResult}
 * and leaves the stored baseline untouched. Store failures propagate as
 * {@link com.qualitysentinel.core.storage.PersistenceException}.
 * </p>
 *
 * @since 1.0.0
 */
public class BaselineBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(BaselineBuilder.class);

    static final double SMOOTHING_ALPHA = 0.3;
    static final double IQR_TO_STDDEV = 1.35;
    static final double BASELINE_OUTLIER_THRESHOLD = 3.0;
    static final Duration DEFAULT_MAX_AGE = Duration.ofHours(24);

    private final AnomalyStore store;
    private final DataPreprocessor preprocessor;
    private final SeasonalityAnalyzer seasonality;
    private final Clock clock;

    public BaselineBuilder(AnomalyStore store, DataPreprocessor preprocessor,
            SeasonalityAnalyzer seasonality, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.preprocessor = Objects.requireNonNull(preprocessor, "preprocessor must not be null");
        this.seasonality = Objects.requireNonNull(seasonality, "seasonality must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public BaselineResult build(String metricName, List<DataPoint> points, BaselineConfig config) {
        return build(metricName, points, config, false);
    }

    /**
     * Fit and store a baseline.
     *
     * @param metricName            metric the baseline describes
     * @param points                history, any order
     * @param config                fitting options
     * @param autoDetectSeasonality analyse the cleaned series for cycles when
     *                              {@code config} has no seasonality enabled
     * @return the stored baseline, or the empty-input error
     */
    public BaselineResult build(String metricName, List<DataPoint> points, BaselineConfig config,
            boolean autoDetectSeasonality) {
        Objects.requireNonNull(metricName, "metricName must not be null");
        Objects.requireNonNull(points, "points must not be null");
        Objects.requireNonNull(config, "config must not be null");

        PreprocessResult cleaned = preprocessor.preprocess(points, PreprocessConfig.builder()
                .outlierRemoval(config.isExcludeAnomalies())
                .outlierThreshold(BASELINE_OUTLIER_THRESHOLD)
                .fillMissing(true)
                .normalize(false)
                .build());
        List<DataPoint> data = cleaned.getData();
        if (data.isEmpty()) {
            LOG.warn("No valid data points for baseline '{}' ({} raw point(s))", metricName, points.size());
            return BaselineResult.empty(metricName);
        }

        BaselineConfig effective = config;
        if (autoDetectSeasonality && !config.getSeasonality().isEnabled()) {
            SeasonalAnalysisResult analysis = seasonality.analyze(data);
            if (analysis.hasSeasonality()) {
                effective = config.withSeasonality(analysis.toConfig());
                LOG.info("Seasonality detected for '{}': dominant={} confidence={}",
                        metricName, analysis.getDominantPeriod().orElse(null), analysis.getConfidence());
            }
        }

        double[] values = new double[data.size()];
        SeasonalityConfig seasonalConfig = effective.getSeasonality();
        for (int i = 0; i < values.length; i++) {
            DataPoint p = data.get(i);
            values[i] = seasonalConfig.isActive()
                    ? seasonality.deseasonalize(p.getValue(), p.getTimestamp(), seasonalConfig)
                    : p.getValue();
        }

        Instant now = clock.instant();
        Baseline baseline = fit(values, effective)
                .sampleCount(data.size())
                .period(periodLabel(effective.getWindowSize()))
                .lastUpdated(now)
                .build();

        Instant createdAt = store.getBaseline(metricName).map(BaselineRecord::getCreatedAt).orElse(now);
        store.saveBaseline(new BaselineRecord(metricName, baseline, effective, createdAt, now));
        LOG.debug("Built {} baseline for '{}': {}", effective.getCalculationMethod().id(), metricName, baseline);
        return BaselineResult.success(baseline);
    }

    /**
     * Rebuild an existing baseline from new data, reusing its config.
     *
     * @param preserveSeasonality keep the stored seasonal patterns; when
     *                            {@code false} they are dropped and
     *                            re-detected
     * @return the rebuild result, or empty if no baseline exists for the metric
     */
    public Optional<BaselineResult> updateBaseline(String metricName, List<DataPoint> newPoints,
            boolean preserveSeasonality) {
        Optional<BaselineRecord> existing = store.getBaseline(metricName);
        if (existing.isEmpty()) {
            LOG.warn("Cannot update baseline '{}': not found", metricName);
            return Optional.empty();
        }
        BaselineConfig config = existing.get().getConfig();
        if (!preserveSeasonality) {
            config = config.withSeasonality(SeasonalityConfig.disabled());
        }
        return Optional.of(build(metricName, newPoints, config, !preserveSeasonality));
    }

    /**
     * Build baselines for several metrics with seasonality auto-detection.
     *
     * <p>
     * A metric without valid data is logged and left out of the result.
     * </p>
     *
     * @return successfully built baselines keyed by metric name
     */
    public Map<String, Baseline> buildAll(Map<String, List<DataPoint>> metrics, BaselineConfig config) {
        Map<String, Baseline> built = new LinkedHashMap<>();
        for (Map.Entry<String, List<DataPoint>> e : metrics.entrySet()) {
            BaselineResult result = build(e.getKey(), e.getValue(), config, true);
            if (result.isSuccess()) {
                built.put(e.getKey(), result.orElseThrow());
            } else {
                LOG.warn("Skipping baseline for '{}': {}", e.getKey(),
                        result.getError().map(Throwable::getMessage).orElse("unknown error"));
            }
        }
        LOG.info("Built {}/{} baseline(s)", built.size(), metrics.size());
        return built;
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    public Optional<Baseline> getBaseline(String metricName) {
        return store.getBaseline(metricName).map(BaselineRecord::getBaseline);
    }

    public Optional<BaselineRecord> getBaselineRecord(String metricName) {
        return store.getBaseline(metricName);
    }

    /**
     * Stored baseline with its seasonal factor for {@code timestamp} re-applied
     * to the centre and spread.
     */
    public Optional<Baseline> getBaselineAt(String metricName, long timestamp) {
        return store.getBaseline(metricName).map(record -> {
            SeasonalityConfig seasonal = record.getConfig().getSeasonality();
            if (!seasonal.isActive()) {
                return record.getBaseline();
            }
            return record.getBaseline().scaledBy(seasonality.getAdjustment(timestamp, seasonal));
        });
    }

    public boolean needsUpdate(String metricName) {
        return needsUpdate(metricName, DEFAULT_MAX_AGE);
    }

    /** @return {@code true} if no baseline exists or it is older than {@code maxAge} */
    public boolean needsUpdate(String metricName, Duration maxAge) {
        return getBaseline(metricName)
                .map(b -> Duration.between(b.getLastUpdated(), clock.instant()).compareTo(maxAge) > 0)
                .orElse(true);
    }

    public OptionalDouble getExpectedValue(String metricName, long timestamp) {
        return getBaselineAt(metricName, timestamp)
                .map(b -> OptionalDouble.of(b.getMean()))
                .orElse(OptionalDouble.empty());
    }

    /**
     * @param sigmas half-width of the band in standard deviations
     * @return {@code mean ± sigmas·stdDev} with seasonality re-applied
     */
    public Optional<ExpectedRange> getExpectedRange(String metricName, long timestamp, double sigmas) {
        return getBaselineAt(metricName, timestamp)
                .map(b -> new ExpectedRange(b.getMean() - sigmas * b.getStdDev(),
                        b.getMean() + sigmas * b.getStdDev()));
    }

    public Map<String, Baseline> getAllBaselines() {
        Map<String, Baseline> out = new LinkedHashMap<>();
        for (BaselineRecord r : store.getAllBaselines()) {
            out.put(r.getMetricName(), r.getBaseline());
        }
        return out;
    }

    public boolean deleteBaseline(String metricName) {
        boolean removed = store.deleteBaseline(metricName);
        if (!removed) {
            LOG.warn("Cannot delete baseline '{}': not found", metricName);
        }
        return removed;
    }

    // ---------------------------------------------------------------
    // Estimators
    // ---------------------------------------------------------------

    Baseline.Builder fit(double[] values, BaselineConfig config) {
        Baseline.Builder builder = switch (config.getCalculationMethod()) {
            case MOVING_AVERAGE -> movingAverage(values, config.getWindowSize());
            case EXPONENTIAL_SMOOTHING -> exponentialSmoothing(values);
            case PERCENTILE -> percentile(values);
            case MEDIAN -> median(values);
        };
        return builder
                .p5(Statistics.percentile(values, 0.05))
                .p25(Statistics.percentile(values, 0.25))
                .median(Statistics.median(values))
                .p75(Statistics.percentile(values, 0.75))
                .p95(Statistics.percentile(values, 0.95));
    }

    private Baseline.Builder movingAverage(double[] values, int windowSize) {
        int window = Math.min(values.length, windowSize);
        SummaryStats stats = Statistics.summarize(Arrays.copyOfRange(values, values.length - window, values.length));
        return Baseline.builder()
                .mean(stats.getMean())
                .stdDev(stats.getStdDev())
                .min(stats.getMin())
                .max(stats.getMax());
    }

    private Baseline.Builder exponentialSmoothing(double[] values) {
        double level = values[0];
        for (int i = 1; i < values.length; i++) {
            level = SMOOTHING_ALPHA * values[i] + (1 - SMOOTHING_ALPHA) * level;
        }
        double variance = 0;
        int n = values.length;
        for (int i = 0; i < n; i++) {
            double weight = Math.pow(1 - SMOOTHING_ALPHA, n - 1 - i);
            variance += weight * (values[i] - level) * (values[i] - level);
        }
        variance /= n;
        SummaryStats stats = Statistics.summarize(values);
        return Baseline.builder()
                .mean(level)
                .stdDev(Math.sqrt(variance))
                .min(stats.getMin())
                .max(stats.getMax());
    }

    private Baseline.Builder percentile(double[] values) {
        SummaryStats stats = Statistics.summarize(values);
        return Baseline.builder()
                .mean(stats.getMedian())
                .stdDev(stats.getIqr() / IQR_TO_STDDEV)
                .min(Statistics.percentile(values, 0.05))
                .max(Statistics.percentile(values, 0.95));
    }

    private Baseline.Builder median(double[] values) {
        SummaryStats stats = Statistics.summarize(values);
        return Baseline.builder()
                .mean(stats.getMedian())
                .stdDev(Statistics.mad(values) * Statistics.MAD_TO_STDDEV)
                .min(stats.getMin())
                .max(stats.getMax());
    }

    /**
     * Label describing the window size: days up to a week, weeks up to a
     * month, months beyond.
     */
    static String periodLabel(int windowSize) {
        if (windowSize <= 7) {
            return windowSize + "d";
        }
        if (windowSize <= 30) {
            return Math.round(windowSize / 7.0) + "w";
        }
        return Math.round(windowSize / 30.0) + "m";
    }
}
