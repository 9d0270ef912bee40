package com.qualitysentinel.core.baseline;

import com.qualitysentinel.core.model.Baseline;
import com.qualitysentinel.core.model.DataPoint;
import com.qualitysentinel.core.seasonality.SeasonalityAnalyzer;
import com.qualitysentinel.core.stats.DataPreprocessor;
import com.qualitysentinel.core.storage.InMemoryAnomalyStore;
import com.qualitysentinel.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link BaselineBuilder}.
 */
class BaselineBuilderTest {

    private static final Instant NOW = Instant.parse("2024-03-10T00:00:00Z");
    private static final Instant SERIES_START = Instant.parse("2024-03-04T00:00:00Z");

    private MutableClock clock;
    private InMemoryAnomalyStore store;
    private BaselineBuilder builder;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        store = new InMemoryAnomalyStore();
        builder = new BaselineBuilder(store, new DataPreprocessor(), new SeasonalityAnalyzer(), clock);
    }

    @Test
    @DisplayName("No valid points yields an empty-input error and stores nothing")
    void shouldReportEmptyInput() {
        BaselineResult result = builder.build("suite:duration", List.of(), BaselineConfig.defaults());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isPresent();
        assertThat(result.getError().get()).hasMessageContaining("suite:duration");
        assertThat(store.getBaseline("suite:duration")).isEmpty();
    }

    @Test
    @DisplayName("Moving average uses only the most recent window")
    void shouldFitMovingAverage() {
        BaselineConfig config = BaselineConfig.builder()
                .calculationMethod(BaselineMethod.MOVING_AVERAGE)
                .windowSize(3)
                .excludeAnomalies(false)
                .build();

        Baseline baseline = builder.build("m", series(1, 2, 3, 4, 5, 6, 7, 8, 9, 10), config).orElseThrow();

        assertThat(baseline.getMean()).isCloseTo(9, within(1e-9));
        assertThat(baseline.getMin()).isEqualTo(8);
        assertThat(baseline.getMax()).isEqualTo(10);
        assertThat(baseline.getSampleCount()).isEqualTo(10);
        assertThat(baseline.getPeriod()).isEqualTo("3d");
        assertThat(baseline.getLastUpdated()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Median method is robust to a single extreme value")
    void shouldFitMedian() {
        BaselineConfig config = BaselineConfig.builder()
                .calculationMethod(BaselineMethod.MEDIAN)
                .excludeAnomalies(false)
                .build();

        Baseline baseline = builder.build("m", series(10, 10, 10, 11, 100), config).orElseThrow();

        assertThat(baseline.getMean()).isEqualTo(10);
        assertThat(baseline.getMax()).isEqualTo(100);
        assertThat(baseline.getMedian()).contains(10.0);
    }

    @Test
    @DisplayName("Exponential smoothing leans towards recent values")
    void shouldFitExponentialSmoothing() {
        BaselineConfig config = BaselineConfig.builder()
                .calculationMethod(BaselineMethod.EXPONENTIAL_SMOOTHING)
                .excludeAnomalies(false)
                .build();

        Baseline baseline = builder.build("m", series(10, 10, 20), config).orElseThrow();

        // level 0.3 * 20 + 0.7 * 10; squared residuals weighted 0.49, 0.7, 1
        assertThat(baseline.getMean()).isCloseTo(13, within(1e-9));
        assertThat(baseline.getStdDev()).isCloseTo(Math.sqrt((0.49 * 9 + 0.7 * 9 + 49) / 3), within(1e-9));
        assertThat(baseline.getMin()).isEqualTo(10);
        assertThat(baseline.getMax()).isEqualTo(20);
    }

    @Test
    @DisplayName("Percentile method centres on the median and clips to the 5th and 95th percentiles")
    void shouldFitPercentile() {
        double[] values = new double[21];
        for (int i = 0; i < 20; i++) {
            values[i] = i + 1;
        }
        values[20] = 500;
        BaselineConfig config = BaselineConfig.builder()
                .calculationMethod(BaselineMethod.PERCENTILE)
                .excludeAnomalies(false)
                .build();

        Baseline baseline = builder.build("m", series(values), config).orElseThrow();

        assertThat(baseline.getMean()).isEqualTo(11);
        assertThat(baseline.getStdDev()).isCloseTo(10 / 1.35, within(1e-9));
        assertThat(baseline.getMin()).isEqualTo(2);
        assertThat(baseline.getMax()).isEqualTo(20);
    }

    @Test
    @DisplayName("Rebuilding keeps the creation time and moves the update time")
    void shouldPreserveCreatedAt() {
        builder.build("m", series(1, 2, 3), BaselineConfig.defaults());
        clock.advance(Duration.ofHours(2));
        builder.build("m", series(4, 5, 6), BaselineConfig.defaults());

        BaselineRecord record = builder.getBaselineRecord("m").orElseThrow();
        assertThat(record.getCreatedAt()).isEqualTo(NOW);
        assertThat(record.getUpdatedAt()).isEqualTo(NOW.plus(Duration.ofHours(2)));
    }

    @Test
    @DisplayName("A baseline older than the max age needs an update")
    void shouldReportStaleness() {
        assertThat(builder.needsUpdate("m")).isTrue();

        builder.build("m", series(1, 2, 3), BaselineConfig.defaults());
        assertThat(builder.needsUpdate("m", Duration.ofHours(24))).isFalse();

        clock.advance(Duration.ofHours(25));
        assertThat(builder.needsUpdate("m", Duration.ofHours(24))).isTrue();
    }

    @Test
    @DisplayName("Detected seasonality is re-applied when reading the baseline back")
    void shouldScaleSeasonalBaseline() {
        List<DataPoint> data = new ArrayList<>();
        for (int h = 0; h < 96; h++) {
            int hourOfDay = h % 24;
            double value = hourOfDay >= 12 && hourOfDay < 18 ? 200 : 100;
            data.add(DataPoint.of(SERIES_START.plus(Duration.ofHours(h)).toEpochMilli(), value));
        }

        builder.build("m", data, BaselineConfig.defaults(), true);

        assertThat(builder.getBaselineRecord("m").orElseThrow().getConfig().getSeasonality().isActive()).isTrue();
        long afternoon = NOW.plus(Duration.ofHours(14)).toEpochMilli();
        long night = NOW.plus(Duration.ofHours(2)).toEpochMilli();
        assertThat(builder.getBaselineAt("m", afternoon).orElseThrow().getMean()).isCloseTo(200, within(1e-6));
        assertThat(builder.getBaselineAt("m", night).orElseThrow().getMean()).isCloseTo(100, within(1e-6));
        assertThat(builder.getBaseline("m").orElseThrow().getMean()).isCloseTo(125, within(1e-6));
    }

    @Test
    @DisplayName("Expected range spans mean plus or minus the requested sigmas")
    void shouldReturnExpectedRange() {
        BaselineConfig config = BaselineConfig.builder().excludeAnomalies(false).build();
        builder.build("m", series(8, 12, 8, 12), config);

        ExpectedRange range = builder.getExpectedRange("m", NOW.toEpochMilli(), 2).orElseThrow();

        assertThat(range.getLower()).isCloseTo(6, within(1e-9));
        assertThat(range.getUpper()).isCloseTo(14, within(1e-9));
    }

    private static List<DataPoint> series(double... values) {
        List<DataPoint> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            points.add(DataPoint.of(SERIES_START.plus(Duration.ofHours(i)).toEpochMilli(), values[i]));
        }
        return points;
    }
}
