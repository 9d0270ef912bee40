package com.qualitysentinel.core.stats;

import com.qualitysentinel.core.model.DataPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link DataPreprocessor}.
 */
class DataPreprocessorTest {

    private final DataPreprocessor preprocessor = new DataPreprocessor();

    @Test
    @DisplayName("Should interpolate points into a wide gap")
    void shouldFillGapLinearly() {
        List<DataPoint> data = List.of(
                DataPoint.of(0, 10),
                DataPoint.of(1000, 20),
                DataPoint.of(2000, 30),
                DataPoint.of(5000, 60));

        List<DataPoint> filled = preprocessor.fillMissing(data, PreprocessConfig.FillMethod.LINEAR);

        assertThat(filled).hasSize(6);
        assertThat(filled.get(3).getTimestamp()).isEqualTo(3000);
        assertThat(filled.get(3).getValue()).isCloseTo(40, within(1e-9));
        assertThat(filled.get(4).getValue()).isCloseTo(50, within(1e-9));
    }

    @Test
    @DisplayName("Should drop a single extreme value and report it")
    void shouldRemoveOutlier() {
        List<DataPoint> data = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            data.add(DataPoint.of(i * 1000L, 10));
        }
        data.add(DataPoint.of(10_000, 1000));

        PreprocessResult result = preprocessor.preprocess(data, PreprocessConfig.builder()
                .fillMissing(false)
                .build());

        assertThat(result.getRemovedOutliers()).isEqualTo(1);
        assertThat(result.getData()).hasSize(10);
        assertThat(result.getStats().getMax()).isEqualTo(10);
    }

    @Test
    @DisplayName("Should sort unordered input by timestamp")
    void shouldSortInput() {
        List<DataPoint> data = List.of(DataPoint.of(3000, 3), DataPoint.of(1000, 1), DataPoint.of(2000, 2));

        PreprocessResult result = preprocessor.preprocess(data, PreprocessConfig.builder()
                .outlierRemoval(false)
                .build());

        assertThat(result.getData()).extracting(DataPoint::getValue).containsExactly(1.0, 2.0, 3.0);
    }

    @Test
    @DisplayName("A steady climb is reported as an upward trend")
    void shouldDetectTrend() {
        List<DataPoint> data = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            data.add(DataPoint.of(i, i * 2.0));
        }

        TrendInfo trend = preprocessor.detectTrend(data);

        assertThat(trend.hasTrend()).isTrue();
        assertThat(trend.getDirection()).isEqualTo(TrendInfo.Direction.UP);
        assertThat(trend.getSlope()).isCloseTo(2.0, within(1e-9));
    }

    @Test
    @DisplayName("Aggregation buckets on epoch-aligned boundaries")
    void shouldAggregate() {
        List<DataPoint> data = List.of(
                DataPoint.of(100, 1),
                DataPoint.of(900, 2),
                DataPoint.of(1100, 5));

        List<DataPoint> buckets = preprocessor.aggregate(data, 1000, AggregateMethod.SUM);

        assertThat(buckets).extracting(DataPoint::getTimestamp).containsExactly(0L, 1000L);
        assertThat(buckets).extracting(DataPoint::getValue).containsExactly(3.0, 5.0);
    }
}
