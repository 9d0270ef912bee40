package com.qualitysentinel.core.algorithms;

import com.qualitysentinel.core.model.ExecutionResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ConsecutivePattern}.
 */
class ConsecutivePatternTest {

    @Test
    @DisplayName("Four failures after a pass form a failure streak")
    void shouldDetectFailureStreak() {
        List<ExecutionResult> results = List.of(
                ExecutionResult.passed(1),
                ExecutionResult.failed(2),
                ExecutionResult.failed(3),
                ExecutionResult.failed(4),
                ExecutionResult.failed(5));

        ConsecutivePattern.StreakResult result = ConsecutivePattern.detectConsecutiveFailures(results);

        assertThat(result.isAnomaly()).isTrue();
        assertThat(result.getConsecutiveFailures()).isEqualTo(4);
        assertThat(result.getConsecutiveSuccesses()).isZero();
        assertThat(result.getPattern()).isEqualTo(StreakPattern.CONSECUTIVE_FAILURES);
    }

    @Test
    @DisplayName("Two trailing failures stay under the default threshold")
    void shouldIgnoreShortStreak() {
        List<ExecutionResult> results = List.of(
                ExecutionResult.passed(1),
                ExecutionResult.passed(2),
                ExecutionResult.failed(3),
                ExecutionResult.failed(4));

        ConsecutivePattern.StreakResult result = ConsecutivePattern.detectConsecutiveFailures(results);

        assertThat(result.isAnomaly()).isFalse();
        assertThat(result.getConsecutiveFailures()).isEqualTo(2);
    }

    @Test
    @DisplayName("Order of the input list does not matter")
    void shouldSortByTimestamp() {
        List<ExecutionResult> results = List.of(
                ExecutionResult.failed(5),
                ExecutionResult.failed(3),
                ExecutionResult.passed(1),
                ExecutionResult.failed(4));

        ConsecutivePattern.StreakResult result = ConsecutivePattern.detectConsecutiveFailures(results);

        assertThat(result.getConsecutiveFailures()).isEqualTo(3);
        assertThat(result.getFailureStreak()).extracting(ExecutionResult::getTimestamp).containsExactly(5L, 4L, 3L);
    }

    @Test
    @DisplayName("Strictly alternating results are flaky")
    void shouldDetectFlaky() {
        List<ExecutionResult> results = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            results.add(i % 2 == 0 ? ExecutionResult.passed(i) : ExecutionResult.failed(i));
        }

        ConsecutivePattern.FlakyResult result = ConsecutivePattern.detectFlaky(results);

        assertThat(result.isFlaky()).isTrue();
        assertThat(result.getAlternations()).isEqualTo(9);
        assertThat(result.getFlakyScore()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    @DisplayName("Should report a pass-rate drop between windows")
    void shouldDetectPassRateDrop() {
        List<ExecutionResult> results = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            results.add(ExecutionResult.passed(i));
        }
        for (int i = 10; i < 20; i++) {
            results.add(i < 15 ? ExecutionResult.failed(i) : ExecutionResult.passed(i));
        }

        ConsecutivePattern.PassRateChange change = ConsecutivePattern.detectPassRateChange(results);

        assertThat(change.hasChange()).isTrue();
        assertThat(change.getPreviousRate()).isEqualTo(1.0);
        assertThat(change.getCurrentRate()).isCloseTo(0.5, within(1e-9));
        assertThat(change.getChange()).isCloseTo(-0.5, within(1e-9));
    }
}
