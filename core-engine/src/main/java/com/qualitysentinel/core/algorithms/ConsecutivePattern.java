package com.qualitysentinel.core.algorithms;

import com.qualitysentinel.core.model.ExecutionResult;
import com.qualitysentinel.core.stats.Statistics;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Pass/fail series analysis: failure streaks, flakiness, pass-rate shifts and
 * failure trend.
 *
 * <p>
 * Inputs may arrive in any order; every method sorts by timestamp first.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConsecutivePattern {

    public static final int DEFAULT_FAILURE_THRESHOLD = 3;
    public static final int DEFAULT_SUCCESS_THRESHOLD = 2;
    public static final int DEFAULT_MIN_EXECUTIONS = 5;
    public static final double DEFAULT_FLAKY_THRESHOLD = 0.3;
    public static final int DEFAULT_RATE_WINDOW = 10;
    public static final double DEFAULT_RATE_CHANGE_THRESHOLD = 0.3;
    public static final int DEFAULT_TREND_WINDOW = 5;

    static final double TREND_SLOPE = 0.05;
    static final int INTERMITTENT_LOOKBACK = 10;

    private static final Comparator<ExecutionResult> OLDEST_FIRST =
            Comparator.comparingLong(ExecutionResult::getTimestamp);

    private ConsecutivePattern() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Result types
    // ---------------------------------------------------------------

    /** Outcome of {@link #detectConsecutiveFailures}. */
    public static final class StreakResult {
        private final boolean anomaly;
        private final int consecutiveFailures;
        private final int consecutiveSuccesses;
        private final List<ExecutionResult> failureStreak;
        private final StreakPattern pattern;

        StreakResult(boolean anomaly, int consecutiveFailures, int consecutiveSuccesses,
                List<ExecutionResult> failureStreak, StreakPattern pattern) {
            this.anomaly = anomaly;
            this.consecutiveFailures = consecutiveFailures;
            this.consecutiveSuccesses = consecutiveSuccesses;
            this.failureStreak = List.copyOf(failureStreak);
            this.pattern = pattern;
        }

        public boolean isAnomaly() {
            return anomaly;
        }

        public int getConsecutiveFailures() {
            return consecutiveFailures;
        }

        public int getConsecutiveSuccesses() {
            return consecutiveSuccesses;
        }

        /** @return failing results of the current streak, newest first */
        public List<ExecutionResult> getFailureStreak() {
            return failureStreak;
        }

        public StreakPattern getPattern() {
            return pattern;
        }
    }

    /** Outcome of {@link #detectFlaky}. */
    public static final class FlakyResult {
        private final boolean flaky;
        private final double flakyScore;
        private final int alternations;

        FlakyResult(boolean flaky, double flakyScore, int alternations) {
            this.flaky = flaky;
            this.flakyScore = flakyScore;
            this.alternations = alternations;
        }

        public boolean isFlaky() {
            return flaky;
        }

        /** @return alternations / (n - 1) */
        public double getFlakyScore() {
            return flakyScore;
        }

        public int getAlternations() {
            return alternations;
        }
    }

    /** Outcome of {@link #detectPassRateChange}. */
    public static final class PassRateChange {
        private final boolean changed;
        private final double previousRate;
        private final double currentRate;

        PassRateChange(boolean changed, double previousRate, double currentRate) {
            this.changed = changed;
            this.previousRate = previousRate;
            this.currentRate = currentRate;
        }

        public boolean hasChange() {
            return changed;
        }

        public double getPreviousRate() {
            return previousRate;
        }

        public double getCurrentRate() {
            return currentRate;
        }

        /** @return {@code currentRate - previousRate} */
        public double getChange() {
            return currentRate - previousRate;
        }
    }

    /** Direction of the failure rate over consecutive windows. */
    public enum TrendDirection {
        INCREASING, DECREASING, STABLE
    }

    /** Outcome of {@link #failureTrend}. */
    public static final class FailureTrend {
        private final TrendDirection direction;
        private final double slope;

        FailureTrend(TrendDirection direction, double slope) {
            this.direction = direction;
            this.slope = slope;
        }

        public TrendDirection getDirection() {
            return direction;
        }

        public double getSlope() {
            return slope;
        }
    }

    // ---------------------------------------------------------------
    // Detection
    // ---------------------------------------------------------------

    public static StreakResult detectConsecutiveFailures(List<ExecutionResult> results) {
        return detectConsecutiveFailures(results, DEFAULT_FAILURE_THRESHOLD, DEFAULT_SUCCESS_THRESHOLD);
    }

    /**
     * Count the unbroken run at the newest end of the series.
     *
     * <p>
     * Exactly one of the failure and success counts is non-zero for a
     * non-empty series. The pattern is {@code consecutive_failures} at or above
     * {@code failureThreshold}, {@code stable} for a success run of at least
     * {@code successThreshold}, {@code recovering} for a shorter success run
     * that follows a failure, otherwise {@code intermittent} when the last ten
     * results fail between 30% and 70% of the time, else {@code stable}.
     * </p>
     */
    public static StreakResult detectConsecutiveFailures(List<ExecutionResult> results,
            int failureThreshold, int successThreshold) {
        if (results.isEmpty()) {
            return new StreakResult(false, 0, 0, List.of(), StreakPattern.STABLE);
        }
        List<ExecutionResult> newestFirst = new ArrayList<>(results);
        newestFirst.sort(OLDEST_FIRST.reversed());

        int failures = 0;
        int successes = 0;
        List<ExecutionResult> streak = new ArrayList<>();
        for (ExecutionResult r : newestFirst) {
            if (!r.isPassed()) {
                if (successes > 0) {
                    break;
                }
                failures++;
                streak.add(r);
            } else {
                if (failures > 0) {
                    break;
                }
                successes++;
            }
        }

        StreakPattern pattern;
        if (failures >= failureThreshold) {
            pattern = StreakPattern.CONSECUTIVE_FAILURES;
        } else if (successes >= successThreshold) {
            pattern = StreakPattern.STABLE;
        } else if (successes > 0 && successes < newestFirst.size()) {
            // a short success run that ends a failure
            pattern = StreakPattern.RECOVERING;
        } else {
            List<ExecutionResult> recent = newestFirst.subList(0, Math.min(INTERMITTENT_LOOKBACK, newestFirst.size()));
            double failRate = (double) countFailures(recent) / recent.size();
            pattern = failRate > 0.3 && failRate < 0.7 ? StreakPattern.INTERMITTENT : StreakPattern.STABLE;
        }
        return new StreakResult(failures >= failureThreshold, failures, successes, streak, pattern);
    }

    public static FlakyResult detectFlaky(List<ExecutionResult> results) {
        return detectFlaky(results, DEFAULT_MIN_EXECUTIONS, DEFAULT_FLAKY_THRESHOLD);
    }

    /**
     * Flag alternating pass/fail behaviour.
     *
     * <p>
     * Flaky when {@code alternations / (n - 1) >= flakyThreshold} and the pass
     * rate lies strictly between 20% and 80%. Fewer than
     * {@code minExecutions} results are never flaky.
     * </p>
     */
    public static FlakyResult detectFlaky(List<ExecutionResult> results, int minExecutions, double flakyThreshold) {
        if (results.size() < minExecutions || results.size() < 2) {
            return new FlakyResult(false, 0, 0);
        }
        List<ExecutionResult> sorted = new ArrayList<>(results);
        sorted.sort(OLDEST_FIRST);

        int alternations = 0;
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i).isPassed() != sorted.get(i - 1).isPassed()) {
                alternations++;
            }
        }
        double score = (double) alternations / (sorted.size() - 1);
        double passRate = 1.0 - (double) countFailures(sorted) / sorted.size();
        boolean balanced = passRate > 0.2 && passRate < 0.8;
        return new FlakyResult(score >= flakyThreshold && balanced, score, alternations);
    }

    public static PassRateChange detectPassRateChange(List<ExecutionResult> results) {
        return detectPassRateChange(results, DEFAULT_RATE_WINDOW, DEFAULT_RATE_CHANGE_THRESHOLD);
    }

    /**
     * Compare the pass rate of the newest {@code windowSize} results with the
     * window before it. Needs at least {@code 2 · windowSize} results.
     */
    public static PassRateChange detectPassRateChange(List<ExecutionResult> results, int windowSize,
            double changeThreshold) {
        if (results.size() < windowSize * 2) {
            return new PassRateChange(false, 0, 0);
        }
        List<ExecutionResult> sorted = new ArrayList<>(results);
        sorted.sort(OLDEST_FIRST);
        int mid = sorted.size() - windowSize;
        double previous = passRate(sorted.subList(mid - windowSize, mid));
        double current = passRate(sorted.subList(mid, sorted.size()));
        return new PassRateChange(Math.abs(current - previous) >= changeThreshold, previous, current);
    }

    public static FailureTrend failureTrend(List<ExecutionResult> results) {
        return failureTrend(results, DEFAULT_TREND_WINDOW);
    }

    /**
     * Least-squares slope of failure rates over consecutive non-overlapping
     * windows; {@code > 0.05} is increasing, {@code < -0.05} decreasing.
     */
    public static FailureTrend failureTrend(List<ExecutionResult> results, int windowSize) {
        if (results.size() < windowSize * 2) {
            return new FailureTrend(TrendDirection.STABLE, 0);
        }
        List<ExecutionResult> sorted = new ArrayList<>(results);
        sorted.sort(OLDEST_FIRST);
        List<Double> rates = new ArrayList<>();
        for (int end = windowSize; end <= sorted.size(); end += windowSize) {
            rates.add((double) countFailures(sorted.subList(end - windowSize, end)) / windowSize);
        }

        int n = rates.size();
        double xMean = (n - 1) / 2.0;
        double yMean = Statistics.mean(Statistics.toArray(rates));
        double numerator = 0;
        double denominator = 0;
        for (int i = 0; i < n; i++) {
            numerator += (i - xMean) * (rates.get(i) - yMean);
            denominator += (i - xMean) * (i - xMean);
        }
        double slope = Statistics.safeDivide(numerator, denominator);

        TrendDirection direction;
        if (slope > TREND_SLOPE) {
            direction = TrendDirection.INCREASING;
        } else if (slope < -TREND_SLOPE) {
            direction = TrendDirection.DECREASING;
        } else {
            direction = TrendDirection.STABLE;
        }
        return new FailureTrend(direction, slope);
    }

    private static int countFailures(List<ExecutionResult> results) {
        int count = 0;
        for (ExecutionResult r : results) {
            if (!r.isPassed()) {
                count++;
            }
        }
        return count;
    }

    private static double passRate(List<ExecutionResult> results) {
        return 1.0 - (double) countFailures(results) / results.size();
    }
}
