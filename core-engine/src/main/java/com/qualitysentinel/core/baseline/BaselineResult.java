package com.qualitysentinel.core.baseline;

import com.qualitysentinel.core.model.Baseline;

import java.util.Objects;
import java.util.Optional;

/**
 * Either a fitted {@link Baseline} or the {@link EmptyBaselineInputException}
 * explaining why none could be fitted.
 *
 * <p>
 * Returned instead of throwing so that callers handle the empty case
 * explicitly.
 * </p>
 *
 * @since 1.0.0
 */
public final class BaselineResult {

    private final Baseline baseline;
    private final EmptyBaselineInputException error;

    private BaselineResult(Baseline baseline, EmptyBaselineInputException error) {
        this.baseline = baseline;
        this.error = error;
    }

    public static BaselineResult success(Baseline baseline) {
        return new BaselineResult(Objects.requireNonNull(baseline, "baseline must not be null"), null);
    }

    public static BaselineResult empty(String metricName) {
        return new BaselineResult(null, new EmptyBaselineInputException(metricName));
    }

    public boolean isSuccess() {
        return baseline != null;
    }

    public Optional<Baseline> getBaseline() {
        return Optional.ofNullable(baseline);
    }

    public Optional<EmptyBaselineInputException> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * @return the baseline
     * @throws EmptyBaselineInputException if building failed
     */
    public Baseline orElseThrow() {
        if (error != null) {
            throw error;
        }
        return baseline;
    }

    @Override
    public String toString() {
        return isSuccess() ? "BaselineResult{" + baseline + '}' : "BaselineResult{error=" + error.getMessage() + '}';
    }
}
