package com.qualitysentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * One weighted input to a severity score.
 *
 * <p>
 * {@code contribution} is the number of score points this factor added before
 * the anomaly-type multiplier is applied. The {@code type_modifier} factor
 * carries the multiplier in {@code value} and contributes zero points.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeverityFactor implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final double weight;
    private final double value;
    private final double contribution;

    public SeverityFactor(String name, double weight, double value, double contribution) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.weight = weight;
        this.value = value;
        this.contribution = contribution;
    }

    public String getName() {
        return name;
    }

    public double getWeight() {
        return weight;
    }

    public double getValue() {
        return value;
    }

    public double getContribution() {
        return contribution;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeverityFactor that))
            return false;
        return Double.compare(weight, that.weight) == 0
                && Double.compare(value, that.value) == 0
                && Double.compare(contribution, that.contribution) == 0
                && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, weight, value, contribution);
    }

    @Override
    public String toString() {
        return "SeverityFactor{" +
                "name='" + name + '\'' +
                ", weight=" + weight +
                ", value=" + value +
                ", contribution=" + contribution +
                '}';
    }
}
