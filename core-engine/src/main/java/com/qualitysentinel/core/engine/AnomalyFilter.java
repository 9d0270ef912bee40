package com.qualitysentinel.core.engine;

import com.qualitysentinel.core.model.Anomaly;
import com.qualitysentinel.core.model.AnomalyType;
import com.qualitysentinel.core.model.Severity;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Optional narrowing of an anomaly listing. Empty criteria match everything.
 *
 * @since 1.0.0
 */
public final class AnomalyFilter implements Predicate<Anomaly> {

    private static final AnomalyFilter NONE = builder().build();

    private final Set<Severity> severities;
    private final Set<AnomalyType> types;
    private final String caseId;

    private AnomalyFilter(Builder b) {
        this.severities = Collections.unmodifiableSet(b.severities);
        this.types = Collections.unmodifiableSet(b.types);
        this.caseId = b.caseId;
    }

    public static AnomalyFilter none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean test(Anomaly anomaly) {
        if (!severities.isEmpty() && !severities.contains(anomaly.getSeverity())) {
            return false;
        }
        if (!types.isEmpty() && !types.contains(anomaly.getType())) {
            return false;
        }
        return caseId == null || anomaly.getCaseId().map(caseId::equals).orElse(false);
    }

    public Set<Severity> getSeverities() {
        return severities;
    }

    public Set<AnomalyType> getTypes() {
        return types;
    }

    public static class Builder {

        private final Set<Severity> severities = EnumSet.noneOf(Severity.class);
        private final Set<AnomalyType> types = EnumSet.noneOf(AnomalyType.class);
        private String caseId;

        private Builder() {
        }

        public Builder severity(Severity... values) {
            Collections.addAll(severities, values);
            return this;
        }

        public Builder type(AnomalyType... values) {
            Collections.addAll(types, values);
            return this;
        }

        public Builder caseId(String caseId) {
            this.caseId = caseId;
            return this;
        }

        public AnomalyFilter build() {
            return new AnomalyFilter(this);
        }
    }
}
