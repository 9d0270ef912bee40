package com.qualitysentinel.core.engine;

import com.qualitysentinel.core.model.Anomaly;
import com.qualitysentinel.core.model.AnomalyStatus;
import com.qualitysentinel.core.model.AnomalyType;
import com.qualitysentinel.core.model.Severity;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Counts of anomalies by severity, type and status. Every enum constant has
 * an entry, zero when absent.
 *
 * @since 1.0.0
 */
public final class AnomalyStatistics {

    private final int total;
    private final Map<Severity, Integer> bySeverity;
    private final Map<AnomalyType, Integer> byType;
    private final Map<AnomalyStatus, Integer> byStatus;

    private AnomalyStatistics(int total, Map<Severity, Integer> bySeverity, Map<AnomalyType, Integer> byType,
            Map<AnomalyStatus, Integer> byStatus) {
        this.total = total;
        this.bySeverity = Collections.unmodifiableMap(bySeverity);
        this.byType = Collections.unmodifiableMap(byType);
        this.byStatus = Collections.unmodifiableMap(byStatus);
    }

    static AnomalyStatistics of(Collection<Anomaly> anomalies) {
        Map<Severity, Integer> bySeverity = zeroed(Severity.class);
        Map<AnomalyType, Integer> byType = zeroed(AnomalyType.class);
        Map<AnomalyStatus, Integer> byStatus = zeroed(AnomalyStatus.class);
        for (Anomaly a : anomalies) {
            bySeverity.merge(a.getSeverity(), 1, Integer::sum);
            byType.merge(a.getType(), 1, Integer::sum);
            byStatus.merge(a.getStatus(), 1, Integer::sum);
        }
        return new AnomalyStatistics(anomalies.size(), bySeverity, byType, byStatus);
    }

    private static <E extends Enum<E>> Map<E, Integer> zeroed(Class<E> type) {
        Map<E, Integer> m = new EnumMap<>(type);
        for (E e : type.getEnumConstants()) {
            m.put(e, 0);
        }
        return m;
    }

    public int getTotal() {
        return total;
    }

    public Map<Severity, Integer> getBySeverity() {
        return bySeverity;
    }

    public Map<AnomalyType, Integer> getByType() {
        return byType;
    }

    public Map<AnomalyStatus, Integer> getByStatus() {
        return byStatus;
    }

    @Override
    public String toString() {
        return "AnomalyStatistics{total=" + total + ", bySeverity=" + bySeverity + ", byStatus=" + byStatus + '}';
    }
}
