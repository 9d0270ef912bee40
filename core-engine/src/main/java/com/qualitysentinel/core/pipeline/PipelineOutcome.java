package com.qualitysentinel.core.pipeline;

import com.qualitysentinel.core.alert.AlertNotification;
import com.qualitysentinel.core.engine.DetectionResult;
import com.qualitysentinel.core.model.AnomalyAlert;

import java.util.Objects;
import java.util.Optional;

/**
 * What happened to one metric sample: the detection result and, for
 * anomalies, the alert decision.
 *
 * @since 1.0.0
 */
public final class PipelineOutcome {

    private final DetectionResult detection;
    private final AlertNotification notification;

    PipelineOutcome(DetectionResult detection, AlertNotification notification) {
        this.detection = Objects.requireNonNull(detection, "detection must not be null");
        this.notification = notification;
    }

    public DetectionResult getDetection() {
        return detection;
    }

    public Optional<AlertNotification> getNotification() {
        return Optional.ofNullable(notification);
    }

    /** @return the alert to publish, present only when it was not suppressed */
    public Optional<AnomalyAlert> getSurfacedAlert() {
        return getNotification().filter(AlertNotification::shouldNotify).map(AlertNotification::getAlert);
    }

    @Override
    public String toString() {
        return "PipelineOutcome{" + detection + (notification != null ? ", " + notification : "") + '}';
    }
}
