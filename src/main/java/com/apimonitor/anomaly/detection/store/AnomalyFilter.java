package com.apimonitor.anomaly.detection.store;

import com.apimonitor.anomaly.detection.domain.Anomaly;
import com.apimonitor.anomaly.detection.domain.AnomalyType;
import com.apimonitor.anomaly.detection.domain.DetectorKind;
import com.apimonitor.anomaly.detection.domain.Severity;

/**
 * Criteria for listing recent anomalies. A null criterion matches everything;
 * {@code minSeverity} also matches every band above it.
 */
public record AnomalyFilter(AnomalyType type, Severity minSeverity, DetectorKind detector, String service) {

    public static final AnomalyFilter ANY = new AnomalyFilter(null, null, null, null);

    /**
     * Builds a filter from wire names such as {@code error_rate}, {@code high} or {@code ml_model}.
     *
     * @throws IllegalArgumentException if a value is not a known name
     */
    public static AnomalyFilter fromWireNames(String type, String minSeverity, String detector, String service) {
        return new AnomalyFilter(
                isBlank(type) ? null : AnomalyType.fromWireName(type),
                isBlank(minSeverity) ? null : Severity.fromWireName(minSeverity),
                isBlank(detector) ? null : DetectorKind.fromWireName(detector),
                isBlank(service) ? null : service);
    }

    public boolean matches(Anomaly anomaly) {
        if (type != null && anomaly.getType() != type) {
            return false;
        }
        if (minSeverity != null && (anomaly.getSeverity() == null || anomaly.getSeverity().compareTo(minSeverity) < 0)) {
            return false;
        }
        if (detector != null && anomaly.getDetector() != detector) {
            return false;
        }
        return service == null || service.equals(anomaly.getService());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
