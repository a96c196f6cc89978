package com.apimonitor.anomaly.detection.engine;

import com.apimonitor.anomaly.detection.domain.Severity;

/**
 * Severity bands per detector and signal. A baseline value of zero or less means
 * no baseline, and the absolute bands apply instead.
 */
public final class SeverityClassifier {

    private SeverityClassifier() {
    }

    public static Severity modelResponseTime(double avgResponseTime, double baselineAvg) {
        if (baselineAvg > 0) {
            double deviation = avgResponseTime / baselineAvg;
            return deviation > 3 ? Severity.CRITICAL : deviation > 2 ? Severity.HIGH : Severity.MEDIUM;
        }
        return avgResponseTime > 1000 ? Severity.HIGH : Severity.MEDIUM;
    }

    public static Severity modelErrorRate(double errorRate, double baselineRate) {
        if (baselineRate > 0) {
            return band(errorRate, Math.max(0.1, 5 * baselineRate), Math.max(0.05, 3 * baselineRate));
        }
        return band(errorRate, 0.2, 0.1);
    }

    public static Severity thresholdResponseTime(double avgResponseTime, double baselineAvg) {
        if (baselineAvg > 0) {
            double deviation = avgResponseTime / baselineAvg;
            return deviation > 4 ? Severity.CRITICAL : deviation > 2.5 ? Severity.HIGH : Severity.MEDIUM;
        }
        return band(avgResponseTime, 5000, 3000);
    }

    public static Severity thresholdErrorRate(double errorRate, double baselineRate) {
        if (baselineRate > 0) {
            return band(errorRate, Math.max(0.2, 5 * baselineRate), Math.max(0.1, 3 * baselineRate));
        }
        return band(errorRate, 0.3, 0.2);
    }

    private static Severity band(double value, double critical, double high) {
        if (value > critical) {
            return Severity.CRITICAL;
        }
        return value > high ? Severity.HIGH : Severity.MEDIUM;
    }
}
