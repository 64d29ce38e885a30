package com.gov.kpianalytics.engine.anomaly;

import com.gov.kpianalytics.model.AnomalyDirection;
import com.gov.kpianalytics.model.AnomalySeverity;

import java.util.Locale;

/**
 * Maps z-score magnitudes to severity tiers and renders anomaly descriptions.
 */
public class SeverityClassifier {

    private final double warningThreshold;
    private final double criticalThreshold;

    public SeverityClassifier(double warningThreshold, double criticalThreshold) {
        if (criticalThreshold < warningThreshold) {
            throw new IllegalArgumentException(String.format(
                    "Critical threshold (%.2f) must not be below warning threshold (%.2f)",
                    criticalThreshold, warningThreshold));
        }
        this.warningThreshold = warningThreshold;
        this.criticalThreshold = criticalThreshold;
    }

    public AnomalySeverity classify(double zScore) {
        double absZ = Math.abs(zScore);
        if (absZ >= criticalThreshold) return AnomalySeverity.CRITICAL;
        if (absZ >= warningThreshold) return AnomalySeverity.WARNING;
        return AnomalySeverity.INFO;
    }

    /**
     * Severity for a point already known to be an outlier, so never INFO.
     */
    public AnomalySeverity classifyFlagged(double zScore) {
        return Math.abs(zScore) >= criticalThreshold ? AnomalySeverity.CRITICAL : AnomalySeverity.WARNING;
    }

    public boolean exceedsWarning(double zScore) {
        return Math.abs(zScore) >= warningThreshold;
    }

    public static AnomalyDirection direction(double zScore) {
        return zScore > 0 ? AnomalyDirection.HIGH : AnomalyDirection.LOW;
    }

    public static boolean isFavourable(AnomalyDirection direction, boolean higherIsBetter) {
        return higherIsBetter ? direction == AnomalyDirection.HIGH : direction == AnomalyDirection.LOW;
    }

    /**
     * e.g. "Concerning anomaly: Value is 12.3% below expected (Z-score: -2.71)"
     */
    public static String describeZScore(AnomalyDirection direction, boolean higherIsBetter,
                                        double deviationPct, double zScore) {
        String prefix = isFavourable(direction, higherIsBetter) ? "Positive anomaly" : "Concerning anomaly";
        return String.format(Locale.ROOT, "%s: Value is %.1f%% %s expected (Z-score: %.2f)",
                prefix, Math.abs(deviationPct), direction.verb(), zScore);
    }

    public static String describeIsolation(AnomalyDirection direction, double zScore) {
        return String.format(Locale.ROOT, "IsolationForest anomaly: %s deviation (z=%.2f)",
                direction.code(), zScore);
    }

    public double getWarningThreshold() { return warningThreshold; }
    public double getCriticalThreshold() { return criticalThreshold; }
}
