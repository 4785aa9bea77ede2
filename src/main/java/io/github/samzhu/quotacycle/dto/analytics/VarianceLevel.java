package io.github.samzhu.quotacycle.dto.analytics;

/**
 * 計費週期峰值的離散程度。
 */
public enum VarianceLevel {
    HIGH("High Variance", InsightSeverity.WARNING),
    MODERATE("Usage Spread", InsightSeverity.INFO),
    CONSISTENT("Consistent", InsightSeverity.POSITIVE);

    private final String label;
    private final InsightSeverity severity;

    VarianceLevel(String label, InsightSeverity severity) {
        this.label = label;
        this.severity = severity;
    }

    public String label() {
        return label;
    }

    public InsightSeverity severity() {
        return severity;
    }
}
