package io.github.samzhu.quotacycle.dto.analytics;

/**
 * 計費週期用量趨勢。
 */
public enum TrendDirection {
    RISING("Rising", InsightSeverity.WARNING),
    FALLING("Declining", InsightSeverity.POSITIVE),
    STABLE("Stable", InsightSeverity.POSITIVE);

    private final String label;
    private final InsightSeverity severity;

    TrendDirection(String label, InsightSeverity severity) {
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
