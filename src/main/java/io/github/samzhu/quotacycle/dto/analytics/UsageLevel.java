package io.github.samzhu.quotacycle.dto.analytics;

/**
 * 使用率等級。
 *
 * <ul>
 *   <li>{@link #HEALTHY} - 低於 50%</li>
 *   <li>{@link #WARNING} - 50% 至 80%</li>
 *   <li>{@link #DANGER} - 80% 至 95%</li>
 *   <li>{@link #CRITICAL} - 95% 以上</li>
 * </ul>
 */
public enum UsageLevel {
    HEALTHY(InsightSeverity.POSITIVE),
    WARNING(InsightSeverity.INFO),
    DANGER(InsightSeverity.WARNING),
    CRITICAL(InsightSeverity.NEGATIVE);

    private final InsightSeverity severity;

    UsageLevel(InsightSeverity severity) {
        this.severity = severity;
    }

    public InsightSeverity severity() {
        return severity;
    }
}
