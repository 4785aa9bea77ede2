package io.github.samzhu.quotacycle.dto.analytics;

/**
 * 一張洞察卡片。
 *
 * @param key 卡片識別碼，例如 {@code forecast}
 * @param severity 嚴重程度
 * @param title 標題
 * @param metric 主要數值
 * @param sublabel 數值說明
 * @param description 詳細說明
 */
public record InsightItem(
    String key,
    InsightSeverity severity,
    String title,
    String metric,
    String sublabel,
    String description
) {
}
