package io.github.samzhu.quotacycle.dto.analytics;

import java.time.Instant;

/**
 * 計費週期，由相鄰的一組週期合併而成（不持久化，每次查詢重新計算）。
 *
 * @param start 第一個組成週期的開始時間
 * @param maxPeak 組成週期峰值的最大值
 * @param cycleCount 組成週期數
 */
public record BillingPeriod(
    Instant start,
    double maxPeak,
    int cycleCount
) {
}
