package io.github.samzhu.quotacycle.dto.analytics;

import java.time.Instant;

/**
 * 單一配額鍵的用量摘要。
 *
 * @param quotaKey 配額鍵
 * @param displayName 顯示名稱
 * @param completedCycles 已完成週期數
 * @param avgPerCycle 已完成週期的平均增量
 * @param peakCycle 已完成週期的最大增量
 * @param totalTracked 追蹤期間總增量（含進行中週期）
 * @param trackingSince 開始追蹤時間
 * @param currentUsage 目前消耗量
 * @param limit 上限，未知時為 null
 * @param usagePercent 使用率，上限未知時為 null
 * @param usageLevel 使用率等級，上限未知時為 null
 * @param activeCycleStart 進行中週期的開始時間
 * @param renewsAt 供應商回報的重置時間
 * @param secondsUntilReset 距離重置秒數，未知或已過時為 null
 */
public record QuotaSummary(
    String quotaKey,
    String displayName,
    int completedCycles,
    double avgPerCycle,
    double peakCycle,
    double totalTracked,
    Instant trackingSince,
    double currentUsage,
    Double limit,
    Double usagePercent,
    UsageLevel usageLevel,
    Instant activeCycleStart,
    Instant renewsAt,
    Long secondsUntilReset
) {
}
