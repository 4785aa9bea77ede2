package io.github.samzhu.quotacycle.dto;

import java.time.Instant;

/**
 * 進行中週期的一次進度更新。
 *
 * @param peak 新的峰值（不得小於原峰值）
 * @param totalDelta 新的週期增量
 * @param lastSampleAt 觸發更新的樣本時間
 * @param lastConsumed 觸發更新的消耗量
 * @param lastLimit 最新上限，可為 null
 * @param renewsAt 最新回報的重置時間，可為 null
 */
public record CycleProgress(
    double peak,
    double totalDelta,
    Instant lastSampleAt,
    double lastConsumed,
    Double lastLimit,
    Instant renewsAt
) {
}
