package io.github.samzhu.quotacycle.dto.api;

import java.time.Instant;

import io.github.samzhu.quotacycle.document.QuotaCycle;

/**
 * 週期 API 回應。
 *
 * @param id 週期 ID
 * @param quotaKey 配額鍵
 * @param cycleStart 開始時間
 * @param cycleEnd 結束時間，進行中為 null
 * @param active 是否進行中
 * @param peak 峰值
 * @param totalDelta 週期增量
 * @param lastConsumed 最後消耗量
 * @param lastLimit 最後上限
 * @param renewsAt 供應商回報的重置時間
 * @param lastSampleAt 最後樣本時間
 */
public record CycleResponse(
    String id,
    String quotaKey,
    Instant cycleStart,
    Instant cycleEnd,
    boolean active,
    double peak,
    double totalDelta,
    double lastConsumed,
    Double lastLimit,
    Instant renewsAt,
    Instant lastSampleAt
) {

    /**
     * 從 QuotaCycle 建立回應。
     */
    public static CycleResponse fromQuotaCycle(QuotaCycle cycle) {
        return new CycleResponse(
            cycle.id(),
            cycle.quotaKey(),
            cycle.cycleStart(),
            cycle.cycleEnd(),
            cycle.active(),
            cycle.peak(),
            cycle.totalDelta(),
            cycle.lastConsumed(),
            cycle.lastLimit(),
            cycle.renewsAt(),
            cycle.lastSampleAt()
        );
    }
}
