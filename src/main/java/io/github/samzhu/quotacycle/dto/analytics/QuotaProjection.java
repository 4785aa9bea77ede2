package io.github.samzhu.quotacycle.dto.analytics;

import java.time.Instant;

/**
 * 配額用量預測。
 *
 * <p>無法計算的欄位為 {@code null}（前端顯示 N/A），不會出現 NaN 或 Infinity。
 *
 * @param current 目前消耗量
 * @param limit 上限
 * @param rate 消耗速率
 * @param projectedAtReset 預估重置時的消耗量，已限制在 [0, limit]
 * @param hoursUntilReset 距離重置的小時數
 * @param hoursUntilExhaustion 距離用盡的小時數
 * @param exhaustionAt 預估用盡時間
 * @param exhaustsFirst 是否會在重置前用盡
 */
public record QuotaProjection(
    double current,
    Double limit,
    RateEstimate rate,
    Double projectedAtReset,
    Double hoursUntilReset,
    Double hoursUntilExhaustion,
    Instant exhaustionAt,
    boolean exhaustsFirst
) {

    /**
     * 預估重置時的使用率。
     *
     * @return 百分比；上限或預估值未知時為 null
     */
    public Double projectedPercent() {
        if (projectedAtReset == null || limit == null || limit <= 0) {
            return null;
        }
        return projectedAtReset / limit * 100.0;
    }
}
