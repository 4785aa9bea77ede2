package io.github.samzhu.quotacycle.dto.api;

import java.time.Instant;
import java.util.List;

import io.github.samzhu.quotacycle.dto.analytics.BillingPeriod;
import io.github.samzhu.quotacycle.dto.analytics.BillingPeriodRollup;

/**
 * 計費週期彙總 API 回應。
 *
 * @param quotaKey 配額鍵
 * @param lookbackDays 回溯天數
 * @param count 計費週期數
 * @param sum 峰值總和
 * @param average 平均峰值
 * @param max 最大峰值
 * @param since 視窗總和的起始時間，未指定時為 null
 * @param sumSince 視窗內開始的計費週期峰值總和，未指定時為 null
 * @param periods 計費週期（由舊到新）
 */
public record BillingPeriodResponse(
    String quotaKey,
    int lookbackDays,
    int count,
    double sum,
    double average,
    double max,
    Instant since,
    Double sumSince,
    List<BillingPeriod> periods
) {

    /**
     * 從彙總建立回應。
     *
     * @param quotaKey 配額鍵
     * @param lookbackDays 回溯天數
     * @param rollup 彙總
     * @param since 視窗起始時間，可為 null
     * @return 回應
     */
    public static BillingPeriodResponse fromRollup(String quotaKey, int lookbackDays,
            BillingPeriodRollup rollup, Instant since) {
        return new BillingPeriodResponse(
            quotaKey,
            lookbackDays,
            rollup.count(),
            rollup.sum(),
            rollup.average(),
            rollup.max(),
            since,
            since != null ? rollup.sumSince(since) : null,
            rollup.periods()
        );
    }
}
