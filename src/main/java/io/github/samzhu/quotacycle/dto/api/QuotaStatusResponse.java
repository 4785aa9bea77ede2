package io.github.samzhu.quotacycle.dto.api;

import java.time.Instant;

import io.github.samzhu.quotacycle.dto.analytics.QuotaProjection;
import io.github.samzhu.quotacycle.dto.analytics.QuotaSummary;
import io.github.samzhu.quotacycle.dto.analytics.RateSource;
import io.github.samzhu.quotacycle.dto.analytics.UsageLevel;

/**
 * 配額狀態 API 回應。
 *
 * <p>包含目前用量、速率與預測、歷史摘要三部分；
 * 無法計算的數值為 {@code null}，前端顯示 N/A。
 *
 * @param quotaKey 配額鍵
 * @param displayName 顯示名稱
 * @param usage 目前用量
 * @param forecast 速率與預測
 * @param history 歷史摘要
 */
public record QuotaStatusResponse(
    String quotaKey,
    String displayName,
    Usage usage,
    Forecast forecast,
    History history
) {

    /**
     * 目前用量。
     */
    public record Usage(
        double current,
        Double limit,
        Double percent,
        UsageLevel level,
        Instant cycleStart,
        Instant renewsAt,
        Long secondsUntilReset
    ) {}

    /**
     * 速率與預測。
     */
    public record Forecast(
        Double ratePerHour,
        RateSource rateSource,
        Double projectedAtReset,
        Double projectedPercent,
        Double hoursUntilExhaustion,
        Instant exhaustionAt,
        boolean exhaustsFirst
    ) {}

    /**
     * 歷史摘要。
     */
    public record History(
        int completedCycles,
        double avgPerCycle,
        double peakCycle,
        double totalTracked,
        Instant trackingSince
    ) {}

    /**
     * 從摘要與預測建立回應。
     */
    public static QuotaStatusResponse from(QuotaSummary summary, QuotaProjection projection) {
        return new QuotaStatusResponse(
            summary.quotaKey(),
            summary.displayName(),
            new Usage(
                summary.currentUsage(),
                summary.limit(),
                summary.usagePercent(),
                summary.usageLevel(),
                summary.activeCycleStart(),
                summary.renewsAt(),
                summary.secondsUntilReset()
            ),
            new Forecast(
                projection.rate().perHour(),
                projection.rate().source(),
                projection.projectedAtReset(),
                projection.projectedPercent(),
                projection.hoursUntilExhaustion(),
                projection.exhaustionAt(),
                projection.exhaustsFirst()
            ),
            new History(
                summary.completedCycles(),
                summary.avgPerCycle(),
                summary.peakCycle(),
                summary.totalTracked(),
                summary.trackingSince()
            )
        );
    }
}
