package io.github.samzhu.quotacycle.dto;

import java.time.Instant;

import io.github.samzhu.quotacycle.document.QuotaCycle;

/**
 * 配額重置事件，透過 {@link org.springframework.context.ApplicationEventPublisher} 同步發布。
 *
 * @param quotaKey 配額鍵
 * @param closedCycle 剛關閉的週期
 * @param newCycle 新開啟的週期
 * @param reason 重置依據
 * @param detectedAt 觸發重置的樣本時間
 */
public record QuotaResetEvent(
    QuotaKey quotaKey,
    QuotaCycle closedCycle,
    QuotaCycle newCycle,
    ResetReason reason,
    Instant detectedAt
) {
}
