package io.github.samzhu.quotacycle.dto;

import io.github.samzhu.quotacycle.document.QuotaCycle;

/**
 * 週期偵測結果。
 *
 * @param status 處理結果
 * @param cycle 處理後的進行中週期
 * @param closedCycle 因重置而關閉的週期，僅 {@link IngestStatus#RESET} 時有值
 * @param reason 重置依據，僅 {@link IngestStatus#RESET} 時有值
 */
public record IngestOutcome(
    IngestStatus status,
    QuotaCycle cycle,
    QuotaCycle closedCycle,
    ResetReason reason
) {

    public static IngestOutcome created(QuotaCycle cycle) {
        return new IngestOutcome(IngestStatus.CREATED, cycle, null, null);
    }

    public static IngestOutcome continued(QuotaCycle cycle) {
        return new IngestOutcome(IngestStatus.CONTINUED, cycle, null, null);
    }

    public static IngestOutcome reset(QuotaCycle cycle, QuotaCycle closedCycle, ResetReason reason) {
        return new IngestOutcome(IngestStatus.RESET, cycle, closedCycle, reason);
    }

    public static IngestOutcome outOfOrder(QuotaCycle cycle) {
        return new IngestOutcome(IngestStatus.OUT_OF_ORDER, cycle, null, null);
    }

    /**
     * 此結果是否改變了儲存狀態。
     */
    public boolean accepted() {
        return status != IngestStatus.OUT_OF_ORDER;
    }
}
