package io.github.samzhu.quotacycle.dto.api;

import io.github.samzhu.quotacycle.dto.IngestOutcome;
import io.github.samzhu.quotacycle.dto.IngestStatus;
import io.github.samzhu.quotacycle.dto.ResetReason;

/**
 * 樣本寫入 API 回應。
 *
 * @param status 處理結果
 * @param resetReason 重置依據，非重置時為 null
 * @param cycle 處理後的進行中週期
 * @param closedCycle 因重置而關閉的週期，非重置時為 null
 */
public record IngestResponse(
    IngestStatus status,
    ResetReason resetReason,
    CycleResponse cycle,
    CycleResponse closedCycle
) {

    public static IngestResponse fromOutcome(IngestOutcome outcome) {
        return new IngestResponse(
            outcome.status(),
            outcome.reason(),
            outcome.cycle() != null ? CycleResponse.fromQuotaCycle(outcome.cycle()) : null,
            outcome.closedCycle() != null ? CycleResponse.fromQuotaCycle(outcome.closedCycle()) : null
        );
    }
}
