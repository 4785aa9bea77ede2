package io.github.samzhu.quotacycle.dto.analytics;

import java.time.Instant;

/**
 * 用量歷史中的一個點。
 *
 * @param capturedAt 樣本時間
 * @param consumed 正規化後的消耗量
 * @param limit 上限，未知時為 null
 * @param percent 使用率，上限未知時為 null
 */
public record SamplePoint(
    Instant capturedAt,
    double consumed,
    Double limit,
    Double percent
) {
}
