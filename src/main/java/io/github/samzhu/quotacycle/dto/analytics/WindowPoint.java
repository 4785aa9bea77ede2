package io.github.samzhu.quotacycle.dto.analytics;

import java.time.Instant;

/**
 * 速率視窗中的一個觀測點。
 *
 * @param timestamp 樣本時間
 * @param consumed 消耗量
 */
public record WindowPoint(
    Instant timestamp,
    double consumed
) {
}
