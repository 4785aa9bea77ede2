package io.github.samzhu.quotacycle.dto.analytics;

/**
 * 趨勢分類結果。
 *
 * @param direction 趨勢方向
 * @param changePercent 近期平均相對於較早平均的變化百分比
 */
public record TrendResult(
    TrendDirection direction,
    double changePercent
) {
}
