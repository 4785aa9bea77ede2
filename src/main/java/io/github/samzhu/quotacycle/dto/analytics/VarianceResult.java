package io.github.samzhu.quotacycle.dto.analytics;

/**
 * 離散度分類結果。
 *
 * @param level 離散等級
 * @param diffPercent 峰值高出平均的百分比
 */
public record VarianceResult(
    VarianceLevel level,
    double diffPercent
) {
}
