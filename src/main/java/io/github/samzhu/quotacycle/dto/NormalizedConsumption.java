package io.github.samzhu.quotacycle.dto;

/**
 * 正規化後的消耗量（衍生值，不持久化）。
 *
 * @param consumed 週期內已消耗量，週期開啟期間單調遞增
 * @param limit 配額上限，{@code null} 表示未知
 */
public record NormalizedConsumption(
    double consumed,
    Double limit
) {

    /**
     * 是否有可用於計算百分比的上限。
     */
    public boolean hasLimit() {
        return limit != null && limit > 0;
    }

    /**
     * 計算使用率百分比。
     *
     * @return 使用率 (0-100+)，上限未知時返回 {@code null}
     */
    public Double percentOfLimit() {
        if (!hasLimit()) {
            return null;
        }
        return (consumed / limit) * 100.0;
    }
}
