package io.github.samzhu.quotacycle.dto;

/**
 * 重置判斷依據。
 */
public enum ResetReason {
    /** 消耗量跌破峰值的一半 */
    DROP,
    /** 樣本時間超過供應商回報的重置時間加寬限期 */
    TIME
}
