package io.github.samzhu.quotacycle.dto.analytics;

/**
 * 消耗速率的來源。
 */
public enum RateSource {
    /** 速率視窗內最舊與最新樣本 */
    WINDOW,
    /** 週期歷史的平均速率 */
    CYCLE_AVERAGE,
    /** 資料不足 */
    NONE
}
