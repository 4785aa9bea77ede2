package io.github.samzhu.quotacycle.dto;

/**
 * 單一樣本的處理結果。
 */
public enum IngestStatus {
    /** 配額鍵沒有進行中週期，建立新週期 */
    CREATED,
    /** 延續進行中週期 */
    CONTINUED,
    /** 偵測到重置，關閉舊週期並建立新週期 */
    RESET,
    /** 樣本時間不晚於上一筆，忽略 */
    OUT_OF_ORDER
}
