package io.github.samzhu.quotacycle.dto;

/**
 * 樣本處理計數（自服務啟動起）。
 *
 * @param ingested 已接受的樣本數
 * @param cyclesCreated 因沒有進行中週期而建立的週期數
 * @param resets 偵測到的重置次數
 * @param outOfOrder 被忽略的亂序樣本數
 * @param discarded 正規化失敗而丟棄的樣本數
 * @param trackedKeys 目前持有速率視窗的配額鍵數
 */
public record IngestStats(
    long ingested,
    long cyclesCreated,
    long resets,
    long outOfOrder,
    long discarded,
    int trackedKeys
) {
}
