package io.github.samzhu.quotacycle.document;

import java.time.Instant;
import java.util.Map;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 已接受的配額樣本文件。
 *
 * <p>用途：
 * <ul>
 *   <li>用量歷史查詢（正規化後的時間序列）</li>
 *   <li>服務重啟後重建速率視窗</li>
 * </ul>
 *
 * <p>寫入後不再修改；排序依 {@code capturedAt}，而非寫入順序。
 * 亂序或正規化失敗的樣本不會寫入。
 */
@Document(collection = "quota_samples")
@CompoundIndex(name = "quota_captured_idx", def = "{'quotaKey': 1, 'capturedAt': 1}")
public record QuotaSampleRecord(
    @Id String id,

    /** 配額鍵，格式 provider/quotaType */
    String quotaKey,
    /** 輪詢時間 */
    Instant capturedAt,
    /** 正規化後的消耗量 */
    double consumed,
    /** 上限，null 表示未知 */
    Double limit,
    /** 供應商回報的重置時間 */
    Instant renewsAt,
    /** 供應商原始欄位（診斷用） */
    Map<String, Object> rawFields,
    /** 服務收到樣本的時間 */
    Instant receivedAt
) {
}
