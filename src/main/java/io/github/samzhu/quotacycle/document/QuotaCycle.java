package io.github.samzhu.quotacycle.document;

import java.time.Duration;
import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import io.github.samzhu.quotacycle.dto.QuotaKey;

/**
 * 配額週期文件，代表單一配額鍵的一段會計週期。
 *
 * <p>設計原則：
 * <ul>
 *   <li>ID 自動生成：由 MongoDB 自動產生 ObjectId</li>
 *   <li>避免自定義類型：配額鍵以 {@code provider/quotaType} 字串儲存</li>
 *   <li>單一 active：每個配額鍵最多一筆 {@code active = true}，由部分唯一索引保證</li>
 *   <li>永不刪除：週期只會被關閉（設定 {@code cycleEnd}），不會被刪除</li>
 * </ul>
 *
 * <p>欄位分類：
 * <ul>
 *   <li>週期邊界 - 開始與結束時間，結束時間為上一筆樣本的時間</li>
 *   <li>消耗統計 - 起始值、峰值與週期增量，峰值在週期開啟期間單調不減</li>
 *   <li>最後樣本 - 最近一次接受的樣本時間、消耗量與上限</li>
 *   <li>供應商資訊 - 回報的重置時間（僅供參考）</li>
 * </ul>
 *
 * @see io.github.samzhu.quotacycle.service.CycleDetector
 */
@Document(collection = "quota_cycles")
@CompoundIndex(name = "quota_start_idx", def = "{'quotaKey': 1, 'cycleStart': -1}")
public record QuotaCycle(
    @Id String id,

    // ========== 基本識別 ==========
    /** 配額鍵，格式 provider/quotaType */
    String quotaKey,

    // ========== 週期邊界 ==========
    /** 週期開始時間（第一筆樣本的時間） */
    Instant cycleStart,
    /** 週期結束時間，null 表示仍在進行中 */
    Instant cycleEnd,
    /** 是否為目前進行中的週期 */
    boolean active,

    // ========== 消耗統計 ==========
    /** 週期開始時的消耗量 */
    double startConsumed,
    /** 週期內觀測到的最高消耗量 */
    double peak,
    /** 週期內累積的消耗量 = peak - startConsumed */
    double totalDelta,

    // ========== 最後樣本 ==========
    /** 最近一次接受的樣本時間 */
    Instant lastSampleAt,
    /** 最近一次接受的消耗量 */
    double lastConsumed,
    /** 最近一次回報的上限，null 表示未知 */
    Double lastLimit,

    // ========== 供應商資訊 ==========
    /** 供應商回報的重置時間，會隨輪詢漂移 */
    Instant renewsAt,

    // ========== 時間戳記 ==========
    Instant createdAt,
    Instant lastUpdatedAt
) {

    /**
     * 建立新的進行中週期。
     *
     * @param key 配額鍵
     * @param start 第一筆樣本時間
     * @param consumed 第一筆樣本的消耗量
     * @param limit 上限，可為 null
     * @param renewsAt 供應商回報的重置時間，可為 null
     * @return 尚未儲存的週期（id 為 null）
     */
    public static QuotaCycle open(QuotaKey key, Instant start, double consumed, Double limit, Instant renewsAt) {
        Instant now = Instant.now();
        return new QuotaCycle(
            null, // ID 自動產生
            key.asString(),
            start,
            null,
            true,
            consumed,
            consumed,
            0.0,
            start,
            consumed,
            limit,
            renewsAt,
            now,
            now
        );
    }

    /**
     * 計算目前使用率百分比。
     *
     * @return 使用率，上限未知時返回 null
     */
    public Double currentPercent() {
        if (lastLimit == null || lastLimit <= 0) {
            return null;
        }
        return (lastConsumed / lastLimit) * 100.0;
    }

    /**
     * 計算距離重置的時間。
     *
     * @param now 目前時間
     * @return 剩餘時間；重置時間未知或已過時返回 null
     */
    public Duration timeUntilReset(Instant now) {
        if (renewsAt == null || !renewsAt.isAfter(now)) {
            return null;
        }
        return Duration.between(now, renewsAt);
    }

    /**
     * 以新的進度建立副本。
     */
    public QuotaCycle withProgress(double newPeak, double newTotalDelta, Instant sampleAt,
            double consumed, Double limit, Instant newRenewsAt) {
        return new QuotaCycle(id, quotaKey, cycleStart, cycleEnd, active, startConsumed,
            newPeak, newTotalDelta, sampleAt, consumed, limit, newRenewsAt, createdAt, Instant.now());
    }

    /**
     * 以結束時間建立已關閉的副本。
     */
    public QuotaCycle closedAt(Instant end) {
        return new QuotaCycle(id, quotaKey, cycleStart, end, false, startConsumed,
            peak, totalDelta, lastSampleAt, lastConsumed, lastLimit, renewsAt, createdAt, Instant.now());
    }

    /**
     * 指定 ID 的副本（儲存後使用）。
     */
    public QuotaCycle withId(String newId) {
        return new QuotaCycle(newId, quotaKey, cycleStart, cycleEnd, active, startConsumed,
            peak, totalDelta, lastSampleAt, lastConsumed, lastLimit, renewsAt, createdAt, lastUpdatedAt);
    }
}
