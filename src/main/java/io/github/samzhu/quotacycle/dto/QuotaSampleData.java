package io.github.samzhu.quotacycle.dto;

import java.time.Instant;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * 配額樣本資料（CloudEvents data payload / REST 請求本體）。
 *
 * <p>代表一次輪詢供應商 API 得到的觀測值。{@code rawFields} 保留供應商原始欄位，
 * 由 {@code SampleNormalizer} 依配額定義讀取數值；樣本依 {@code capturedAt} 排序，而非到達順序。
 *
 * <p>範例：
 * <pre>
 * {
 *   "provider": "zai",
 *   "quotaType": "tokens",
 *   "capturedAt": "2026-01-10T08:00:00Z",
 *   "counterKind": "REMAINING_BUDGET",
 *   "rawFields": { "remaining": 850000 },
 *   "limit": 1000000,
 *   "renewsAt": "2026-01-10T13:00:00Z"
 * }
 * </pre>
 *
 * @param provider 供應商名稱
 * @param quotaType 配額維度
 * @param capturedAt 輪詢時間
 * @param counterKind 計數器種類；組態中有配額定義時以組態為準
 * @param rawFields 供應商原始欄位
 * @param limit 配額上限，可為 {@code null}
 * @param renewsAt 供應商回報的重置時間（僅供參考，會隨輪詢漂移）
 */
public record QuotaSampleData(
    @NotBlank String provider,
    @NotBlank String quotaType,
    @NotNull Instant capturedAt,
    CounterKind counterKind,
    @NotNull Map<String, Object> rawFields,
    Double limit,
    Instant renewsAt
) {

    /**
     * 取得此樣本的配額鍵。
     */
    @JsonIgnore
    public QuotaKey quotaKey() {
        return new QuotaKey(provider, quotaType);
    }
}
