package io.github.samzhu.quotacycle.config;

import java.time.Duration;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

import io.github.samzhu.quotacycle.dto.CounterKind;

/**
 * Quota Cycle 服務的組態屬性，支援型別安全的配置綁定。
 *
 * <p>此配置包含以下部分：
 * <ul>
 *   <li>{@link TrackerConfig} - 週期偵測與速率視窗設定</li>
 *   <li>{@link AnalyticsConfig} - 計費週期分析的回溯範圍</li>
 *   <li>{@link QuotaDefinition} - 各配額鍵的計數器種類與欄位對應</li>
 * </ul>
 *
 * <p>配置範例 (application.yaml)：
 * <pre>
 * quotacycle:
 *   tracker:
 *     window-span: 30m
 *     min-rate-span: 5m
 *     min-fallback-span: 30m
 *     reset-grace: 2m
 *     time-based-reset: true
 *   analytics:
 *     lookback-days: 30
 *     pace-days: 7
 *     history-limit: 50
 *   quotas:
 *     "[synthetic/subscription]":
 *       counter-kind: INCREASING_USAGE
 *       value-field: requests
 *       limit-field: limit
 *       display-name: Subscription
 *     "[minimax/coding-plan]":
 *       counter-kind: REMAINING_BUDGET
 *       value-field: remaining
 *       limit-field: total
 * </pre>
 *
 * <p>注意：Map key 含有 {@code /}，在 YAML 中需以 {@code "[...]"} 包住避免被拆解。
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/features/external-config.html">Spring Boot Externalized Configuration</a>
 */
@ConfigurationProperties(prefix = "quotacycle")
public record QuotaCycleProperties(
    TrackerConfig tracker,
    AnalyticsConfig analytics,
    Map<String, QuotaDefinition> quotas
) {

    public QuotaCycleProperties {
        if (tracker == null) {
            tracker = TrackerConfig.defaults();
        }
        if (analytics == null) {
            analytics = AnalyticsConfig.defaults();
        }
        if (quotas == null) {
            quotas = Map.of();
        }
    }

    /**
     * 建立全部使用預設值的配置（測試與無配置啟動時使用）。
     */
    public static QuotaCycleProperties defaults() {
        return new QuotaCycleProperties(TrackerConfig.defaults(), AnalyticsConfig.defaults(), Map.of());
    }

    /**
     * 週期偵測與速率視窗設定。
     *
     * <p>控制 {@link io.github.samzhu.quotacycle.service.CycleDetector} 與
     * {@link io.github.samzhu.quotacycle.service.RateProjectionService} 的行為：
     * <ul>
     *   <li>{@code windowSpan} - 速率視窗保留的時間範圍，超過即丟棄</li>
     *   <li>{@code minRateSpan} - 短視窗速率所需的最短時間跨度，避免除以接近零的時間</li>
     *   <li>{@code minFallbackSpan} - 週期平均速率所需的最短追蹤時間</li>
     *   <li>{@code resetGrace} - 供應商重置時間過後的寬限期（時鐘漂移與 API 延遲）</li>
     *   <li>{@code timeBasedReset} - 重置時間過後是否視為重置</li>
     * </ul>
     *
     * @param windowSpan 視窗範圍，預設 30 分鐘
     * @param minRateSpan 短視窗最短跨度，預設 5 分鐘
     * @param minFallbackSpan 週期平均最短跨度，預設 30 分鐘
     * @param resetGrace 重置寬限期，預設 2 分鐘
     * @param timeBasedReset 是否啟用時間重置，預設 true
     */
    public record TrackerConfig(
        Duration windowSpan,
        Duration minRateSpan,
        Duration minFallbackSpan,
        Duration resetGrace,
        Boolean timeBasedReset
    ) {
        public TrackerConfig {
            if (windowSpan == null || windowSpan.isNegative() || windowSpan.isZero()) {
                windowSpan = Duration.ofMinutes(30);
            }
            if (minRateSpan == null || minRateSpan.isNegative() || minRateSpan.isZero()) {
                minRateSpan = Duration.ofMinutes(5);
            }
            if (minFallbackSpan == null || minFallbackSpan.isNegative() || minFallbackSpan.isZero()) {
                minFallbackSpan = Duration.ofMinutes(30);
            }
            if (resetGrace == null || resetGrace.isNegative()) {
                resetGrace = Duration.ofMinutes(2);
            }
            if (timeBasedReset == null) {
                timeBasedReset = Boolean.TRUE;
            }
        }

        /**
         * 建立預設偵測設定。
         */
        public static TrackerConfig defaults() {
            return new TrackerConfig(Duration.ofMinutes(30), Duration.ofMinutes(5),
                Duration.ofMinutes(30), Duration.ofMinutes(2), Boolean.TRUE);
        }
    }

    /**
     * 計費週期分析設定。
     *
     * @param lookbackDays 分析回溯天數，預設 30
     * @param paceDays 週消耗速度統計天數，預設 7
     * @param historyLimit 摘要統計讀取的已完成週期上限，預設 50
     */
    public record AnalyticsConfig(
        int lookbackDays,
        int paceDays,
        int historyLimit
    ) {
        public AnalyticsConfig {
            if (lookbackDays <= 0) {
                lookbackDays = 30;
            }
            if (paceDays <= 0) {
                paceDays = 7;
            }
            if (historyLimit <= 0) {
                historyLimit = 50;
            }
        }

        /**
         * 建立預設分析設定。
         */
        public static AnalyticsConfig defaults() {
            return new AnalyticsConfig(30, 7, 50);
        }
    }

    /**
     * 單一配額鍵的定義。
     *
     * @param counterKind 計數器種類
     * @param valueField 讀取數值的欄位，未設定時使用 {@link CounterKind#defaultValueField()}
     * @param limitField 讀取上限的欄位，預設 {@code limit}
     * @param fixedLimit 固定上限，樣本未提供上限時使用
     * @param displayName 顯示名稱
     */
    public record QuotaDefinition(
        CounterKind counterKind,
        String valueField,
        String limitField,
        Double fixedLimit,
        String displayName
    ) {
        public QuotaDefinition {
            if (counterKind == null) {
                counterKind = CounterKind.INCREASING_USAGE;
            }
            if (valueField == null || valueField.isBlank()) {
                valueField = counterKind.defaultValueField();
            }
            if (limitField == null || limitField.isBlank()) {
                limitField = "limit";
            }
        }

        /**
         * 以計數器種類建立只含預設欄位的定義。
         */
        public static QuotaDefinition of(CounterKind counterKind) {
            return new QuotaDefinition(counterKind, null, null, null, null);
        }
    }
}
