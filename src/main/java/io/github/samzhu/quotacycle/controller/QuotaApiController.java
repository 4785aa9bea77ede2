package io.github.samzhu.quotacycle.controller;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.quotacycle.config.QuotaCycleProperties;
import io.github.samzhu.quotacycle.dto.QuotaKey;
import io.github.samzhu.quotacycle.dto.analytics.BillingPeriodRollup;
import io.github.samzhu.quotacycle.dto.analytics.QuotaProjection;
import io.github.samzhu.quotacycle.dto.analytics.QuotaSummary;
import io.github.samzhu.quotacycle.dto.analytics.SamplePoint;
import io.github.samzhu.quotacycle.dto.api.BillingPeriodResponse;
import io.github.samzhu.quotacycle.dto.api.CycleResponse;
import io.github.samzhu.quotacycle.dto.api.InsightsResponse;
import io.github.samzhu.quotacycle.dto.api.QuotaStatusResponse;
import io.github.samzhu.quotacycle.service.InsightService;
import io.github.samzhu.quotacycle.service.QuotaQueryService;
import io.github.samzhu.quotacycle.service.RateProjectionService;

/**
 * 配額查詢 API 控制器。
 *
 * <p>提供配額狀態、週期歷史、計費週期彙總、洞察與用量歷史查詢。
 * 路徑中的 {@code provider} 與 {@code quotaType} 組成配額鍵。
 */
@RestController
@RequestMapping("/api/v1/quotas")
public class QuotaApiController {

    private static final Logger log = LoggerFactory.getLogger(QuotaApiController.class);

    private static final int MAX_CYCLES = 500;
    private static final int MAX_HISTORY_HOURS = 24 * 90;

    private final QuotaQueryService queryService;
    private final RateProjectionService rateProjectionService;
    private final InsightService insightService;
    private final QuotaCycleProperties properties;
    private final Clock clock;

    public QuotaApiController(
            QuotaQueryService queryService,
            RateProjectionService rateProjectionService,
            InsightService insightService,
            QuotaCycleProperties properties,
            Clock clock) {
        this.queryService = queryService;
        this.rateProjectionService = rateProjectionService;
        this.insightService = insightService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * 列出所有追蹤中的配額鍵。
     */
    @GetMapping
    public ResponseEntity<List<String>> listQuotas() {
        List<String> keys = queryService.listQuotaKeys().stream()
            .map(QuotaKey::asString)
            .toList();
        return ResponseEntity.ok(keys);
    }

    // ========== 配額狀態 ==========

    /**
     * 取得配額目前狀態（用量、速率預測、歷史摘要）。
     */
    @GetMapping("/{provider}/{quotaType}")
    public ResponseEntity<QuotaStatusResponse> getStatus(
            @PathVariable String provider,
            @PathVariable String quotaType) {
        QuotaKey key = new QuotaKey(provider, quotaType);
        log.debug("Getting quota status: {}", key);

        QuotaSummary summary = queryService.summary(key);
        QuotaProjection projection = rateProjectionService.projection(key, summary);
        return ResponseEntity.ok(QuotaStatusResponse.from(summary, projection));
    }

    // ========== 週期與計費週期 ==========

    /**
     * 取得週期歷史（進行中的週期在最前）。
     *
     * @param limit 筆數上限，預設 50
     */
    @GetMapping("/{provider}/{quotaType}/cycles")
    public ResponseEntity<List<CycleResponse>> getCycles(
            @PathVariable String provider,
            @PathVariable String quotaType,
            @RequestParam(defaultValue = "50") int limit) {
        QuotaKey key = new QuotaKey(provider, quotaType);
        int effectiveLimit = Math.max(1, Math.min(limit, MAX_CYCLES));

        List<CycleResponse> cycles = queryService.cycleHistory(key, effectiveLimit).stream()
            .map(CycleResponse::fromQuotaCycle)
            .toList();
        return ResponseEntity.ok(cycles);
    }

    /**
     * 取得計費週期彙總。
     *
     * @param days 回溯天數，預設 {@code analytics.lookback-days}
     * @param sinceDays 視窗總和的天數（例如 7 表示最近 7 天），未指定時不計算
     */
    @GetMapping("/{provider}/{quotaType}/billing-periods")
    public ResponseEntity<BillingPeriodResponse> getBillingPeriods(
            @PathVariable String provider,
            @PathVariable String quotaType,
            @RequestParam(required = false) Integer days,
            @RequestParam(required = false) Integer sinceDays) {
        QuotaKey key = new QuotaKey(provider, quotaType);
        int lookbackDays = days != null && days > 0 ? days : properties.analytics().lookbackDays();

        BillingPeriodRollup rollup = queryService.billingPeriods(key, lookbackDays);
        Instant since = sinceDays != null && sinceDays > 0
            ? clock.instant().minus(Duration.ofDays(sinceDays))
            : null;
        return ResponseEntity.ok(BillingPeriodResponse.fromRollup(key.asString(), lookbackDays, rollup, since));
    }

    // ========== 洞察與歷史 ==========

    /**
     * 取得洞察卡片。
     */
    @GetMapping("/{provider}/{quotaType}/insights")
    public ResponseEntity<InsightsResponse> getInsights(
            @PathVariable String provider,
            @PathVariable String quotaType) {
        return ResponseEntity.ok(insightService.insights(new QuotaKey(provider, quotaType)));
    }

    /**
     * 取得正規化後的用量歷史。
     *
     * @param hours 回溯小時數，預設 24
     */
    @GetMapping("/{provider}/{quotaType}/history")
    public ResponseEntity<List<SamplePoint>> getHistory(
            @PathVariable String provider,
            @PathVariable String quotaType,
            @RequestParam(defaultValue = "24") int hours) {
        QuotaKey key = new QuotaKey(provider, quotaType);
        int effectiveHours = Math.max(1, Math.min(hours, MAX_HISTORY_HOURS));
        return ResponseEntity.ok(queryService.history(key, effectiveHours));
    }
}
