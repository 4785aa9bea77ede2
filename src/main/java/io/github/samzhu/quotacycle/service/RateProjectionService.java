package io.github.samzhu.quotacycle.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.springframework.stereotype.Service;

import io.github.samzhu.quotacycle.config.QuotaCycleProperties;
import io.github.samzhu.quotacycle.config.QuotaCycleProperties.TrackerConfig;
import io.github.samzhu.quotacycle.dto.QuotaKey;
import io.github.samzhu.quotacycle.dto.analytics.QuotaProjection;
import io.github.samzhu.quotacycle.dto.analytics.QuotaSummary;
import io.github.samzhu.quotacycle.dto.analytics.RateEstimate;
import io.github.samzhu.quotacycle.dto.analytics.RateSource;
import io.github.samzhu.quotacycle.dto.analytics.WindowPoint;

/**
 * 消耗速率與用量預測服務。
 *
 * <p>速率來源優先順序：
 * <ol>
 *   <li><b>短視窗</b> - {@link TrackerWindow} 中最舊與最新的觀測點，時間跨度至少 {@code min-rate-span}；
 *       消耗量沒有增加時速率為 0（閒置）。最新點早於 {@code window-span} 之前（輪詢中斷）時不採用</li>
 *   <li><b>週期平均</b> - 總追蹤量除以開始追蹤後的小時數，追蹤時間至少 {@code min-fallback-span}</li>
 * </ol>
 * 兩者皆不成立時速率為「未定義」，前端顯示收集資料中。
 *
 * <p>預測結果中無法計算的欄位一律為 {@code null}，不拋出例外，也不產生 NaN 或 Infinity。
 */
@Service
public class RateProjectionService {

    private final TrackerWindowRegistry windowRegistry;
    private final QuotaQueryService queryService;
    private final TrackerConfig trackerConfig;
    private final Clock clock;

    public RateProjectionService(TrackerWindowRegistry windowRegistry, QuotaQueryService queryService,
            QuotaCycleProperties properties, Clock clock) {
        this.windowRegistry = windowRegistry;
        this.queryService = queryService;
        this.trackerConfig = properties.tracker();
        this.clock = clock;
    }

    /**
     * 估計配額鍵目前的消耗速率。
     *
     * @param key 配額鍵
     * @return 速率估計
     */
    public RateEstimate rate(QuotaKey key) {
        return rate(key, queryService.summary(key));
    }

    /**
     * 以已查詢的摘要估計速率（避免重複查詢）。
     */
    public RateEstimate rate(QuotaKey key, QuotaSummary summary) {
        Instant now = clock.instant();
        List<WindowPoint> points = windowRegistry.window(key).snapshot();
        if (!isStale(points, now, trackerConfig.windowSpan())) {
            RateEstimate windowed = windowRate(points, trackerConfig.minRateSpan());
            if (windowed.isDefined()) {
                return windowed;
            }
        }
        return cycleAverageRate(summary.totalTracked(), summary.trackingSince(), now,
            trackerConfig.minFallbackSpan());
    }

    /**
     * 預測配額鍵到重置時的用量與用盡時間。
     *
     * @param key 配額鍵
     * @return 預測結果
     */
    public QuotaProjection projection(QuotaKey key) {
        QuotaSummary summary = queryService.summary(key);
        return projection(key, summary);
    }

    /**
     * 以已查詢的摘要計算預測。
     */
    public QuotaProjection projection(QuotaKey key, QuotaSummary summary) {
        return project(summary.currentUsage(), summary.limit(), rate(key, summary), summary.renewsAt(), clock.instant());
    }

    // ========== 純計算 ==========

    /**
     * 視窗最新的觀測點是否已超出 {@code maxAge}。
     */
    static boolean isStale(List<WindowPoint> points, Instant now, Duration maxAge) {
        if (points.isEmpty()) {
            return true;
        }
        return points.get(points.size() - 1).timestamp().isBefore(now.minus(maxAge));
    }

    /**
     * 以視窗中最舊與最新的點計算速率。
     *
     * @param points 由舊到新的觀測點
     * @param minSpan 最短時間跨度
     * @return 速率；點數不足或跨度太短時為未定義
     */
    static RateEstimate windowRate(List<WindowPoint> points, Duration minSpan) {
        if (points.size() < 2) {
            return RateEstimate.undefined();
        }
        WindowPoint oldest = points.get(0);
        WindowPoint newest = points.get(points.size() - 1);
        Duration elapsed = Duration.between(oldest.timestamp(), newest.timestamp());
        if (elapsed.compareTo(minSpan) < 0) {
            return RateEstimate.undefined();
        }
        double delta = newest.consumed() - oldest.consumed();
        if (delta <= 0) {
            return new RateEstimate(0.0, RateSource.WINDOW);
        }
        return new RateEstimate(delta / hours(elapsed), RateSource.WINDOW);
    }

    /**
     * 以追蹤期間的平均計算速率。
     *
     * @param totalTracked 總追蹤量
     * @param trackingSince 開始追蹤時間，可為 null
     * @param now 目前時間
     * @param minSpan 最短追蹤時間
     * @return 速率；資料不足時為未定義
     */
    static RateEstimate cycleAverageRate(double totalTracked, Instant trackingSince, Instant now, Duration minSpan) {
        if (trackingSince == null || totalTracked <= 0) {
            return RateEstimate.undefined();
        }
        Duration elapsed = Duration.between(trackingSince, now);
        if (elapsed.compareTo(minSpan) < 0) {
            return RateEstimate.undefined();
        }
        return new RateEstimate(totalTracked / hours(elapsed), RateSource.CYCLE_AVERAGE);
    }

    /**
     * 計算預測。
     *
     * <ul>
     *   <li>預估重置時用量 = current + rate × 距離重置小時數，有上限時限制在 [0, limit]</li>
     *   <li>用盡時間 = (limit - current) / rate，僅在 rate &gt; 0 且上限已知時</li>
     *   <li>exhaustsFirst = 用盡時間早於重置時間</li>
     * </ul>
     *
     * @param current 目前消耗量
     * @param limit 上限，可為 null
     * @param rate 速率
     * @param renewsAt 重置時間，可為 null
     * @param now 目前時間
     * @return 預測結果
     */
    static QuotaProjection project(double current, Double limit, RateEstimate rate, Instant renewsAt, Instant now) {
        boolean knownLimit = limit != null && limit > 0;
        Double hoursUntilReset = renewsAt != null && renewsAt.isAfter(now)
            ? hours(Duration.between(now, renewsAt))
            : null;

        Double projected = null;
        if (rate.isDefined() && hoursUntilReset != null) {
            double value = current + rate.perHour() * hoursUntilReset;
            value = Math.max(0.0, value);
            if (knownLimit) {
                value = Math.min(limit, value);
            }
            projected = value;
        }

        Double hoursUntilExhaustion = null;
        Instant exhaustionAt = null;
        if (rate.isDefined() && rate.perHour() > 0 && knownLimit) {
            double remaining = Math.max(0.0, limit - current);
            hoursUntilExhaustion = remaining / rate.perHour();
            exhaustionAt = now.plusSeconds(Math.round(hoursUntilExhaustion * 3600));
        }

        boolean exhaustsFirst = hoursUntilExhaustion != null && hoursUntilReset != null
            && hoursUntilExhaustion < hoursUntilReset;

        return new QuotaProjection(
            current,
            knownLimit ? limit : null,
            rate,
            projected,
            hoursUntilReset,
            hoursUntilExhaustion,
            exhaustionAt,
            exhaustsFirst
        );
    }

    private static double hours(Duration duration) {
        return duration.toMillis() / 3_600_000.0;
    }
}
