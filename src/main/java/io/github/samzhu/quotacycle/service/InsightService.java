package io.github.samzhu.quotacycle.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Service;

import io.github.samzhu.quotacycle.config.QuotaCycleProperties;
import io.github.samzhu.quotacycle.config.QuotaCycleProperties.AnalyticsConfig;
import io.github.samzhu.quotacycle.dto.QuotaKey;
import io.github.samzhu.quotacycle.dto.analytics.BillingPeriod;
import io.github.samzhu.quotacycle.dto.analytics.BillingPeriodRollup;
import io.github.samzhu.quotacycle.dto.analytics.InsightItem;
import io.github.samzhu.quotacycle.dto.analytics.InsightSeverity;
import io.github.samzhu.quotacycle.dto.analytics.QuotaProjection;
import io.github.samzhu.quotacycle.dto.analytics.QuotaSummary;
import io.github.samzhu.quotacycle.dto.analytics.TrendDirection;
import io.github.samzhu.quotacycle.dto.analytics.TrendResult;
import io.github.samzhu.quotacycle.dto.analytics.VarianceResult;
import io.github.samzhu.quotacycle.dto.api.InsightsResponse;
import io.github.samzhu.quotacycle.util.QuotaFormat;

/**
 * 洞察組裝服務，將摘要、計費週期與預測轉換為前端卡片。
 *
 * <p>卡片清單：
 * <ul>
 *   <li>統計卡 - 計費週期平均峰值；尚無已完成週期時顯示目前值 (now)</li>
 *   <li>預測卡 - 速率、重置前是否用盡、重置時預估用量</li>
 *   <li>週期使用率卡 - 平均峰值占上限的比例（上限已知時）</li>
 *   <li>週消耗卡 - 最近 {@code pace-days} 天開始的計費週期消耗，推估 30 天</li>
 *   <li>離散度卡 - 至少 3 個計費週期且平均 &gt; 1</li>
 *   <li>趨勢卡 - 至少 4 個計費週期，比較近期一半與較早一半</li>
 *   <li>入門卡 - 沒有任何洞察時</li>
 * </ul>
 */
@Service
public class InsightService {

    static final double IDLE_RATE = 0.01;
    static final double PROJECTION_WARNING_PERCENT = 80.0;

    private final QuotaQueryService queryService;
    private final RateProjectionService rateProjectionService;
    private final AnalyticsConfig analyticsConfig;
    private final Clock clock;

    public InsightService(QuotaQueryService queryService, RateProjectionService rateProjectionService,
            QuotaCycleProperties properties, Clock clock) {
        this.queryService = queryService;
        this.rateProjectionService = rateProjectionService;
        this.analyticsConfig = properties.analytics();
        this.clock = clock;
    }

    /**
     * 組裝配額鍵的所有洞察卡片。
     *
     * @param key 配額鍵
     * @return 洞察回應
     */
    public InsightsResponse insights(QuotaKey key) {
        QuotaSummary summary = queryService.summary(key);
        BillingPeriodRollup rollup = queryService.billingPeriods(key, analyticsConfig.lookbackDays());
        QuotaProjection projection = rateProjectionService.projection(key, summary);
        String name = summary.displayName();

        List<InsightItem> stats = new ArrayList<>();
        stats.add(statCard(summary, rollup, name));

        List<InsightItem> insights = new ArrayList<>();
        insights.add(forecastCard(summary, projection, name));
        addIfPresent(insights, cycleUtilizationCard(rollup, summary.limit(), name));
        addIfPresent(insights, weeklyPaceCard(rollup, summary.limit()));
        addIfPresent(insights, varianceCard(rollup, name));
        addIfPresent(insights, trendCard(rollup, name));

        if (insights.size() == 1 && !projection.rate().isDefined()) {
            insights.add(new InsightItem("getting_started", InsightSeverity.INFO, "Getting Started", null, null,
                "Keep polling to build up usage data. Deep insights will appear after a few cycles."));
        }
        return new InsightsResponse(summary.quotaKey(), name, stats, insights);
    }

    // ========== 統計卡 ==========

    InsightItem statCard(QuotaSummary summary, BillingPeriodRollup rollup, String name) {
        if (summary.completedCycles() > 0 && rollup.count() > 0) {
            int count = rollup.count();
            return new InsightItem("avg_period", InsightSeverity.INFO,
                "Avg " + name,
                QuotaFormat.amount(rollup.average()),
                String.format(Locale.ROOT, "across %d %s", count, count > 1 ? "periods" : "period"),
                null);
        }
        return new InsightItem("current", InsightSeverity.INFO,
            name + " (now)",
            QuotaFormat.amount(summary.currentUsage()),
            null,
            null);
    }

    // ========== 預測卡 ==========

    InsightItem forecastCard(QuotaSummary summary, QuotaProjection projection, String name) {
        String resetStr = projection.hoursUntilReset() != null ? QuotaFormat.hours(projection.hoursUntilReset()) : null;
        String current = QuotaFormat.amount(summary.currentUsage());

        if (!projection.rate().isDefined()) {
            return new InsightItem("forecast", InsightSeverity.INFO, name, "Analyzing...",
                "burn rate & forecast",
                String.format(Locale.ROOT, "Collecting usage patterns to calculate burn rate and exhaustion forecasts. Currently at %s.",
                    current));
        }

        double rate = projection.rate().perHour();
        String rateStr = QuotaFormat.amount(rate) + "/hr";

        if (rate < IDLE_RATE) {
            return new InsightItem("forecast", InsightSeverity.INFO, name, "Idle",
                resetStr != null ? "resets in " + resetStr : "no activity",
                String.format(Locale.ROOT, "No consumption detected recently. Currently at %s.", current));
        }

        if (projection.exhaustsFirst()) {
            String exhaustStr = QuotaFormat.hours(projection.hoursUntilExhaustion());
            String desc = String.format(Locale.ROOT, "At this rate, quota exhausts in %s.", exhaustStr);
            if (resetStr != null) {
                desc += String.format(Locale.ROOT, " Resets in %s. May hit limit before reset.", resetStr);
            }
            return new InsightItem("forecast", InsightSeverity.NEGATIVE, name, rateStr,
                "exhausts in " + exhaustStr, desc);
        }

        Double projectedPct = projection.projectedPercent();
        if (projectedPct != null && projectedPct > PROJECTION_WARNING_PERCENT) {
            return new InsightItem("forecast", InsightSeverity.WARNING, name, rateStr,
                resetStr != null
                    ? String.format(Locale.ROOT, "~%.0f%% at reset in %s", projectedPct, resetStr)
                    : String.format(Locale.ROOT, "projected ~%.0f%%", projectedPct),
                String.format(Locale.ROOT, "Consuming at %s. Projected ~%.0f%% at reset.", rateStr, projectedPct));
        }

        return new InsightItem("forecast", InsightSeverity.POSITIVE, name, rateStr,
            resetStr != null ? "resets in " + resetStr : "comfortable headroom",
            String.format(Locale.ROOT, "Consuming at %s with comfortable headroom.", rateStr));
    }

    // ========== 計費週期卡 ==========

    InsightItem cycleUtilizationCard(BillingPeriodRollup rollup, Double limit, String name) {
        double avg = rollup.average();
        if (avg <= 0 || limit == null || limit <= 0) {
            return null;
        }
        double util = avg / limit * 100.0;
        InsightSeverity severity;
        String advice;
        if (util < 25) {
            severity = InsightSeverity.WARNING;
            advice = "Significantly under-utilizing; a lower tier could save costs.";
        } else if (util < 50) {
            severity = InsightSeverity.INFO;
            advice = "Comfortable headroom.";
        } else if (util < 80) {
            severity = InsightSeverity.POSITIVE;
            advice = "Plan fits your usage well.";
        } else if (util < 95) {
            severity = InsightSeverity.WARNING;
            advice = "Approaching your limit frequently.";
        } else {
            severity = InsightSeverity.NEGATIVE;
            advice = "Consistently near limit; consider upgrading.";
        }
        return new InsightItem("cycle_utilization", severity, "Avg Cycle Utilization",
            QuotaFormat.percent(util),
            String.format(Locale.ROOT, "of %s limit/period", QuotaFormat.amount(limit)),
            String.format(Locale.ROOT, "%s averages ~%.0f%% of its limit per billing period. %s", name, util, advice));
    }

    InsightItem weeklyPaceCard(BillingPeriodRollup rollup, Double limit) {
        int paceDays = analyticsConfig.paceDays();
        Instant since = clock.instant().minus(Duration.ofDays(paceDays));
        double recent = rollup.sumSince(since);
        if (recent <= 0) {
            return null;
        }
        double projected = recent * (30.0 / paceDays);
        double total = rollup.sum();

        InsightSeverity severity = InsightSeverity.INFO;
        if (limit != null && limit > 0 && rollup.count() > 0 && projected > limit * rollup.count() * 0.8) {
            severity = InsightSeverity.WARNING;
        }
        String desc = String.format(Locale.ROOT, "%s consumed in the last %d days", QuotaFormat.amount(recent), paceDays);
        if (total > 0) {
            desc += String.format(Locale.ROOT, " (%.0f%% of %d-day total). Monthly projection: ~%s.",
                recent / total * 100.0, analyticsConfig.lookbackDays(), QuotaFormat.amount(projected));
        }
        return new InsightItem("weekly_pace", severity, "Weekly Pace",
            QuotaFormat.amount(recent),
            String.format(Locale.ROOT, "last %d days", paceDays),
            desc);
    }

    InsightItem varianceCard(BillingPeriodRollup rollup, String name) {
        double avg = rollup.average();
        if (rollup.count() < 3 || avg <= 1) {
            return null;
        }
        double peak = rollup.max();
        VarianceResult variance = InsightClassifier.classifyVariance(avg, peak);
        String metric;
        String desc;
        switch (variance.level()) {
            case HIGH -> {
                metric = String.format(Locale.ROOT, "+%.0f%%", variance.diffPercent());
                desc = String.format(Locale.ROOT, "Peak period %s vs average %s for %s. Usage varies significantly.",
                    QuotaFormat.amount(peak), QuotaFormat.amount(avg), name);
            }
            case MODERATE -> {
                metric = String.format(Locale.ROOT, "+%.0f%%", variance.diffPercent());
                desc = String.format(Locale.ROOT, "Peak: %s, average: %s for %s. Moderately consistent.",
                    QuotaFormat.amount(peak), QuotaFormat.amount(avg), name);
            }
            default -> {
                metric = "~" + QuotaFormat.amount(avg);
                desc = String.format(Locale.ROOT, "Peak (%s) close to average (%s) for %s. Predictable usage.",
                    QuotaFormat.amount(peak), QuotaFormat.amount(avg), name);
            }
        }
        return new InsightItem("variance", variance.level().severity(), variance.level().label(), metric, name, desc);
    }

    InsightItem trendCard(BillingPeriodRollup rollup, String name) {
        List<BillingPeriod> periods = rollup.periods();
        int n = periods.size();
        if (n < 4) {
            return null;
        }
        // 由舊到新排列：較早的 n - n/2 個、近期的 n/2 個
        int recentCount = n / 2;
        double olderAvg = average(periods.subList(0, n - recentCount));
        double recentAvg = average(periods.subList(n - recentCount, n));
        if (olderAvg <= 0) {
            return null;
        }
        TrendResult trend = InsightClassifier.classifyTrend(olderAvg, recentAvg);
        String metric = switch (trend.direction()) {
            case RISING -> String.format(Locale.ROOT, "+%.0f%%", trend.changePercent());
            case FALLING -> String.format(Locale.ROOT, "%.0f%%", trend.changePercent());
            case STABLE -> TrendDirection.STABLE.label();
        };
        String tail = switch (trend.direction()) {
            case RISING -> "usage is increasing.";
            case FALLING -> "usage is decreasing.";
            case STABLE -> "steady usage.";
        };
        return new InsightItem("trend", trend.direction().severity(), "Trend", metric, name,
            String.format(Locale.ROOT, "Recent %s periods avg %s vs earlier %s; %s", name,
                QuotaFormat.amount(recentAvg), QuotaFormat.amount(olderAvg), tail));
    }

    private static double average(List<BillingPeriod> periods) {
        return periods.stream().mapToDouble(BillingPeriod::maxPeak).average().orElse(0.0);
    }

    private static void addIfPresent(List<InsightItem> items, InsightItem item) {
        if (item != null) {
            items.add(item);
        }
    }
}
