package io.github.samzhu.quotacycle.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.quotacycle.config.QuotaCycleProperties;
import io.github.samzhu.quotacycle.config.QuotaCycleProperties.AnalyticsConfig;
import io.github.samzhu.quotacycle.config.QuotaCycleProperties.QuotaDefinition;
import io.github.samzhu.quotacycle.config.QuotaCycleProperties.TrackerConfig;
import io.github.samzhu.quotacycle.document.QuotaCycle;
import io.github.samzhu.quotacycle.dto.CounterKind;
import io.github.samzhu.quotacycle.dto.QuotaKey;
import io.github.samzhu.quotacycle.dto.analytics.InsightItem;
import io.github.samzhu.quotacycle.dto.analytics.InsightSeverity;
import io.github.samzhu.quotacycle.dto.api.InsightsResponse;
import io.github.samzhu.quotacycle.repository.InMemoryCycleStore;
import io.github.samzhu.quotacycle.repository.QuotaSampleRepository;

class InsightServiceTest {

    private static final QuotaKey KEY = new QuotaKey("synthetic", "subscription");
    private static final Instant NOW = Instant.parse("2026-01-20T12:00:00Z");

    private InMemoryCycleStore store;
    private TrackerWindowRegistry registry;
    private InsightService insightService;

    @BeforeEach
    void setUp() {
        QuotaCycleProperties properties = new QuotaCycleProperties(
            TrackerConfig.defaults(),
            AnalyticsConfig.defaults(),
            Map.of("synthetic/subscription",
                new QuotaDefinition(CounterKind.INCREASING_USAGE, "requests", null, null, "Subscription")));
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        store = new InMemoryCycleStore();
        QuotaSampleRepository sampleRepository = mock(QuotaSampleRepository.class);
        registry = new TrackerWindowRegistry(store, sampleRepository, properties);
        QuotaQueryService queryService = new QuotaQueryService(store, sampleRepository, properties, clock);
        RateProjectionService rateService = new RateProjectionService(registry, queryService, properties, clock);
        insightService = new InsightService(queryService, rateService, properties, clock);
    }

    @Test
    void shouldShowGettingStartedForNewQuota() {
        // Given: 只有一個進行中週期，沒有速率可用
        store.put(active(NOW.minus(Duration.ofDays(10)), 40, 40, null, null));

        // When
        InsightsResponse response = insightService.insights(KEY);

        // Then
        assertThat(response.displayName()).isEqualTo("Subscription");
        assertThat(response.stats()).extracting(InsightItem::key).containsExactly("current");
        assertThat(response.stats().get(0).title()).isEqualTo("Subscription (now)");
        assertThat(response.insights()).extracting(InsightItem::key).containsExactly("forecast", "getting_started");
        assertThat(response.insights().get(0).metric()).isEqualTo("Analyzing...");
    }

    @Test
    void shouldWarnWhenQuotaExhaustsBeforeReset() {
        // Given: 2 小時消耗 600（300/hr），剩 400，5 小時後重置
        store.put(active(NOW.minus(Duration.ofHours(2)), 0, 600, 1000.0, NOW.plus(Duration.ofHours(5))));

        // When
        InsightItem forecast = insightService.insights(KEY).insights().get(0);

        // Then
        assertThat(forecast.severity()).isEqualTo(InsightSeverity.NEGATIVE);
        assertThat(forecast.metric()).isEqualTo("300/hr");
        assertThat(forecast.sublabel()).isEqualTo("exhausts in 1h 20m");
    }

    @Test
    void shouldWarnWhenProjectionAboveEightyPercent() {
        // Given: 300/hr，1 小時後重置 → 預估 900 / 1000
        store.put(active(NOW.minus(Duration.ofHours(2)), 0, 600, 1000.0, NOW.plus(Duration.ofHours(1))));

        // When
        InsightItem forecast = insightService.insights(KEY).insights().get(0);

        // Then
        assertThat(forecast.severity()).isEqualTo(InsightSeverity.WARNING);
        assertThat(forecast.sublabel()).isEqualTo("~90% at reset in 1h");
    }

    @Test
    void shouldReportComfortableHeadroom() {
        // Given: 50/hr，5 小時後重置 → 預估 350 / 1000
        store.put(active(NOW.minus(Duration.ofHours(2)), 0, 100, 1000.0, NOW.plus(Duration.ofHours(5))));

        // When
        InsightItem forecast = insightService.insights(KEY).insights().get(0);

        // Then
        assertThat(forecast.severity()).isEqualTo(InsightSeverity.POSITIVE);
        assertThat(forecast.metric()).isEqualTo("50/hr");
    }

    @Test
    void shouldReportIdleWhenWindowFlat() {
        // Given: 視窗內 19 分鐘沒有變化
        store.put(active(NOW.minus(Duration.ofHours(2)), 0, 50, 1000.0, NOW.plus(Duration.ofHours(5))));
        registry.window(KEY).add(NOW.minus(Duration.ofMinutes(20)), 50);
        registry.window(KEY).add(NOW.minus(Duration.ofMinutes(1)), 50);

        // When
        InsightItem forecast = insightService.insights(KEY).insights().get(0);

        // Then
        assertThat(forecast.metric()).isEqualTo("Idle");
        assertThat(forecast.severity()).isEqualTo(InsightSeverity.INFO);
        assertThat(forecast.sublabel()).isEqualTo("resets in 5h");
    }

    @Test
    void shouldBuildVarianceAndTrendFromBillingPeriods() {
        // Given: 每兩天一個週期，漂移造成的小週期會併入下一個計費週期
        // 計費週期峰值（由舊到新）= [100, 100, 150, 200]
        double[] peaks = {100, 10, 100, 10, 150, 10, 200};
        for (int i = 0; i < peaks.length; i++) {
            store.put(closed(NOW.minus(Duration.ofDays(13)).plus(Duration.ofDays(2L * i)), peaks[i]));
        }

        // When
        InsightsResponse response = insightService.insights(KEY);

        // Then
        InsightItem stat = response.stats().get(0);
        assertThat(stat.key()).isEqualTo("avg_period");
        assertThat(stat.metric()).isEqualTo("138");
        assertThat(stat.sublabel()).isEqualTo("across 4 periods");

        assertThat(response.insights()).extracting(InsightItem::key)
            .containsExactly("forecast", "weekly_pace", "variance", "trend");

        InsightItem weekly = find(response, "weekly_pace");
        // 最近 7 天開始的計費週期：150 + 200
        assertThat(weekly.metric()).isEqualTo("350");
        assertThat(weekly.severity()).isEqualTo(InsightSeverity.INFO);

        InsightItem variance = find(response, "variance");
        // (200 - 137.5) / 137.5 ≈ 45%
        assertThat(variance.title()).isEqualTo("Usage Spread");
        assertThat(variance.metric()).isEqualTo("+45%");

        InsightItem trend = find(response, "trend");
        // 較早 [100, 100] 平均 100，近期 [150, 200] 平均 175
        assertThat(trend.severity()).isEqualTo(InsightSeverity.WARNING);
        assertThat(trend.metric()).isEqualTo("+75%");
    }

    @Test
    void shouldFormatInsightTextIndependentOfDefaultLocale() {
        // Given: 預設語系使用泰文數字
        double[] peaks = {100, 10, 100, 10, 150, 10, 200};
        for (int i = 0; i < peaks.length; i++) {
            store.put(closed(NOW.minus(Duration.ofDays(13)).plus(Duration.ofDays(2L * i)), peaks[i]));
        }
        Locale original = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("th-TH-u-nu-thai"));
        try {
            // When
            InsightsResponse response = insightService.insights(KEY);

            // Then
            assertThat(response.stats().get(0).sublabel()).isEqualTo("across 4 periods");
            assertThat(find(response, "variance").metric()).isEqualTo("+45%");
            assertThat(find(response, "trend").metric()).isEqualTo("+75%");
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    void shouldRateCycleUtilizationAgainstLimit() {
        // Given: 計費週期峰值 [900, 900]，上限 1000
        store.put(closedWithLimit(NOW.minus(Duration.ofDays(20)), 900, 1000.0));
        store.put(closedWithLimit(NOW.minus(Duration.ofDays(15)), 10, 1000.0));
        store.put(active(NOW.minus(Duration.ofDays(1)), 0, 900, 1000.0, null));

        // When
        InsightItem card = find(insightService.insights(KEY), "cycle_utilization");

        // Then
        assertThat(card.metric()).isEqualTo("90%");
        assertThat(card.severity()).isEqualTo(InsightSeverity.WARNING);
    }

    private static InsightItem find(InsightsResponse response, String key) {
        return response.insights().stream()
            .filter(i -> i.key().equals(key))
            .findFirst()
            .orElseThrow();
    }

    private static QuotaCycle closed(Instant start, double peak) {
        return closedWithLimit(start, peak, null);
    }

    private static QuotaCycle closedWithLimit(Instant start, double peak, Double limit) {
        Instant end = start.plus(Duration.ofDays(1));
        return new QuotaCycle(null, KEY.asString(), start, end, false, 0.0, peak, peak,
            end, peak, limit, null, start, end);
    }

    private static QuotaCycle active(Instant start, double startConsumed, double peak, Double limit, Instant renewsAt) {
        return new QuotaCycle(null, KEY.asString(), start, null, true, startConsumed, peak,
            peak - startConsumed, NOW.minusSeconds(60), peak, limit, renewsAt, start, NOW);
    }
}
