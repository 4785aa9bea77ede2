package io.github.samzhu.quotacycle.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import io.github.samzhu.quotacycle.config.QuotaCycleProperties;
import io.github.samzhu.quotacycle.config.QuotaCycleProperties.QuotaDefinition;
import io.github.samzhu.quotacycle.document.QuotaCycle;
import io.github.samzhu.quotacycle.dto.QuotaKey;
import io.github.samzhu.quotacycle.dto.analytics.BillingPeriodRollup;
import io.github.samzhu.quotacycle.dto.analytics.QuotaSummary;
import io.github.samzhu.quotacycle.dto.analytics.SamplePoint;
import io.github.samzhu.quotacycle.dto.analytics.UsageLevel;
import io.github.samzhu.quotacycle.exception.CycleStoreException;
import io.github.samzhu.quotacycle.exception.QuotaNotFoundException;
import io.github.samzhu.quotacycle.repository.CycleStore;
import io.github.samzhu.quotacycle.repository.QuotaSampleRepository;

/**
 * 配額查詢服務，提供唯讀的週期、計費週期與用量摘要查詢。
 *
 * <p>所有查詢皆為無狀態計算，可與樣本寫入同時執行；
 * 讀到的週期清單視為一致的快照。
 */
@Service
public class QuotaQueryService {

    private static final Logger log = LoggerFactory.getLogger(QuotaQueryService.class);

    private final CycleStore cycleStore;
    private final QuotaSampleRepository sampleRepository;
    private final QuotaCycleProperties properties;
    private final Clock clock;

    public QuotaQueryService(CycleStore cycleStore, QuotaSampleRepository sampleRepository,
            QuotaCycleProperties properties, Clock clock) {
        this.cycleStore = cycleStore;
        this.sampleRepository = sampleRepository;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * 列出所有追蹤中的配額鍵。
     */
    public List<QuotaKey> listQuotaKeys() {
        return cycleStore.listQuotaKeys();
    }

    /**
     * 計算配額鍵的用量摘要。
     *
     * <p>已完成週期取最近 {@code analytics.history-limit} 筆：
     * <ul>
     *   <li>平均增量 = 已完成週期 totalDelta 的平均</li>
     *   <li>峰值 = 所有週期（含進行中）peak 的最大值</li>
     *   <li>總追蹤量 = 已完成週期 totalDelta 總和 + 進行中週期 totalDelta</li>
     *   <li>開始追蹤時間 = 最舊已完成週期的開始時間，否則為進行中週期的開始時間</li>
     * </ul>
     *
     * @param key 配額鍵
     * @return 用量摘要
     * @throws QuotaNotFoundException 配額鍵從未收過樣本時
     */
    public QuotaSummary summary(QuotaKey key) {
        Optional<QuotaCycle> active = cycleStore.getActiveCycle(key);
        List<QuotaCycle> completed = cycleStore.listCompletedCycles(key, properties.analytics().historyLimit());
        if (active.isEmpty() && completed.isEmpty()) {
            throw new QuotaNotFoundException(key.asString());
        }

        double totalDelta = 0.0;
        double peakCycle = 0.0;
        for (QuotaCycle cycle : completed) {
            totalDelta += cycle.totalDelta();
            peakCycle = Math.max(peakCycle, cycle.peak());
        }
        double avgPerCycle = completed.isEmpty() ? 0.0 : totalDelta / completed.size();
        Instant trackingSince = completed.isEmpty() ? null : completed.get(completed.size() - 1).cycleStart();

        double totalTracked = totalDelta;
        double currentUsage = 0.0;
        Double limit = null;
        Double percent = null;
        UsageLevel level = null;
        Instant activeStart = null;
        Instant renewsAt = null;
        Long secondsUntilReset = null;

        if (active.isPresent()) {
            QuotaCycle cycle = active.get();
            totalTracked += cycle.totalDelta();
            peakCycle = Math.max(peakCycle, cycle.peak());
            if (trackingSince == null) {
                trackingSince = cycle.cycleStart();
            }
            activeStart = cycle.cycleStart();
            currentUsage = cycle.lastConsumed();
            limit = cycle.lastLimit();
            percent = cycle.currentPercent();
            level = percent != null ? InsightClassifier.classifyUsage(percent) : null;
            renewsAt = cycle.renewsAt();
            Duration untilReset = cycle.timeUntilReset(clock.instant());
            secondsUntilReset = untilReset != null ? untilReset.getSeconds() : null;
        }

        return new QuotaSummary(
            key.asString(),
            displayName(key),
            completed.size(),
            avgPerCycle,
            peakCycle,
            totalTracked,
            trackingSince,
            currentUsage,
            limit,
            percent,
            level,
            activeStart,
            renewsAt,
            secondsUntilReset
        );
    }

    /**
     * 查詢週期歷史（新到舊，進行中的週期在最前）。
     *
     * @param key 配額鍵
     * @param limit 筆數上限
     * @return 週期清單
     */
    public List<QuotaCycle> cycleHistory(QuotaKey key, int limit) {
        List<QuotaCycle> cycles = cycleStore.listCycleHistory(key, limit);
        if (cycles.isEmpty()) {
            throw new QuotaNotFoundException(key.asString());
        }
        return cycles;
    }

    /**
     * 合併回溯期間內的週期為計費週期。
     *
     * @param key 配額鍵
     * @param lookbackDays 回溯天數
     * @return 計費週期彙總（由舊到新）
     */
    public BillingPeriodRollup billingPeriods(QuotaKey key, int lookbackDays) {
        Instant since = clock.instant().minus(Duration.ofDays(lookbackDays));
        List<QuotaCycle> cycles = cycleStore.listCyclesSince(key, since);
        BillingPeriodRollup rollup = BillingPeriodAggregator.rollup(cycles);
        log.debug("Billing periods: quotaKey={}, cycles={}, periods={}", key, cycles.size(), rollup.count());
        return rollup;
    }

    /**
     * 查詢正規化後的用量歷史。
     *
     * @param key 配額鍵
     * @param hours 回溯小時數
     * @return 依時間遞增的樣本點
     */
    public List<SamplePoint> history(QuotaKey key, int hours) {
        Instant since = clock.instant().minus(Duration.ofHours(hours));
        try {
            return sampleRepository
                .findByQuotaKeyAndCapturedAtGreaterThanEqualOrderByCapturedAtAsc(key.asString(), since)
                .stream()
                .map(s -> new SamplePoint(s.capturedAt(), s.consumed(), s.limit(),
                    s.limit() != null && s.limit() > 0 ? s.consumed() / s.limit() * 100.0 : null))
                .toList();
        } catch (DataAccessException e) {
            throw new CycleStoreException("history", key.asString(), e);
        }
    }

    /**
     * 取得配額鍵的顯示名稱，未設定時使用配額鍵本身。
     */
    public String displayName(QuotaKey key) {
        QuotaDefinition definition = properties.quotas().get(key.asString());
        if (definition != null && definition.displayName() != null && !definition.displayName().isBlank()) {
            return definition.displayName();
        }
        return key.asString();
    }
}
