package io.github.samzhu.quotacycle.repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import io.github.samzhu.quotacycle.document.QuotaCycle;
import io.github.samzhu.quotacycle.dto.CycleProgress;
import io.github.samzhu.quotacycle.dto.QuotaKey;
import io.github.samzhu.quotacycle.exception.CycleStoreException;

/**
 * 測試用的記憶體週期儲存。
 *
 * <p>與 MongoDB 的部分唯一索引相同，拒絕同一配額鍵的第二筆 active 週期；
 * 更新或關閉非 active 週期時拋出 {@link CycleStoreException}。
 */
public class InMemoryCycleStore implements CycleStore {

    private final Map<String, QuotaCycle> cycles = new LinkedHashMap<>();

    @Override
    public synchronized Optional<QuotaCycle> getActiveCycle(QuotaKey key) {
        return cycles.values().stream()
            .filter(c -> c.quotaKey().equals(key.asString()) && c.active())
            .findFirst();
    }

    @Override
    public synchronized QuotaCycle createCycle(QuotaKey key, Instant start, double initialConsumed,
            Double limit, Instant renewsAt) {
        if (getActiveCycle(key).isPresent()) {
            throw new IllegalStateException("active cycle already exists for " + key);
        }
        QuotaCycle cycle = QuotaCycle.open(key, start, initialConsumed, limit, renewsAt)
            .withId(UUID.randomUUID().toString());
        cycles.put(cycle.id(), cycle);
        return cycle;
    }

    @Override
    public synchronized void updateCycle(String cycleId, CycleProgress progress) {
        QuotaCycle cycle = cycles.get(cycleId);
        if (cycle == null || !cycle.active()) {
            throw new CycleStoreException("updateCycle", cycleId);
        }
        cycles.put(cycleId, cycle.withProgress(progress.peak(), progress.totalDelta(), progress.lastSampleAt(),
            progress.lastConsumed(), progress.lastLimit(), progress.renewsAt()));
    }

    @Override
    public synchronized void closeCycle(String cycleId, Instant end) {
        QuotaCycle cycle = cycles.get(cycleId);
        if (cycle == null || !cycle.active()) {
            throw new CycleStoreException("closeCycle", cycleId);
        }
        cycles.put(cycleId, cycle.closedAt(end));
    }

    @Override
    public synchronized List<QuotaCycle> listCyclesSince(QuotaKey key, Instant since) {
        return newestFirst(key).stream()
            .filter(c -> !c.cycleStart().isBefore(since))
            .toList();
    }

    @Override
    public synchronized List<QuotaCycle> listCycleHistory(QuotaKey key, int limit) {
        return newestFirst(key).stream().limit(limit).toList();
    }

    @Override
    public synchronized List<QuotaCycle> listCompletedCycles(QuotaKey key, int limit) {
        return newestFirst(key).stream().filter(c -> !c.active()).limit(limit).toList();
    }

    @Override
    public synchronized List<QuotaKey> listQuotaKeys() {
        return cycles.values().stream()
            .map(QuotaCycle::quotaKey)
            .distinct()
            .sorted()
            .map(QuotaKey::parse)
            .toList();
    }

    /**
     * 直接放入週期（分析測試用）。
     */
    public synchronized QuotaCycle put(QuotaCycle cycle) {
        QuotaCycle stored = cycle.id() == null ? cycle.withId(UUID.randomUUID().toString()) : cycle;
        cycles.put(stored.id(), stored);
        return stored;
    }

    public synchronized List<QuotaCycle> all(QuotaKey key) {
        return newestFirst(key);
    }

    private List<QuotaCycle> newestFirst(QuotaKey key) {
        List<QuotaCycle> result = new ArrayList<>();
        for (QuotaCycle cycle : cycles.values()) {
            if (cycle.quotaKey().equals(key.asString())) {
                result.add(cycle);
            }
        }
        result.sort(Comparator.comparing(QuotaCycle::cycleStart).reversed());
        return result;
    }
}
