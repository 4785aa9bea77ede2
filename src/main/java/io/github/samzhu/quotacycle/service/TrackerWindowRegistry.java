package io.github.samzhu.quotacycle.service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import io.github.samzhu.quotacycle.config.QuotaCycleProperties;
import io.github.samzhu.quotacycle.document.QuotaCycle;
import io.github.samzhu.quotacycle.document.QuotaSampleRecord;
import io.github.samzhu.quotacycle.dto.QuotaKey;
import io.github.samzhu.quotacycle.dto.QuotaResetEvent;
import io.github.samzhu.quotacycle.exception.CycleStoreException;
import io.github.samzhu.quotacycle.repository.CycleStore;
import io.github.samzhu.quotacycle.repository.QuotaSampleRepository;

/**
 * 配額鍵到速率視窗的註冊表。
 *
 * <p>每個配額鍵擁有獨立的 {@link TrackerWindow}：
 * <ul>
 *   <li>第一次存取時從 {@code quota_samples} 重建（服務重啟後）</li>
 *   <li>收到 {@link QuotaResetEvent} 時換成空視窗</li>
 * </ul>
 */
@Component
public class TrackerWindowRegistry {

    private static final Logger log = LoggerFactory.getLogger(TrackerWindowRegistry.class);

    private final Map<QuotaKey, TrackerWindow> windows = new ConcurrentHashMap<>();
    private final CycleStore cycleStore;
    private final QuotaSampleRepository sampleRepository;
    private final QuotaCycleProperties properties;

    public TrackerWindowRegistry(CycleStore cycleStore, QuotaSampleRepository sampleRepository,
            QuotaCycleProperties properties) {
        this.cycleStore = cycleStore;
        this.sampleRepository = sampleRepository;
        this.properties = properties;
    }

    /**
     * 取得配額鍵的視窗，不存在時重建。
     */
    public TrackerWindow window(QuotaKey key) {
        return windows.computeIfAbsent(key, this::rehydrate);
    }

    @EventListener
    public void onQuotaReset(QuotaResetEvent event) {
        windows.put(event.quotaKey(), new TrackerWindow(properties.tracker().windowSpan()));
        log.debug("Tracker window cleared: quotaKey={}", event.quotaKey());
    }

    /**
     * 目前持有視窗的配額鍵數量（監控用）。
     */
    public int size() {
        return windows.size();
    }

    private TrackerWindow rehydrate(QuotaKey key) {
        TrackerWindow window = new TrackerWindow(properties.tracker().windowSpan());
        Optional<QuotaCycle> active = cycleStore.getActiveCycle(key);
        if (active.isEmpty() || active.get().lastSampleAt() == null) {
            return window;
        }

        QuotaCycle cycle = active.get();
        Instant since = cycle.lastSampleAt().minus(window.span());
        if (since.isBefore(cycle.cycleStart())) {
            since = cycle.cycleStart();
        }
        List<QuotaSampleRecord> samples;
        try {
            samples = sampleRepository.findByQuotaKeyAndCapturedAtGreaterThanEqualOrderByCapturedAtAsc(
                key.asString(), since);
        } catch (DataAccessException e) {
            throw new CycleStoreException("rehydrateWindow", key.asString(), e);
        }
        samples.forEach(s -> window.add(s.capturedAt(), s.consumed()));
        log.info("Tracker window rehydrated: quotaKey={}, points={}", key, window.size());
        return window;
    }
}
