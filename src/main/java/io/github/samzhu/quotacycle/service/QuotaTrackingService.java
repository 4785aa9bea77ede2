package io.github.samzhu.quotacycle.service;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import io.github.samzhu.quotacycle.document.QuotaSampleRecord;
import io.github.samzhu.quotacycle.dto.IngestOutcome;
import io.github.samzhu.quotacycle.dto.IngestStats;
import io.github.samzhu.quotacycle.dto.IngestStatus;
import io.github.samzhu.quotacycle.dto.NormalizedConsumption;
import io.github.samzhu.quotacycle.dto.QuotaKey;
import io.github.samzhu.quotacycle.dto.QuotaSampleData;
import io.github.samzhu.quotacycle.exception.CycleStoreException;
import io.github.samzhu.quotacycle.exception.SampleNormalizationException;
import io.github.samzhu.quotacycle.repository.QuotaSampleRepository;

/**
 * 配額追蹤協調服務，負責單一樣本的完整寫入流程。
 *
 * <p>處理流程：
 * <ol>
 *   <li>{@link SampleNormalizer} 正規化樣本，失敗則丟棄（不修改任何狀態）</li>
 *   <li>取得配額鍵鎖，確保「讀取進行中週期、判斷、寫入」不會交錯</li>
 *   <li>{@link CycleDetector} 判斷重置或延續並寫入週期</li>
 *   <li>將觀測點加入 {@link TrackerWindow}</li>
 *   <li>儲存 {@link QuotaSampleRecord}</li>
 * </ol>
 *
 * <p>不同配額鍵之間不需同步，各自的鎖互不影響。
 *
 * <p>實作 {@link SmartLifecycle}，關閉時記錄處理計數。
 *
 * @see CycleDetector
 * @see TrackerWindowRegistry
 */
@Service
public class QuotaTrackingService implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(QuotaTrackingService.class);

    private final SampleNormalizer sampleNormalizer;
    private final CycleDetector cycleDetector;
    private final TrackerWindowRegistry windowRegistry;
    private final QuotaSampleRepository sampleRepository;
    private final Clock clock;

    private final Map<QuotaKey, ReentrantLock> keyLocks = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    // ========== 處理計數 ==========
    private final AtomicLong ingested = new AtomicLong();
    private final AtomicLong cyclesCreated = new AtomicLong();
    private final AtomicLong resets = new AtomicLong();
    private final AtomicLong outOfOrder = new AtomicLong();
    private final AtomicLong discarded = new AtomicLong();

    public QuotaTrackingService(
            SampleNormalizer sampleNormalizer,
            CycleDetector cycleDetector,
            TrackerWindowRegistry windowRegistry,
            QuotaSampleRepository sampleRepository,
            Clock clock) {
        this.sampleNormalizer = sampleNormalizer;
        this.cycleDetector = cycleDetector;
        this.windowRegistry = windowRegistry;
        this.sampleRepository = sampleRepository;
        this.clock = clock;
    }

    /**
     * 處理一筆配額樣本。
     *
     * @param sample 樣本
     * @return 偵測結果；亂序樣本返回 {@link IngestStatus#OUT_OF_ORDER}
     * @throws SampleNormalizationException 樣本無法解讀時（已丟棄）
     * @throws CycleStoreException 儲存失敗時（樣本未被處理，呼叫端應重送）
     */
    public IngestOutcome ingest(QuotaSampleData sample) {
        if (sample == null) {
            discarded.incrementAndGet();
            log.warn("Sample discarded: empty payload");
            throw new SampleNormalizationException("?", "empty sample payload");
        }
        QuotaKey key;
        NormalizedConsumption consumption;
        try {
            key = sample.quotaKey();
            if (sample.capturedAt() == null) {
                throw new SampleNormalizationException(key.asString(), "missing capturedAt");
            }
            consumption = sampleNormalizer.normalize(sample);
        } catch (SampleNormalizationException e) {
            discarded.incrementAndGet();
            log.warn("Sample discarded: {}", e.getMessage());
            throw e;
        } catch (IllegalArgumentException e) {
            discarded.incrementAndGet();
            log.warn("Sample discarded, invalid quota key: provider={}, quotaType={}",
                sample.provider(), sample.quotaType());
            throw new SampleNormalizationException(sample.provider() + "/" + sample.quotaType(), e.getMessage(), e);
        }

        ReentrantLock lock = keyLocks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            IngestOutcome outcome = cycleDetector.detect(key, sample.capturedAt(), consumption, sample.renewsAt());
            if (!outcome.accepted()) {
                outOfOrder.incrementAndGet();
                return outcome;
            }

            windowRegistry.window(key).add(sample.capturedAt(), consumption.consumed());
            saveSample(key, sample, consumption);

            ingested.incrementAndGet();
            if (outcome.status() == IngestStatus.CREATED) {
                cyclesCreated.incrementAndGet();
            } else if (outcome.status() == IngestStatus.RESET) {
                resets.incrementAndGet();
            }
            return outcome;
        } finally {
            lock.unlock();
        }
    }

    private void saveSample(QuotaKey key, QuotaSampleData sample, NormalizedConsumption consumption) {
        QuotaSampleRecord record = new QuotaSampleRecord(
            null, // ID 自動產生
            key.asString(),
            sample.capturedAt(),
            consumption.consumed(),
            consumption.limit(),
            sample.renewsAt(),
            sample.rawFields(),
            clock.instant()
        );
        try {
            sampleRepository.save(record);
        } catch (DataAccessException e) {
            log.error("Failed to store sample: quotaKey={}, capturedAt={}", key, sample.capturedAt(), e);
            throw new CycleStoreException("saveSample", key.asString(), e);
        }
    }

    /**
     * 取得處理計數，用於監控。
     */
    public IngestStats getStats() {
        return new IngestStats(
            ingested.get(),
            cyclesCreated.get(),
            resets.get(),
            outOfOrder.get(),
            discarded.get(),
            windowRegistry.size()
        );
    }

    // ===== SmartLifecycle Implementation =====

    @Override
    public void start() {
        running.set(true);
        log.info("QuotaTrackingService started");
    }

    @Override
    public void stop() {
        running.set(false);
        log.info("QuotaTrackingService stopped: {}", getStats());
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // 在 Spring Cloud Stream bindings 之後關閉
        return Integer.MAX_VALUE - 100;
    }
}
