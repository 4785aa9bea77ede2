package io.github.samzhu.quotacycle.service;

import java.time.Instant;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import io.github.samzhu.quotacycle.config.QuotaCycleProperties;
import io.github.samzhu.quotacycle.config.QuotaCycleProperties.TrackerConfig;
import io.github.samzhu.quotacycle.document.QuotaCycle;
import io.github.samzhu.quotacycle.dto.CycleProgress;
import io.github.samzhu.quotacycle.dto.IngestOutcome;
import io.github.samzhu.quotacycle.dto.NormalizedConsumption;
import io.github.samzhu.quotacycle.dto.QuotaKey;
import io.github.samzhu.quotacycle.dto.QuotaResetEvent;
import io.github.samzhu.quotacycle.dto.ResetReason;
import io.github.samzhu.quotacycle.repository.CycleStore;

/**
 * 週期偵測器，依連續的正規化樣本判斷配額是重置還是延續。
 *
 * <p>供應商不會送出重置事件，因此從數值推斷：
 * <ul>
 *   <li><b>跌落重置</b> - 峰值高於 {@link #MIN_SIGNAL} 且新消耗量低於峰值的 {@link #DROP_RATIO}</li>
 *   <li><b>時間重置</b> - 樣本時間晚於週期記錄的 {@code renewsAt + resetGrace}，
 *       且樣本回報的 {@code renewsAt} 已經往後推移（或未回報）；可關閉</li>
 * </ul>
 *
 * <p>重置時以<b>上一筆樣本的時間</b>關閉舊週期，並以目前樣本開啟新週期，
 * 之後發布 {@link QuotaResetEvent}。
 *
 * <p>呼叫端須保證同一配額鍵的 {@link #detect} 不會同時執行
 * （見 {@link QuotaTrackingService} 的配額鍵鎖）。
 */
@Component
public class CycleDetector {

    private static final Logger log = LoggerFactory.getLogger(CycleDetector.class);

    /** 消耗量低於峰值此比例時視為重置 */
    public static final double DROP_RATIO = 0.5;

    /** 峰值需高於此值才會判斷跌落重置，避免把接近零的雜訊當成重置 */
    public static final double MIN_SIGNAL = 5.0;

    private final CycleStore cycleStore;
    private final TrackerConfig trackerConfig;
    private final ApplicationEventPublisher eventPublisher;

    public CycleDetector(CycleStore cycleStore, QuotaCycleProperties properties,
            ApplicationEventPublisher eventPublisher) {
        this.cycleStore = cycleStore;
        this.trackerConfig = properties.tracker();
        this.eventPublisher = eventPublisher;
    }

    /**
     * 處理一筆已正規化的樣本。
     *
     * @param key 配額鍵
     * @param capturedAt 樣本時間
     * @param consumption 正規化後的消耗量
     * @param renewsAt 供應商回報的重置時間，可為 null
     * @return 偵測結果
     */
    public IngestOutcome detect(QuotaKey key, Instant capturedAt, NormalizedConsumption consumption, Instant renewsAt) {
        double consumed = consumption.consumed();
        Optional<QuotaCycle> activeCycle = cycleStore.getActiveCycle(key);

        if (activeCycle.isEmpty()) {
            QuotaCycle created = cycleStore.createCycle(key, capturedAt, consumed, consumption.limit(), renewsAt);
            log.info("Cycle started: quotaKey={}, start={}, consumed={}", key, capturedAt, consumed);
            return IngestOutcome.created(created);
        }

        QuotaCycle active = activeCycle.get();
        if (active.lastSampleAt() != null && !capturedAt.isAfter(active.lastSampleAt())) {
            log.warn("Out-of-order sample ignored: quotaKey={}, capturedAt={}, lastSampleAt={}",
                key, capturedAt, active.lastSampleAt());
            return IngestOutcome.outOfOrder(active);
        }

        ResetReason reason = resetReason(active, capturedAt, consumed, renewsAt);
        if (reason != null) {
            return reset(key, active, capturedAt, consumption, renewsAt, reason);
        }

        double newPeak = Math.max(active.peak(), consumed);
        CycleProgress progress = new CycleProgress(
            newPeak,
            newPeak - active.startConsumed(),
            capturedAt,
            consumed,
            consumption.limit() != null ? consumption.limit() : active.lastLimit(),
            renewsAt != null ? renewsAt : active.renewsAt()
        );
        cycleStore.updateCycle(active.id(), progress);
        log.debug("Cycle continued: quotaKey={}, consumed={}, peak={}", key, consumed, newPeak);

        return IngestOutcome.continued(active.withProgress(progress.peak(), progress.totalDelta(),
            progress.lastSampleAt(), progress.lastConsumed(), progress.lastLimit(), progress.renewsAt()));
    }

    /**
     * 判斷是否重置。
     *
     * <p>供應商仍回報同一個（已過期的）{@code renewsAt} 時表示尚未換週期，不做時間重置。
     *
     * @param renewsAt 樣本回報的重置時間，可為 null
     * @return 重置依據；延續時返回 null
     */
    ResetReason resetReason(QuotaCycle active, Instant capturedAt, double consumed, Instant renewsAt) {
        if (isDrop(active.peak(), consumed)) {
            return ResetReason.DROP;
        }
        if (trackerConfig.timeBasedReset() && active.renewsAt() != null
                && capturedAt.isAfter(active.renewsAt().plus(trackerConfig.resetGrace()))
                && (renewsAt == null || renewsAt.isAfter(active.renewsAt()))) {
            return ResetReason.TIME;
        }
        return null;
    }

    /**
     * 跌落重置規則，計費週期合併也使用相同比例。
     */
    static boolean isDrop(double peak, double consumed) {
        return peak > MIN_SIGNAL && consumed < peak * DROP_RATIO;
    }

    private IngestOutcome reset(QuotaKey key, QuotaCycle active, Instant capturedAt,
            NormalizedConsumption consumption, Instant renewsAt, ResetReason reason) {
        Instant end = active.lastSampleAt() != null ? active.lastSampleAt() : active.cycleStart();
        cycleStore.closeCycle(active.id(), end);
        QuotaCycle closed = active.closedAt(end);

        QuotaCycle created = cycleStore.createCycle(key, capturedAt, consumption.consumed(),
            consumption.limit(), renewsAt);
        log.info("Reset detected: quotaKey={}, reason={}, closedCycle={}, peak={}, totalDelta={}, newStart={}",
            key, reason, closed.id(), closed.peak(), closed.totalDelta(), capturedAt);

        eventPublisher.publishEvent(new QuotaResetEvent(key, closed, created, reason, capturedAt));
        return IngestOutcome.reset(created, closed, reason);
    }
}
