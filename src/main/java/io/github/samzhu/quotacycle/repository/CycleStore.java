package io.github.samzhu.quotacycle.repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import io.github.samzhu.quotacycle.document.QuotaCycle;
import io.github.samzhu.quotacycle.dto.CycleProgress;
import io.github.samzhu.quotacycle.dto.QuotaKey;

/**
 * 週期儲存契約。
 *
 * <p>週期偵測與分析服務只透過此介面存取週期，實作須保證：
 * <ul>
 *   <li>每個配額鍵最多一筆進行中週期</li>
 *   <li>清單查詢依 {@code cycleStart} 由新到舊排序</li>
 *   <li>失敗時立即拋出 {@link io.github.samzhu.quotacycle.exception.CycleStoreException}，不重試</li>
 * </ul>
 */
public interface CycleStore {

    Optional<QuotaCycle> getActiveCycle(QuotaKey key);

    /**
     * 建立新的進行中週期，{@code peak} 初始為 {@code initialConsumed}。
     */
    QuotaCycle createCycle(QuotaKey key, Instant start, double initialConsumed, Double limit, Instant renewsAt);

    void updateCycle(String cycleId, CycleProgress progress);

    void closeCycle(String cycleId, Instant end);

    /**
     * 列出指定時間之後開始的週期（新到舊）。
     */
    List<QuotaCycle> listCyclesSince(QuotaKey key, Instant since);

    /**
     * 列出最近的週期（新到舊，進行中的週期排在最前）。
     */
    List<QuotaCycle> listCycleHistory(QuotaKey key, int limit);

    /**
     * 列出最近的已完成週期（新到舊）。
     */
    List<QuotaCycle> listCompletedCycles(QuotaKey key, int limit);

    /**
     * 列出所有曾經追蹤過的配額鍵。
     */
    List<QuotaKey> listQuotaKeys();
}
