package io.github.samzhu.quotacycle.repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.Update;

import io.github.samzhu.quotacycle.document.QuotaCycle;

/**
 * 配額週期資料存取介面。
 *
 * <p>提供對 {@code quota_cycles} 集合的存取。
 *
 * <p>更新操作策略：
 * <ul>
 *   <li>使用 {@code @Query + @Update} 進行原子更新</li>
 *   <li>更新條件包含 {@code active: true}，已關閉的週期不會被改寫</li>
 * </ul>
 *
 * @see io.github.samzhu.quotacycle.document.QuotaCycle
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/repositories/query-methods.html">Query Methods</a>
 */
public interface QuotaCycleRepository extends MongoRepository<QuotaCycle, String> {

    // ========== 基本查詢 (Derived Query Methods) ==========

    /**
     * 查詢配額鍵目前進行中的週期。
     *
     * @param quotaKey 配額鍵
     * @return 進行中週期（如存在）
     */
    Optional<QuotaCycle> findFirstByQuotaKeyAndActiveTrue(String quotaKey);

    /**
     * 查詢指定時間之後開始的週期，最新的在前。
     *
     * @param quotaKey 配額鍵
     * @param since 起始時間（含）
     * @return 週期清單
     */
    List<QuotaCycle> findByQuotaKeyAndCycleStartGreaterThanEqualOrderByCycleStartDesc(String quotaKey, Instant since);

    /**
     * 查詢週期歷史，最新的在前。
     *
     * @param quotaKey 配額鍵
     * @param pageable 筆數限制
     * @return 週期清單
     */
    List<QuotaCycle> findByQuotaKeyOrderByCycleStartDesc(String quotaKey, Pageable pageable);

    /**
     * 查詢已完成的週期，最新的在前（摘要統計用）。
     *
     * @param quotaKey 配額鍵
     * @param pageable 筆數限制
     * @return 已關閉的週期清單
     */
    List<QuotaCycle> findByQuotaKeyAndActiveFalseOrderByCycleStartDesc(String quotaKey, Pageable pageable);

    // ========== 更新操作 (@Query + @Update) ==========

    /**
     * 更新進行中週期的進度。
     *
     * @return 更新的文件數，0 表示週期已不是 active
     */
    @Query("{ '_id': ?0, 'active': true }")
    @Update("{ '$set': { 'peak': ?1, 'totalDelta': ?2, 'lastSampleAt': ?3, 'lastConsumed': ?4, " +
            "'lastLimit': ?5, 'renewsAt': ?6, 'lastUpdatedAt': ?7 } }")
    long updateProgressById(String id, double peak, double totalDelta, Instant lastSampleAt,
            double lastConsumed, Double lastLimit, Instant renewsAt, Instant now);

    /**
     * 關閉進行中的週期。
     *
     * @return 更新的文件數，0 表示週期已被關閉
     */
    @Query("{ '_id': ?0, 'active': true }")
    @Update("{ '$set': { 'active': false, 'cycleEnd': ?1, 'lastUpdatedAt': ?2 } }")
    long closeById(String id, Instant end, Instant now);
}
