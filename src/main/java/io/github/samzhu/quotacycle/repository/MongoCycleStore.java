package io.github.samzhu.quotacycle.repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.PartialIndexFilter;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import io.github.samzhu.quotacycle.document.QuotaCycle;
import io.github.samzhu.quotacycle.dto.CycleProgress;
import io.github.samzhu.quotacycle.dto.QuotaKey;
import io.github.samzhu.quotacycle.exception.CycleStoreException;

/**
 * 以 MongoDB 實作的週期儲存。
 *
 * <p>寫入策略：
 * <ul>
 *   <li>建立週期使用 {@code insert}，部分唯一索引 {@code active_cycle_uk} 拒絕第二筆 active 週期</li>
 *   <li>更新與關閉使用 {@code @Query + @Update} 原子操作，條件限定 {@code active: true}</li>
 *   <li>所有 {@link DataAccessException} 轉換為 {@link CycleStoreException}</li>
 *   <li>更新或關閉沒有命中 active 週期時拋出 {@link CycleStoreException}</li>
 * </ul>
 */
@Repository
public class MongoCycleStore implements CycleStore {

    private static final Logger log = LoggerFactory.getLogger(MongoCycleStore.class);

    static final String ACTIVE_INDEX_NAME = "active_cycle_uk";

    private final QuotaCycleRepository cycleRepository;
    private final MongoTemplate mongoTemplate;

    public MongoCycleStore(QuotaCycleRepository cycleRepository, MongoTemplate mongoTemplate) {
        this.cycleRepository = cycleRepository;
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * 確保單一 active 週期的部分唯一索引存在。
     *
     * <p>{@code @CompoundIndex} 無法宣告 partial filter，因此在啟動完成後建立。
     */
    @EventListener(ApplicationReadyEvent.class)
    public void ensureActiveCycleIndex() {
        Index index = new Index()
            .on("quotaKey", Sort.Direction.ASC)
            .unique()
            .partial(PartialIndexFilter.of(Criteria.where("active").is(true)))
            .named(ACTIVE_INDEX_NAME);
        String name = mongoTemplate.indexOps(QuotaCycle.class).ensureIndex(index);
        log.info("Ensured index {} on quota_cycles", name);
    }

    @Override
    public Optional<QuotaCycle> getActiveCycle(QuotaKey key) {
        return execute("getActiveCycle", key,
            () -> cycleRepository.findFirstByQuotaKeyAndActiveTrue(key.asString()));
    }

    @Override
    public QuotaCycle createCycle(QuotaKey key, Instant start, double initialConsumed, Double limit, Instant renewsAt) {
        QuotaCycle cycle = QuotaCycle.open(key, start, initialConsumed, limit, renewsAt);
        QuotaCycle saved = execute("createCycle", key, () -> cycleRepository.insert(cycle));
        log.debug("Created cycle: id={}, quotaKey={}, start={}", saved.id(), key, start);
        return saved;
    }

    @Override
    public void updateCycle(String cycleId, CycleProgress progress) {
        long updated = execute("updateCycle", cycleId, () -> cycleRepository.updateProgressById(
            cycleId,
            progress.peak(),
            progress.totalDelta(),
            progress.lastSampleAt(),
            progress.lastConsumed(),
            progress.lastLimit(),
            progress.renewsAt(),
            Instant.now()));
        if (updated == 0) {
            log.warn("Cycle update matched no active cycle: id={}", cycleId);
            throw new CycleStoreException("updateCycle", cycleId);
        }
    }

    @Override
    public void closeCycle(String cycleId, Instant end) {
        long updated = execute("closeCycle", cycleId, () -> cycleRepository.closeById(cycleId, end, Instant.now()));
        if (updated == 0) {
            log.warn("Cycle close matched no active cycle: id={}", cycleId);
            throw new CycleStoreException("closeCycle", cycleId);
        }
    }

    @Override
    public List<QuotaCycle> listCyclesSince(QuotaKey key, Instant since) {
        return execute("listCyclesSince", key, () ->
            cycleRepository.findByQuotaKeyAndCycleStartGreaterThanEqualOrderByCycleStartDesc(key.asString(), since));
    }

    @Override
    public List<QuotaCycle> listCycleHistory(QuotaKey key, int limit) {
        return execute("listCycleHistory", key, () ->
            cycleRepository.findByQuotaKeyOrderByCycleStartDesc(key.asString(), PageRequest.of(0, limit)));
    }

    @Override
    public List<QuotaCycle> listCompletedCycles(QuotaKey key, int limit) {
        return execute("listCompletedCycles", key, () ->
            cycleRepository.findByQuotaKeyAndActiveFalseOrderByCycleStartDesc(key.asString(), PageRequest.of(0, limit)));
    }

    @Override
    public List<QuotaKey> listQuotaKeys() {
        List<String> keys = execute("listQuotaKeys", "*", () ->
            mongoTemplate.findDistinct(new Query(), "quotaKey", QuotaCycle.class, String.class));
        return keys.stream().sorted().map(QuotaKey::parse).toList();
    }

    private <T> T execute(String operation, Object key, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("Cycle store operation failed: operation={}, key={}", operation, key, e);
            throw new CycleStoreException(operation, String.valueOf(key), e);
        }
    }
}
