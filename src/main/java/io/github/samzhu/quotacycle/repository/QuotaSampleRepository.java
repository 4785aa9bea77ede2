package io.github.samzhu.quotacycle.repository;

import java.time.Instant;
import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.quotacycle.document.QuotaSampleRecord;

/**
 * 配額樣本資料存取介面，對應 {@code quota_samples} 集合。
 */
public interface QuotaSampleRepository extends MongoRepository<QuotaSampleRecord, String> {

    /**
     * 查詢指定時間之後的樣本，依時間遞增。
     *
     * @param quotaKey 配額鍵
     * @param since 起始時間（含）
     * @return 樣本清單
     */
    List<QuotaSampleRecord> findByQuotaKeyAndCapturedAtGreaterThanEqualOrderByCapturedAtAsc(String quotaKey, Instant since);
}
