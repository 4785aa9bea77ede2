package io.github.samzhu.quotacycle.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableMongoAuditing;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * MongoDB 資料庫配置。
 *
 * <p>啟用以下功能：
 * <ul>
 *   <li>Repository 自動掃描 - 自動註冊 {@code io.github.samzhu.quotacycle.repository} 下的介面</li>
 *   <li>Auditing 審計功能 - 支援 {@code @CreatedDate}、{@code @LastModifiedDate} 等註解</li>
 * </ul>
 *
 * <p>資料庫集合 (Collections)：
 * <ul>
 *   <li>{@code quota_cycles} - 配額週期（每個配額鍵最多一筆 active）</li>
 *   <li>{@code quota_samples} - 已接受的正規化樣本</li>
 * </ul>
 *
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/configuration.html">Spring Data MongoDB Configuration</a>
 */
@Configuration
@EnableMongoRepositories(basePackages = "io.github.samzhu.quotacycle.repository")
@EnableMongoAuditing
public class MongoConfig {
}
