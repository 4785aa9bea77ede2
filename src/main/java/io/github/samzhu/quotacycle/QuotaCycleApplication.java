package io.github.samzhu.quotacycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Quota Cycle Service - 外部 API 配額週期追蹤服務。
 *
 * <p>此服務接收各供應商配額的輪詢快照，負責：
 * <ul>
 *   <li>將各供應商的計數器正規化為單一的「已消耗量」</li>
 *   <li>在沒有明確重置事件的情況下偵測配額週期重置</li>
 *   <li>將 jitter 造成的迷你週期合併為真實計費週期</li>
 *   <li>計算消耗速率並預測耗盡時間與週期末用量</li>
 *   <li>提供 REST API 查詢配額狀態與洞察</li>
 * </ul>
 *
 * <p>架構流程：
 * <pre>
 * Poller (Publisher) → RabbitMQ / Pub/Sub → quotaSampleConsumer → SampleNormalizer → CycleDetector → MongoDB
 *                                                                              ↓
 *                                                          quota_cycles  (週期記錄)
 *                                                          quota_samples (正規化樣本)
 * </pre>
 *
 * @see <a href="https://cloudevents.io/">CloudEvents Specification</a>
 * @see <a href="https://docs.spring.io/spring-cloud-stream/reference/">Spring Cloud Stream</a>
 */
@SpringBootApplication
public class QuotaCycleApplication {

    private static final Logger log = LoggerFactory.getLogger(QuotaCycleApplication.class);

    public static void main(String[] args) {
        log.info("Starting Quota Cycle Service - quota reset tracking and forecasting");
        SpringApplication.run(QuotaCycleApplication.class, args);
    }
}
