package io.github.samzhu.quotacycle.function;

import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cloud.function.cloudevent.CloudEventMessageUtils;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.Message;

import io.github.samzhu.quotacycle.dto.IngestOutcome;
import io.github.samzhu.quotacycle.dto.QuotaSampleData;
import io.github.samzhu.quotacycle.exception.SampleNormalizationException;
import io.github.samzhu.quotacycle.service.QuotaTrackingService;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;

/**
 * CloudEvents 配額樣本消費者函式配置。
 *
 * <p>訊息代理：本地開發使用 RabbitMQ，GCP 部署（{@code gcp} profile）使用 Pub/Sub。
 *
 * <p>輪詢端以 <b>Structured Mode</b> ({@code application/cloudevents+json}) 發送樣本，
 * Spring Cloud Stream 自動解析後：
 * <ul>
 *   <li>CloudEvent attributes → Message Headers</li>
 *   <li>CloudEvent data → Message Payload（自動轉換為 {@link QuotaSampleData}）</li>
 * </ul>
 *
 * <p>錯誤處理：
 * <ul>
 *   <li>payload 違反欄位約束（如缺少 {@code capturedAt}）- 不交給追蹤服務，記錄後確認訊息</li>
 *   <li>樣本無法正規化 - 記錄後確認訊息，不重新投遞（重送也不會成功）</li>
 *   <li>儲存失敗 - 重新拋出，由 binder 決定重試或送往 DLQ</li>
 * </ul>
 *
 * <p>Binding name: {@code quotaSampleConsumer-in-0}
 *
 * @see <a href="https://spring.io/blog/2020/12/23/cloud-events-and-spring-part-2/">Cloud Events and Spring - part 2</a>
 * @see <a href="https://docs.spring.io/spring-cloud-stream/reference/spring-cloud-stream/producing-and-consuming-messages.html">Spring Cloud Stream Function Model</a>
 */
@Configuration
public class QuotaSampleFunction {

    private static final Logger log = LoggerFactory.getLogger(QuotaSampleFunction.class);

    private final QuotaTrackingService trackingService;
    private final Validator validator;

    public QuotaSampleFunction(QuotaTrackingService trackingService, Validator validator) {
        this.trackingService = trackingService;
        this.validator = validator;
    }

    /**
     * CloudEvents 配額樣本消費者 Bean。
     *
     * @return CloudEvents 訊息消費者
     */
    @Bean
    public Consumer<Message<QuotaSampleData>> quotaSampleConsumer() {
        return message -> {
            QuotaSampleData data = message.getPayload();
            log.debug("CloudEvent received: id={}, type={}, source={}, provider={}, quotaType={}",
                CloudEventMessageUtils.getId(message),
                CloudEventMessageUtils.getType(message),
                CloudEventMessageUtils.getSource(message),
                data.provider(),
                data.quotaType());

            Set<ConstraintViolation<QuotaSampleData>> violations = validator.validate(data);
            if (!violations.isEmpty()) {
                log.warn("Dropping invalid CloudEvent: id={}, violations={}",
                    CloudEventMessageUtils.getId(message),
                    violations.stream()
                        .map(v -> v.getPropertyPath() + " " + v.getMessage())
                        .sorted()
                        .collect(Collectors.joining(", ")));
                return;
            }

            try {
                IngestOutcome outcome = trackingService.ingest(data);
                log.debug("Sample consumed: provider={}, quotaType={}, status={}",
                    data.provider(), data.quotaType(), outcome.status());
            } catch (SampleNormalizationException e) {
                log.warn("Dropping unprocessable CloudEvent: id={}, error={}",
                    CloudEventMessageUtils.getId(message), e.getMessage());
            }
        };
    }
}
