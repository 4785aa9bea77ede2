package io.github.samzhu.quotacycle.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.cloudevents.spring.messaging.CloudEventMessageConverter;

/**
 * CloudEvents 訊息轉換器配置。
 *
 * <p>輪詢端以 <b>Structured Mode</b>（{@code application/cloudevents+json}）發送配額樣本時，
 * 此轉換器讓 Spring Cloud Stream 將 CloudEvent attributes 放入 Message Headers，
 * data 則反序列化為 {@link io.github.samzhu.quotacycle.dto.QuotaSampleData}。
 *
 * <p>需要 {@code cloudevents-json-jackson} 依賴，透過 Java ServiceLoader 提供 JSON 序列化支援。
 *
 * @see <a href="https://cloudevents.github.io/sdk-java/spring.html">CloudEvents Java SDK - Spring Integration</a>
 */
@Configuration
public class CloudEventsConfig {

    @Bean
    public CloudEventMessageConverter cloudEventMessageConverter() {
        return new CloudEventMessageConverter();
    }
}
