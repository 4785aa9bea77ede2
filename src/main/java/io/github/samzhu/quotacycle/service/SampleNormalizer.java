package io.github.samzhu.quotacycle.service;

import java.util.Map;

import org.springframework.stereotype.Component;

import io.github.samzhu.quotacycle.config.QuotaCycleProperties;
import io.github.samzhu.quotacycle.config.QuotaCycleProperties.QuotaDefinition;
import io.github.samzhu.quotacycle.dto.CounterKind;
import io.github.samzhu.quotacycle.dto.NormalizedConsumption;
import io.github.samzhu.quotacycle.dto.QuotaSampleData;
import io.github.samzhu.quotacycle.exception.SampleNormalizationException;

/**
 * 樣本正規化器，將供應商原始欄位轉換為可比較的消耗量。
 *
 * <p>配額定義來源優先順序：
 * <ol>
 *   <li>{@code quotacycle.quotas} 中該配額鍵的定義</li>
 *   <li>樣本自帶的 {@code counterKind}，欄位使用預設名稱</li>
 * </ol>
 * 兩者皆無時拋出 {@link SampleNormalizationException}。
 *
 * <p>上限來源優先順序：樣本的 {@code limit}、{@code rawFields} 中的上限欄位、定義的 {@code fixedLimit}。
 *
 * <p>純函數，不修改任何狀態。
 */
@Component
public class SampleNormalizer {

    private final QuotaCycleProperties properties;

    public SampleNormalizer(QuotaCycleProperties properties) {
        this.properties = properties;
    }

    /**
     * 正規化樣本。
     *
     * @param sample 原始樣本
     * @return 消耗量與上限
     * @throws SampleNormalizationException 樣本無法解讀時
     */
    public NormalizedConsumption normalize(QuotaSampleData sample) {
        String key;
        try {
            key = sample.quotaKey().asString();
        } catch (IllegalArgumentException e) {
            throw new SampleNormalizationException(sample.provider() + "/" + sample.quotaType(), e.getMessage(), e);
        }
        QuotaDefinition definition = resolveDefinition(key, sample.counterKind());
        Map<String, Object> fields = sample.rawFields() != null ? sample.rawFields() : Map.of();

        Double raw = readNumber(key, fields, definition.valueField());
        if (raw == null) {
            throw new SampleNormalizationException(key, "missing field '" + definition.valueField() + "'");
        }
        Double limit = sample.limit();
        if (limit == null) {
            limit = readNumber(key, fields, definition.limitField());
        }
        if (limit == null) {
            limit = definition.fixedLimit();
        }

        try {
            return definition.counterKind().normalize(raw, limit);
        } catch (IllegalArgumentException e) {
            throw new SampleNormalizationException(key, e.getMessage(), e);
        }
    }

    /**
     * 取得配額鍵的定義。
     *
     * @param key 配額鍵字串
     * @param sampleKind 樣本自帶的計數器種類，可為 null
     * @return 配額定義
     */
    public QuotaDefinition resolveDefinition(String key, CounterKind sampleKind) {
        QuotaDefinition configured = properties.quotas().get(key);
        if (configured != null) {
            return configured;
        }
        if (sampleKind != null) {
            return QuotaDefinition.of(sampleKind);
        }
        throw new SampleNormalizationException(key, "no quota definition and no counterKind on sample");
    }

    private static Double readNumber(String key, Map<String, Object> fields, String name) {
        Object value = fields.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw new SampleNormalizationException(key, "field '" + name + "' is not numeric: " + text, e);
            }
        }
        throw new SampleNormalizationException(key, "field '" + name + "' has unsupported type "
            + value.getClass().getSimpleName());
    }
}
