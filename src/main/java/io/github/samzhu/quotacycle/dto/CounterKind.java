package io.github.samzhu.quotacycle.dto;

/**
 * 配額計數器種類，決定原始數值如何轉換為「已消耗量」。
 *
 * <p>各供應商回報配額的方式不同，此列舉為封閉的正規化策略集合：
 * <ul>
 *   <li>{@link #INCREASING_USAGE} - 遞增用量計數器，{@code consumed = raw}</li>
 *   <li>{@link #REMAINING_BUDGET} - 剩餘額度計數器，{@code consumed = limit - remaining}</li>
 *   <li>{@link #UTILIZATION_PERCENT} - 使用率百分比，{@code consumed = percent}，上限固定為 100</li>
 * </ul>
 *
 * <p>上限為 {@code null} 或 {@code <= 0} 時視為「未知」，下游不得據此計算百分比。
 */
public enum CounterKind {

    INCREASING_USAGE("used") {
        @Override
        public NormalizedConsumption normalize(double raw, Double limit) {
            requireNonNegative(raw);
            return new NormalizedConsumption(raw, knownLimit(limit));
        }
    },

    REMAINING_BUDGET("remaining") {
        @Override
        public NormalizedConsumption normalize(double raw, Double limit) {
            requireNonNegative(raw);
            Double known = knownLimit(limit);
            if (known == null) {
                throw new IllegalArgumentException("remaining-budget counter requires a positive limit");
            }
            return new NormalizedConsumption(Math.max(0.0, known - raw), known);
        }
    },

    UTILIZATION_PERCENT("utilization") {
        @Override
        public NormalizedConsumption normalize(double raw, Double limit) {
            requireNonNegative(raw);
            return new NormalizedConsumption(raw, 100.0);
        }
    };

    private final String defaultValueField;

    CounterKind(String defaultValueField) {
        this.defaultValueField = defaultValueField;
    }

    /**
     * 將原始數值正規化為已消耗量。
     *
     * @param raw 供應商回報的原始數值
     * @param limit 配額上限，可為 {@code null}
     * @return 正規化結果
     * @throws IllegalArgumentException 原始數值無法解讀時
     */
    public abstract NormalizedConsumption normalize(double raw, Double limit);

    /**
     * 未設定欄位名稱時，從 {@code rawFields} 讀取數值使用的預設欄位。
     */
    public String defaultValueField() {
        return defaultValueField;
    }

    private static void requireNonNegative(double raw) {
        if (Double.isNaN(raw) || Double.isInfinite(raw)) {
            throw new IllegalArgumentException("raw value is not a finite number: " + raw);
        }
        if (raw < 0) {
            throw new IllegalArgumentException("raw value must not be negative: " + raw);
        }
    }

    private static Double knownLimit(Double limit) {
        if (limit == null || limit.isNaN() || limit.isInfinite() || limit <= 0) {
            return null;
        }
        return limit;
    }
}
