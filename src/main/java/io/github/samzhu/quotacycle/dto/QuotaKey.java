package io.github.samzhu.quotacycle.dto;

/**
 * 配額識別鍵，由供應商與配額維度組成，例如 {@code synthetic/subscription}。
 *
 * <p>文件中以 {@link #asString()} 的字串形式儲存，避免在 MongoDB 中使用自定義類型。
 *
 * @param provider 供應商名稱
 * @param quotaType 配額維度
 */
public record QuotaKey(
    String provider,
    String quotaType
) {

    private static final String SEPARATOR = "/";

    public QuotaKey {
        if (provider == null || provider.isBlank()) {
            throw new IllegalArgumentException("provider must not be blank");
        }
        if (quotaType == null || quotaType.isBlank()) {
            throw new IllegalArgumentException("quotaType must not be blank");
        }
        if (provider.contains(SEPARATOR)) {
            throw new IllegalArgumentException("provider must not contain '/': " + provider);
        }
        provider = provider.trim();
        quotaType = quotaType.trim();
    }

    /**
     * 解析 {@code provider/quotaType} 格式的字串。
     *
     * @param value 配額鍵字串
     * @return QuotaKey
     */
    public static QuotaKey parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("quota key must not be null");
        }
        int idx = value.indexOf(SEPARATOR);
        if (idx <= 0 || idx == value.length() - 1) {
            throw new IllegalArgumentException("quota key must look like 'provider/quotaType': " + value);
        }
        return new QuotaKey(value.substring(0, idx), value.substring(idx + 1));
    }

    /**
     * 取得儲存用的字串形式。
     *
     * @return 格式如 "synthetic/subscription"
     */
    public String asString() {
        return provider + SEPARATOR + quotaType;
    }

    @Override
    public String toString() {
        return asString();
    }
}
