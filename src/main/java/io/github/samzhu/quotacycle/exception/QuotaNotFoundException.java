package io.github.samzhu.quotacycle.exception;

/**
 * 查詢從未收過樣本的配額鍵時拋出。
 */
public class QuotaNotFoundException extends RuntimeException {

    private final String quotaKey;

    public QuotaNotFoundException(String quotaKey) {
        super(String.format("No cycles tracked for quotaKey='%s'", quotaKey));
        this.quotaKey = quotaKey;
    }

    public String getQuotaKey() {
        return quotaKey;
    }
}
