package io.github.samzhu.quotacycle.exception;

/**
 * 樣本正規化失敗異常。
 *
 * <p>當樣本欄位缺失、數值無法解讀，或配額鍵沒有可用的計數器定義時拋出。
 *
 * <p>處理方式：
 * <ul>
 *   <li>樣本被丟棄，不修改任何週期狀態</li>
 *   <li>訊息通道上記錄 warn 後確認訊息，不重新投遞</li>
 *   <li>REST 呼叫回應 422</li>
 * </ul>
 */
public class SampleNormalizationException extends RuntimeException {

    private final String quotaKey;

    public SampleNormalizationException(String quotaKey, String reason) {
        super(String.format("Cannot normalize sample: quotaKey='%s', reason='%s'", quotaKey, reason));
        this.quotaKey = quotaKey;
    }

    public SampleNormalizationException(String quotaKey, String reason, Throwable cause) {
        super(String.format("Cannot normalize sample: quotaKey='%s', reason='%s'", quotaKey, reason), cause);
        this.quotaKey = quotaKey;
    }

    public String getQuotaKey() {
        return quotaKey;
    }
}
