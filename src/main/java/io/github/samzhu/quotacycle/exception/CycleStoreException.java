package io.github.samzhu.quotacycle.exception;

/**
 * 週期儲存操作失敗異常。
 *
 * <p>包裝 MongoDB 的 {@link org.springframework.dao.DataAccessException}，
 * 讓呼叫端知道是哪一個儲存操作失敗。不重試，直接中止當前的寫入或查詢；
 * 訊息通道上會重新拋出，讓 binder 不確認該訊息。
 *
 * <p>更新或關閉時找不到進行中的週期（例如已被其他實例關閉）也拋出此例外，
 * 重送後會以最新狀態重新判斷。
 */
public class CycleStoreException extends RuntimeException {

    private final String operation;
    private final String quotaKey;

    public CycleStoreException(String operation, String quotaKey, Throwable cause) {
        super(String.format("Cycle store operation failed: operation='%s', quotaKey='%s'", operation, quotaKey), cause);
        this.operation = operation;
        this.quotaKey = quotaKey;
    }

    public CycleStoreException(String operation, String quotaKey) {
        super(String.format("Cycle store operation matched no active cycle: operation='%s', quotaKey='%s'",
            operation, quotaKey));
        this.operation = operation;
        this.quotaKey = quotaKey;
    }

    public String getOperation() {
        return operation;
    }

    public String getQuotaKey() {
        return quotaKey;
    }
}
