package io.github.samzhu.quotacycle.dto.api;

import java.time.Instant;

/**
 * API 錯誤回應。
 *
 * @param status HTTP 狀態碼
 * @param error 錯誤代碼
 * @param message 錯誤訊息
 * @param timestamp 發生時間
 */
public record ErrorResponse(
    int status,
    String error,
    String message,
    Instant timestamp
) {

    public static ErrorResponse of(int status, String error, String message) {
        return new ErrorResponse(status, error, message, Instant.now());
    }
}
