package io.github.samzhu.quotacycle.config;

import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import io.github.samzhu.quotacycle.dto.api.ErrorResponse;
import io.github.samzhu.quotacycle.exception.CycleStoreException;
import io.github.samzhu.quotacycle.exception.QuotaNotFoundException;
import io.github.samzhu.quotacycle.exception.SampleNormalizationException;

/**
 * 全局 REST 例外處理，將領域例外轉換為 JSON 錯誤回應。
 *
 * <ul>
 *   <li>{@link QuotaNotFoundException} → 404</li>
 *   <li>{@link SampleNormalizationException} → 422（樣本已丟棄）</li>
 *   <li>{@link CycleStoreException} → 503（樣本未處理，可重送）</li>
 *   <li>請求驗證失敗、無效配額鍵 → 400</li>
 * </ul>
 */
@RestControllerAdvice(basePackages = "io.github.samzhu.quotacycle.controller")
public class GlobalExceptionAdvice {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionAdvice.class);

    @ExceptionHandler(QuotaNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(QuotaNotFoundException ex) {
        log.debug("[API] Not found: {}", ex.getQuotaKey());
        return error(HttpStatus.NOT_FOUND, "quota_not_found", ex.getMessage());
    }

    @ExceptionHandler(SampleNormalizationException.class)
    public ResponseEntity<ErrorResponse> handleUnprocessable(SampleNormalizationException ex) {
        log.warn("[API] Unprocessable sample: {}", ex.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "sample_unprocessable", ex.getMessage());
    }

    @ExceptionHandler(CycleStoreException.class)
    public ResponseEntity<ErrorResponse> handleStoreFailure(CycleStoreException ex) {
        log.error("[API] Store unavailable: operation={}", ex.getOperation(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "store_unavailable", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
            .map(e -> e.getField() + " " + e.getDefaultMessage())
            .collect(Collectors.joining(", "));
        log.warn("[API] Validation failed: {}", message);
        return error(HttpStatus.BAD_REQUEST, "validation_failed", message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("[API] Unreadable request body: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "malformed_request", "Request body is not valid JSON for a quota sample");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(ErrorResponse.of(status.value(), code, message));
    }
}
