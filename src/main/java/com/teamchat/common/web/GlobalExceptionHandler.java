package com.teamchat.common.web;

import com.teamchat.auth.service.TokenVerificationException;
import com.teamchat.common.api.ApiCodes;
import com.teamchat.common.api.Result;
import com.teamchat.common.error.ChatException;
import com.teamchat.common.ratelimit.RateLimitExceededException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 把异常翻译为统一的 Result JSON，同时设置对应的 HTTP 状态码。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Bean Validation（@Valid）失败：message 取第一条，data 带上全部字段错误。
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Result<Map<String, String>>> handleValidation(MethodArgumentNotValidException e) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (FieldError fe : e.getBindingResult().getFieldErrors()) {
            fields.putIfAbsent(fe.getField(), fe.getDefaultMessage());
        }
        String msg = e.getBindingResult().getAllErrors().isEmpty()
                ? "validation_failed"
                : e.getBindingResult().getAllErrors().get(0).getDefaultMessage();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Result.fail(ApiCodes.BAD_REQUEST, msg, fields.isEmpty() ? null : fields));
    }

    @ExceptionHandler(ChatException.class)
    public ResponseEntity<Result<Map<String, String>>> handleChat(ChatException e) {
        Map<String, String> detail = e.getFieldErrors().isEmpty() ? null : e.getFieldErrors();
        return ResponseEntity.status(e.getCode().getStatus())
                .body(Result.fail(e.getCode().getApiCode(), e.getReason(), detail));
    }

    /**
     * token 过期/吊销/版本不符等，一律 401。
     */
    @ExceptionHandler(TokenVerificationException.class)
    public ResponseEntity<Result<Void>> handleToken(TokenVerificationException e) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(Result.fail(ApiCodes.UNAUTHORIZED, e.getMessage()));
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<Result<Void>> handleRateLimit(RateLimitExceededException e) {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()))
                .body(Result.fail(ApiCodes.TOO_MANY_REQUESTS, e.getMessage()));
    }

    /**
     * 其余业务校验失败（IllegalArgumentException 携带 reason）。
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Result<Void>> handleBadRequest(IllegalArgumentException e) {
        String msg = (e.getMessage() == null || e.getMessage().isBlank()) ? "bad_request" : e.getMessage();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Result.fail(ApiCodes.BAD_REQUEST, msg));
    }

    /**
     * 兜底：避免默认 HTML 错误页。
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Result<Void>> handleAny(Exception e) {
        log.error("unhandled exception", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Result.fail(ApiCodes.INTERNAL_ERROR, "internal_error"));
    }
}
