package com.bit.locker.api;

import com.bit.locker.exception.LedgerException;
import com.bit.locker.result.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 账本拒绝统一转换为 Result 返回
 */
@Slf4j
@RestControllerAdvice
public class LedgerExceptionHandler {

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<Result<Void>> handleLedger(LedgerException e) {
        int code = e.getErrorType().getCategory().getCode();
        log.debug("请求被拒绝 {}: {}", e.getErrorType(), e.getMessage());
        return ResponseEntity.status(code)
                .body(Result.error(code, e.getErrorType().name(), e.getErrorType().getDesc()));
    }

    // 地址、哈希格式错误
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Result<Void>> handleIllegalArgument(IllegalArgumentException e) {
        log.debug("参数错误: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Result.error(400, "BAD_REQUEST", e.getMessage()));
    }
}
