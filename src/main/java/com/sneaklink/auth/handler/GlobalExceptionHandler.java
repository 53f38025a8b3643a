package com.sneaklink.auth.handler;

import com.sneaklink.shared.dto.ErrorResponse;
import com.sneaklink.shared.exception.EntitlementException;
import com.sneaklink.shared.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全域例外處理
 *
 * 業務例外（EntitlementException）依 ErrorCode 對應 HTTP 狀態碼，
 * 認證 / 授權 / 驗證例外也回傳同一個 ErrorResponse 格式。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(EntitlementException.class)
    public ResponseEntity<ErrorResponse> handleEntitlement(EntitlementException e) {
        ErrorCode code = e.getErrorCode();
        if (code.getHttpStatus().is5xxServerError()) {
            log.error("金流閘道錯誤: code={} message={}", code, e.getMessage());
        } else {
            log.warn("請求被拒: code={} message={}", code, e.getMessage());
        }
        return ResponseEntity.status(code.getHttpStatus())
                .body(ErrorResponse.builder()
                        .error(code.getDefaultMessage())
                        .message(e.getMessage())
                        .code(code.name())
                        .details(e.getDetails())
                        .build());
    }

    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<ErrorResponse> handleAuth(AuthenticationException e) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(ErrorResponse.builder().error("認證失敗").message(e.getMessage()).build());
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(AccessDeniedException e) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(ErrorResponse.builder().error("存取被拒絕").message("您沒有權限存取此資源").build());
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        if (e.getMessage() != null && e.getMessage().contains("帳號未登入")) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(ErrorResponse.builder().error("未登入").message("請先登入").build());
        }
        log.error("未預期的狀態錯誤", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.builder().error("伺服器錯誤").message(e.getMessage()).build());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("參數驗證失敗");
        return ResponseEntity.badRequest()
                .body(ErrorResponse.builder().error("參數驗證失敗").message(message).build());
    }
}
