package com.lendingvault.engine.api;

import com.lendingvault.engine.domain.exception.VaultErrorCode;
import com.lendingvault.engine.domain.exception.VaultException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(VaultException.class)
    public ResponseEntity<Map<String, Object>> handleVault(VaultException e) {
        HttpStatus status = statusOf(e.getErrorCode());
        if (status.is5xxServerError()) {
            log.warn("[Api] upstream failure: code={}, reason={}", e.getErrorCode(), e.getMessage());
        } else {
            log.debug("[Api] request rejected: code={}, reason={}", e.getErrorCode(), e.getMessage());
        }
        return body(status, e.getErrorCode().name(), e.getMessage());
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Map<String, Object>> handleMissingHeader(MissingRequestHeaderException e) {
        return body(HttpStatus.BAD_REQUEST, VaultErrorCode.INVALID_ADDRESS.name(), e.getMessage());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<Map<String, Object>> handleUnreadable(Exception e) {
        return body(HttpStatus.BAD_REQUEST, VaultErrorCode.INVALID_PARAMETERS.name(), e.getMessage());
    }

    static HttpStatus statusOf(VaultErrorCode code) {
        return switch (code.category()) {
            case INPUT_VALIDATION -> HttpStatus.BAD_REQUEST;
            case STATE_PRECONDITION -> HttpStatus.CONFLICT;
            case ECONOMIC_PRECONDITION -> HttpStatus.UNPROCESSABLE_ENTITY;
            case EXTERNAL_DATA -> code == VaultErrorCode.PLATFORM_UNAVAILABLE
                    ? HttpStatus.BAD_GATEWAY
                    : HttpStatus.BAD_REQUEST;
            case ACCESS -> HttpStatus.FORBIDDEN;
        };
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "success", false,
                "code", code,
                "message", message == null ? "" : message
        ));
    }
}
