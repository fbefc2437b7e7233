package com.distributedraft.node.config;

import com.distributedraft.common.exception.ErrorCode;
import com.distributedraft.common.exception.RaftException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for REST endpoints.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(RaftException.class)
    public ResponseEntity<Map<String, Object>> handleRaftException(RaftException ex) {
        log.warn("Raft exception: {} - {}", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.status(mapErrorCodeToHttpStatus(ex.getErrorCode()))
                .body(errorBody(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity.badRequest()
                .body(errorBody(ErrorCode.INVALID_REQUEST, "Request body could not be read"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody(ErrorCode.UNKNOWN_ERROR, "An unexpected error occurred"));
    }

    private Map<String, Object> errorBody(ErrorCode errorCode, String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("timestamp", LocalDateTime.now());
        response.put("errorCode", errorCode.getCode());
        response.put("errorType", errorCode.name());
        response.put("message", message);
        return response;
    }

    private HttpStatus mapErrorCodeToHttpStatus(ErrorCode errorCode) {
        if (errorCode == ErrorCode.COMMIT_TIMEOUT) {
            return HttpStatus.GATEWAY_TIMEOUT;
        }

        int code = errorCode.getCode();
        if (code >= 1000 && code < 2000) {
            return HttpStatus.BAD_REQUEST;
        } else if (code >= 2000 && code < 3000) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        } else if (code >= 4000 && code < 5000) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        } else {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
