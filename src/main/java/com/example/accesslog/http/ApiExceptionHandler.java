package com.example.accesslog.http;

import com.example.accesslog.service.AccessLogException;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badReq(IllegalArgumentException ex) {
        String message = ex.getMessage() != null ? ex.getMessage() : "BAD_REQUEST";
        return ResponseEntity.badRequest().body(Map.of("code", "BAD_REQUEST", "message", message));
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<Map<String, Object>> invalidRequest(Exception ex) {
        return ResponseEntity.badRequest().body(Map.of("code", "BAD_REQUEST", "message", ex.getMessage()));
    }

    @ExceptionHandler(AccessLogException.class)
    public ResponseEntity<Map<String, Object>> domainError(AccessLogException ex) {
        HttpStatus status;
        switch (ex.getCode()) {
            case INVALID_IDENTIFIER -> status = HttpStatus.BAD_REQUEST;
            case LOG_ID_COLLISION -> status = HttpStatus.CONFLICT;
            case UNSUPPORTED_ADDRESS_FAMILY -> status = HttpStatus.UNPROCESSABLE_ENTITY;
            default -> status = HttpStatus.INTERNAL_SERVER_ERROR;
        }

        return ResponseEntity.status(status)
                .body(Map.of(
                        "code", ex.getCode().name(),
                        "message", ex.getMessage()
                ));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> boom(Exception ex) {
        log.error("Unexpected error handling request", ex);
        String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("code", "INTERNAL_ERROR", "message", message));
    }
}
