package dao.metatx.relay.controller;

import dao.metatx.relay.exception.LedgerException;
import dao.metatx.relay.model.ApiError;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Maps ledger errors to HTTP by category.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ApiError> handleLedger(LedgerException e) {
        HttpStatus status = switch (e.getCategory()) {
            case PRECONDITION -> HttpStatus.BAD_REQUEST;
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
            case VALUE_ACCOUNTING -> HttpStatus.CONFLICT;
            case ORACLE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
        log.warn("Rejected with {}: {}", e.getCode(), e.getMessage());
        return ResponseEntity.status(status).body(ApiError.builder()
                .status("REJECTED")
                .code(e.getCode().name())
                .category(e.getCategory().name())
                .error(e.getMessage())
                .build());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException e) {
        String details = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + " " + f.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return badRequest(details);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ApiError> handleMalformed(Exception e) {
        return badRequest(e.getMessage());
    }

    private static ResponseEntity<ApiError> badRequest(String message) {
        return ResponseEntity.badRequest().body(ApiError.builder()
                .status("INVALID_REQUEST")
                .error(message)
                .build());
    }
}
