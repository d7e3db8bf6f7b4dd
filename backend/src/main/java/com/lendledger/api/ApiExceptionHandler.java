package com.lendledger.api;

import com.lendledger.api.dto.ErrorResponse;
import com.lendledger.error.ErrorCode;
import com.lendledger.error.LedgerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps ledger error categories to HTTP statuses.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ErrorResponse> onLedger(LedgerException e) {
        HttpStatus status = statusOf(e.getCode());
        if (status.is5xxServerError()) {
            log.error("[api] {} {}", e.getCode(), e.getMessage());
        } else {
            log.info("[api] {} {}", e.getCode(), e.getMessage());
        }
        return ResponseEntity.status(status)
                .body(new ErrorResponse(e.getCode().name(), e.getCategory().name(), e.getMessage()));
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, MissingRequestHeaderException.class})
    public ResponseEntity<ErrorResponse> onBadRequest(Exception e) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("BAD_REQUEST", "VALIDATION", e.getMessage()));
    }

    static HttpStatus statusOf(ErrorCode code) {
        if (code == ErrorCode.GUARANTEE_NOT_FOUND) return HttpStatus.NOT_FOUND;
        return switch (code.getCategory()) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
            case ARITHMETIC -> HttpStatus.UNPROCESSABLE_ENTITY;
            case SETTLEMENT_INTEGRITY -> HttpStatus.CONFLICT;
            case TRANSFER -> HttpStatus.BAD_GATEWAY;
        };
    }
}
