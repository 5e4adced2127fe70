package com.kakeibo.ledger.controller;

import com.kakeibo.ledger.controller.dto.ErrorResponseDto;
import com.kakeibo.ledger.export.InvalidCsvException;
import com.kakeibo.ledger.model.AmountOverflowException;
import com.kakeibo.ledger.service.ConfirmationRequiredException;
import com.kakeibo.ledger.service.ReceiptNotFoundException;
import com.kakeibo.ledger.service.ReceiptValidationException;
import com.kakeibo.ledger.web.RequestContextHolder;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ReceiptValidationException.class)
    public ResponseEntity<ErrorResponseDto> handleReceiptValidation(ReceiptValidationException ex) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("field", ex.error().field());
        details.put("value", ex.error().rawValue());
        return build(HttpStatus.BAD_REQUEST, ex.error().code().name(), ex.getMessage(), details);
    }

    @ExceptionHandler(InvalidCsvException.class)
    public ResponseEntity<ErrorResponseDto> handleInvalidCsv(InvalidCsvException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_CSV", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(ConfirmationRequiredException.class)
    public ResponseEntity<ErrorResponseDto> handleConfirmationRequired(ConfirmationRequiredException ex) {
        return build(HttpStatus.BAD_REQUEST, "CONFIRMATION_REQUIRED", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(ReceiptNotFoundException.class)
    public ResponseEntity<ErrorResponseDto> handleNotFound(ReceiptNotFoundException ex) {
        return build(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), Map.of("id", ex.receiptId()));
    }

    @ExceptionHandler(AmountOverflowException.class)
    public ResponseEntity<ErrorResponseDto> handleAmountOverflow(AmountOverflowException ex) {
        log.warn("Receipt totals out of range: {}", ex.getMessage());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "AMOUNT_OVERFLOW", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponseDto> handleIllegalArgument(IllegalArgumentException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class
    })
    public ResponseEntity<ErrorResponseDto> handleValidation(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGeneral(Exception ex) {
        // framework errors (unknown route, wrong method) carry their own status
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatusCode status = errorResponse.getStatusCode();
            return build(status, "HTTP_" + status.value(), ex.getMessage(), Map.of());
        }
        log.error("Unexpected error", ex);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", ex.getMessage());
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error", details);
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatusCode status, String code, String message, Map<String, Object> details) {
        String traceId = RequestContextHolder.traceId().orElse(null);
        return ResponseEntity.status(status)
                .body(new ErrorResponseDto(code, message, details, traceId));
    }
}
