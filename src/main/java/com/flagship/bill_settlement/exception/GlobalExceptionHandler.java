package com.flagship.bill_settlement.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for the REST API.
 *
 * Engine failures carry the offending line, charge or participant id, which is
 * returned as {@code subject_id} so the caller can point at the bad input.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException e) {
        log.warn("Settlement input rejected: violation={}, subjectId={}, message={}",
            e.getViolation(), e.getSubjectId(), e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("Validation Failed")
            .message(e.getMessage())
            .subjectId(e.getSubjectId())
            .details(Map.of("violation", e.getViolation().name()))
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(InvalidAllocationException.class)
    public ResponseEntity<ErrorResponse> handleInvalidAllocation(InvalidAllocationException e) {
        log.warn("Invalid allocation: subjectId={}, message={}", e.getSubjectId(), e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("Invalid Allocation")
            .message(e.getMessage())
            .subjectId(e.getSubjectId())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(UnreconcilableSettlementException.class)
    public ResponseEntity<ErrorResponse> handleUnreconcilable(UnreconcilableSettlementException e) {
        log.warn("Unreconcilable settlement: subjectId={}, residual={}, tolerance={}",
            e.getSubjectId(), e.getResidualMinorUnits(), e.getToleranceMinorUnits());

        ErrorResponse error = ErrorResponse.builder()
            .error("Unreconcilable Settlement")
            .message(e.getMessage())
            .subjectId(e.getSubjectId())
            .details(Map.of(
                "residual_minor_units", String.valueOf(e.getResidualMinorUnits()),
                "tolerance_minor_units", String.valueOf(e.getToleranceMinorUnits())))
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(error);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Request validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        ErrorResponse error = ErrorResponse.builder()
            .error("Validation Failed")
            .message("Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("Malformed Request")
            .message("Request body could not be parsed")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("Invalid Request")
            .message(e.getMessage())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ErrorResponse error = ErrorResponse.builder()
            .error("Internal Server Error")
            .message("An unexpected error occurred")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }
}
