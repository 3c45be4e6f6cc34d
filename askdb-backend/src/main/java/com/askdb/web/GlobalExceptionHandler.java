package com.askdb.web;

import com.askdb.api.ErrorResponse;
import com.askdb.llm.AnswerGenerationException;
import com.askdb.query.ExecutionErrorKind;
import com.askdb.query.QueryExecutionException;
import com.askdb.validation.StatementRejectedException;
import com.askdb.validation.ValidationVerdict;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));

        ErrorResponse error = ErrorResponse.of("VALIDATION_FAILED", "Input validation failed", details);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        ErrorResponse error = ErrorResponse.of("VALIDATION_FAILED", "Request body is missing or malformed", null);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(StatementRejectedException.class)
    public ResponseEntity<ErrorResponse> handleRejectedStatement(StatementRejectedException ex) {
        ValidationVerdict verdict = ex.getVerdict();
        String reason = verdict.reason() != null ? verdict.reason().name() : null;
        ErrorResponse error = ErrorResponse.of("STATEMENT_REJECTED", verdict.message(), reason);
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(error);
    }

    @ExceptionHandler(QueryExecutionException.class)
    public ResponseEntity<ErrorResponse> handleQueryExecutionException(QueryExecutionException ex) {
        HttpStatus status = statusFor(ex.getKind());
        if (status.is5xxServerError()) {
            log.warn("Query execution failed (kind={}, sql_state={}): {}", ex.getKind(), ex.getSqlState(), ex.getMessage());
        }
        ErrorResponse error = ErrorResponse.of(ex.getKind().name(), ex.getMessage(), ex.getDetail());
        return ResponseEntity.status(status).body(error);
    }

    @ExceptionHandler(AnswerGenerationException.class)
    public ResponseEntity<ErrorResponse> handleGenerationFailure(AnswerGenerationException ex) {
        log.warn("Answer generation failed: {}", ex.getMessage());
        ErrorResponse error = ErrorResponse.of("GENERATION_FAILED", ex.getMessage(), null);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(error);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException ex) {
        ErrorResponse error = ErrorResponse.of("INVALID_ARGUMENT", ex.getMessage(), null);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFoundException(Exception ex) {
        ErrorResponse error = ErrorResponse.of("NOT_FOUND", "Not found", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllExceptions(Exception ex) {
        log.error("Unhandled exception occurred", ex);

        ErrorResponse error = ErrorResponse.of("INTERNAL_SERVER_ERROR", "An unexpected error occurred", null);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    static HttpStatus statusFor(ExecutionErrorKind kind) {
        switch (kind) {
            case POOL_EXHAUSTED:
            case TIMEOUT:
                return HttpStatus.SERVICE_UNAVAILABLE;
            case RESULT_TOO_LARGE:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            case CONNECTION_REFUSED:
            case HOST_NOT_FOUND:
            case AUTHENTICATION_FAILED:
            case DATABASE_NOT_FOUND:
                return HttpStatus.BAD_GATEWAY;
            case TABLE_NOT_FOUND:
            case SYNTAX_ERROR:
                return HttpStatus.BAD_REQUEST;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
