package com.newsbrief.pipeline.exception;

import com.newsbrief.pipeline.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.List;

/**
 * 제어 API 예외를 JSON 오류 응답으로 변환
 */
@RestControllerAdvice
@Slf4j
public class PipelineExceptionHandler {

    @ExceptionHandler(SchedulerException.class)
    public ResponseEntity<ErrorResponse> handleSchedulerException(SchedulerException e) {
        HttpStatus status = switch (e.getKind()) {
            case CONFIG_INVALID, UNKNOWN_SOURCE -> HttpStatus.BAD_REQUEST;
            case UNKNOWN_TENANT, UNKNOWN_JOB -> HttpStatus.NOT_FOUND;
            case NOT_RUNNING -> HttpStatus.CONFLICT;
            case JOB_TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
        };
        log.warn("Scheduler request rejected: {}", e.getMessage());
        return createErrorResponse(status, e.getErrorCode(), e.getMessage(), e.getViolations());
    }

    @ExceptionHandler(GenerationException.class)
    public ResponseEntity<ErrorResponse> handleGenerationException(GenerationException e) {
        HttpStatus status = e.getKind() == GenerationException.Kind.NO_CONTENT
                ? HttpStatus.UNPROCESSABLE_ENTITY
                : HttpStatus.SERVICE_UNAVAILABLE;
        log.warn("Report generation failed: {}", e.getMessage());
        return createErrorResponse(status, e.getErrorCode(), e.getMessage(), List.of());
    }

    @ExceptionHandler(FetchException.class)
    public ResponseEntity<ErrorResponse> handleFetchException(FetchException e) {
        log.warn("Source fetch failed: {}", e.getMessage());
        return createErrorResponse(HttpStatus.BAD_GATEWAY, e.getErrorCode(), e.getMessage(), List.of());
    }

    @ExceptionHandler({ContentStoreException.class, ProcessingException.class})
    public ResponseEntity<ErrorResponse> handleStoreException(PipelineException e) {
        log.error("Content store error: {}", e.getMessage(), e);
        return createErrorResponse(HttpStatus.SERVICE_UNAVAILABLE, e.getErrorCode(), e.getMessage(), List.of());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        List<String> violations = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .sorted()
                .toList();
        return createErrorResponse(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Request validation failed", violations);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return createErrorResponse(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", e.getMessage(), List.of());
    }

    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<ErrorResponse> handlePipelineException(PipelineException e) {
        log.error("Pipeline error: {}", e.getMessage(), e);
        return createErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, e.getErrorCode(), e.getMessage(), List.of());
    }

    private ResponseEntity<ErrorResponse> createErrorResponse(HttpStatus status, String errorCode, String message,
                                                              List<String> violations) {
        return ResponseEntity.status(status)
                .body(new ErrorResponse(errorCode, message, violations, status.value(), Instant.now()));
    }
}
