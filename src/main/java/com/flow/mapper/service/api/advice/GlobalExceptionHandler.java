package com.flow.mapper.service.api.advice;

import com.flow.mapper.service.api.dto.ApiResponse;
import com.flow.mapper.service.api.dto.ViolationResponse;
import com.flow.mapper.service.engine.FlowServiceException;
import com.flow.mapper.service.patch.PatchApplicationException;
import com.flow.mapper.service.topology.TopologyViolation;
import com.flow.mapper.service.translate.TranslationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.ArrayList;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST controllers.
 *
 * Provides consistent error responses across all endpoints.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidationException(
            MethodArgumentNotValidException ex) {

        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining(", "));

        log.warn("Validation error: {}", details);

        return ResponseEntity.badRequest()
                .body(ApiResponse.error("Validation failed", "VALIDATION_ERROR", details));
    }

    /**
     * Unreadable JSON, including operations missing their payload.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadableMessage(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request: {}", ex.getMostSpecificCause().getMessage());

        return ResponseEntity.badRequest()
                .body(ApiResponse.error("Malformed request body", "VALIDATION_ERROR",
                        ex.getMostSpecificCause().getMessage()));
    }

    /**
     * The intent was judged too sparse to describe a process.
     */
    @ExceptionHandler(TranslationException.class)
    public ResponseEntity<ApiResponse<Void>> handleTranslationException(TranslationException ex) {
        log.warn("Intent rejected: {} [{}]", ex.getMessage(), ex.getReason());

        var details = new ArrayList<String>();
        details.add(ex.getReason().name() + ": " + ex.getMessage());
        ex.getViolations().stream().map(TopologyViolation::message).forEach(details::add);

        return ResponseEntity.badRequest()
                .body(ApiResponse.rejectedIntent(ex.getUserMessage(), ex.getErrorCode(), details,
                        ViolationResponse.fromAll(ex.getViolations())));
    }

    @ExceptionHandler(PatchApplicationException.class)
    public ResponseEntity<ApiResponse<Void>> handlePatchApplicationException(PatchApplicationException ex) {
        log.warn("Patch rejected: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(ApiResponse.rejectedOperation(ex.getMessage(), ex.getErrorCode(),
                        ex.getOperationIndex(), ex.getOperationType().wireName()));
    }

    @ExceptionHandler(FlowServiceException.class)
    public ResponseEntity<ApiResponse<Void>> handleFlowServiceException(FlowServiceException ex) {
        log.warn("Flow error: {} [{}]", ex.getMessage(), ex.getErrorCode());

        HttpStatus status = switch (ex.getErrorCode()) {
            case "FLOW_NOT_FOUND" -> HttpStatus.NOT_FOUND;
            case "NOTHING_TO_ROLLBACK" -> HttpStatus.CONFLICT;
            case "STORE_FULL" -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };

        return ResponseEntity.status(status)
                .body(ApiResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNoResourceFoundException(
            NoResourceFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error("Resource not found", "NOT_FOUND"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Void>> handleIllegalArgumentException(
            IllegalArgumentException ex) {
        log.warn("Illegal argument: {}", ex.getMessage());

        return ResponseEntity.badRequest()
                .body(ApiResponse.error(ex.getMessage(), "INVALID_ARGUMENT"));
    }

    /**
     * Handles all other exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error(
                        "An unexpected error occurred",
                        "INTERNAL_ERROR",
                        ex.getMessage()
                ));
    }
}
