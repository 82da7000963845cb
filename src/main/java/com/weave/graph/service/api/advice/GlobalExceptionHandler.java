package com.weave.graph.service.api.advice;

import com.weave.graph.service.api.dto.ApiResponse;
import com.weave.graph.service.embedding.EmbeddingException;
import com.weave.graph.service.engine.NodeNotFoundException;
import com.weave.graph.service.engine.PolicyViolationException;
import com.weave.graph.service.persistence.GatewayClosedException;
import com.weave.graph.service.persistence.MalformedSnapshotException;
import com.weave.graph.service.persistence.PersistenceException;
import com.weave.graph.service.session.SessionNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

/**
 * Global exception handler for REST controllers.
 *
 * Provides consistent error responses across all endpoints.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Handles validation errors.
     */
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
     * Handles unreadable bodies, e.g. an unknown node or edge type.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotReadableException(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());

        return ResponseEntity.badRequest()
                .body(ApiResponse.error("Malformed request body", "INVALID_ARGUMENT",
                        ex.getMostSpecificCause().getMessage()));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleTypeMismatchException(MethodArgumentTypeMismatchException ex) {
        log.warn("Invalid value for {}: {}", ex.getName(), ex.getValue());

        return ResponseEntity.badRequest()
                .body(ApiResponse.error("Invalid value for '" + ex.getName() + "'", "INVALID_ARGUMENT"));
    }

    /**
     * Handles unknown sessions, nodes and edges.
     */
    @ExceptionHandler({ResourceNotFoundException.class, NodeNotFoundException.class, SessionNotFoundException.class})
    public ResponseEntity<ApiResponse<Void>> handleNotFoundException(RuntimeException ex) {
        log.warn("Not found: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error(ex.getMessage(), "NOT_FOUND"));
    }

    @ExceptionHandler(PolicyViolationException.class)
    public ResponseEntity<ApiResponse<Void>> handlePolicyViolationException(PolicyViolationException ex) {
        log.warn("Policy violation on node {}: {}", ex.getNodeId(), ex.getMessage());

        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ApiResponse.error(ex.getMessage(), "POLICY_VIOLATION"));
    }

    @ExceptionHandler(GatewayClosedException.class)
    public ResponseEntity<ApiResponse<Void>> handleGatewayClosedException(GatewayClosedException ex) {
        log.error("Persistence unavailable: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ApiResponse.error(ex.getMessage(), "PROVIDER_CLOSED"));
    }

    @ExceptionHandler(MalformedSnapshotException.class)
    public ResponseEntity<ApiResponse<Void>> handleMalformedSnapshotException(MalformedSnapshotException ex) {
        log.error("Malformed snapshot {}", ex.getKey(), ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error(ex.getMessage(), "MALFORMED_SNAPSHOT"));
    }

    @ExceptionHandler(PersistenceException.class)
    public ResponseEntity<ApiResponse<Void>> handlePersistenceException(PersistenceException ex) {
        log.error("Persistence failure", ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error(ex.getMessage(), "PERSISTENCE_ERROR"));
    }

    @ExceptionHandler(EmbeddingException.class)
    public ResponseEntity<ApiResponse<Void>> handleEmbeddingException(EmbeddingException ex) {
        log.error("Embedding provider failure: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(ApiResponse.error(ex.getMessage(), "EMBEDDING_ERROR"));
    }

    /**
     * Handles resource not found.
     */
    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNoResourceFoundException(
            NoResourceFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error("Resource not found", "NOT_FOUND"));
    }

    /**
     * Handles illegal argument exceptions.
     */
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
