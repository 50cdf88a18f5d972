package net.ogimage.controller;

import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import net.ogimage.controller.support.ErrorResponseUtils;
import net.ogimage.exception.DedupFailedException;
import net.ogimage.exception.InvalidImageRequestException;
import net.ogimage.exception.RenderWaitTimeoutException;
import net.ogimage.exception.StorageUnavailableException;
import net.ogimage.exception.TaskNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps pipeline exceptions to HTTP responses.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    private static final long DEDUP_RETRY_AFTER_SECONDS = 1;
    private static final long STORAGE_RETRY_AFTER_SECONDS = 5;

    @ExceptionHandler(InvalidImageRequestException.class)
    public ResponseEntity<Map<String, String>> handleInvalidRequest(InvalidImageRequestException ex) {
        return ErrorResponseUtils.badRequest("Invalid request", ex.getMessage());
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, String>> handleMissingParameter(MissingServletRequestParameterException ex) {
        return ErrorResponseUtils.badRequest("Invalid request", "Missing required parameter '" + ex.getParameterName() + "'");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, String>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return ErrorResponseUtils.badRequest("Invalid request", "Malformed value for '" + ex.getName() + "'");
    }

    @ExceptionHandler(TaskNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleTaskNotFound(TaskNotFoundException ex) {
        return ErrorResponseUtils.notFound("Task not found", ex.getMessage());
    }

    @ExceptionHandler(DedupFailedException.class)
    public ResponseEntity<Map<String, String>> handleDedupFailed(DedupFailedException ex) {
        log.warn("Render task acquisition for {} lost every race after {} attempts", ex.getFingerprint(), ex.getAttempts());
        return ErrorResponseUtils.serviceUnavailable("Render queue busy", "Please retry the request", DEDUP_RETRY_AFTER_SECONDS);
    }

    @ExceptionHandler(RenderWaitTimeoutException.class)
    public ResponseEntity<Map<String, String>> handleRenderWaitTimeout(RenderWaitTimeoutException ex) {
        return ErrorResponseUtils.error(HttpStatus.GATEWAY_TIMEOUT, "Image generation timed out",
            ex.getMessage() + "; poll /status/" + ex.getTaskId());
    }

    @ExceptionHandler(StorageUnavailableException.class)
    public ResponseEntity<Map<String, String>> handleStorageUnavailable(StorageUnavailableException ex) {
        log.error("Storage backend {} unavailable: {}", ex.getBackend(), ex.getMessage());
        return ErrorResponseUtils.serviceUnavailable("Storage unavailable", ex.getBackend() + " is not reachable",
            STORAGE_RETRY_AFTER_SECONDS);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, String>> handleIllegalState(IllegalStateException ex) {
        log.error("Unexpected pipeline state", ex);
        return ErrorResponseUtils.error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal error", null);
    }
}
