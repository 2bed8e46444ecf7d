package com.example.evcharging.config;

import com.example.evcharging.dto.ApiResponse;
import com.example.evcharging.exception.ClientException;
import com.example.evcharging.exception.FailureReason;
import com.example.evcharging.exception.NotAuthenticatedException;
import com.example.evcharging.exception.ProviderRejectedException;
import com.example.evcharging.exception.ProviderUnavailableException;
import com.example.evcharging.exception.SessionNotFoundException;
import com.example.evcharging.exception.SessionOperationException;
import com.example.evcharging.exception.StationNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps the error taxonomy onto HTTP statuses and the {@link ApiResponse} envelope.
 * Unexpected failures never leak their message.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(NotAuthenticatedException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotAuthenticated(NotAuthenticatedException ex) {
        log.debug("Not authenticated: {}", ex.getMessage());
        return error(HttpStatus.UNAUTHORIZED, ex.getMessage());
    }

    @ExceptionHandler(ClientException.class)
    public ResponseEntity<ApiResponse<Void>> handleClientError(ClientException ex) {
        log.warn("Client error: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<ApiResponse<Void>> handleBadRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiResponse<Void>> handleMissingHeader(MissingRequestHeaderException ex) {
        if ("Authorization".equalsIgnoreCase(ex.getHeaderName())) {
            return error(HttpStatus.UNAUTHORIZED, "Missing credentials");
        }
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Map<String, String>>> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach((FieldError error) ->
                errors.put(error.getField(), error.getDefaultMessage()));
        log.warn("Validation failed: {}", errors);
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(400, "Validation failed", errors));
    }

    @ExceptionHandler({StationNotFoundException.class, SessionNotFoundException.class})
    public ResponseEntity<ApiResponse<Void>> handleNotFound(RuntimeException ex) {
        log.debug("Not found: {}", ex.getMessage());
        return error(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(ProviderUnavailableException.class)
    public ResponseEntity<ApiResponse<Void>> handleProviderUnavailable(ProviderUnavailableException ex) {
        log.warn("Provider {} unavailable: {}", ex.getProviderId(), ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Provider " + ex.getProviderId() + " is unavailable");
    }

    @ExceptionHandler(ProviderRejectedException.class)
    public ResponseEntity<ApiResponse<Void>> handleProviderRejected(ProviderRejectedException ex) {
        log.warn("Provider {} rejected the request: {}", ex.getProviderId(), ex.getMessage());
        return error(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(SessionOperationException.class)
    public ResponseEntity<ApiResponse<Void>> handleSessionOperation(SessionOperationException ex) {
        HttpStatus status = ex.getReason() == FailureReason.UNAVAILABLE ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.CONFLICT;
        log.warn("Session operation failed on {} ({}): {}", ex.getProviderId(), ex.getReason(), ex.getMessage());
        return error(status, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleAllExceptions(Exception ex) {
        log.error("Unexpected error occurred", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static ResponseEntity<ApiResponse<Void>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiResponse.error(status.value(), message));
    }
}
