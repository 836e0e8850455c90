// services/recommender/src/main/java/dev/devanks/recommender/web/ApiExceptionHandler.java
package dev.devanks.recommender.web;

import dev.devanks.recommender.exception.DeadlineExceededException;
import dev.devanks.recommender.exception.ProviderDataException;
import dev.devanks.recommender.exception.ProviderTransportException;
import dev.devanks.recommender.exception.TravelValidationException;
import dev.devanks.recommender.model.ApiResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps failures to the {@code {"error":{"code","message"}}} envelope.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    static final String TIMEOUT_MESSAGE = "request timeout - try again";
    static final String INTERNAL_MESSAGE = "failed to fetch weather data";

    @ExceptionHandler(TravelValidationException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(TravelValidationException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), ex, request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleInvalidBody(MethodArgumentNotValidException ex,
                                                               HttpServletRequest request) {
        FieldError fieldError = ex.getBindingResult().getFieldError();
        String message = fieldError != null ? fieldError.getDefaultMessage() : "invalid request body";
        return respond(HttpStatus.BAD_REQUEST, message, ex, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadableBody(HttpMessageNotReadableException ex,
                                                                  HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "invalid request body", ex, request);
    }

    @ExceptionHandler({ProviderTransportException.class, ProviderDataException.class})
    public ResponseEntity<ApiResponse<Void>> handleProvider(RuntimeException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_GATEWAY, "failed to fetch weather data: " + ex.getMessage(), ex, request);
    }

    @ExceptionHandler(DeadlineExceededException.class)
    public ResponseEntity<ApiResponse<Void>> handleDeadline(DeadlineExceededException ex, HttpServletRequest request) {
        return respond(HttpStatus.GATEWAY_TIMEOUT, TIMEOUT_MESSAGE, ex, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleUnexpected(Exception ex, HttpServletRequest request) {
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_MESSAGE, ex, request);
    }

    private ResponseEntity<ApiResponse<Void>> respond(HttpStatus status, String message, Exception ex,
                                                      HttpServletRequest request) {
        if (status.is5xxServerError()) {
            log.error("Request {} {} failed with status {}: {}",
                    request.getMethod(), request.getRequestURI(), status.value(), ex.getMessage(), ex);
        } else {
            log.warn("Request {} {} returned status {}: {}",
                    request.getMethod(), request.getRequestURI(), status.value(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(ApiResponse.error(status.value(), message));
    }
}
