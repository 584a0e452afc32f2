package com.salesadvisor.exception;

import com.salesadvisor.config.RequestGuardFilter;
import com.salesadvisor.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {

        List<ApiError.FieldError> fieldErrors = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> ApiError.FieldError.builder()
                .field(fe.getField())
                .rejectedValue(fe.getRejectedValue())
                .message(fe.getDefaultMessage())
                .build())
            .toList();

        log.warn("Validation failed | path={} | errors={}", request.getRequestURI(), fieldErrors.size());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed",
                     "One or more fields failed validation", request, "VALIDATION_FAILED", fieldErrors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.warn("Malformed request body | path={} | reason={}",
                 request.getRequestURI(), ex.getMostSpecificCause().getMessage());
        return build(HttpStatus.BAD_REQUEST, "Malformed Request",
                     "Request body is not valid JSON or has a malformed field (dates use yyyy-MM-dd)",
                     request, "MALFORMED_REQUEST", null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String msg = String.format("Parameter '%s' should be of type %s",
                ex.getName(), ex.getRequiredType() != null
                        ? ex.getRequiredType().getSimpleName() : "unknown");
        return build(HttpStatus.BAD_REQUEST, "Type Mismatch", msg, request, "TYPE_MISMATCH", null);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiError> handleMethodNotSupported(
            HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {
        return build(HttpStatus.METHOD_NOT_ALLOWED, "Method Not Allowed",
                     "Request method '" + ex.getMethod() + "' is not supported", request, "METHOD_NOT_ALLOWED", null);
    }

    @ExceptionHandler(ServiceNotReadyException.class)
    public ResponseEntity<ApiError> handleNotReady(
            ServiceNotReadyException ex, HttpServletRequest request) {
        log.warn("Request rejected before readiness | path={}", request.getRequestURI());
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Service Not Ready", ex.getMessage(),
                     request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(StoreNotFoundException.class)
    public ResponseEntity<ApiError> handleStoreNotFound(
            StoreNotFoundException ex, HttpServletRequest request) {
        log.warn("{} | path={}", ex.getMessage(), request.getRequestURI());
        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(),
                     request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(NotFittedException.class)
    public ResponseEntity<ApiError> handleNotFitted(
            NotFittedException ex, HttpServletRequest request) {
        log.error("Pipeline component used before fit: {}", ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", ex.getMessage(),
                     request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(InferenceApiUnavailableException.class)
    public ResponseEntity<ApiError> handleInferenceUnavailable(
            InferenceApiUnavailableException ex, HttpServletRequest request) {
        log.error("Inference API unavailable: {}", ex.getMessage(), ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Inference Service Unavailable",
                     ex.getMessage(), request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(InferenceApiException.class)
    public ResponseEntity<ApiError> handleInferenceError(
            InferenceApiException ex, HttpServletRequest request) {
        log.error("Inference API error: {}", ex.getMessage());
        return build(HttpStatus.BAD_GATEWAY, "Inference Service Error",
                     ex.getMessage(), request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(
            Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                     "An unexpected error occurred", request, "INTERNAL_ERROR", null);
    }

    private ResponseEntity<ApiError> build(
            HttpStatus status, String error, String message,
            HttpServletRequest request, String errorCode,
            List<ApiError.FieldError> fieldErrors) {

        String reqId = request.getHeader(RequestGuardFilter.REQUEST_ID_HEADER);
        if (reqId == null || reqId.isBlank()) {
            reqId = MDC.get(RequestGuardFilter.REQUEST_ID_MDC_KEY);
        }

        ApiError body = ApiError.builder()
            .status(status.value())
            .error(error)
            .message(message)
            .path(request.getRequestURI())
            .requestId(reqId)
            .errorCode(errorCode)
            .timestamp(Instant.now())
            .fieldErrors(fieldErrors)
            .build();

        return ResponseEntity.status(status).body(body);
    }
}
