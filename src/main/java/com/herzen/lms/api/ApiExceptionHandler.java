package com.herzen.lms.api;

import com.herzen.lms.common.LmsException;
import com.herzen.lms.common.ValidationFailedException;
import com.herzen.lms.validation.FieldViolation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.http.converter.HttpMessageNotReadableException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ValidationFailedException.class)
    public ResponseEntity<ErrorResponse> handleRuleViolations(ValidationFailedException ex) {
        Map<String, String> details = new LinkedHashMap<>();
        for (FieldViolation v : ex.violations()) {
            details.putIfAbsent(v.field(), v.message());
        }
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), details);
    }

    @ExceptionHandler(LmsException.class)
    public ResponseEntity<ErrorResponse> handleLms(LmsException ex) {
        if (ex.status().is5xxServerError()) {
            log.warn("{}: {}", ex.status().value(), ex.getMessage());
        } else {
            log.debug("{}: {}", ex.status().value(), ex.getMessage());
        }
        return respond(ex.status(), ex.getMessage(), null);
    }

    /**
     * Bean validation failures on request bodies and bound query objects.
     */
    @ExceptionHandler(BindException.class)
    public ResponseEntity<ErrorResponse> handleBinding(BindException ex) {
        Map<String, String> details = new LinkedHashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String field = error instanceof FieldError fe ? fe.getField() : error.getObjectName();
            details.putIfAbsent(field, error.getDefaultMessage());
        });
        return respond(HttpStatus.BAD_REQUEST, "Request validation failed", details);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorResponse> handleMethodValidation(HandlerMethodValidationException ex) {
        Map<String, String> details = new LinkedHashMap<>();
        ex.getAllValidationResults().forEach(result -> result.getResolvableErrors().forEach(error ->
                details.putIfAbsent(result.getMethodParameter().getParameterName(), error.getDefaultMessage())));
        return respond(HttpStatus.BAD_REQUEST, "Request validation failed", details);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        Throwable root = ex.getMostSpecificCause();
        String message = root instanceof LmsException ? root.getMessage() : "Invalid value for " + ex.getName() + ": " + ex.getValue();
        return respond(HttpStatus.BAD_REQUEST, message, Map.of(ex.getName(), message));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
        return respond(HttpStatus.BAD_REQUEST, ex.getHeaderName() + " header is required", null);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParam(MissingServletRequestParameterException ex) {
        return respond(HttpStatus.BAD_REQUEST, ex.getParameterName() + " is required", null);
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ErrorResponse> handleMissingPart(MissingServletRequestPartException ex) {
        return respond(HttpStatus.BAD_REQUEST, ex.getRequestPartName() + " is required", null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        Throwable root = ex.getMostSpecificCause();
        String message = root instanceof LmsException ? root.getMessage() : "Malformed request body";
        return respond(HttpStatus.BAD_REQUEST, message, null);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleUploadSize(MaxUploadSizeExceededException ex) {
        return respond(HttpStatus.PAYLOAD_TOO_LARGE, "Uploaded file exceeds the server limit", null);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethod(HttpRequestMethodNotSupportedException ex) {
        return respond(HttpStatus.METHOD_NOT_ALLOWED, ex.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unhandled error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", null);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String message, Map<String, String> details) {
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(Instant.now())
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .details(details == null || details.isEmpty() ? null : details)
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
