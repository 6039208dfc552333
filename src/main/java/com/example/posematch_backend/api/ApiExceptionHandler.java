package com.example.posematch_backend.api;

import com.example.posematch_backend.dto.web.ErrorResponse;
import com.example.posematch_backend.exception.AnalysisException;
import com.example.posematch_backend.exception.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;

/**
 * Maps analysis failures to {@code {error, code, message}} bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(AnalysisException.class)
    public ResponseEntity<ErrorResponse> handleAnalysis(AnalysisException ex) {
        HttpStatus status = statusFor(ex.getKind());
        if (status.is5xxServerError()) {
            LOGGER.warn("Analysis request failed kind={} code={} msg={}", ex.getKind(), ex.getCode(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(new ErrorResponse(ex.getKind().name(), ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(ErrorKind.VALIDATION.name(), "FILE_TOO_LARGE", ex.getMessage()));
    }

    @ExceptionHandler(MultipartException.class)
    public ResponseEntity<ErrorResponse> handleMultipart(MultipartException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(ErrorKind.VALIDATION.name(), "FILE_MISSING", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
        LOGGER.error("Unhandled error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse(ErrorKind.INTERNAL.name(), "UNEXPECTED_FAILURE", ex.getMessage()));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case EXTERNAL_TOOL -> HttpStatus.BAD_GATEWAY;
            case CANCELLED -> HttpStatus.SERVICE_UNAVAILABLE;
            case INTEGRITY, RESOURCE, INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
