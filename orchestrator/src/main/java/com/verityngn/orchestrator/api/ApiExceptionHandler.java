package com.verityngn.orchestrator.api;

import com.verityngn.orchestrator.admission.AdmissionDeniedException;
import com.verityngn.orchestrator.admission.ValidationException;
import com.verityngn.orchestrator.api.dto.ErrorResponse;
import com.verityngn.orchestrator.report.ArtifactNotFoundException;
import com.verityngn.orchestrator.repository.JobNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps domain exceptions to HTTP responses with an {error, message} body.
 * Stack traces stay in the log.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> validation(ValidationException e) {
        return body(HttpStatus.BAD_REQUEST, "validation_error", e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> unreadable(HttpMessageNotReadableException e) {
        return body(HttpStatus.BAD_REQUEST, "validation_error", "Malformed request body");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> badParameter(MethodArgumentTypeMismatchException e) {
        return body(HttpStatus.BAD_REQUEST, "validation_error",
                "Invalid value for parameter '" + e.getName() + "'");
    }

    @ExceptionHandler(AdmissionDeniedException.class)
    public ResponseEntity<ErrorResponse> denied(AdmissionDeniedException e) {
        return body(HttpStatus.TOO_MANY_REQUESTS, "admission_denied", e.getMessage());
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(JobNotFoundException e) {
        return body(HttpStatus.NOT_FOUND, "not_found", e.getMessage());
    }

    @ExceptionHandler(ArtifactNotFoundException.class)
    public ResponseEntity<ErrorResponse> artifactMissing(ArtifactNotFoundException e) {
        log.error("Report artifact missing: {}", e.getMessage());
        return body(HttpStatus.NOT_FOUND, "report_missing", "Report artifact is no longer available");
    }

    private static ResponseEntity<ErrorResponse> body(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(error, message));
    }
}
