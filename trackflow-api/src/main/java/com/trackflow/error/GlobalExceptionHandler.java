package com.trackflow.error;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.io.UncheckedIOException;

/**
 * Maps pipeline exceptions onto {@link ErrorResponse} bodies.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(InvalidRequestException e, HttpServletRequest request) {
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of(400, "Bad Request", e.getMessage(), request.getRequestURI(), e.code()));
    }

    @ExceptionHandler(IngestionRejectedException.class)
    public ResponseEntity<ErrorResponse> handleRejected(IngestionRejectedException e, HttpServletRequest request) {
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of(400, "Bad Request", e.getMessage(), request.getRequestURI(), "UPLOAD_REJECTED"));
    }

    @ExceptionHandler(TrackNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(TrackNotFoundException e, HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorResponse.of(404, "Not Found", e.getMessage(), request.getRequestURI(), "TRACK_NOT_FOUND"));
    }

    @ExceptionHandler(PipelineBusyException.class)
    public ResponseEntity<ErrorResponse> handleBusy(PipelineBusyException e, HttpServletRequest request) {
        log.warn("Rejecting {}: {}", request.getRequestURI(), e.getMessage());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header("Retry-After", "2")
                .body(ErrorResponse.of(429, "Too Many Requests", e.getMessage(), request.getRequestURI(), "BUSY"));
    }

    @ExceptionHandler(EnrichmentException.class)
    public ResponseEntity<ErrorResponse> handleEnrichment(EnrichmentException e, HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(ErrorResponse.of(422, "Unprocessable Entity", e.getMessage(), request.getRequestURI(),
                        "ENRICHMENT_FAILED"));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestPartException.class})
    public ResponseEntity<ErrorResponse> handleMalformed(Exception e, HttpServletRequest request) {
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of(400, "Bad Request", "Malformed request", request.getRequestURI(),
                        "MALFORMED_REQUEST"));
    }

    @ExceptionHandler({DataAccessException.class, IngestionException.class, UncheckedIOException.class})
    public ResponseEntity<ErrorResponse> handleInfrastructure(RuntimeException e, HttpServletRequest request) {
        log.error("Infrastructure error on {}", request.getRequestURI(), e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorResponse.of(503, "Service Unavailable", "Storage temporarily unavailable",
                        request.getRequestURI(), "STORE_ERROR"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknown(Exception e, HttpServletRequest request) {
        log.error("Unhandled error on {}", request.getRequestURI(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(500, "Internal Server Error", "Unexpected error", request.getRequestURI(),
                        "INTERNAL_ERROR"));
    }
}
