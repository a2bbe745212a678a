package com.docspace.backend.global.error;

import com.docspace.backend.modules.folder.domain.FolderHierarchyIntegrityException;

import jakarta.servlet.http.HttpServletRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

@ControllerAdvice
public class RestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    @ExceptionHandler(ProblemException.class)
    public ResponseEntity<ProblemResponse> handleProblemException(ProblemException ex, HttpServletRequest request) {
        HttpStatus status = toHttpStatus(ex.getStatusCode());
        ProblemResponse body = ProblemResponse.of(status, ex.getCode(), ex.getDetailMessage(), request.getRequestURI());
        return respond(status, body);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ProblemResponse> handleResponseStatusException(ResponseStatusException ex,
                                                                         HttpServletRequest request) {
        HttpStatus status = toHttpStatus(ex.getStatusCode());
        String message = ex.getReason() != null ? ex.getReason() : status.getReasonPhrase();
        ProblemResponse body = ProblemResponse.of(status, message, message, request.getRequestURI());
        return respond(status, body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemResponse> handleValidationException(MethodArgumentNotValidException ex,
                                                                     HttpServletRequest request) {
        HttpStatus status = HttpStatus.UNPROCESSABLE_ENTITY;
        StringBuilder sb = new StringBuilder();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            sb.append(fieldError.getField()).append(": ").append(fieldError.getDefaultMessage()).append("; ");
        }
        String detail = sb.length() > 0 ? sb.substring(0, sb.length() - 2) : "Validation failed";
        ProblemResponse body = ProblemResponse.of(status, "validation_error", detail, request.getRequestURI());
        return respond(status, body);
    }

    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<ProblemResponse> handleMalformedRequest(Exception ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        ProblemResponse body = ProblemResponse.of(status, "malformed_request", "Malformed request", request.getRequestURI());
        return respond(status, body);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ProblemResponse> handleDataIntegrityViolation(DataIntegrityViolationException ex,
                                                                        HttpServletRequest request) {
        log.warn("Constraint violation on {}: {}", request.getRequestURI(), ex.getMostSpecificCause().getMessage());
        HttpStatus status = HttpStatus.CONFLICT;
        ProblemResponse body = ProblemResponse.of(status, "data_conflict", "Conflicting data", request.getRequestURI());
        return respond(status, body);
    }

    @ExceptionHandler(FolderHierarchyIntegrityException.class)
    public ResponseEntity<ProblemResponse> handleHierarchyIntegrity(FolderHierarchyIntegrityException ex,
                                                                    HttpServletRequest request) {
        log.error("Folder hierarchy integrity failure at folder {}", ex.getFolderId(), ex);
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        ProblemResponse body = ProblemResponse.of(status, "hierarchy_integrity_error", null, request.getRequestURI());
        return respond(status, body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemResponse> handleGenericException(Exception ex, HttpServletRequest request) {
        log.error("Unhandled error on {}", request.getRequestURI(), ex);
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        ProblemResponse body = ProblemResponse.of(status, "internal_error", null, request.getRequestURI());
        return respond(status, body);
    }

    private ResponseEntity<ProblemResponse> respond(HttpStatus status, ProblemResponse body) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_PROBLEM_JSON)
                .body(body);
    }

    private HttpStatus toHttpStatus(HttpStatusCode statusCode) {
        return statusCode instanceof HttpStatus httpStatus
                ? httpStatus
                : HttpStatus.valueOf(statusCode.value());
    }
}
