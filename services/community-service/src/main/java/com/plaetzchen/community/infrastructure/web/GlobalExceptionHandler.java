package com.plaetzchen.community.infrastructure.web;

import com.plaetzchen.community.domain.common.BusinessRuleException;
import com.plaetzchen.community.domain.common.ConflictException;
import com.plaetzchen.community.domain.common.ResourceNotFoundException;
import com.plaetzchen.observability.CorrelationContextHolder;
import com.plaetzchen.security.AccessDeniedException;
import com.plaetzchen.security.AuthenticationRequiredException;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Global exception handler: maps exceptions to RFC 7807 ProblemDetail responses.
 *
 * <p>WHY: Spring's {@link RestControllerAdvice} centralises error handling for all
 * {@code @RestController} endpoints. Domain services only throw; this class decides the status
 * code. Clients get one machine-readable error format:
 *
 * <pre>
 * {
 *   "type": "https://plaetzchen.community/errors/bad-request",
 *   "title": "Bad Request",
 *   "status": 400,
 *   "detail": "Event is full",
 *   "timestamp": "2025-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String TYPE_BASE = "https://plaetzchen.community/errors/";

    @ExceptionHandler({IllegalArgumentException.class, BusinessRuleException.class})
    public ProblemDetail handleBadRequest(RuntimeException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        log.warn("Validation failed: {}", detail);
        return problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation", detail);
    }

    @ExceptionHandler({
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
    })
    public ProblemDetail handleMalformedRequest(Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        String detail =
                ex instanceof HttpMessageNotReadableException
                        ? "Malformed request body"
                        : ex.getMessage();
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", detail);
    }

    @ExceptionHandler(AuthenticationRequiredException.class)
    public ProblemDetail handleUnauthorized(AuthenticationRequiredException ex) {
        log.warn("Unauthorized: {}", ex.getMessage());
        return problem(HttpStatus.UNAUTHORIZED, "Unauthorized", "unauthorized", ex.getMessage());
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ProblemDetail handleForbidden(AccessDeniedException ex) {
        log.warn("Forbidden: {}", ex.getMessage());
        return problem(HttpStatus.FORBIDDEN, "Forbidden", "forbidden", ex.getMessage());
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ProblemDetail handleNotFound(ResourceNotFoundException ex) {
        log.warn("Not found: {}", ex.getMessage());
        return problem(HttpStatus.NOT_FOUND, "Not Found", "not-found", ex.getMessage());
    }

    @ExceptionHandler(ConflictException.class)
    public ProblemDetail handleConflict(ConflictException ex) {
        log.warn("Conflict: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, "Conflict", "conflict", ex.getMessage());
    }

    /** Unique constraints losing a race with a concurrent request (double vote, double join). */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ProblemDetail handleIntegrityViolation(DataIntegrityViolationException ex) {
        log.warn("Integrity violation: {}", ex.getMostSpecificCause().getMessage());
        return problem(
                HttpStatus.CONFLICT,
                "Conflict",
                "conflict",
                "Request conflicts with existing data");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            // Spring MVC's own exceptions (unknown path, unsupported method) carry their status.
            log.warn("Request rejected by Spring MVC: {}", ex.getMessage());
            ProblemDetail problem = errorResponse.getBody();
            enrichWithCorrelation(problem);
            return problem;
        }
        log.error("Internal server error", ex);
        return problem(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "internal",
                "An unexpected error occurred");
    }

    private ProblemDetail problem(HttpStatus status, String title, String slug, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(TYPE_BASE + slug));
        enrichWithCorrelation(problem);
        return problem;
    }

    /**
     * Enriches the ProblemDetail with correlation ID and timestamp. WHY: Clients need the
     * correlation ID to reference when contacting support.
     */
    private void enrichWithCorrelation(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
    }
}
