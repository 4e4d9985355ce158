package com.planner.taskservice.infrastructure.web;

import com.planner.database.ConnectionUnavailableException;
import com.planner.database.ContextBindException;
import com.planner.database.LeakageGuardViolationException;
import com.planner.database.PoolExhaustedException;
import com.planner.database.QueryException;
import com.planner.database.TenantDataAccessException;
import com.planner.observability.CorrelationContextHolder;
import com.planner.security.AuthenticationException;
import com.planner.taskservice.domain.TaskNotFoundException;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses carrying a timestamp and the
 * request's correlation id.
 * <p>
 * Tenant data errors map by kind: retryable pool failures to 503 with {@code Retry-After},
 * integrity and policy violations to 409, binding failures and leaks to 500.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String ERROR_TYPE_BASE = "https://planner.dev/errors/";
    static final String RETRY_AFTER_SECONDS = "1";

    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<ProblemDetail> handleAuthentication(AuthenticationException ex) {
        log.warn("Authentication failed: {}", ex.failure());
        ProblemDetail problem = problem(HttpStatus.UNAUTHORIZED, "Unauthorized", "unauthorized",
                "Invalid or missing credential");
        problem.setProperty("reason", ex.failure().name());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
                .body(problem);
    }

    @ExceptionHandler(TaskNotFoundException.class)
    public ProblemDetail handleNotFound(TaskNotFoundException ex) {
        log.debug("Not found: {}", ex.getMessage());
        return problem(HttpStatus.NOT_FOUND, "Not Found", "not-found", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        return problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation", detail);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", "Malformed request body");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ProblemDetail handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Bad parameter {}: {}", ex.getName(), ex.getValue());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request",
                "Invalid value for '" + ex.getName() + "'");
    }

    @ExceptionHandler({PoolExhaustedException.class, ConnectionUnavailableException.class})
    public ResponseEntity<ProblemDetail> handleUnavailable(TenantDataAccessException ex) {
        log.warn("Database temporarily unavailable: {}", ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable",
                "unavailable", "The service is busy, retry shortly");
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
                .body(problem);
    }

    @ExceptionHandler(QueryException.class)
    public ProblemDetail handleQuery(QueryException ex) {
        if (ex.isConflict()) {
            log.warn("Statement rejected (SQLState {}): {}", ex.sqlState(), ex.getMessage());
            return problem(HttpStatus.CONFLICT, "Conflict", "conflict",
                    "The change conflicts with existing data or is not permitted");
        }
        log.error("Query failed (SQLState {})", ex.sqlState(), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal",
                "An unexpected error occurred");
    }

    @ExceptionHandler(ContextBindException.class)
    public ProblemDetail handleContextBind(ContextBindException ex) {
        log.error("Tenant context could not be bound on {}", ex.handleId(), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal",
                "An unexpected error occurred");
    }

    @ExceptionHandler(LeakageGuardViolationException.class)
    public ProblemDetail handleLeak(LeakageGuardViolationException ex) {
        log.error("Tenant context leak detected on {}", ex.handleId(), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal",
                "An unexpected error occurred");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse framework) {
            // Spring MVC's own errors (unknown route, wrong method) keep their status
            log.debug("Request rejected by the framework: {}", ex.getMessage());
            ProblemDetail problem = framework.getBody();
            problem.setProperty("timestamp", Instant.now().toString());
            CorrelationContextHolder.get()
                    .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
            return problem;
        }
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal",
                "An unexpected error occurred");
    }

    private static ProblemDetail problem(HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(ERROR_TYPE_BASE + type));
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
        return problem;
    }
}
