package com.di.ingestion.exception;

import com.di.ingestion.catalog.CatalogValidationException;
import com.di.ingestion.warehouse.StatementExecutionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Clock;
import java.time.Instant;

/**
 * Maps exceptions escaping the ingestion API to a consistent {@link ErrorResponse}.
 *
 * <ul>
 *   <li>{@link CatalogValidationException} for an unknown ingestion id → 404</li>
 *   <li>other {@link CatalogValidationException}s (configuration errors) → 400</li>
 *   <li>bad path/query parameters → 400</li>
 *   <li>catalog or warehouse access failures → 502</li>
 *   <li>anything else → 500</li>
 * </ul>
 *
 * <p>Pipeline failures never reach this handler: they are returned as FAILED run results.
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final Clock clock;

    @ExceptionHandler(CatalogValidationException.class)
    public ResponseEntity<ErrorResponse> handleCatalogValidation(CatalogValidationException e) {
        HttpStatus status = isUnknownId(e) ? HttpStatus.NOT_FOUND : HttpStatus.BAD_REQUEST;
        log.warn("[API] Catalog rejected ingestion {}: {}", e.getIngestionId(), e.getMessage());
        ErrorResponse body = buildErrorResponse(e, status);
        body.addDetail("ingestionId", e.getIngestionId());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        log.warn("[API] Bad request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(buildErrorResponse(e, HttpStatus.BAD_REQUEST));
    }

    @ExceptionHandler({DataAccessException.class, StatementExecutionException.class})
    public ResponseEntity<ErrorResponse> handleWarehouseException(RuntimeException e) {
        log.error("[API] Warehouse access failed: {}", e.getMessage(), e);
        ErrorResponse body = buildErrorResponse(e, HttpStatus.BAD_GATEWAY);
        Throwable root = getRootCause(e);
        if (root != e) {
            body.addDetail("rootCauseType", root.getClass().getName());
            body.addDetail("rootCauseMessage", root.getMessage());
        }
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("[API] Unhandled exception: {}", e.getClass().getSimpleName(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(buildErrorResponse(e, HttpStatus.INTERNAL_SERVER_ERROR));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static boolean isUnknownId(CatalogValidationException e) {
        return e.getMessage() != null && e.getMessage().startsWith("Unknown ingestion id");
    }

    private ErrorResponse buildErrorResponse(Throwable exception, HttpStatus status) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now(clock).toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        response.setPath(getRequestPath());
        response.addDetail("exceptionType", exception.getClass().getName());
        return response;
    }

    private static Throwable getRootCause(Throwable exception) {
        Throwable cause = exception.getCause();
        if (cause == null || cause == exception) {
            return exception;
        }
        return getRootCause(cause);
    }

    private static String getRequestPath() {
        String path = MDC.get("requestPath");
        return path != null ? path : "/unknown";
    }
}
