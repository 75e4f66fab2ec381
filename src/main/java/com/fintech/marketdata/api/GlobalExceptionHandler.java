package com.fintech.marketdata.api;

import com.fintech.marketdata.service.SeriesQueryService;
import com.fintech.marketdata.upstream.FetchError;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps query failures and request validation errors to {@link ErrorResponse} bodies.
 *
 * <ul>
 *   <li>invalid or inverted dates: 400</li>
 *   <li>upstream fetch failure: 404 (the series could not be obtained)</li>
 *   <li>no rows in range: 404</li>
 *   <li>anything else: 500</li>
 * </ul>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(SeriesQueryService.InvalidRangeException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRange(
            SeriesQueryService.InvalidRangeException ex,
            WebRequest request) {

        String path = pathOf(request);
        ErrorResponse error = new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(),
            "INVALID_RANGE",
            ex.getMessage(),
            path
        );

        log.warn("Invalid range on {}: {}", path, ex.getMessage());
        return ResponseEntity.badRequest().body(error);
    }

    @ExceptionHandler(SeriesQueryService.UpstreamException.class)
    public ResponseEntity<ErrorResponse> handleUpstream(
            SeriesQueryService.UpstreamException ex,
            WebRequest request) {

        String path = pathOf(request);
        FetchError fetchError = ex.getError();
        ErrorResponse error = new ErrorResponse(
            HttpStatus.NOT_FOUND.value(),
            "UPSTREAM_ERROR",
            fetchError.message(),
            path,
            fetchError.key().value()
        );

        log.warn("Upstream error on {} for {}: {} ({})", path, fetchError.key(), fetchError.message(), fetchError.reason());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    @ExceptionHandler(SeriesQueryService.NoDataException.class)
    public ResponseEntity<ErrorResponse> handleNoData(
            SeriesQueryService.NoDataException ex,
            WebRequest request) {

        String path = pathOf(request);
        ErrorResponse error = new ErrorResponse(
            HttpStatus.NOT_FOUND.value(),
            "NO_DATA",
            ex.getMessage(),
            path,
            ex.getKey().value()
        );

        log.warn("No data on {} for {} [{} .. {}]", path, ex.getKey(), ex.getStart(), ex.getEnd());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex,
            WebRequest request) {

        List<ErrorResponse.ValidationError> validationErrors = ex.getConstraintViolations().stream()
            .map(violation -> new ErrorResponse.ValidationError(
                getFieldName(violation),
                violation.getInvalidValue() != null ? violation.getInvalidValue().toString() : "null",
                violation.getMessage()
            ))
            .collect(Collectors.toList());

        String path = pathOf(request);
        ErrorResponse error = new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(),
            "VALIDATION_ERROR",
            "Request validation failed",
            path,
            validationErrors
        );

        log.warn("Validation error on {}: {}", path, validationErrors);
        return ResponseEntity.badRequest().body(error);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(
            MissingServletRequestParameterException ex,
            WebRequest request) {

        String path = pathOf(request);
        ErrorResponse error = new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(),
            "MISSING_PARAMETER",
            String.format("Required parameter '%s' is missing", ex.getParameterName()),
            path,
            List.of(new ErrorResponse.ValidationError(
                ex.getParameterName(),
                null,
                "This parameter is required"
            ))
        );

        log.warn("Missing parameter on {}: {}", path, ex.getParameterName());
        return ResponseEntity.badRequest().body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            WebRequest request) {

        String path = pathOf(request);
        ErrorResponse error = new ErrorResponse(
            HttpStatus.INTERNAL_SERVER_ERROR.value(),
            "INTERNAL_ERROR",
            "An unexpected error occurred. Please contact support if this persists.",
            path
        );

        log.error("Unexpected error on {}: {}", path, ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private static String pathOf(WebRequest request) {
        return request.getDescription(false).replace("uri=", "");
    }

    private String getFieldName(ConstraintViolation<?> violation) {
        String propertyPath = violation.getPropertyPath().toString();
        int lastDot = propertyPath.lastIndexOf('.');
        return lastDot >= 0 ? propertyPath.substring(lastDot + 1) : propertyPath;
    }
}
