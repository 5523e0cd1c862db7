package com.fintech.metals.api;

import com.fintech.metals.service.QuoteQueryService;
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
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;

/**
 * Maps exceptions from all controllers onto {@link ErrorResponse}.
 * Store outages become 503 so clients know to retry.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(QuoteQueryService.ValidationException.class)
    public ResponseEntity<ErrorResponse> handleServiceValidation(
            QuoteQueryService.ValidationException ex,
            WebRequest request) {
        String path = pathOf(request);
        log.warn("Rejected request on {}: {}", path, ex.getMessage());
        return ResponseEntity.badRequest()
            .body(ErrorResponse.of(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage(), path));
    }

    @ExceptionHandler(QuoteQueryService.ServiceException.class)
    public ResponseEntity<ErrorResponse> handleServiceException(
            QuoteQueryService.ServiceException ex,
            WebRequest request) {
        String path = pathOf(request);
        log.error("Store unavailable on {}: {}", path, ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(ErrorResponse.of(HttpStatus.SERVICE_UNAVAILABLE, "STORE_UNAVAILABLE",
                "Price data is temporarily unavailable. Please retry shortly.", path));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex,
            WebRequest request) {
        List<ErrorResponse.FieldProblem> problems = ex.getConstraintViolations().stream()
            .map(violation -> new ErrorResponse.FieldProblem(
                fieldName(violation),
                violation.getInvalidValue() != null ? violation.getInvalidValue().toString() : null,
                violation.getMessage()))
            .toList();

        String path = pathOf(request);
        log.warn("Validation error on {}: {}", path, problems);
        return ResponseEntity.badRequest()
            .body(ErrorResponse.withProblems(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR",
                "Request validation failed", path, problems));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(
            MissingServletRequestParameterException ex,
            WebRequest request) {
        String path = pathOf(request);
        log.warn("Missing parameter on {}: {}", path, ex.getParameterName());
        return ResponseEntity.badRequest()
            .body(ErrorResponse.withProblems(HttpStatus.BAD_REQUEST, "MISSING_PARAMETER",
                String.format("Required parameter '%s' is missing", ex.getParameterName()), path,
                List.of(new ErrorResponse.FieldProblem(ex.getParameterName(), null, "This parameter is required"))));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex,
            WebRequest request) {
        String path = pathOf(request);
        String expectedType = ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "unknown";
        String rejected = ex.getValue() != null ? ex.getValue().toString() : null;
        log.warn("Type mismatch on {}: {} expected {} but got {}", path, ex.getName(), expectedType, rejected);
        return ResponseEntity.badRequest()
            .body(ErrorResponse.withProblems(HttpStatus.BAD_REQUEST, "TYPE_MISMATCH",
                String.format("Parameter '%s' must be a valid %s", ex.getName(), expectedType), path,
                List.of(new ErrorResponse.FieldProblem(ex.getName(), rejected, "Expected type: " + expectedType))));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex,
            WebRequest request) {
        String path = pathOf(request);
        log.warn("Invalid argument on {}: {}", path, ex.getMessage());
        return ResponseEntity.badRequest()
            .body(ErrorResponse.of(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), path));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            WebRequest request) {
        String path = pathOf(request);
        log.error("Unexpected error on {}: {}", path, ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ErrorResponse.of(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
                "An unexpected error occurred. Please contact support if this persists.", path));
    }

    private static String pathOf(WebRequest request) {
        return request.getDescription(false).replace("uri=", "");
    }

    private static String fieldName(ConstraintViolation<?> violation) {
        String propertyPath = violation.getPropertyPath().toString();
        int lastDot = propertyPath.lastIndexOf('.');
        return lastDot >= 0 ? propertyPath.substring(lastDot + 1) : propertyPath;
    }
}
