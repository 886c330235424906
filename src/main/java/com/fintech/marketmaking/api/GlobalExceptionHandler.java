package com.fintech.marketmaking.api;

import com.fintech.marketmaking.config.InvalidConfigurationException;
import com.fintech.marketmaking.service.BacktestService;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps request, service and configuration failures of the backtest API to {@link ErrorResponse} bodies.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Handle service layer validation errors.
     */
    @ExceptionHandler(BacktestService.ValidationException.class)
    public ResponseEntity<ErrorResponse> handleServiceValidation(
            BacktestService.ValidationException ex,
            WebRequest request) {

        String path = pathOf(request);
        ErrorResponse error = new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(),
            "SERVICE_VALIDATION_ERROR",
            ex.getMessage(),
            path
        );

        log.warn("Service validation error on {}: {}", path, ex.getMessage());
        return ResponseEntity.badRequest().body(error);
    }

    /**
     * Handle a failed security session. Configuration problems are the caller's to fix.
     */
    @ExceptionHandler(BacktestService.BacktestException.class)
    public ResponseEntity<ErrorResponse> handleBacktestException(
            BacktestService.BacktestException ex,
            WebRequest request) {

        String path = pathOf(request);
        if (ex.getCause() instanceof InvalidConfigurationException) {
            ErrorResponse error = new ErrorResponse(
                HttpStatus.BAD_REQUEST.value(),
                "INVALID_CONFIGURATION",
                ex.getCause().getMessage(),
                path,
                ex.getSecurity()
            );
            log.warn("Invalid configuration for {} on {}: {}", ex.getSecurity(), path, ex.getCause().getMessage());
            return ResponseEntity.badRequest().body(error);
        }

        ErrorResponse error = new ErrorResponse(
            HttpStatus.INTERNAL_SERVER_ERROR.value(),
            "BACKTEST_ERROR",
            "Backtest failed for security " + ex.getSecurity(),
            path,
            ex.getSecurity()
        );

        log.error("Backtest exception on {}: {}", path, ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    /**
     * Handle invalid resolved configuration (negative sizes, spread out of range, ...).
     */
    @ExceptionHandler(InvalidConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleInvalidConfiguration(
            InvalidConfigurationException ex,
            WebRequest request) {

        String path = pathOf(request);
        ErrorResponse error = new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(),
            "INVALID_CONFIGURATION",
            ex.getMessage(),
            path
        );

        log.warn("Invalid configuration on {}: {}", path, ex.getMessage());
        return ResponseEntity.badRequest().body(error);
    }

    @ExceptionHandler(RunNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleRunNotFound(
            RunNotFoundException ex,
            WebRequest request) {

        String path = pathOf(request);
        ErrorResponse error = new ErrorResponse(
            HttpStatus.NOT_FOUND.value(),
            "NOT_FOUND",
            ex.getMessage(),
            path
        );

        log.debug("Run not found on {}", path);
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    /**
     * Handle request body bean validation failures.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex,
            WebRequest request) {

        List<ErrorResponse.FieldRejection> rejections = ex.getBindingResult().getFieldErrors().stream()
            .map(fieldError -> new ErrorResponse.FieldRejection(
                fieldError.getField(),
                fieldError.getRejectedValue() != null ? fieldError.getRejectedValue().toString() : "null",
                fieldError.getDefaultMessage()
            ))
            .collect(Collectors.toList());

        String path = pathOf(request);
        ErrorResponse error = new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(),
            "VALIDATION_ERROR",
            "Request validation failed",
            path,
            rejections
        );

        log.warn("Validation error on {}: {}", path, rejections);
        return ResponseEntity.badRequest().body(error);
    }

    /**
     * Handle validation constraint violations.
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex,
            WebRequest request) {

        List<ErrorResponse.FieldRejection> rejections = ex.getConstraintViolations().stream()
            .map(violation -> new ErrorResponse.FieldRejection(
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
            rejections
        );

        log.warn("Validation error on {}: {}", path, rejections);
        return ResponseEntity.badRequest().body(error);
    }

    /**
     * Handle unparseable request bodies (bad timestamps, unknown mode).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(
            HttpMessageNotReadableException ex,
            WebRequest request) {

        String path = pathOf(request);
        ErrorResponse error = new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(),
            "MALFORMED_REQUEST",
            "Request body could not be parsed",
            path
        );

        log.warn("Malformed request on {}: {}", path, ex.getMessage());
        return ResponseEntity.badRequest().body(error);
    }

    /**
     * Handle type conversion errors (e.g., a run id that is not a UUID).
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex,
            WebRequest request) {

        String path = pathOf(request);
        String expectedType = ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "unknown";

        ErrorResponse error = new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(),
            "TYPE_MISMATCH",
            String.format("Parameter '%s' must be a valid %s", ex.getName(), expectedType),
            path,
            List.of(new ErrorResponse.FieldRejection(
                ex.getName(),
                ex.getValue() != null ? ex.getValue().toString() : "null",
                String.format("Expected type: %s", expectedType)
            ))
        );

        log.warn("Type mismatch on {}: {} expected {} but got {}",
                path, ex.getName(), expectedType, ex.getValue());
        return ResponseEntity.badRequest().body(error);
    }

    /**
     * Handle all other unexpected exceptions.
     */
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
