package io.github.crudgraph.core.exception;

import io.github.crudgraph.core.response.ApiResponse;
import io.github.crudgraph.web.CrudGraphController;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps failures of {@link CrudGraphController} endpoints to {@link ApiResponse} error bodies.
 */
@Slf4j
@RestControllerAdvice(assignableTypes = CrudGraphController.class)
public class CrudGraphExceptionHandler {

    @ExceptionHandler(ApplicationException.class)
    public ResponseEntity<ApiResponse<Void>> handleApplicationException(ApplicationException ex) {
        if (ex.isServerError()) {
            log.error("{}: {}", ex.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("{}: {}", ex.getCode(), ex.getMessage());
        }

        return ResponseEntity.status(ex.getStatus())
                .body(ApiResponse.error(
                        ex.getMessage(),
                        ex.getStatus(),
                        ex.getCode(),
                        ex.getDescriptor().getTitle()
                ));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Void>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Illegal argument: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(
                        ex.getMessage(),
                        HttpStatus.BAD_REQUEST,
                        "INVALID_ARGUMENT",
                        ex.getMessage()
                ));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleHttpMessageNotReadable(HttpMessageNotReadableException ex) {
        log.warn("Message not readable: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(
                        "Invalid request body format",
                        HttpStatus.BAD_REQUEST,
                        "INVALID_REQUEST_BODY",
                        ex.getMostSpecificCause().getMessage()
                ));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiResponse<Void>> handleDataAccessException(DataAccessException ex) {
        log.error("Data access error: {}", ex.getMessage(), ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error(
                        "Database operation failed",
                        HttpStatus.INTERNAL_SERVER_ERROR,
                        "DATABASE_ERROR",
                        ex.getMostSpecificCause().getMessage()
                ));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error(
                        "An unexpected error occurred",
                        HttpStatus.INTERNAL_SERVER_ERROR,
                        "INTERNAL_SERVER_ERROR",
                        ex.getMessage()
                ));
    }
}
