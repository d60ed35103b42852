package com.b2b.inventory.exception;

import com.b2b.inventory.model.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps service exceptions to HTTP responses. Unexpected failures are logged in full
 * and answered with a generic message; internal error text never reaches the client.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    static final String UNEXPECTED_ERROR = "An unexpected error occurred.";

    @ExceptionHandler(ProductValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ProductValidationException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(ex.getMessage(), ex.getField()));
    }

    @ExceptionHandler(SkuConflictException.class)
    public ResponseEntity<ErrorResponse> handleSkuConflict(SkuConflictException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ErrorResponse.of(ex.getMessage()));
    }

    @ExceptionHandler(InventoryConstraintException.class)
    public ResponseEntity<ErrorResponse> handleConstraint(InventoryConstraintException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(ex.getMessage()));
    }

    @ExceptionHandler(UnexpectedInventoryException.class)
    public ResponseEntity<ErrorResponse> handleUnexpectedInventory(UnexpectedInventoryException ex) {
        // Already logged with its cause where it was raised
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(UNEXPECTED_ERROR));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("Malformed JSON request body.", "body"));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(ex.getName() + " must be an integer.", ex.getName()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneral(Exception ex) {
        // Framework errors (unknown route, wrong method, media type) keep their own status
        if (ex instanceof org.springframework.web.ErrorResponse frameworkError
                && frameworkError.getStatusCode().is4xxClientError()) {
            return ResponseEntity.status(frameworkError.getStatusCode())
                    .body(ErrorResponse.of(frameworkError.getBody().getDetail() != null
                            ? frameworkError.getBody().getDetail()
                            : frameworkError.getStatusCode().toString()));
        }
        log.error("Unhandled exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(UNEXPECTED_ERROR));
    }
}
