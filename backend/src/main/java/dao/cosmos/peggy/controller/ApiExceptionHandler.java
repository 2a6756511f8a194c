package dao.cosmos.peggy.controller;

import dao.cosmos.peggy.exception.InvalidRequestException;
import dao.cosmos.peggy.exception.PreconditionFailedException;
import dao.cosmos.peggy.model.ErrorBody;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Optional;

/**
 * Maps bridge failures to HTTP: malformed input 400, rejected by state 422,
 * broken invariants 500.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ErrorBody> handleInvalidRequest(InvalidRequestException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorBody> handleValidation(MethodArgumentNotValidException ex) {
        String message = Optional.ofNullable(ex.getBindingResult().getFieldError())
                .map(FieldError::getField)
                .map(field -> field + ": " + ex.getBindingResult().getFieldError().getDefaultMessage())
                .orElse("Validation failed");
        return ResponseEntity.badRequest().body(ErrorBody.of(InvalidRequestException.CODE, message));
    }

    @ExceptionHandler(PreconditionFailedException.class)
    public ResponseEntity<ErrorBody> handlePrecondition(PreconditionFailedException ex) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(ErrorBody.of(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorBody> handleInvariant(IllegalStateException ex) {
        log.error("Bridge invariant violated", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorBody.of("INVARIANT_VIOLATION", ex.getMessage()));
    }
}
