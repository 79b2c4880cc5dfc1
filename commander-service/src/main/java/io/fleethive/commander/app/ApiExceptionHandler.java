package io.fleethive.commander.app;

import io.fleethive.fleet.error.AlreadyExistsException;
import io.fleethive.fleet.error.InvalidCursorException;
import io.fleethive.fleet.error.NotFoundException;
import io.fleethive.fleet.error.ProtocolException;
import io.fleethive.fleet.error.StorageException;
import io.fleethive.fleet.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Translates control-plane failures into HTTP statuses with a {@code {"message": ...}} body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NotFoundException.class)
    ResponseEntity<ErrorResponse> notFound(NotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(AlreadyExistsException.class)
    ResponseEntity<ErrorResponse> conflict(AlreadyExistsException e) {
        return respond(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler({InvalidCursorException.class, ValidationException.class})
    ResponseEntity<ErrorResponse> badRequest(RuntimeException e) {
        return respond(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(ProtocolException.class)
    ResponseEntity<ErrorResponse> protocol(ProtocolException e) {
        log.debug("[REST] protocol error: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "malformed or unexpected message");
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    ResponseEntity<ErrorResponse> unreadableRequest(Exception e) {
        log.debug("[REST] rejected request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "malformed request");
    }

    @ExceptionHandler(StorageException.class)
    ResponseEntity<ErrorResponse> storage(StorageException e) {
        log.error("[REST] storage failure", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "storage failure");
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String message) {
        log.info("[REST] -> status={} message={}", status.value(), message);
        return ResponseEntity.status(status).body(new ErrorResponse(message));
    }
}
