package org.learningjava.blockprog.infrastructure.adapter.in.web;

import jakarta.servlet.http.HttpServletRequest;
import org.learningjava.blockprog.application.port.DocumentsNotFoundException;
import org.learningjava.blockprog.domain.exception.DocumentSyntaxException;
import org.learningjava.blockprog.domain.exception.ProgramParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    // 400 - text is not XML at all
    @ExceptionHandler(DocumentSyntaxException.class)
    public ResponseEntity<ApiError> handleSyntax(DocumentSyntaxException ex, HttpServletRequest req) {
        return error(HttpStatus.BAD_REQUEST, ex.code().name(), ex.getMessage(), req);
    }

    // 422 - well-formed XML that is not a usable block program
    @ExceptionHandler(ProgramParseException.class)
    public ResponseEntity<ApiError> handleProgram(ProgramParseException ex, HttpServletRequest req) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, ex.code().name(), ex.getMessage(), req);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleBadRequest(IllegalArgumentException ex, HttpServletRequest req) {
        return error(HttpStatus.BAD_REQUEST, null, ex.getMessage(), req);
    }

    // 404 - nothing to parse (missing directory, no documents)
    @ExceptionHandler(DocumentsNotFoundException.class)
    public ResponseEntity<ApiError> handleNothingFound(DocumentsNotFoundException ex, HttpServletRequest req) {
        return error(HttpStatus.NOT_FOUND, null, ex.getMessage(), req);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest req) {
        // ResponseStatusException and Spring MVC's own errors carry their status
        if (ex instanceof ErrorResponse er) {
            String message = er.getBody().getDetail() != null ? er.getBody().getDetail() : ex.getMessage();
            return error(er.getStatusCode(), null, message, req);
        }
        log.error("Unhandled error on {}", req.getRequestURI(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, null, ex.getMessage(), req);
    }

    private static ResponseEntity<ApiError> error(HttpStatusCode status, String code, String message,
                                                  HttpServletRequest req) {
        String reason = status instanceof HttpStatus hs ? hs.getReasonPhrase() : String.valueOf(status.value());
        return ResponseEntity.status(status).body(
                new ApiError(status.value(), reason, code, message, req.getRequestURI(), Instant.now())
        );
    }
}
