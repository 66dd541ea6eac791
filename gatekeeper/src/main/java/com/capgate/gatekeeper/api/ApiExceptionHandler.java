package com.capgate.gatekeeper.api;

import com.capgate.gatekeeper.api.dto.ErrorResponse;
import com.capgate.gatekeeper.policy.PolicyException;
import com.capgate.gatekeeper.service.ApprovalException;
import com.capgate.gatekeeper.service.ApprovalNotFoundException;
import com.capgate.gatekeeper.workspace.WorkspaceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Locale;

/**
 * Maps the service's exception kinds onto HTTP status codes.
 *
 * Unknown approval → 404; everything the caller can fix (bad input, not
 * pending, path escape, patch no longer applies) → 400. Workspace I/O
 * failures are the server's problem → 500.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ApprovalNotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(ApprovalNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorResponse.of("not_found", e.getMessage()));
    }

    @ExceptionHandler(ApprovalException.class)
    public ResponseEntity<ErrorResponse> approval(ApprovalException e) {
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of(wire(e.getKind()), e.getMessage()));
    }

    @ExceptionHandler(PolicyException.class)
    public ResponseEntity<ErrorResponse> policy(PolicyException e) {
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of(wire(e.getKind()), e.getMessage()));
    }

    @ExceptionHandler(WorkspaceException.class)
    public ResponseEntity<ErrorResponse> workspace(WorkspaceException e) {
        HttpStatus status = e.getKind() == WorkspaceException.Kind.IO_FAILURE
                ? HttpStatus.INTERNAL_SERVER_ERROR
                : HttpStatus.BAD_REQUEST;
        if (status.is5xxServerError()) {
            log.error("Workspace I/O failure on {}", e.getPath(), e);
        }
        return ResponseEntity.status(status)
                .body(new ErrorResponse(wire(e.getKind()), e.getMessage(), e.getPath()));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> unreadable(Exception e) {
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of("malformed_request", e.getMessage()));
    }

    private static String wire(Enum<?> kind) {
        return kind.name().toLowerCase(Locale.ROOT);
    }
}
