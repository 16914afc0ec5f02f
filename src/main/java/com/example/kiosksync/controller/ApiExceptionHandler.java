package com.example.kiosksync.controller;

import com.example.kiosksync.error.*;
import com.example.kiosksync.gateway.ApiErrors;
import com.example.kiosksync.store.RevisionConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps the sync exceptions to status codes and {@code {"error": ..., "message": ...}} bodies.
 * The HTTP gateways read these bodies back into the same exceptions.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException ex) {
        Map<String, Object> body = body(ApiErrors.NOT_FOUND, ex);
        body.put("id", ex.getId());
        return new ResponseEntity<>(body, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(ReservedIdentifierException.class)
    public ResponseEntity<Map<String, Object>> handleReserved(ReservedIdentifierException ex) {
        Map<String, Object> body = body(ApiErrors.RESERVED_ID, ex);
        body.put("id", ex.getId());
        body.put("name", ex.getName());
        return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<Map<String, Object>> handleInvalid(InvalidRequestException ex) {
        return new ResponseEntity<>(body(ApiErrors.INVALID_REQUEST, ex), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(VersionConflictException.class)
    public ResponseEntity<Map<String, Object>> handleVersionConflict(VersionConflictException ex) {
        Map<String, Object> body = body(ApiErrors.VERSION_CONFLICT, ex);
        body.put("id", ex.getId());
        body.put("currentVersion", ex.getCurrentVersion());
        body.put("expectedVersion", ex.getExpectedVersion());
        return new ResponseEntity<>(body, HttpStatus.CONFLICT);
    }

    @ExceptionHandler(DuplicateEntityException.class)
    public ResponseEntity<Map<String, Object>> handleDuplicate(DuplicateEntityException ex) {
        Map<String, Object> body = body(ApiErrors.DUPLICATE, ex);
        body.put("id", ex.getId());
        return new ResponseEntity<>(body, HttpStatus.CONFLICT);
    }

    @ExceptionHandler(NoActiveSessionException.class)
    public ResponseEntity<Map<String, Object>> handleNoActiveSession(NoActiveSessionException ex) {
        return new ResponseEntity<>(body(ApiErrors.NO_ACTIVE_SESSION, ex), HttpStatus.CONFLICT);
    }

    @ExceptionHandler(SessionAlreadyActiveException.class)
    public ResponseEntity<Map<String, Object>> handleSessionActive(SessionAlreadyActiveException ex) {
        Map<String, Object> body = body(ApiErrors.SESSION_ACTIVE, ex);
        body.put("id", ex.getActiveSessionId());
        return new ResponseEntity<>(body, HttpStatus.CONFLICT);
    }

    @ExceptionHandler({RemoteUnavailableException.class, RevisionConflictException.class})
    public ResponseEntity<Map<String, Object>> handleUnavailable(RuntimeException ex) {
        logger.warn("Backend unavailable: {}", ex.getMessage());
        return new ResponseEntity<>(body(ApiErrors.UNAVAILABLE, ex), HttpStatus.SERVICE_UNAVAILABLE);
    }

    @ExceptionHandler(ArchiveFailureException.class)
    public ResponseEntity<Map<String, Object>> handleArchiveFailure(ArchiveFailureException ex) {
        logger.error("Archive failure", ex);
        return new ResponseEntity<>(body(ApiErrors.INTERNAL, ex), HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private static Map<String, Object> body(String error, Exception ex) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", error);
        body.put("message", ex.getMessage());
        return body;
    }
}
