package com.gamefamily.controller;

import com.gamefamily.model.FamilyErrorCode;
import com.gamefamily.model.FamilyOperationException;
import com.gamefamily.model.SubtreeDissolutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders failures as {@code {"error": {status, title, detail, code, characterIds}}}.
 */
@RestControllerAdvice
public class FamilyExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(FamilyExceptionHandler.class);

    static final String INVALID_REQUEST = "INVALID_REQUEST";

    @ExceptionHandler(SubtreeDissolutionException.class)
    public ResponseEntity<Map<String, Object>> handleDissolution(SubtreeDissolutionException e) {
        log.error("Subtree dissolution incomplete: {}", e.getMessage());
        Map<String, Object> error = error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), e.code().name(), e.characterIds());
        error.put("removedIds", e.removedIds());
        return ResponseEntity.internalServerError().body(Map.of("error", error));
    }

    @ExceptionHandler(FamilyOperationException.class)
    public ResponseEntity<Map<String, Object>> handleFamilyOperation(FamilyOperationException e) {
        HttpStatus status = statusOf(e.code());
        if (status.is5xxServerError()) {
            log.error("Family operation failed: {}", e.getMessage(), e);
        } else {
            log.debug("Family operation rejected with {}: {}", e.code(), e.getMessage());
        }
        // Storage details stay in the log.
        String detail = status.is5xxServerError() ? e.code().defaultMessage() : e.getMessage();
        return ResponseEntity.status(status)
            .body(Map.of("error", error(status, detail, e.code().name(), e.characterIds())));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidArgument(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
            .map(FieldError::getField)
            .map(field -> field + " is invalid")
            .collect(Collectors.joining(", "));
        return ResponseEntity.badRequest()
            .body(Map.of("error", error(HttpStatus.BAD_REQUEST, detail, INVALID_REQUEST, List.of())));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest()
            .body(Map.of("error", error(HttpStatus.BAD_REQUEST, "request body is malformed", INVALID_REQUEST, List.of())));
    }

    static HttpStatus statusOf(FamilyErrorCode code) {
        return switch (code.category()) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case CONFLICT -> HttpStatus.CONFLICT;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case FAILURE -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static Map<String, Object> error(HttpStatus status, String detail, String code, List<Long> characterIds) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("status", String.valueOf(status.value()));
        error.put("title", status.getReasonPhrase());
        error.put("detail", detail);
        error.put("code", code);
        error.put("characterIds", characterIds);
        return error;
    }
}
