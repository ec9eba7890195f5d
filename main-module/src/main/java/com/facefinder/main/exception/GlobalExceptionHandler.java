package com.facefinder.main.exception;

import com.facefinder.common.exception.CorruptStoreException;
import com.facefinder.common.exception.DimensionMismatchException;
import com.facefinder.common.exception.FaceFinderException;
import com.facefinder.common.exception.RoomNotFoundException;
import com.facefinder.common.exception.SessionExpiredException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(DimensionMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleDimensionMismatch(DimensionMismatchException e,
                                                                       HttpServletRequest request) {
        log.warn("Dimension mismatch: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Dimension Mismatch", e.getMessage(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgumentException(IllegalArgumentException e,
                                                                              HttpServletRequest request) {
        log.warn("Invalid argument: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Bad Request", e.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException e,
                                                                HttpServletRequest request) {
        String message = e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
        log.warn("Validation failed: {}", message);
        return error(HttpStatus.BAD_REQUEST, "Bad Request", message, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e,
                                                                HttpServletRequest request) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Bad Request", "Malformed request body", request);
    }

    @ExceptionHandler(RoomNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleRoomNotFound(RoomNotFoundException e,
                                                                  HttpServletRequest request) {
        log.warn("Room not found: {}", e.getRoomId());
        return error(HttpStatus.NOT_FOUND, "Not Found", e.getMessage(), request);
    }

    @ExceptionHandler(SessionExpiredException.class)
    public ResponseEntity<Map<String, Object>> handleSessionExpired(SessionExpiredException e,
                                                                    HttpServletRequest request) {
        log.info("Session expired: {}", e.getSessionId());
        return error(HttpStatus.GONE, "Session Expired", e.getMessage(), request);
    }

    @ExceptionHandler(CorruptStoreException.class)
    public ResponseEntity<Map<String, Object>> handleCorruptStore(CorruptStoreException e,
                                                                  HttpServletRequest request) {
        log.error("Face store is corrupt: {}", e.getMessage(), e);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable", e.getMessage(), request);
    }

    @ExceptionHandler(FaceFinderException.class)
    public ResponseEntity<Map<String, Object>> handleFaceFinderException(FaceFinderException e,
                                                                         HttpServletRequest request) {
        log.error("Face finder error: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Face Finder Error", e.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception e, HttpServletRequest request) {
        log.error("Unexpected error: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
            "An unexpected error occurred", request);
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String error, String message,
                                                      HttpServletRequest request) {
        Map<String, Object> errorResponse = Map.of(
            "timestamp", LocalDateTime.now(),
            "status", status.value(),
            "error", error,
            "message", message != null ? message : error,
            "path", request.getRequestURI()
        );
        return ResponseEntity.status(status).body(errorResponse);
    }
}
