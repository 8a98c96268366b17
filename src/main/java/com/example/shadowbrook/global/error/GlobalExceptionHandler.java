package com.example.shadowbrook.global.error;

import java.util.stream.Collectors;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(CommonException.class)
    public ResponseEntity<ErrorResponse> handleCommonException(CommonException e) {
        ErrorCode errorCode = e.getErrorCode();
        switch (errorCode.getType()) {
            // 사용자 요청 오류는 장애로 기록하지 않음
            case VALIDATION, NOT_FOUND -> log.debug("Rejected request: {} - {}", errorCode.getCode(), e.getMessage());
            case COLLABORATOR_FAILURE -> log.warn("Collaborator failure: {} - {}", errorCode.getCode(), e.getMessage());
            case INTERNAL -> log.error("Internal failure: {}", errorCode.getCode(), e);
        }
        return new ResponseEntity<>(ErrorResponse.of(e), errorCode.getStatus());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return handleCommonException(ErrorCode.INVALID_REQUEST.commonException(message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        return handleCommonException(ErrorCode.INVALID_REQUEST.commonException("Malformed request body"));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleStorageException(DataAccessException e) {
        log.warn("Storage failure: {}", e.getMessage());
        ErrorCode errorCode = ErrorCode.STORAGE_UNAVAILABLE;
        ErrorResponse response = ErrorResponse.builder()
                .code(errorCode.getCode())
                .message(errorCode.getMessage())
                .build();
        return new ResponseEntity<>(response, errorCode.getStatus());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("Unhandled Exception: ", e);
        ErrorCode errorCode = ErrorCode.INTERNAL_SERVER_ERROR;
        ErrorResponse response = ErrorResponse.builder()
                .code(errorCode.getCode())
                .message(errorCode.getMessage())
                .build();
        return new ResponseEntity<>(response, errorCode.getStatus());
    }
}
