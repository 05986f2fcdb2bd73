package com.example.walmartcrawling.controller;

import com.example.walmartcrawling.dto.MessageResponse;
import com.example.walmartcrawling.service.DuplicateClientException;
import com.example.walmartcrawling.service.TaskNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * API 예외 → JSON 응답 변환 ({"message": ...})
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(DuplicateClientException.class)
    public ResponseEntity<MessageResponse> handleDuplicateClient(DuplicateClientException e) {
        log.info("중복 고객 등록 거절: {}", e.getMessage());
        return ResponseEntity.badRequest().body(MessageResponse.of("Client already registered."));
    }

    @ExceptionHandler(TaskNotFoundException.class)
    public ResponseEntity<MessageResponse> handleTaskNotFound(TaskNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(MessageResponse.of(e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<MessageResponse> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(MessageResponse.of(e.getMessage()));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<MessageResponse> handleMalformedRequest(Exception e) {
        log.debug("잘못된 요청: {}", e.getMessage());
        return ResponseEntity.badRequest().body(MessageResponse.of("요청 형식이 올바르지 않습니다."));
    }
}
