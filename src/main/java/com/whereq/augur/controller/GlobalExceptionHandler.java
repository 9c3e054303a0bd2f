package com.whereq.augur.controller;

import com.whereq.augur.dto.JobSubmitResponse;
import com.whereq.augur.model.ErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.stream.Collectors;

/**
 * Turns request binding failures (bean validation, unreadable body, missing tenant header)
 * into the same error body the controllers return
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<JobSubmitResponse> handleBinding(WebExchangeBindException ex) {
        String message = ex.getFieldErrors().stream()
            .map(GlobalExceptionHandler::describe)
            .collect(Collectors.joining("; "));
        if (message.isEmpty()) {
            message = ex.getReason();
        }
        log.warn("Rejected request: {}", message);
        return ResponseEntity.badRequest().body(JobSubmitResponse.error(ErrorKind.VALIDATION_ERROR, message));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<JobSubmitResponse> handleInput(ServerWebInputException ex) {
        log.warn("Rejected request: {}", ex.getReason());
        return ResponseEntity.badRequest()
            .body(JobSubmitResponse.error(ErrorKind.VALIDATION_ERROR, ex.getReason()));
    }

    private static String describe(FieldError error) {
        return error.getDefaultMessage() != null
            ? error.getDefaultMessage()
            : error.getField() + " is invalid";
    }
}
