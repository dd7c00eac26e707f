package com.chainmirror.api.controller;

import com.chainmirror.api.dto.ErrorBody;
import com.chainmirror.ingestion.adapter.RpcException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps bad query parameters to 400 and chain failures during a live check to 502, with ErrorBody.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleBadInput(ServerWebInputException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getReason()));
    }

    @ExceptionHandler(RpcException.class)
    public ResponseEntity<ErrorBody> handleRpc(RpcException ex) {
        log.warn("Chain unavailable for block check: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ErrorBody.of("CHAIN_UNAVAILABLE", ex.getMessage()));
    }
}
