package com.odin.peer_mesh_service.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.odin.peer_mesh_service.dto.ResponseDTO;
import com.odin.peer_mesh_service.exception.RecordingException;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestControllerAdvice(assignableTypes = SessionController.class)
public class SessionExceptionHandler {

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ResponseDTO> handleIllegalState(IllegalStateException e) {
        log.warn("Request rejected: {}", e.getMessage());
        return conflict(e.getMessage());
    }

    @ExceptionHandler(RecordingException.class)
    public ResponseEntity<ResponseDTO> handleRecording(RecordingException e) {
        log.warn("Recording request failed ({}): {}", e.getReason(), e.getMessage());
        return conflict(e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ResponseDTO> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Bad request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ResponseDTO.failure(HttpStatus.BAD_REQUEST.value(), e.getMessage()));
    }

    private static ResponseEntity<ResponseDTO> conflict(String message) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ResponseDTO.failure(HttpStatus.CONFLICT.value(), message));
    }
}
