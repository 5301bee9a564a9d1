package com.codenames.backend.controller;

import com.codenames.backend.dto.ErrorResponseDTO;
import com.codenames.backend.exception.ActionNotAllowedException;
import com.codenames.backend.exception.ConfigurationException;
import com.codenames.backend.exception.GameNotFoundException;
import com.codenames.backend.exception.InvalidClueException;
import com.codenames.backend.exception.PlayerNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(GameNotFoundException.class)
    public ResponseEntity<ErrorResponseDTO> gameNotFound(GameNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "GAME_NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(PlayerNotFoundException.class)
    public ResponseEntity<ErrorResponseDTO> playerNotFound(PlayerNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "PLAYER_NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(InvalidClueException.class)
    public ResponseEntity<ErrorResponseDTO> invalidClue(InvalidClueException e) {
        return error(HttpStatus.BAD_REQUEST, e.getRejection().name(), e.getMessage());
    }

    @ExceptionHandler(ActionNotAllowedException.class)
    public ResponseEntity<ErrorResponseDTO> notAllowed(ActionNotAllowedException e) {
        return error(HttpStatus.FORBIDDEN, "ACTION_NOT_ALLOWED", e.getMessage());
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ErrorResponseDTO> configuration(ConfigurationException e) {
        log.warn("Rejected game configuration: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "INVALID_CONFIGURATION", e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponseDTO> badRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage());
    }

    private static ResponseEntity<ErrorResponseDTO> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ErrorResponseDTO(code, message));
    }
}
