package com.codenames.backend.exception;

import lombok.Getter;

@Getter
public class GameNotFoundException extends RuntimeException {
    private final String gameId;

    public GameNotFoundException(String gameId) {
        super("Game not found: " + gameId);
        this.gameId = gameId;
    }
}
