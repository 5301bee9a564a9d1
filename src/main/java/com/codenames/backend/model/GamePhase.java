package com.codenames.backend.model;

public enum GamePhase {
    AWAITING_CLUE,
    AWAITING_GUESS,
    GAME_OVER
}
