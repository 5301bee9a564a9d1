package com.codenames.backend.dto;

/**
 * Why a clue was refused, in the order the checks run.
 */
public enum ClueRejection {
    MALFORMED,
    NOT_YOUR_TURN,
    GAME_OVER,
    MULTI_WORD,
    MATCHES_BOARD_WORD,
    UNKNOWN_TARGET,
    DUPLICATE_TARGET
}
