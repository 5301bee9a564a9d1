package com.codenames.backend.exception;

import com.codenames.backend.dto.ClueRejection;
import lombok.Getter;

@Getter
public class InvalidClueException extends RuntimeException {
    private final ClueRejection rejection;

    public InvalidClueException(ClueRejection rejection, String reason) {
        super(reason);
        this.rejection = rejection;
    }
}
