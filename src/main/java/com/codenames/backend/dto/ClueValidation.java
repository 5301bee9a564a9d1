package com.codenames.backend.dto;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ClueValidation {
    private static final ClueValidation OK = new ClueValidation(true, null, null);

    boolean valid;
    ClueRejection rejection;
    String reason;

    public static ClueValidation ok() {
        return OK;
    }

    public static ClueValidation rejected(ClueRejection rejection, String reason) {
        return new ClueValidation(false, rejection, reason);
    }
}
