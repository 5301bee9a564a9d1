package com.codenames.backend.debate;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;

@Value
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TranscriptEntry {
    int round;
    String agentId;
    String message;
    /** Lower-case board word or {@code "end"}; {@code null} when nothing could be extracted. */
    String preference;

    public Optional<String> preference() {
        return Optional.ofNullable(preference);
    }
}
