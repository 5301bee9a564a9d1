package com.codenames.backend.config;

import java.security.Principal;

/**
 * Names a STOMP session after the player id sent in the CONNECT frame, so
 * {@code convertAndSendToUser(playerId, ...)} reaches that player.
 */
public class StompPrincipal implements Principal {
    private final String name;

    public StompPrincipal(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }
}
