package com.codenames.backend.model;

import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The people seated at one game.
 */
@Data
public class Table {
    private final String gameId;
    private final Instant createdAt;
    private final List<Player> players = new CopyOnWriteArrayList<>();
}
