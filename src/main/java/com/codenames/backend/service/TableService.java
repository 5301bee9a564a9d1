package com.codenames.backend.service;

import com.codenames.backend.dto.JoinGameDTO;
import com.codenames.backend.exception.GameNotFoundException;
import com.codenames.backend.exception.PlayerNotFoundException;
import com.codenames.backend.model.Player;
import com.codenames.backend.model.Table;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Service
public class TableService {
    private final Map<String, Table> tables = new ConcurrentHashMap<>();

    public Table openTable(String gameId) {
        return tables.computeIfAbsent(gameId, id -> new Table(id, Instant.now()));
    }

    public Table getTable(String gameId) {
        Table table = gameId == null ? null : tables.get(gameId);
        if (table == null) {
            throw new GameNotFoundException(gameId);
        }
        return table;
    }

    /**
     * Seats a player. Joining again under the same name returns the existing seat, so a client can reconnect.
     */
    public Player join(String gameId, JoinGameDTO request) {
        Table table = getTable(gameId);
        if (request.getPlayerName() == null || request.getPlayerName().isBlank()) {
            throw new IllegalArgumentException("Player name is required");
        }
        if (request.getTeam() == null || request.getRole() == null) {
            throw new IllegalArgumentException("Team and role are required");
        }

        synchronized (table) {
            for (Player p : table.getPlayers()) {
                if (p.getName().equalsIgnoreCase(request.getPlayerName())) {
                    return p;
                }
            }

            Player player = new Player(UUID.randomUUID().toString(), request.getPlayerName(),
                    request.getTeam(), request.getRole(), request.isAi());
            table.getPlayers().add(player);
            log.info("{} joined game {} as {} {}", player.getName(), gameId, player.getTeam(), player.getRole());
            return player;
        }
    }

    public Player getPlayer(String gameId, String playerId) {
        return getTable(gameId).getPlayers().stream()
                .filter(p -> p.getId().equals(playerId))
                .findFirst()
                .orElseThrow(() -> new PlayerNotFoundException(playerId));
    }

    public void closeTable(String gameId) {
        tables.remove(gameId);
    }
}
