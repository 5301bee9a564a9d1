package com.codenames.backend.service;

import com.codenames.backend.dto.JoinGameDTO;
import com.codenames.backend.exception.GameNotFoundException;
import com.codenames.backend.exception.PlayerNotFoundException;
import com.codenames.backend.model.Player;
import com.codenames.backend.model.Role;
import com.codenames.backend.model.Table;
import com.codenames.backend.model.Team;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TableServiceTest {

    private TableService tableService;

    @BeforeEach
    void setUp() {
        tableService = new TableService();
        tableService.openTable("GAME");
    }

    @Test
    void testOpenTableIsIdempotent() {
        Table first = tableService.getTable("GAME");

        assertSame(first, tableService.openTable("GAME"));
    }

    @Test
    void testJoinAndReconnect() {
        Player alice = tableService.join("GAME", new JoinGameDTO("Alice", Team.RED, Role.SPYMASTER, false));
        Player again = tableService.join("GAME", new JoinGameDTO("alice", Team.BLUE, Role.OPERATIVE, false));

        assertSame(alice, again);
        assertEquals(Team.RED, again.getTeam());
        assertEquals(1, tableService.getTable("GAME").getPlayers().size());
        assertSame(alice, tableService.getPlayer("GAME", alice.getId()));
    }

    @Test
    void testJoinValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> tableService.join("GAME", new JoinGameDTO(" ", Team.RED, Role.OPERATIVE, false)));
        assertThrows(IllegalArgumentException.class,
                () -> tableService.join("GAME", new JoinGameDTO("Bob", null, Role.OPERATIVE, false)));
        assertThrows(GameNotFoundException.class,
                () -> tableService.join("NOPE", new JoinGameDTO("Bob", Team.RED, Role.OPERATIVE, false)));
    }

    @Test
    void testUnknownPlayer() {
        assertThrows(PlayerNotFoundException.class, () -> tableService.getPlayer("GAME", "ghost"));
    }

    @Test
    void testCloseTable() {
        tableService.closeTable("GAME");

        assertThrows(GameNotFoundException.class, () -> tableService.getTable("GAME"));
    }
}
