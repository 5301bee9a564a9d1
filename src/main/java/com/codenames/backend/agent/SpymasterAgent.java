package com.codenames.backend.agent;

import com.codenames.backend.model.GameView;

public interface SpymasterAgent {

    String getId();

    /**
     * @param spymasterView snapshot with every card's type visible
     */
    ClueProposal generateClue(GameView spymasterView);
}
