package com.codenames.backend.model;

public enum CardType {
    RED,
    BLUE,
    NEUTRAL,
    ASSASSIN;

    /**
     * @return the team owning cards of this type, or {@code null} for neutral and assassin cards
     */
    public Team team() {
        switch (this) {
            case RED:
                return Team.RED;
            case BLUE:
                return Team.BLUE;
            default:
                return null;
        }
    }

    public boolean belongsTo(Team team) {
        return team != null && team() == team;
    }
}
