package com.codenames.backend.model;

public enum Team {
    RED,
    BLUE;

    public Team opponent() {
        return this == RED ? BLUE : RED;
    }

    public CardType cardType() {
        return this == RED ? CardType.RED : CardType.BLUE;
    }
}
