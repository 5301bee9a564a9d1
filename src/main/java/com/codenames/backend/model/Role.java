package com.codenames.backend.model;

public enum Role {
    SPYMASTER,
    OPERATIVE
}
