package com.openforge.mnemosyne.session;

import java.util.Optional;

public enum TurnRole {

    USER("user"),
    ASSISTANT("assistant"),
    SYSTEM("system");

    private final String wireName;

    TurnRole(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isDialogue() {
        return this == USER || this == ASSISTANT;
    }

    public static Optional<TurnRole> fromWire(String role) {
        if (role == null) return Optional.empty();
        for (TurnRole r : values()) {
            if (r.wireName.equals(role)) return Optional.of(r);
        }
        return Optional.empty();
    }
}
