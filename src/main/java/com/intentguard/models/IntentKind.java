package com.intentguard.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse category a user request or agent action is classified into.
 * UNKNOWN is both a classification result and the fallback when nothing matches.
 */
public enum IntentKind {
    READ("read"),
    WRITE("write"),
    DELETE("delete"),
    UNKNOWN("unknown");

    private final String value;

    IntentKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
