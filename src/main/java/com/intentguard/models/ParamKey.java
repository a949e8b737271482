package com.intentguard.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Parameters that can bind an agent action to what the user asked for.
 */
public enum ParamKey {
    FROM("from"),
    TO("to"),
    SUBJECT("subject");

    private final String key;

    ParamKey(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public static ParamKey fromString(String key) {
        if (key == null) {
            return null;
        }
        for (ParamKey param : values()) {
            if (param.key.equals(key)) {
                return param;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return key;
    }
}
