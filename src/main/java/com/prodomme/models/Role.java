package com.prodomme.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Speaker of a message. Only USER and ASSISTANT are kept in a session's history;
 * SYSTEM and DEVELOPER exist for backends that want the system prompt as a message.
 */
public enum Role {
    USER,
    ASSISTANT,
    SYSTEM,
    DEVELOPER;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Role fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Role is required.");
        }
        return Role.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
