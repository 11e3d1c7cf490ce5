package com.simrelay.core.command;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum TaskOperation {
    /** Write {@code value} once. */
    SET,
    /** Write {@code value}, hold, then write {@code reset_value}. */
    PULSE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<TaskOperation> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "set" -> Optional.of(SET);
            case "pulse" -> Optional.of(PULSE);
            default -> Optional.empty();
        };
    }
}
