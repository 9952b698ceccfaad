package com.multifish.scheduler;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum ScheduleType {
    ONCE("Once"),
    CONTINUOUS("Continuous");

    private final String wireName;

    ScheduleType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() { return wireName; }

    public static Optional<ScheduleType> fromWireName(String value) {
        for (ScheduleType type : values()) {
            if (type.wireName.equals(value)) return Optional.of(type);
        }
        return Optional.empty();
    }
}
