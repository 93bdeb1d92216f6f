package com.printshop_voice_backend.dto;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of control commands a client may send on the voice channel.
 */
public enum ControlType {
    START_RECORDING("start_recording"),
    STOP_RECORDING("stop_recording"),
    RESET("reset");

    private final String wireName;

    ControlType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<ControlType> fromWireName(String value) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(value))
                .findFirst();
    }
}
