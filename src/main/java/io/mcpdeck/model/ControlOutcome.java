package io.mcpdeck.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ControlOutcome {
    STARTED,
    ALREADY_RUNNING,
    STOPPED,
    ALREADY_EXITED,
    NOT_RUNNING,
    UNKNOWN_SERVER,
    COMMAND_NOT_FOUND,
    LAUNCH_FAILED,
    STOP_FAILED,
    INVALID_DEFINITION,
    SAVED,
    SAVE_FAILED,
    REMOVED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
