package com.frameception.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Normalized project state shown to the user.
 */
public enum ProjectState {
    CREATED,
    BUILDING,
    DEPLOYED,
    ERROR;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase();
    }
}
