package com.frameception.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Job type tag as written by the backend.
 */
public enum JobType {
    SETUP_PROJECT("setup_project"),
    UPDATE_CODE("update_code"),
    UNKNOWN("unknown");

    private final String wireValue;

    JobType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /** Only setup and update jobs feed the derived project status and the conversation. */
    public boolean statusRelevant() {
        return this == SETUP_PROJECT || this == UPDATE_CODE;
    }

    @JsonCreator
    public static JobType fromWire(String value) {
        if (value == null) return UNKNOWN;
        for (JobType type : values()) {
            if (type.wireValue.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
