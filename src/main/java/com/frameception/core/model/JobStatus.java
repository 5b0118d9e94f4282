package com.frameception.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Backend job status. The backend writes pending, running, completed and failed;
 * "succeeded" is read as {@link #COMPLETED}.
 */
public enum JobStatus {
    PENDING("pending"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    UNKNOWN("unknown");

    private final String wireValue;

    JobStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public boolean inProgress() {
        return this == PENDING || this == RUNNING;
    }

    @JsonCreator
    public static JobStatus fromWire(String value) {
        if (value == null) return UNKNOWN;
        String normalized = value.trim().toLowerCase();
        if ("succeeded".equals(normalized)) return COMPLETED;
        for (JobStatus status : values()) {
            if (status.wireValue.equals(normalized)) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
