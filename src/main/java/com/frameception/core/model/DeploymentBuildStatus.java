package com.frameception.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Build status reported by the deployment platform for the latest deployment.
 */
public enum DeploymentBuildStatus {
    QUEUED,
    INITIALIZING,
    BUILDING,
    READY,
    ERROR,
    CANCELED,
    UNKNOWN;

    /** Queued and initializing deployments are reported as building. */
    public boolean inProgress() {
        return this == QUEUED || this == INITIALIZING || this == BUILDING;
    }

    @JsonValue
    public String wireValue() {
        return name();
    }

    @JsonCreator
    public static DeploymentBuildStatus fromWire(String value) {
        if (value == null || value.isBlank()) return UNKNOWN;
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
