package com.frameception.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Subsystem a log entry originates from.
 */
public enum LogSource {
    FRONTEND("frontend"),
    BACKEND("backend"),
    DEPLOYMENT_PLATFORM("vercel"),
    SOURCE_CONTROL("github"),
    SOCIAL_CLIENT("farcaster"),
    UNKNOWN("unknown");

    private final String wireValue;

    LogSource(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static LogSource fromWire(String value) {
        if (value == null) return UNKNOWN;
        for (LogSource source : values()) {
            if (source.wireValue.equalsIgnoreCase(value.trim())) {
                return source;
            }
        }
        return UNKNOWN;
    }
}
