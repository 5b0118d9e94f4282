package com.frameception.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Output stream a deployment build-log line was written to. The platform also emits
 * bookkeeping lines (command, delimiter, exit) which are read as {@link #OTHER}.
 */
public enum BuildStream {
    STDOUT("stdout"),
    STDERR("stderr"),
    OTHER("other");

    private final String wireValue;

    BuildStream(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static BuildStream fromWire(String value) {
        if (value == null) return OTHER;
        for (BuildStream stream : values()) {
            if (stream.wireValue.equalsIgnoreCase(value.trim())) {
                return stream;
            }
        }
        return OTHER;
    }
}
