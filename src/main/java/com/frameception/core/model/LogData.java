package com.frameception.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.util.List;

/**
 * Structured payload attached to a log entry.
 *
 * @param status deployment status at the time the entry was written; nullable
 * @param logs   raw build-log lines
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LogData(
    String status,
    List<BuildLogLine> logs
) implements Serializable {

    public LogData {
        logs = logs == null ? List.of() : List.copyOf(logs);
    }
}
