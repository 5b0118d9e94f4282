package com.frameception.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * One entry of the activity timeline.
 *
 * @param id        identity, stable across polls; two entries with the same id are the same event
 * @param source    subsystem that wrote the entry
 * @param text      freeform text
 * @param createdAt creation timestamp
 * @param data      optional structured payload (deployment status and raw build-log lines)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LogEntry(
    String id,
    LogSource source,
    String text,
    @JsonProperty("created_at") Instant createdAt,
    LogData data
) implements Serializable {

    public LogEntry {
        source = source == null ? LogSource.UNKNOWN : source;
    }

    public List<BuildLogLine> buildLines() {
        return data == null ? List.of() : data.logs();
    }

    public boolean hasBuildLines() {
        return !buildLines().isEmpty();
    }
}
