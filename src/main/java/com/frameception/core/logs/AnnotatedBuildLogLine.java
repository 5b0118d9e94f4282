package com.frameception.core.logs;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.frameception.core.model.BuildLogLine;

/**
 * A build-log line prepared for display.
 *
 * @param line      the source line
 * @param timestamp human-readable UTC timestamp, empty when the line carried none
 * @param error     true iff the line was written to stderr
 */
public record AnnotatedBuildLogLine(
    BuildLogLine line,
    String timestamp,
    @JsonProperty("is_error") boolean error
) {

    /** Render key: the line identity, or the position in the filtered view when the platform sent none. */
    public String key(int position) {
        return line.id() != null ? line.id() : String.valueOf(position);
    }
}
