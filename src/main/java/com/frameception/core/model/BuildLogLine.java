package com.frameception.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;

/**
 * A single line of the deployment platform's build output, in the platform's wire shape
 * {@code {"type": "stderr", "payload": {"id": ..., "text": ..., "date": <epoch millis>}}}.
 *
 * @param stream  output stream the line was written to
 * @param payload line identity, text and timestamp
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BuildLogLine(
    @JsonProperty("type") BuildStream stream,
    Payload payload
) implements Serializable {

    public BuildLogLine {
        stream = stream == null ? BuildStream.OTHER : stream;
        payload = payload == null ? new Payload(null, null, null) : payload;
    }

    public static BuildLogLine of(String id, BuildStream stream, String text, Instant date) {
        return new BuildLogLine(stream, new Payload(id, text, date != null ? date.toEpochMilli() : null));
    }

    public String id() {
        return payload.id();
    }

    public String text() {
        return payload.text() != null ? payload.text() : "";
    }

    /** Payload timestamp, or null when the platform sent none. */
    public Instant timestamp() {
        return payload.date() != null ? Instant.ofEpochMilli(payload.date()) : null;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Payload(
        String id,
        String text,
        Long date
    ) implements Serializable {}
}
