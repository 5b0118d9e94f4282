package com.frameception.core.notifications;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;

public record UserRecord(
    long fid,
    String username,
    @JsonProperty("updated_at") Instant updatedAt
) implements Serializable {
}
