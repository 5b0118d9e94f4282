package com.frameception.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.frameception.core.model.ProjectStatus;

import java.time.Instant;

/**
 * One row of the project listing.
 */
public record ProjectSummary(
    String id,
    String name,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("frontend_url") String frontendUrl,
    ProjectStatus status
) {}
