package com.frameception.dispatch.api;

import com.frameception.core.model.UserContext;

/**
 * Inbound JSON body for POST /api/v1/projects.
 *
 * @param prompt      what the new frame should do
 * @param description project description
 * @param userContext requesting user; nullable, falls back to the configured user
 */
public record CreateProjectRequest(
    String prompt,
    String description,
    UserContext userContext
) {}
