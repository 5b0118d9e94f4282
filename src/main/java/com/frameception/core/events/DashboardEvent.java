package com.frameception.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a project is being watched, used for SSE streaming and CLI watch mode.
 *
 * @param eventType event type (e.g. "dashboard.updated", "deployment.status_changed", "action.completed")
 * @param projectId the project this event belongs to
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record DashboardEvent(
    String eventType,
    String projectId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String DASHBOARD_UPDATED = "dashboard.updated";
    public static final String DEPLOYMENT_STATUS_CHANGED = "deployment.status_changed";
    public static final String PROJECT_FETCH_FAILED = "project.fetch_failed";
    public static final String ACTION_COMPLETED = "action.completed";
}
