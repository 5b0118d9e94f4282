package com.frameception.core.state;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.frameception.core.conversation.ConversationTurn;
import com.frameception.core.model.DeploymentBuildStatus;
import com.frameception.core.model.LogEntry;
import com.frameception.core.model.Project;
import com.frameception.core.model.ProjectStatus;

import java.util.List;

/**
 * Read-only view of the dashboard handed to the rendering layer. The derived status and
 * conversation are computed when the snapshot is taken and never stored.
 */
public record DashboardSnapshot(
    @JsonProperty("project_id") String projectId,
    ViewPhase phase,
    Project project,
    ProjectStatus status,
    List<LogEntry> logs,
    @JsonProperty("deployment_status") DeploymentBuildStatus deploymentStatus,
    @JsonProperty("is_submitting") boolean submitting,
    @JsonProperty("last_error") String lastError,
    @JsonProperty("update_prompt") String updatePrompt,
    @JsonProperty("has_pending_jobs") boolean hasPendingJobs,
    List<ConversationTurn> conversation
) {}
