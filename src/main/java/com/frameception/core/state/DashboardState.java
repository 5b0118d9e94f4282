package com.frameception.core.state;

import com.frameception.core.model.DeploymentBuildStatus;
import com.frameception.core.model.LogEntry;
import com.frameception.core.model.Project;
import com.frameception.core.model.UserContext;

import java.util.List;

/**
 * Immutable dashboard state. Every change produces a new instance which replaces the
 * previous one as a whole, so readers never observe a half-applied update.
 *
 * @param projectId        active project; null when idle
 * @param project          last successfully fetched project; null until the first fetch lands
 * @param logs             aggregated activity timeline, newest first
 * @param deploymentStatus last observed deployment status; null until first observed
 * @param submitting       true while a user action is in flight
 * @param lastError        page-level error of the last project fetch; null when it succeeded
 * @param updatePrompt     update-prompt text buffer
 * @param userContext      signed-in user; null when unknown
 * @param notFound         true when the backend answered without the project
 */
public record DashboardState(
    String projectId,
    Project project,
    List<LogEntry> logs,
    DeploymentBuildStatus deploymentStatus,
    boolean submitting,
    String lastError,
    String updatePrompt,
    UserContext userContext,
    boolean notFound
) {

    public DashboardState {
        logs = logs == null ? List.of() : List.copyOf(logs);
        updatePrompt = updatePrompt == null ? "" : updatePrompt;
    }

    public static DashboardState idle(UserContext userContext) {
        return new DashboardState(null, null, List.of(), null, false, null, "", userContext, false);
    }

    /** Fresh state for a newly activated project; nothing is carried over but the user. */
    public DashboardState forProject(String newProjectId) {
        return new DashboardState(newProjectId, null, List.of(), null, false, null, "", userContext, false);
    }

    public DashboardState withProject(Project newProject, List<LogEntry> newLogs) {
        return new DashboardState(projectId, newProject, newLogs, deploymentStatus, submitting,
                null, updatePrompt, userContext, false);
    }

    public DashboardState withProjectMissing() {
        return new DashboardState(projectId, null, logs, deploymentStatus, submitting,
                null, updatePrompt, userContext, true);
    }

    public DashboardState withFetchError(String message) {
        return new DashboardState(projectId, project, logs, deploymentStatus, submitting,
                message, updatePrompt, userContext, notFound);
    }

    public DashboardState withDeployment(DeploymentBuildStatus status, List<LogEntry> newLogs) {
        return new DashboardState(projectId, project, newLogs, status, submitting,
                lastError, updatePrompt, userContext, notFound);
    }

    public DashboardState withSubmitting(boolean value) {
        return new DashboardState(projectId, project, logs, deploymentStatus, value,
                lastError, updatePrompt, userContext, notFound);
    }

    public DashboardState withUpdatePrompt(String prompt) {
        return new DashboardState(projectId, project, logs, deploymentStatus, submitting,
                lastError, prompt, userContext, notFound);
    }

    public DashboardState withUserContext(UserContext user) {
        return new DashboardState(projectId, project, logs, deploymentStatus, submitting,
                lastError, updatePrompt, user, notFound);
    }

    public ViewPhase phase() {
        if (projectId == null) return ViewPhase.IDLE;
        if (lastError != null) return ViewPhase.ERROR;
        if (project != null) return ViewPhase.READY;
        if (notFound) return ViewPhase.NOT_FOUND;
        return ViewPhase.LOADING;
    }
}
