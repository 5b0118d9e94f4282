package com.frameception.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.frameception.core.model.DeploymentStatusReport;
import com.frameception.core.model.Project;
import com.frameception.core.model.UserContext;

import java.util.List;
import java.util.Optional;

/**
 * Blocking access to the project-generation backend. Every method either returns normally
 * or throws {@link BackendRequestException}; callers run it off the dashboard event loop.
 */
public interface BackendClient {

    /**
     * Fetches one project with its jobs and their logs. Idempotent.
     *
     * @return the project, or empty when the backend knows no project with that id
     */
    Optional<Project> fetchProject(String projectId);

    /**
     * Lists the projects visible to the dashboard.
     */
    List<Project> listProjects();

    /**
     * Fetches the current deployment-platform build status of a project.
     */
    DeploymentStatusReport fetchDeploymentStatus(String projectId);

    /**
     * Requests a code update. On success a new update job appears on the next project fetch.
     */
    void submitUpdate(String projectId, String prompt, UserContext userContext);

    /**
     * Requests a deployment. On success a new job appears on the next project fetch.
     */
    void deploy(String projectId, UserContext userContext);

    /**
     * Creates a new project from a prompt and description.
     *
     * @return the backend's response body
     */
    JsonNode createProject(String prompt, String description, UserContext userContext);
}
