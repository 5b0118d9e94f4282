package com.frameception.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * A generated project as reported by the backend. The dashboard only ever holds
 * a read-only copy that is replaced wholesale on every successful fetch.
 *
 * @param id              backend identifier
 * @param name            display name
 * @param createdAt       creation timestamp
 * @param frontendUrl     deployed frontend URL; nullable until the first deployment
 * @param repoUrl         source repository URL; nullable
 * @param vercelProjectId deployment-platform binding; nullable until the platform project exists
 * @param jobs            jobs created for this project, in backend order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Project(
    String id,
    String name,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("frontend_url") String frontendUrl,
    @JsonProperty("repo_url") String repoUrl,
    @JsonProperty("vercel_project_id") String vercelProjectId,
    List<Job> jobs
) implements Serializable {

    public Project {
        jobs = jobs == null ? List.of() : List.copyOf(jobs);
    }

    public boolean hasDeploymentBinding() {
        return vercelProjectId != null && !vercelProjectId.isBlank();
    }

    public boolean hasFrontendUrl() {
        return frontendUrl != null && !frontendUrl.isBlank();
    }
}
