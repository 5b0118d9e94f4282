package com.frameception.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.util.List;

/**
 * Payload of the deployment-status endpoint.
 *
 * @param status current build status
 * @param logs   build-log lines of the latest deployment; empty when the endpoint sent none
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DeploymentStatusReport(
    DeploymentBuildStatus status,
    List<BuildLogLine> logs
) implements Serializable {

    public DeploymentStatusReport {
        status = status == null ? DeploymentBuildStatus.UNKNOWN : status;
        logs = logs == null ? List.of() : List.copyOf(logs);
    }

    public static DeploymentStatusReport of(DeploymentBuildStatus status) {
        return new DeploymentStatusReport(status, List.of());
    }
}
