package com.frameception.core.status;

import com.frameception.core.model.DeploymentBuildStatus;
import com.frameception.core.model.Job;
import com.frameception.core.model.Project;
import com.frameception.core.model.ProjectStatus;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;

/**
 * Combines a project's record, its latest status-relevant job and the polled deployment
 * status into one normalized {@link ProjectStatus}.
 * <p>
 * Precedence, highest first: an error on the latest relevant job or an ERROR deployment,
 * then an in-progress job or deployment, then a reachable frontend URL, then CREATED.
 * Every combination of inputs, including all-null, maps to exactly one status.
 */
@Component
public class StatusReconciler {

    static final String JOB_FAILED_MESSAGE = "Job failed";
    static final String DEPLOYMENT_FAILED_MESSAGE = "Deployment build failed";

    private static final Comparator<Job> BY_CREATED_AT = Comparator.comparing(
            Job::createdAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()));

    public ProjectStatus deriveStatus(Project project, DeploymentBuildStatus deploymentStatus) {
        return deriveStatus(project, latestRelevantJob(project).orElse(null), deploymentStatus);
    }

    public ProjectStatus deriveStatus(Project project, Job latestRelevantJob,
                                      DeploymentBuildStatus deploymentStatus) {
        if (latestRelevantJob != null && latestRelevantJob.reportsError()) {
            return ProjectStatus.error(latestRelevantJob.data().hasError()
                    ? latestRelevantJob.data().error()
                    : JOB_FAILED_MESSAGE);
        }
        if (deploymentStatus == DeploymentBuildStatus.ERROR) {
            return ProjectStatus.error(DEPLOYMENT_FAILED_MESSAGE);
        }

        if (latestRelevantJob != null && latestRelevantJob.inProgress()) {
            return ProjectStatus.BUILDING;
        }
        if (deploymentStatus != null && deploymentStatus.inProgress()) {
            return ProjectStatus.BUILDING;
        }

        if (project != null && project.hasFrontendUrl()) {
            return ProjectStatus.DEPLOYED;
        }
        return ProjectStatus.CREATED;
    }

    /**
     * Returns the most recently created setup or update job of the project.
     */
    public Optional<Job> latestRelevantJob(Project project) {
        if (project == null) {
            return Optional.empty();
        }
        return project.jobs().stream()
                .filter(job -> job.type().statusRelevant())
                .max(BY_CREATED_AT);
    }

    /**
     * True while any setup or update job is still pending or running.
     */
    public boolean hasPendingJobs(Project project) {
        if (project == null) {
            return false;
        }
        return project.jobs().stream()
                .anyMatch(job -> job.type().statusRelevant() && job.inProgress());
    }
}
