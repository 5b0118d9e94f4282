package com.frameception.dispatch.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.frameception.client.BackendClient;
import com.frameception.client.BackendRequestException;
import com.frameception.core.config.FrameceptionProperties;
import com.frameception.core.model.Project;
import com.frameception.core.model.UserContext;
import com.frameception.core.status.StatusReconciler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST controller for listing and creating projects.
 */
@RestController
@RequestMapping("/api/v1/projects")
public class ProjectsController {

    private static final Logger log = LoggerFactory.getLogger(ProjectsController.class);

    static final String MISSING_FIELDS = "Project name, description and userContext are required";

    private final BackendClient backendClient;
    private final StatusReconciler statusReconciler;
    private final FrameceptionProperties properties;

    public ProjectsController(BackendClient backendClient,
                              StatusReconciler statusReconciler,
                              FrameceptionProperties properties) {
        this.backendClient = backendClient;
        this.statusReconciler = statusReconciler;
        this.properties = properties;
    }

    /**
     * GET /api/v1/projects — All projects with the status derived from their jobs.
     */
    @GetMapping
    public ResponseEntity<Object> listProjects() {
        try {
            List<ProjectSummary> summaries = backendClient.listProjects().stream()
                    .map(this::summarize)
                    .toList();
            return ResponseEntity.ok(summaries);
        } catch (BackendRequestException e) {
            log.warn("Listing projects failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * POST /api/v1/projects — Ask the backend to create a new frame project.
     */
    @PostMapping
    public ResponseEntity<Object> createProject(@RequestBody CreateProjectRequest request) {
        UserContext user = request.userContext() != null ? request.userContext() : properties.getUserContext();
        if (user == null) {
            return ResponseEntity.badRequest().body(Map.of("error", MISSING_FIELDS));
        }
        try {
            JsonNode created = backendClient.createProject(request.prompt(), request.description(), user);
            log.info("Created project for user {}", user.fid());
            return ResponseEntity.status(HttpStatus.CREATED).body(created);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (BackendRequestException e) {
            log.warn("Project creation failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(Map.of("error", e.getMessage()));
        }
    }

    private ProjectSummary summarize(Project project) {
        return new ProjectSummary(project.id(), project.name(), project.createdAt(), project.frontendUrl(),
                statusReconciler.deriveStatus(project, null));
    }
}
