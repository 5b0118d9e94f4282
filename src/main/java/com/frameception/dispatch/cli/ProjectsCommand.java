package com.frameception.dispatch.cli;

import com.frameception.client.BackendClient;
import com.frameception.client.BackendRequestException;
import com.frameception.core.model.Project;
import com.frameception.core.status.StatusReconciler;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: frameception projects
 */
@Command(name = "projects", mixinStandardHelpOptions = true, description = "List projects")
@Component
public class ProjectsCommand implements Runnable {

    private final BackendClient backendClient;
    private final StatusReconciler statusReconciler;

    public ProjectsCommand(BackendClient backendClient, StatusReconciler statusReconciler) {
        this.backendClient = backendClient;
        this.statusReconciler = statusReconciler;
    }

    @Override
    public void run() {
        List<Project> projects;
        try {
            projects = backendClient.listProjects();
        } catch (BackendRequestException e) {
            ConsoleOutput.error("Failed to list projects: " + e.getMessage());
            return;
        }
        if (projects.isEmpty()) {
            ConsoleOutput.info("No projects found.");
            return;
        }

        System.out.printf("  %-38s %-10s %s%n", "ID", "STATUS", "NAME");
        System.out.println("  " + "-".repeat(70));
        for (Project project : projects) {
            var status = statusReconciler.deriveStatus(project, null);
            System.out.printf("  %-38s %-10s %s%n", project.id(), status.state(), truncate(project.name(), 30));
        }
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
