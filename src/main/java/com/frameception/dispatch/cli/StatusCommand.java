package com.frameception.dispatch.cli;

import com.frameception.core.conversation.ConversationTurn;
import com.frameception.core.model.Project;
import com.frameception.core.polling.PollingScheduler;
import com.frameception.core.state.DashboardSnapshot;
import com.frameception.core.state.DashboardStateStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: frameception status &lt;project-id&gt;
 * <p>
 * Fetches the project once and prints its derived status, URLs and conversation.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show project status")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", description = "Project ID")
    private String projectId;

    private final PollingScheduler pollingScheduler;
    private final DashboardStateStore stateStore;

    public StatusCommand(PollingScheduler pollingScheduler, DashboardStateStore stateStore) {
        this.pollingScheduler = pollingScheduler;
        this.stateStore = stateStore;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        pollingScheduler.activate(projectId).join();
        DashboardSnapshot snapshot = stateStore.snapshot();
        pollingScheduler.deactivate().join();

        switch (snapshot.phase()) {
            case ERROR -> {
                ConsoleOutput.error("Failed to load project: " + snapshot.lastError());
                return;
            }
            case NOT_FOUND -> {
                ConsoleOutput.error("Project not found: " + projectId);
                return;
            }
            default -> { }
        }

        Project project = snapshot.project();
        System.out.println();
        System.out.println("PROJECT " + project.id());
        System.out.println("Name: " + project.name());
        ConsoleOutput.status(snapshot.status());
        if (project.hasFrontendUrl()) {
            System.out.println("Frame: " + project.frontendUrl());
        }
        if (project.repoUrl() != null) {
            System.out.println("Repository: " + project.repoUrl());
        }
        if (snapshot.hasPendingJobs()) {
            ConsoleOutput.info("Jobs in progress");
        }

        if (!snapshot.conversation().isEmpty()) {
            System.out.println();
            for (ConversationTurn turn : snapshot.conversation()) {
                ConsoleOutput.turn(turn);
            }
        }
    }
}
