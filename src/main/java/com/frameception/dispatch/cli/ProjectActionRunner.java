package com.frameception.dispatch.cli;

import com.frameception.core.config.FrameceptionProperties;
import com.frameception.core.dispatch.ActionDispatcher;
import com.frameception.core.dispatch.DispatchResult;
import com.frameception.core.model.UserContext;
import com.frameception.core.polling.PollingScheduler;
import com.frameception.core.state.DashboardState;
import com.frameception.core.state.DashboardStateStore;
import com.frameception.core.state.ViewPhase;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Loads a project with the configured user and runs one action against it, for the
 * update, deploy and autofix commands.
 */
@Component
class ProjectActionRunner {

    static final int EXIT_SUBMITTED = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_REFUSED = 3;

    private final PollingScheduler pollingScheduler;
    private final DashboardStateStore stateStore;
    private final ActionDispatcher actionDispatcher;
    private final FrameceptionProperties properties;

    ProjectActionRunner(PollingScheduler pollingScheduler, DashboardStateStore stateStore,
                        ActionDispatcher actionDispatcher, FrameceptionProperties properties) {
        this.pollingScheduler = pollingScheduler;
        this.stateStore = stateStore;
        this.actionDispatcher = actionDispatcher;
        this.properties = properties;
    }

    int run(String projectId, String label, Function<ActionDispatcher, CompletableFuture<DispatchResult>> action) {
        return run(projectId, label, false, action);
    }

    /**
     * @param needsDeploymentStatus also load the deployment status before acting, so build errors
     *                              reported by the deployment platform are on the timeline
     */
    int run(String projectId, String label, boolean needsDeploymentStatus,
            Function<ActionDispatcher, CompletableFuture<DispatchResult>> action) {
        UserContext user = properties.getUserContext();
        if (user == null) {
            ConsoleOutput.error("No user configured (set frameception.user.fid)");
            return EXIT_REFUSED;
        }
        actionDispatcher.setUserContext(user).join();
        pollingScheduler.activate(projectId).join();
        try {
            DashboardState state = stateStore.current();
            if (state.phase() != ViewPhase.READY) {
                ConsoleOutput.error(state.phase() == ViewPhase.NOT_FOUND
                        ? "Project not found: " + projectId
                        : "Failed to load project: " + state.lastError());
                return EXIT_FAILED;
            }
            if (needsDeploymentStatus) {
                pollingScheduler.refreshDeploymentStatus().join();
            }

            DispatchResult result = action.apply(actionDispatcher).join();
            switch (result) {
                case SUBMITTED -> {
                    ConsoleOutput.success(label + " submitted for " + projectId);
                    return EXIT_SUBMITTED;
                }
                case REFUSED -> {
                    ConsoleOutput.error(label + " not possible right now"
                            + (stateStore.snapshot().hasPendingJobs() ? " (jobs still in progress)" : ""));
                    return EXIT_REFUSED;
                }
                default -> {
                    ConsoleOutput.error(label + " failed, see log for details");
                    return EXIT_FAILED;
                }
            }
        } finally {
            pollingScheduler.deactivate().join();
        }
    }
}
