package com.frameception.core.dispatch;

import com.frameception.client.BackendClient;
import com.frameception.core.events.DashboardEvent;
import com.frameception.core.events.EventBus;
import com.frameception.core.logging.MdcContext;
import com.frameception.core.logs.BuildLogView;
import com.frameception.core.metrics.DashboardMetrics;
import com.frameception.core.model.UserContext;
import com.frameception.core.polling.PollingScheduler;
import com.frameception.core.state.DashboardState;
import com.frameception.core.state.DashboardStateStore;
import com.frameception.core.status.StatusReconciler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

/**
 * Submits user mutations (code update, deploy, autofix) for the active project.
 * <p>
 * Validation and every state write run on the polling scheduler's event loop; the
 * backend call itself runs on the I/O pool. At most one action is in flight at a time,
 * tracked by the {@code submitting} flag of the dashboard state.
 */
@Service
public class ActionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ActionDispatcher.class);

    static final String AUTOFIX_PROMPT_PREFIX = "Please fix the following build errors:\n\n";

    private final BackendClient backendClient;
    private final PollingScheduler scheduler;
    private final DashboardStateStore store;
    private final StatusReconciler statusReconciler;
    private final DashboardMetrics metrics;
    private final EventBus eventBus;

    public ActionDispatcher(BackendClient backendClient,
                            PollingScheduler scheduler,
                            DashboardStateStore store,
                            StatusReconciler statusReconciler,
                            DashboardMetrics metrics,
                            EventBus eventBus) {
        this.backendClient = backendClient;
        this.scheduler = scheduler;
        this.store = store;
        this.statusReconciler = statusReconciler;
        this.metrics = metrics;
        this.eventBus = eventBus;
    }

    /**
     * Sends the prompt buffer as a code update. The buffer is cleared once the backend accepts it.
     */
    public CompletableFuture<DispatchResult> submitUpdate() {
        return dispatch("update", true, state -> {
            if (state.updatePrompt().isBlank()) {
                log.debug("Update refused: prompt is blank");
                return null;
            }
            if (statusReconciler.hasPendingJobs(state.project())) {
                log.debug("Update refused: jobs still pending for {}", state.projectId());
                return null;
            }
            String prompt = state.updatePrompt();
            return user -> backendClient.submitUpdate(state.projectId(), prompt, user);
        });
    }

    public CompletableFuture<DispatchResult> deploy() {
        return dispatch("deploy", false,
                state -> user -> backendClient.deploy(state.projectId(), user));
    }

    /**
     * Submits a code update whose prompt is built from the error lines of the latest build report.
     * Refused when there are no error lines to fix.
     */
    public CompletableFuture<DispatchResult> autofix() {
        return dispatch("autofix", false, state -> {
            if (statusReconciler.hasPendingJobs(state.project())) {
                log.debug("Autofix refused: jobs still pending for {}", state.projectId());
                return null;
            }
            String errors = BuildLogView.errorText(state.logs());
            if (errors.isBlank()) {
                log.debug("Autofix refused: no build errors recorded for {}", state.projectId());
                return null;
            }
            String prompt = AUTOFIX_PROMPT_PREFIX + errors;
            return user -> backendClient.submitUpdate(state.projectId(), prompt, user);
        });
    }

    public CompletableFuture<Void> setUpdatePrompt(String prompt) {
        return scheduler.onLoop(() -> {
            store.update(state -> state.withUpdatePrompt(prompt));
            return null;
        });
    }

    public CompletableFuture<Void> setUserContext(UserContext user) {
        return scheduler.onLoop(() -> {
            store.update(state -> state.withUserContext(user));
            return null;
        });
    }

    /**
     * Common dispatch path.
     *
     * @param prepare checks action-specific preconditions against the current state and returns
     *                the mutation to run, or null to refuse
     */
    private CompletableFuture<DispatchResult> dispatch(String action, boolean clearsPrompt,
                                                       Function<DashboardState, Mutation> prepare) {
        return scheduler.onLoop(() -> {
            DashboardState state = store.current();
            Mutation mutation = checkCommon(action, state) ? prepare.apply(state) : null;
            if (mutation == null) {
                metrics.recordDispatch(action, DispatchResult.REFUSED.name());
                return CompletableFuture.completedFuture(DispatchResult.REFUSED);
            }

            String projectId = state.projectId();
            long cycle = scheduler.currentGeneration();
            UserContext user = state.userContext();
            store.update(s -> s.withSubmitting(true));
            MdcContext.setAction(projectId, action);
            try {
                log.info("Dispatching {} for project {}", action, projectId);
            } finally {
                MdcContext.clear();
            }

            return CompletableFuture
                    .runAsync(() -> mutation.run(user), scheduler.ioExecutor())
                    .handleAsync((ignored, error) -> complete(action, projectId, cycle, clearsPrompt, error),
                            scheduler.eventLoop());
        }).thenCompose(result -> result);
    }

    private boolean checkCommon(String action, DashboardState state) {
        if (state.project() == null) {
            log.debug("{} refused: no project loaded", action);
            return false;
        }
        if (state.userContext() == null || !state.userContext().hasIdentity()) {
            log.debug("{} refused: no user identity", action);
            return false;
        }
        if (state.submitting()) {
            log.debug("{} refused: another action is being submitted", action);
            return false;
        }
        return true;
    }

    /**
     * Records the outcome of an action. The state is only touched while the polling cycle the
     * action was dispatched in is still current; after a switch the flags belong to another cycle.
     */
    private DispatchResult complete(String action, String projectId, long cycle, boolean clearsPrompt,
                                    Throwable error) {
        boolean sameCycle = cycle == scheduler.currentGeneration() && projectId.equals(store.current().projectId());
        DispatchResult result = error == null ? DispatchResult.SUBMITTED : DispatchResult.FAILED;

        if (sameCycle) {
            store.update(state -> {
                DashboardState next = state.withSubmitting(false);
                return result == DispatchResult.SUBMITTED && clearsPrompt ? next.withUpdatePrompt("") : next;
            });
        } else {
            log.debug("{} for project {} finished after cycle {} ended; state left alone", action, projectId, cycle);
        }

        MdcContext.setAction(projectId, action);
        try {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                log.warn("{} for project {} failed: {}", action, projectId, cause.getMessage());
            } else {
                log.info("{} for project {} submitted", action, projectId);
            }
        } finally {
            MdcContext.clear();
        }
        metrics.recordDispatch(action, result.name());
        eventBus.publish(new DashboardEvent(DashboardEvent.ACTION_COMPLETED, projectId,
                Map.of("action", action, "result", result.name()), Instant.now()));

        if (result == DispatchResult.SUBMITTED && sameCycle) {
            scheduler.refreshNow();
        }
        return result;
    }

    @FunctionalInterface
    private interface Mutation {
        void run(UserContext user);
    }
}
