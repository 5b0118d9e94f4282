package com.frameception.core.state;

import com.frameception.core.conversation.ConversationView;
import com.frameception.core.model.ProjectStatus;
import com.frameception.core.status.StatusReconciler;
import org.springframework.stereotype.Component;

import java.util.function.UnaryOperator;

/**
 * Holds the single current {@link DashboardState}.
 * <p>
 * Writes are made only from the polling scheduler's event loop, each one a full-value
 * replace. Reads are safe from any thread.
 */
@Component
public class DashboardStateStore {

    private final StatusReconciler statusReconciler;
    private volatile DashboardState state = DashboardState.idle(null);

    public DashboardStateStore(StatusReconciler statusReconciler) {
        this.statusReconciler = statusReconciler;
    }

    public DashboardState current() {
        return state;
    }

    /**
     * Replaces the state with {@code change} applied to the current one. Loop thread only.
     */
    public DashboardState update(UnaryOperator<DashboardState> change) {
        DashboardState next = change.apply(state);
        state = next;
        return next;
    }

    public DashboardSnapshot snapshot() {
        DashboardState current = state;
        ProjectStatus status = statusReconciler.deriveStatus(current.project(), current.deploymentStatus());
        return new DashboardSnapshot(
                current.projectId(),
                current.phase(),
                current.project(),
                status,
                current.logs(),
                current.deploymentStatus(),
                current.submitting(),
                current.lastError(),
                current.updatePrompt(),
                statusReconciler.hasPendingJobs(current.project()),
                ConversationView.turns(current.project()));
    }
}
