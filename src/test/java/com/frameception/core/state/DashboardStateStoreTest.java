package com.frameception.core.state;

import com.frameception.core.model.DeploymentBuildStatus;
import com.frameception.core.model.JobData;
import com.frameception.core.model.JobStatus;
import com.frameception.core.model.JobType;
import com.frameception.core.model.LogSource;
import com.frameception.core.model.ProjectState;
import com.frameception.core.model.ProjectStatus;
import com.frameception.core.status.StatusReconciler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.frameception.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class DashboardStateStoreTest {

    private DashboardStateStore store;

    @BeforeEach
    void setUp() {
        store = new DashboardStateStore(new StatusReconciler());
    }

    @Nested
    @DisplayName("phase")
    class Phase {

        @Test
        @DisplayName("follows the fetch lifecycle")
        void lifecycle() {
            assertEquals(ViewPhase.IDLE, store.current().phase());

            store.update(s -> s.forProject("p1"));
            assertEquals(ViewPhase.LOADING, store.current().phase());

            store.update(s -> s.withFetchError("connection refused"));
            assertEquals(ViewPhase.ERROR, store.current().phase());

            store.update(s -> s.withProject(project("p1"), List.of()));
            assertEquals(ViewPhase.READY, store.current().phase());
            assertNull(store.current().lastError());
        }

        @Test
        @DisplayName("NOT_FOUND when the backend answers without the project")
        void notFound() {
            store.update(s -> s.forProject("p1"));
            store.update(DashboardState::withProjectMissing);

            assertEquals(ViewPhase.NOT_FOUND, store.current().phase());
        }
    }

    @Test
    @DisplayName("switching project keeps only the user")
    void forProjectResets() {
        store.update(s -> s.withUserContext(USER)
                .forProject("p1")
                .withProject(project("p1"), List.of(entry("a", LogSource.BACKEND, 1)))
                .withDeployment(DeploymentBuildStatus.READY, List.of())
                .withUpdatePrompt("draft")
                .withSubmitting(true));

        DashboardState next = store.update(s -> s.forProject("p2"));

        assertEquals("p2", next.projectId());
        assertNull(next.project());
        assertTrue(next.logs().isEmpty());
        assertNull(next.deploymentStatus());
        assertFalse(next.submitting());
        assertEquals("", next.updatePrompt());
        assertEquals(USER, next.userContext());
    }

    @Test
    @DisplayName("snapshot derives status, pending jobs and conversation from the current state")
    void snapshot() {
        var project = deployedProject("p1", "https://frame.example",
                job("j1", JobType.UPDATE_CODE, JobStatus.PENDING, 5, new JobData("make it blue", null, null)));
        store.update(s -> s.forProject("p1").withProject(project, List.of()));

        DashboardSnapshot snapshot = store.snapshot();

        assertEquals(ViewPhase.READY, snapshot.phase());
        assertEquals(ProjectStatus.BUILDING, snapshot.status());
        assertTrue(snapshot.hasPendingJobs());
        assertEquals(1, snapshot.conversation().size());

        store.update(s -> s.withDeployment(DeploymentBuildStatus.ERROR, s.logs()));
        assertEquals(ProjectState.ERROR, store.snapshot().status().state());
    }

    @Test
    @DisplayName("state copies the logs it is given")
    void defensiveCopy() {
        var logs = new java.util.ArrayList<>(List.of(entry("a", LogSource.BACKEND, 1)));
        DashboardState state = DashboardState.idle(null).forProject("p1").withProject(project("p1"), logs);
        logs.clear();

        assertEquals(1, state.logs().size());
    }
}
