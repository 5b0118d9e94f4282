package com.frameception.core.polling;

import com.frameception.client.BackendClient;
import com.frameception.core.config.FrameceptionProperties;
import com.frameception.core.events.DashboardEvent;
import com.frameception.core.events.EventBus;
import com.frameception.core.logging.MdcContext;
import com.frameception.core.logs.LogAggregator;
import com.frameception.core.metrics.DashboardMetrics;
import com.frameception.core.model.DeploymentStatusReport;
import com.frameception.core.model.LogEntry;
import com.frameception.core.model.Project;
import com.frameception.core.state.DashboardState;
import com.frameception.core.state.DashboardStateStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Keeps the dashboard state of the active project fresh by polling the backend.
 * <p>
 * All state writes happen on a single event-loop thread; blocking backend calls run on a
 * separate I/O pool and their results are posted back onto the loop. Each fetch carries
 * the cycle generation and project id active when it was issued and is dropped on
 * completion if either has changed since, so a slow response for a project the user has
 * already left can never overwrite the new project's state.
 * <p>
 * Ticks do not wait for outstanding fetches; only one repeating cycle exists at a time.
 */
@Service
public class PollingScheduler {

    private static final Logger log = LoggerFactory.getLogger(PollingScheduler.class);

    static final String FALLBACK_FETCH_ERROR = "Failed to load project";

    private final BackendClient backendClient;
    private final DashboardStateStore store;
    private final LogAggregator logAggregator;
    private final EventBus eventBus;
    private final DashboardMetrics metrics;
    private final Clock clock;
    private final long intervalMillis;

    private final ScheduledExecutorService loop = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "dashboard-loop");
        t.setDaemon(true);
        return t;
    });
    private final ExecutorService io;

    // Written on the loop thread only.
    private long generation;
    private volatile ScheduledFuture<?> cycle;

    @Autowired
    public PollingScheduler(BackendClient backendClient,
                            DashboardStateStore store,
                            LogAggregator logAggregator,
                            EventBus eventBus,
                            DashboardMetrics metrics,
                            FrameceptionProperties properties) {
        this(backendClient, store, logAggregator, eventBus, metrics,
                properties.getPollIntervalMillis(), properties.getIoThreads(), Clock.systemUTC());
    }

    PollingScheduler(BackendClient backendClient,
                     DashboardStateStore store,
                     LogAggregator logAggregator,
                     EventBus eventBus,
                     DashboardMetrics metrics,
                     long intervalMillis,
                     int ioThreads,
                     Clock clock) {
        this.backendClient = backendClient;
        this.store = store;
        this.logAggregator = logAggregator;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.intervalMillis = intervalMillis;
        this.clock = clock;
        AtomicInteger ioCounter = new AtomicInteger();
        this.io = Executors.newFixedThreadPool(Math.max(1, ioThreads), r -> {
            Thread t = new Thread(r, "dashboard-io-" + ioCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts polling {@code projectId}, cancelling any cycle that was running before.
     * Performs one project fetch immediately, then polls every interval.
     *
     * @return completes once the initial fetch has been applied or recorded as a failure
     */
    public CompletableFuture<Void> activate(String projectId) {
        Objects.requireNonNull(projectId, "projectId");
        return onLoop(() -> {
            cancelCycle();
            long gen = ++generation;
            store.update(state -> state.forProject(projectId));
            log.info("Polling project {} every {}ms (cycle {})", projectId, intervalMillis, gen);

            CompletableFuture<Void> initial = fetchProject(gen, projectId);
            cycle = loop.scheduleAtFixedRate(() -> tick(gen, projectId),
                    intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
            return initial;
        }).thenCompose(initial -> initial);
    }

    /**
     * Stops polling and forgets the cached project. In-flight fetches are discarded when they land.
     */
    public CompletableFuture<Void> deactivate() {
        return onLoop(() -> {
            String previous = store.current().projectId();
            cancelCycle();
            generation++;
            store.update(state -> DashboardState.idle(state.userContext()));
            if (previous != null) {
                log.info("Stopped polling project {}", previous);
            }
            return null;
        });
    }

    /**
     * Fetches the active project once, outside the regular cadence.
     *
     * @return completes once the fetch has been applied, immediately when no project is active
     */
    public CompletableFuture<Void> refreshNow() {
        return onLoop(() -> {
            String projectId = store.current().projectId();
            if (projectId == null) {
                return CompletableFuture.<Void>completedFuture(null);
            }
            log.debug("Out-of-band refresh of project {}", projectId);
            return fetchProject(generation, projectId);
        }).thenCompose(fetch -> fetch);
    }

    /**
     * Fetches the deployment status of the active project once, outside the regular cadence.
     * A changed status is recorded exactly as a tick would record it.
     *
     * @return completes once the result has been applied, immediately when the active project
     *         has no deployment binding
     */
    public CompletableFuture<Void> refreshDeploymentStatus() {
        return onLoop(() -> {
            DashboardState state = store.current();
            if (state.project() == null || !state.project().hasDeploymentBinding()) {
                return CompletableFuture.<Void>completedFuture(null);
            }
            log.debug("Out-of-band deployment status refresh of project {}", state.projectId());
            return fetchDeploymentStatus(generation, state.projectId());
        }).thenCompose(fetch -> fetch);
    }

    /**
     * Polling cycle of the active project; changes on every activate and deactivate.
     * Read on the event loop only.
     */
    public long currentGeneration() {
        return generation;
    }

    /**
     * Runs {@code work} on the event loop. Every state write goes through here.
     */
    public <T> CompletableFuture<T> onLoop(Supplier<T> work) {
        return CompletableFuture.supplyAsync(work, loop);
    }

    /** Executor of the event loop, for continuations that write state. */
    public Executor eventLoop() {
        return loop;
    }

    /** Executor for blocking backend calls. */
    public Executor ioExecutor() {
        return io;
    }

    public boolean isPolling() {
        ScheduledFuture<?> current = cycle;
        return current != null && !current.isCancelled();
    }

    @PreDestroy
    public void shutdown() {
        loop.shutdown();
        io.shutdownNow();
        try {
            if (!loop.awaitTermination(5, TimeUnit.SECONDS)) {
                loop.shutdownNow();
            }
        } catch (InterruptedException e) {
            loop.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Polling scheduler stopped");
    }

    private void tick(long gen, String projectId) {
        if (gen != generation) {
            return;
        }
        metrics.recordPollTick();
        fetchProject(gen, projectId);
        Project cached = store.current().project();
        if (cached != null && cached.hasDeploymentBinding()) {
            fetchDeploymentStatus(gen, projectId);
        }
    }

    private CompletableFuture<Void> fetchProject(long gen, String projectId) {
        long started = System.nanoTime();
        return CompletableFuture.supplyAsync(() -> backendClient.fetchProject(projectId), io)
                .handleAsync((result, error) -> {
                    applyProject(gen, projectId, result, error, elapsedMs(started));
                    return (Void) null;
                }, loop);
    }

    private CompletableFuture<Void> fetchDeploymentStatus(long gen, String projectId) {
        long started = System.nanoTime();
        return CompletableFuture.supplyAsync(() -> backendClient.fetchDeploymentStatus(projectId), io)
                .handleAsync((report, error) -> {
                    applyDeploymentStatus(gen, projectId, report, error, elapsedMs(started));
                    return (Void) null;
                }, loop);
    }

    private void applyProject(long gen, String projectId, Optional<Project> result,
                              Throwable error, long ms) {
        if (!isCurrent(gen, projectId)) {
            log.debug("Discarding stale project fetch for {} (cycle {})", projectId, gen);
            metrics.recordStaleResult("project");
            return;
        }
        MdcContext.setProject(projectId);
        try {
            metrics.recordFetch("project", error == null, ms);
            if (error != null) {
                String message = describe(error);
                log.warn("Project fetch failed for {}: {}", projectId, message);
                store.update(state -> state.withFetchError(message));
                publish(DashboardEvent.PROJECT_FETCH_FAILED, projectId, Map.of("error", message));
            } else if (result == null || result.isEmpty()) {
                log.info("Project {} not found", projectId);
                store.update(DashboardState::withProjectMissing);
            } else {
                Project project = result.get();
                store.update(state -> state.withProject(project,
                        logAggregator.mergeLogs(state.logs(), logAggregator.jobLogs(project))));
                log.debug("Applied project {} ({} jobs, {} log entries)",
                        projectId, project.jobs().size(), store.current().logs().size());
            }
            publish(DashboardEvent.DASHBOARD_UPDATED, projectId, Map.of("phase", store.current().phase().name()));
        } finally {
            MdcContext.clear();
        }
    }

    private void applyDeploymentStatus(long gen, String projectId, DeploymentStatusReport report,
                                       Throwable error, long ms) {
        if (!isCurrent(gen, projectId)) {
            log.debug("Discarding stale deployment status for {} (cycle {})", projectId, gen);
            metrics.recordStaleResult("deployment");
            return;
        }
        MdcContext.setProject(projectId);
        try {
            metrics.recordFetch("deployment", error == null, ms);
            if (error != null) {
                log.warn("Deployment status fetch failed for {}: {}", projectId, describe(error));
                return;
            }
            if (report.status() == store.current().deploymentStatus()) {
                return;
            }

            var previous = store.current().deploymentStatus();
            LogEntry entry = logAggregator.statusChangeEntry(report, clock.instant());
            store.update(state -> state.withDeployment(report.status(), logAggregator.prepend(entry, state.logs())));
            metrics.recordDeploymentTransition(report.status().name());
            log.info("Deployment status of {} changed: {} -> {}", projectId, previous, report.status());

            publish(DashboardEvent.DEPLOYMENT_STATUS_CHANGED, projectId, Map.of(
                    "from", previous != null ? previous.name() : "NONE",
                    "to", report.status().name()));
            publish(DashboardEvent.DASHBOARD_UPDATED, projectId, Map.of("phase", store.current().phase().name()));
        } finally {
            MdcContext.clear();
        }
    }

    private boolean isCurrent(long gen, String projectId) {
        return gen == generation && projectId.equals(store.current().projectId());
    }

    private void cancelCycle() {
        if (cycle != null) {
            cycle.cancel(false);
            cycle = null;
        }
    }

    private void publish(String type, String projectId, Map<String, Object> payload) {
        eventBus.publish(new DashboardEvent(type, projectId, payload, clock.instant()));
    }

    private static String describe(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : FALLBACK_FETCH_ERROR;
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
