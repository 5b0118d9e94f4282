package com.frameception.dispatch.api;

import com.frameception.core.events.DashboardEvent;
import com.frameception.core.events.EventBus;
import com.frameception.core.state.DashboardSnapshot;
import com.frameception.core.state.DashboardStateStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Streams the dashboard of the active project to browsers.
 * <p>
 * A client first receives the current snapshot as a {@value #SNAPSHOT_EVENT} event, then a
 * fresh snapshot on every dashboard update. Deployment transitions, fetch failures and
 * action results are forwarded under their own event names so the page can toast them.
 * Events of a project that is no longer active are not turned into snapshots.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    static final String SNAPSHOT_EVENT = "snapshot";

    private static final long DEFAULT_TIMEOUT_MS = TimeUnit.MINUTES.toMillis(30);
    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBus eventBus;
    private final DashboardStateStore stateStore;
    private final long timeoutMs;

    private final Set<ProjectStream> streams = ConcurrentHashMap.newKeySet();

    private final ScheduledExecutorService heartbeat = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus, DashboardStateStore stateStore) {
        this(eventBus, stateStore, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, DashboardStateStore stateStore, long timeoutMs) {
        this.eventBus = eventBus;
        this.stateStore = stateStore;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeat.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeat.shutdownNow();
        streams.forEach(stream -> stream.emitter.complete());
        streams.clear();
    }

    /**
     * Opens a stream for {@code projectId}, starting with its current snapshot.
     */
    public SseEmitter createEmitter(String projectId) {
        ProjectStream stream = new ProjectStream(projectId, new SseEmitter(timeoutMs));
        streams.add(stream);
        stream.subscription = eventBus.subscribe(projectId, event -> toSseEvent(event).ifPresent(stream::send));

        stream.emitter.onCompletion(() -> close(stream, "completed"));
        stream.emitter.onTimeout(() -> close(stream, "timed out"));
        stream.emitter.onError(e -> close(stream, "failed: " + e.getMessage()));

        currentSnapshot(projectId).ifPresent(snapshot ->
                stream.send(SseEmitter.event().name(SNAPSHOT_EVENT).data(snapshot)));
        log.info("Dashboard stream opened for project {} ({} open)", projectId, streams.size());
        return stream.emitter;
    }

    public int activeEmitterCount() {
        return streams.size();
    }

    /**
     * Maps a dashboard event to the SSE event sent to the browser. Updates of a project that is
     * no longer active map to nothing.
     */
    Optional<SseEmitter.SseEventBuilder> toSseEvent(DashboardEvent event) {
        if (DashboardEvent.DASHBOARD_UPDATED.equals(event.eventType())) {
            return currentSnapshot(event.projectId())
                    .map(snapshot -> SseEmitter.event().name(SNAPSHOT_EVENT).data(snapshot));
        }
        Map<String, Object> data = new LinkedHashMap<>(event.payload());
        data.put("timestamp", event.timestamp().toString());
        return Optional.of(SseEmitter.event().name(event.eventType()).data(data));
    }

    void sendHeartbeats() {
        for (ProjectStream stream : streams) {
            stream.send(SseEmitter.event().comment("heartbeat"));
        }
    }

    private Optional<DashboardSnapshot> currentSnapshot(String projectId) {
        DashboardSnapshot snapshot = stateStore.snapshot();
        return projectId.equals(snapshot.projectId()) ? Optional.of(snapshot) : Optional.empty();
    }

    private void close(ProjectStream stream, String reason) {
        if (streams.remove(stream)) {
            if (stream.subscription != null) {
                stream.subscription.close();
            }
            log.debug("Dashboard stream for project {} {}", stream.projectId, reason);
        }
    }

    private final class ProjectStream {
        private final String projectId;
        private final SseEmitter emitter;
        private volatile EventBus.Subscription subscription;

        ProjectStream(String projectId, SseEmitter emitter) {
            this.projectId = projectId;
            this.emitter = emitter;
        }

        void send(SseEmitter.SseEventBuilder event) {
            try {
                emitter.send(event);
            } catch (IOException | IllegalStateException e) {
                // The emitter callbacks remove the stream.
                log.debug("Send to project {} stream failed: {}", projectId, e.getMessage());
            }
        }
    }
}
