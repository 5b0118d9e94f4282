package com.frameception.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Delivers dashboard events to the listeners of the project they belong to.
 * <p>
 * Listeners are the SSE streams and the CLI watch loop, each following exactly one
 * project. Publishing happens on the polling event loop, so listeners must not block.
 * A project's listener set is dropped as soon as its last listener leaves.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, Set<Consumer<DashboardEvent>>> listeners = new ConcurrentHashMap<>();

    public void publish(DashboardEvent event) {
        Set<Consumer<DashboardEvent>> projectListeners = listeners.get(event.projectId());
        if (projectListeners == null) {
            log.trace("No listeners for {} on project {}", event.eventType(), event.projectId());
            return;
        }
        log.debug("Publishing {} to {} listener(s) of project {}",
                event.eventType(), projectListeners.size(), event.projectId());
        for (Consumer<DashboardEvent> listener : projectListeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Listener failed on {} for project {}: {}",
                        event.eventType(), event.projectId(), e.getMessage(), e);
            }
        }
    }

    /**
     * Registers {@code listener} for the events of {@code projectId}.
     *
     * @return handle that removes the listener when closed
     */
    public Subscription subscribe(String projectId, Consumer<DashboardEvent> listener) {
        Objects.requireNonNull(projectId, "projectId");
        Objects.requireNonNull(listener, "listener");
        listeners.compute(projectId, (id, current) -> {
            Set<Consumer<DashboardEvent>> updated = current != null ? current : ConcurrentHashMap.newKeySet();
            updated.add(listener);
            return updated;
        });
        return () -> listeners.computeIfPresent(projectId, (id, current) -> {
            current.remove(listener);
            return current.isEmpty() ? null : current;
        });
    }

    public int listenerCount(String projectId) {
        Set<Consumer<DashboardEvent>> projectListeners = listeners.get(projectId);
        return projectListeners == null ? 0 : projectListeners.size();
    }

    /**
     * Closing twice is harmless.
     */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
