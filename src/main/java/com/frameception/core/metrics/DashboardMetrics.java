package com.frameception.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for polling and user actions.
 */
@Service
public class DashboardMetrics {

    private final MeterRegistry registry;

    public DashboardMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPollTick() {
        Counter.builder("frameception.poll.ticks")
                .register(registry)
                .increment();
    }

    /**
     * Records the outcome of a backend fetch.
     *
     * @param kind    "project" or "deployment"
     * @param success whether the fetch succeeded
     * @param ms      round-trip time
     */
    public void recordFetch(String kind, boolean success, long ms) {
        Timer.builder("frameception.fetch.duration")
                .tag("kind", kind)
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records a fetch result that arrived after its polling cycle was replaced and was dropped.
     */
    public void recordStaleResult(String kind) {
        Counter.builder("frameception.fetch.stale_discarded")
                .description("Fetch results discarded because the active project changed")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordDeploymentTransition(String status) {
        Counter.builder("frameception.deployment.transitions")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * @param action "update", "deploy" or "autofix"
     * @param result dispatch result name
     */
    public void recordDispatch(String action, String result) {
        Counter.builder("frameception.dispatch.total")
                .tag("action", action)
                .tag("result", result)
                .register(registry)
                .increment();
    }
}
