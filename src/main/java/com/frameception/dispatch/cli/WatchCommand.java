package com.frameception.dispatch.cli;

import com.frameception.core.events.EventBus;
import com.frameception.core.model.ProjectStatus;
import com.frameception.core.polling.PollingScheduler;
import com.frameception.core.state.DashboardStateStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * CLI command: frameception watch &lt;project-id&gt;
 * <p>
 * Polls the project and prints dashboard events as they happen, until interrupted or
 * until {@code --duration} elapses.
 */
@Command(name = "watch", mixinStandardHelpOptions = true, description = "Poll a project and print live updates")
@Component
public class WatchCommand implements Runnable {

    @Parameters(index = "0", description = "Project ID")
    private String projectId;

    @Option(names = {"--duration", "-d"},
            description = "Stop after this many seconds; 0 watches until interrupted (default: ${DEFAULT-VALUE})",
            defaultValue = "0")
    private long durationSeconds;

    private final PollingScheduler pollingScheduler;
    private final DashboardStateStore stateStore;
    private final EventBus eventBus;

    public WatchCommand(PollingScheduler pollingScheduler, DashboardStateStore stateStore, EventBus eventBus) {
        this.pollingScheduler = pollingScheduler;
        this.stateStore = stateStore;
        this.eventBus = eventBus;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Watching project " + projectId + " (Ctrl+C to stop)");

        AtomicReference<ProjectStatus> lastStatus = new AtomicReference<>();
        try (EventBus.Subscription ignored = eventBus.subscribe(projectId, event -> {
            ConsoleOutput.watchEvent(event);
            ProjectStatus status = stateStore.snapshot().status();
            if (!status.equals(lastStatus.getAndSet(status))) {
                ConsoleOutput.status(status);
            }
        })) {
            pollingScheduler.activate(projectId).join();
            CountDownLatch forever = new CountDownLatch(1);
            if (durationSeconds > 0) {
                forever.await(durationSeconds, TimeUnit.SECONDS);
            } else {
                forever.await();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Watch interrupted.");
        } finally {
            pollingScheduler.deactivate().join();
        }
    }
}
