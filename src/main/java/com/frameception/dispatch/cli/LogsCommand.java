package com.frameception.dispatch.cli;

import com.frameception.core.logs.BuildLogView;
import com.frameception.core.logs.LogAggregator;
import com.frameception.core.model.LogEntry;
import com.frameception.core.polling.PollingScheduler;
import com.frameception.core.state.DashboardState;
import com.frameception.core.state.DashboardStateStore;
import com.frameception.core.state.ViewPhase;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.Optional;

/**
 * CLI command: frameception logs &lt;project-id&gt; [--all]
 * <p>
 * Prints the activity timeline, newest first, followed by the lines of the latest build report.
 */
@Command(name = "logs", mixinStandardHelpOptions = true, description = "Show activity timeline and build logs")
@Component
public class LogsCommand implements Runnable {

    @Parameters(index = "0", description = "Project ID")
    private String projectId;

    @Option(names = {"--all", "-a"}, description = "Show every build-log line, not only errors")
    private boolean showAll;

    private final PollingScheduler pollingScheduler;
    private final DashboardStateStore stateStore;
    private final LogAggregator logAggregator;

    public LogsCommand(PollingScheduler pollingScheduler, DashboardStateStore stateStore,
                       LogAggregator logAggregator) {
        this.pollingScheduler = pollingScheduler;
        this.stateStore = stateStore;
        this.logAggregator = logAggregator;
    }

    @Override
    public void run() {
        pollingScheduler.activate(projectId).join();
        DashboardState state = stateStore.current();
        pollingScheduler.deactivate().join();

        if (state.phase() != ViewPhase.READY) {
            ConsoleOutput.error(state.phase() == ViewPhase.NOT_FOUND
                    ? "Project not found: " + projectId
                    : "Failed to load project: " + state.lastError());
            return;
        }

        if (state.logs().isEmpty()) {
            ConsoleOutput.info("No activity yet");
        }
        state.logs().forEach(ConsoleOutput::logEntry);

        Optional<LogEntry> report = logAggregator.latestBuildReport(state.logs());
        if (report.isPresent()) {
            System.out.println();
            ConsoleOutput.info("Build logs" + (showAll ? "" : " (errors only, use --all for everything)"));
            BuildLogView.filter(report.get().buildLines(), showAll).forEach(ConsoleOutput::buildLine);
        }
    }
}
