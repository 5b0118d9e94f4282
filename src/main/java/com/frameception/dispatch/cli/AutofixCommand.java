package com.frameception.dispatch.cli;

import com.frameception.core.dispatch.ActionDispatcher;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: frameception autofix &lt;project-id&gt;
 * <p>
 * Sends the error lines of the latest failed build back as a code update. The deployment
 * status is loaded first so errors reported by the deployment platform are included.
 */
@Command(name = "autofix", mixinStandardHelpOptions = true, description = "Ask for the last build errors to be fixed")
@Component
public class AutofixCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Project ID")
    private String projectId;

    private final ProjectActionRunner runner;

    public AutofixCommand(ProjectActionRunner runner) {
        this.runner = runner;
    }

    @Override
    public Integer call() {
        return runner.run(projectId, "Autofix", true, ActionDispatcher::autofix);
    }
}
