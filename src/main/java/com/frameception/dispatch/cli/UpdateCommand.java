package com.frameception.dispatch.cli;

import com.frameception.core.dispatch.ActionDispatcher;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: frameception update &lt;project-id&gt; &lt;prompt&gt;
 */
@Command(name = "update", mixinStandardHelpOptions = true, description = "Ask for a code change")
@Component
public class UpdateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Project ID")
    private String projectId;

    @Parameters(index = "1", description = "What to change")
    private String prompt;

    private final ProjectActionRunner runner;

    public UpdateCommand(ProjectActionRunner runner) {
        this.runner = runner;
    }

    @Override
    public Integer call() {
        return runner.run(projectId, "Update", dispatcher -> dispatcher.setUpdatePrompt(prompt)
                .thenCompose(ignored -> dispatcher.submitUpdate()));
    }
}
