package com.frameception.dispatch.cli;

import com.frameception.core.dispatch.ActionDispatcher;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: frameception deploy &lt;project-id&gt;
 */
@Command(name = "deploy", mixinStandardHelpOptions = true, description = "Deploy a project")
@Component
public class DeployCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Project ID")
    private String projectId;

    private final ProjectActionRunner runner;

    public DeployCommand(ProjectActionRunner runner) {
        this.runner = runner;
    }

    @Override
    public Integer call() {
        return runner.run(projectId, "Deploy", ActionDispatcher::deploy);
    }
}
