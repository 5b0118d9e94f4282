package com.frameception.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.frameception.client.BackendClient;
import com.frameception.client.BackendRequestException;
import com.frameception.core.config.FrameceptionProperties;
import com.frameception.core.model.UserContext;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: frameception new --prompt ... --description ...
 */
@Command(name = "new", mixinStandardHelpOptions = true, description = "Create a new frame project")
@Component
public class NewProjectCommand implements Callable<Integer> {

    @Option(names = {"--prompt", "-p"}, required = true, description = "What the frame should do")
    private String prompt;

    @Option(names = {"--description"}, required = true, description = "Project description")
    private String description;

    private final BackendClient backendClient;
    private final FrameceptionProperties properties;

    public NewProjectCommand(BackendClient backendClient, FrameceptionProperties properties) {
        this.backendClient = backendClient;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        UserContext user = properties.getUserContext();
        if (user == null) {
            ConsoleOutput.error("No user configured (set frameception.user.fid)");
            return 2;
        }
        try {
            JsonNode created = backendClient.createProject(prompt, description, user);
            String id = created.path("projectId").asText(created.path("id").asText(""));
            ConsoleOutput.success(id.isEmpty() ? "Project requested" : "Project requested: " + id);
            return 0;
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        } catch (BackendRequestException e) {
            ConsoleOutput.error("Project creation failed: " + e.getMessage());
            return 1;
        }
    }
}
