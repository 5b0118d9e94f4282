package com.frameception.dispatch.api;

import com.frameception.core.dispatch.ActionDispatcher;
import com.frameception.core.dispatch.DispatchResult;
import com.frameception.core.logs.AnnotatedBuildLogLine;
import com.frameception.core.logs.BuildLogView;
import com.frameception.core.logs.LogAggregator;
import com.frameception.core.model.LogEntry;
import com.frameception.core.model.UserContext;
import com.frameception.core.polling.PollingScheduler;
import com.frameception.core.state.DashboardSnapshot;
import com.frameception.core.state.DashboardState;
import com.frameception.core.state.DashboardStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * REST controller for the dashboard of the active project.
 */
@RestController
@RequestMapping("/api/v1/dashboard")
public class DashboardController {

    private static final Logger log = LoggerFactory.getLogger(DashboardController.class);

    private final PollingScheduler pollingScheduler;
    private final ActionDispatcher actionDispatcher;
    private final DashboardStateStore stateStore;
    private final LogAggregator logAggregator;
    private final SseStreamingService sseStreamingService;

    public DashboardController(PollingScheduler pollingScheduler,
                               ActionDispatcher actionDispatcher,
                               DashboardStateStore stateStore,
                               LogAggregator logAggregator,
                               SseStreamingService sseStreamingService) {
        this.pollingScheduler = pollingScheduler;
        this.actionDispatcher = actionDispatcher;
        this.stateStore = stateStore;
        this.logAggregator = logAggregator;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * GET /api/v1/dashboard — Current snapshot.
     */
    @GetMapping
    public ResponseEntity<DashboardSnapshot> getSnapshot() {
        return ResponseEntity.ok(stateStore.snapshot());
    }

    /**
     * PUT /api/v1/dashboard/project/{id} — Start watching a project. Answers once the first fetch has landed.
     */
    @PutMapping("/project/{id}")
    public ResponseEntity<DashboardSnapshot> activate(@PathVariable String id) {
        if (id.isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        log.info("Activating project {}", id);
        pollingScheduler.activate(id).join();
        return ResponseEntity.ok(stateStore.snapshot());
    }

    /**
     * DELETE /api/v1/dashboard/project — Stop watching.
     */
    @DeleteMapping("/project")
    public ResponseEntity<Void> deactivate() {
        pollingScheduler.deactivate().join();
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/prompt")
    public ResponseEntity<Map<String, String>> setPrompt(@RequestBody PromptRequest request) {
        if (request.prompt() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "Prompt is required"));
        }
        actionDispatcher.setUpdatePrompt(request.prompt()).join();
        return ResponseEntity.ok(Map.of("prompt", request.prompt()));
    }

    @PutMapping("/user")
    public ResponseEntity<Object> setUser(@RequestBody UserContext user) {
        if (user == null || !user.hasIdentity()) {
            return ResponseEntity.badRequest().body(Map.of("error", "User fid is required"));
        }
        actionDispatcher.setUserContext(user).join();
        return ResponseEntity.ok(user);
    }

    /**
     * POST /api/v1/dashboard/actions/{action} — Submit update, deploy or autofix.
     * 202 when the backend accepted it, 409 when refused, 502 when the backend call failed.
     */
    @PostMapping("/actions/{action}")
    public ResponseEntity<Map<String, String>> dispatch(@PathVariable String action) {
        CompletableFuture<DispatchResult> pending;
        switch (action) {
            case "update" -> pending = actionDispatcher.submitUpdate();
            case "deploy" -> pending = actionDispatcher.deploy();
            case "autofix" -> pending = actionDispatcher.autofix();
            default -> {
                return ResponseEntity.badRequest().body(Map.of("error", "Unknown action: " + action));
            }
        }

        DispatchResult result = pending.join();
        HttpStatus status = switch (result) {
            case SUBMITTED -> HttpStatus.ACCEPTED;
            case REFUSED -> HttpStatus.CONFLICT;
            case FAILED -> HttpStatus.BAD_GATEWAY;
        };
        return ResponseEntity.status(status).body(Map.of("action", action, "result", result.name()));
    }

    /**
     * GET /api/v1/dashboard/build-logs — Lines of the latest build report, error lines only unless showAll.
     */
    @GetMapping("/build-logs")
    public ResponseEntity<Map<String, Object>> getBuildLogs(
            @RequestParam(name = "showAll", defaultValue = "false") boolean showAll) {
        DashboardState state = stateStore.current();
        if (state.projectId() == null) {
            return ResponseEntity.notFound().build();
        }

        Optional<LogEntry> report = logAggregator.latestBuildReport(state.logs());
        List<AnnotatedBuildLogLine> lines = report
                .map(entry -> BuildLogView.filter(entry.buildLines(), showAll).toList())
                .orElse(List.of());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("entry_id", report.map(LogEntry::id).orElse(null));
        body.put("status", report.map(entry -> entry.data().status()).orElse(null));
        body.put("show_all", showAll);
        body.put("lines", lines);
        body.put("error_text", BuildLogView.errorText(state.logs()));
        return ResponseEntity.ok(body);
    }

    /**
     * GET /api/v1/dashboard/events — SSE stream of the active project's events.
     */
    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamEvents() {
        String projectId = stateStore.current().projectId();
        if (projectId == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(sseStreamingService.createEmitter(projectId));
    }
}
