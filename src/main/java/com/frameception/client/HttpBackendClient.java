package com.frameception.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.frameception.core.config.FrameceptionProperties;
import com.frameception.core.model.DeploymentStatusReport;
import com.frameception.core.model.Project;
import com.frameception.core.model.UserContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * HTTP client for the dashboard backend API.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /api/projects?id=} returns {@code {"projects": [...]}}</li>
 *   <li>{@code GET /api/vercel-status/{id}} returns {@code {"status": ..., "logs": [...]}}</li>
 *   <li>{@code POST /api/update-code}, {@code POST /api/deploy-project},
 *       {@code POST /api/new-frame-project}</li>
 * </ul>
 */
public class HttpBackendClient implements BackendClient {

    private static final Logger log = LoggerFactory.getLogger(HttpBackendClient.class);

    private final String baseUrl;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpBackendClient(FrameceptionProperties properties) {
        this.baseUrl = stripTrailingSlash(properties.getBaseUrl());
        this.requestTimeout = Duration.ofSeconds(properties.getRequestTimeoutSeconds());
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
                .build();
        this.objectMapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }

    @Override
    public Optional<Project> fetchProject(String projectId) {
        var response = get("/api/projects?id=" + encode(projectId));
        var projects = response.get("projects");
        if (projects == null || !projects.isArray() || projects.isEmpty()) {
            log.debug("Backend returned no project for id {}", projectId);
            return Optional.empty();
        }
        return Optional.of(read(projects.get(0), Project.class));
    }

    @Override
    public List<Project> listProjects() {
        var response = get("/api/projects");
        var projects = response.get("projects");
        var result = new ArrayList<Project>();
        if (projects != null && projects.isArray()) {
            for (JsonNode node : projects) {
                result.add(read(node, Project.class));
            }
        }
        return result;
    }

    @Override
    public DeploymentStatusReport fetchDeploymentStatus(String projectId) {
        var response = get("/api/vercel-status/" + encode(projectId));
        return read(response, DeploymentStatusReport.class);
    }

    @Override
    public void submitUpdate(String projectId, String prompt, UserContext userContext) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("projectId", projectId);
        body.put("prompt", prompt);
        body.set("userContext", objectMapper.valueToTree(userContext));

        post("/api/update-code", body);
        log.info("Submitted code update for project {} ({} chars)", projectId, prompt.length());
    }

    @Override
    public void deploy(String projectId, UserContext userContext) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("projectId", projectId);
        body.set("userContext", objectMapper.valueToTree(userContext));

        post("/api/deploy-project", body);
        log.info("Requested deployment for project {}", projectId);
    }

    @Override
    public JsonNode createProject(String prompt, String description, UserContext userContext) {
        if (prompt == null || prompt.isBlank() || description == null || description.isBlank()
                || userContext == null) {
            throw new IllegalArgumentException("Project name, description and userContext are required");
        }
        ObjectNode body = objectMapper.createObjectNode();
        body.put("prompt", prompt);
        body.put("description", description);
        body.set("userContext", objectMapper.valueToTree(userContext));

        var response = post("/api/new-frame-project", body);
        log.info("Requested new project '{}'", prompt);
        return response;
    }

    JsonNode get(String path) {
        var request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        return send(request, "GET " + path);
    }

    JsonNode post(String path, JsonNode body) {
        var request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
                .build();
        return send(request, "POST " + path);
    }

    private JsonNode send(HttpRequest request, String description) {
        try {
            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                throw new BackendRequestException("Backend %s failed (HTTP %d): %s"
                        .formatted(description, response.statusCode(), errorMessage(response.body())));
            }
            var body = response.body();
            if (body == null || body.isBlank()) {
                return objectMapper.createObjectNode();
            }
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new BackendRequestException("Unreadable backend response: " + description, e);
        } catch (IOException e) {
            throw new BackendRequestException("Backend request failed: " + description, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendRequestException("Backend request interrupted: " + description, e);
        }
    }

    <T> T read(JsonNode node, Class<T> type) {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new BackendRequestException("Cannot read " + type.getSimpleName() + " from backend response", e);
        }
    }

    ObjectMapper objectMapper() {
        return objectMapper;
    }

    /** Prefers the {@code error} field of a JSON error body. */
    private String errorMessage(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        try {
            var json = objectMapper.readTree(body);
            if (json.has("error")) {
                return json.get("error").asText();
            }
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: {}", e.getMessage());
        }
        return body;
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) return "";
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
