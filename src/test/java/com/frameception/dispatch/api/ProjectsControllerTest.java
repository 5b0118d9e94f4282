package com.frameception.dispatch.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.frameception.client.BackendClient;
import com.frameception.client.BackendRequestException;
import com.frameception.core.config.FrameceptionProperties;
import com.frameception.core.model.JobStatus;
import com.frameception.core.model.JobType;
import com.frameception.core.status.StatusReconciler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static com.frameception.Fixtures.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ProjectsController.class)
@Import(StatusReconciler.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class ProjectsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private BackendClient backendClient;

    @MockitoBean
    private FrameceptionProperties properties;

    @Test
    @DisplayName("GET /projects lists projects with derived status")
    void listProjects() throws Exception {
        when(backendClient.listProjects()).thenReturn(List.of(
                deployedProject("p1", "https://one.example"),
                project("p2", job("j1", JobType.SETUP_PROJECT, JobStatus.RUNNING, 5))));

        mockMvc.perform(get("/api/v1/projects"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("p1"))
                .andExpect(jsonPath("$[0].status.state").value("deployed"))
                .andExpect(jsonPath("$[1].status.state").value("building"));
    }

    @Test
    @DisplayName("GET /projects maps backend failures to 502")
    void listProjectsFailure() throws Exception {
        when(backendClient.listProjects()).thenThrow(new BackendRequestException("connection refused"));

        mockMvc.perform(get("/api/v1/projects"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("connection refused"));
    }

    @Test
    @DisplayName("POST /projects creates a project for the given user")
    void createProject() throws Exception {
        when(backendClient.createProject(eq("a poll frame"), eq("Polls for my channel"), eq(USER)))
                .thenReturn(JsonNodeFactory.instance.objectNode().put("projectId", "p9"));

        mockMvc.perform(post("/api/v1/projects")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new CreateProjectRequest("a poll frame", "Polls for my channel", USER))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.projectId").value("p9"));
    }

    @Test
    @DisplayName("POST /projects without any user is rejected before calling the backend")
    void createProjectWithoutUser() throws Exception {
        when(properties.getUserContext()).thenReturn(null);

        mockMvc.perform(post("/api/v1/projects")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\":\"a\",\"description\":\"b\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(ProjectsController.MISSING_FIELDS));

        verify(backendClient, never()).createProject(anyString(), anyString(), any());
    }

    @Test
    @DisplayName("POST /projects passes validation errors through as 400")
    void createProjectValidation() throws Exception {
        when(backendClient.createProject(any(), any(), any()))
                .thenThrow(new IllegalArgumentException(ProjectsController.MISSING_FIELDS));

        mockMvc.perform(post("/api/v1/projects")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new CreateProjectRequest("", "", USER))))
                .andExpect(status().isBadRequest());
    }
}
