package com.frameception.dispatch.api;

import com.frameception.core.notifications.InMemoryNotificationPreferenceStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(NotificationController.class)
@Import(InMemoryNotificationPreferenceStore.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class NotificationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("PUT, GET and DELETE round through the store")
    void lifecycle() throws Exception {
        mockMvc.perform(get("/api/v1/users/7/notifications"))
                .andExpect(status().isNotFound());

        mockMvc.perform(put("/api/v1/users/7/notifications")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"https://client.example/notify\",\"token\":\"tok\"}"))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/v1/users/7/notifications"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.url").value("https://client.example/notify"))
                .andExpect(jsonPath("$.token").value("tok"));

        mockMvc.perform(delete("/api/v1/users/7/notifications"))
                .andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/v1/users/7/notifications"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("PUT without token is rejected")
    void missingToken() throws Exception {
        mockMvc.perform(put("/api/v1/users/7/notifications")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"https://client.example/notify\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Notification url and token are required"));
    }
}
