package me.go_gradually.phonedesk.presentation.health.controller;

import me.go_gradually.phonedesk.application.shared.policy.ServiceStatusPolicy;
import me.go_gradually.phonedesk.presentation.TestBootApplication;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = {TestBootApplication.class, HealthController.class})
@AutoConfigureMockMvc
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ServiceStatusPolicy statusPolicy;

    @MockBean
    private Clock clock;

    @Test
    void health_reportsServiceNameTimestampAndWebhookFlag() throws Exception {
        when(statusPolicy.serviceName()).thenReturn("phonedesk");
        when(statusPolicy.providerMode()).thenReturn("openai-realtime");
        when(statusPolicy.notificationConfigured()).thenReturn(true);
        when(clock.instant()).thenReturn(Instant.parse("2026-03-01T10:15:30Z"));

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.service").value("phonedesk"))
                .andExpect(jsonPath("$.ts").value("2026-03-01T10:15:30Z"))
                .andExpect(jsonPath("$.call_log_webhook_configured").value(true))
                .andExpect(jsonPath("$.provider_mode").value("openai-realtime"));
    }

    @Test
    void health_reportsUnconfiguredWebhook() throws Exception {
        when(statusPolicy.serviceName()).thenReturn("phonedesk");
        when(statusPolicy.providerMode()).thenReturn("openai-realtime");
        when(statusPolicy.notificationConfigured()).thenReturn(false);
        when(clock.instant()).thenReturn(Instant.parse("2026-03-01T10:15:30Z"));

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.call_log_webhook_configured").value(false));
    }
}
