package me.go_gradually.phonedesk.presentation.health.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record HealthResponse(boolean ok,
                             String service,
                             String ts,
                             @JsonProperty("call_log_webhook_configured") boolean callLogWebhookConfigured,
                             @JsonProperty("provider_mode") String providerMode) {
}
