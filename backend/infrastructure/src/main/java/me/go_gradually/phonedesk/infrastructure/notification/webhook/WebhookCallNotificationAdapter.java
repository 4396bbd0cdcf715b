package me.go_gradually.phonedesk.infrastructure.notification.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.phonedesk.application.call.model.CallNotification;
import me.go_gradually.phonedesk.application.call.model.CallReport;
import me.go_gradually.phonedesk.application.call.port.CallNotificationPort;
import me.go_gradually.phonedesk.domain.gate.GateSnapshot;
import me.go_gradually.phonedesk.infrastructure.shared.config.AppProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

@Component
public class WebhookCallNotificationAdapter implements CallNotificationPort {
    private static final Logger log = Logger.getLogger(WebhookCallNotificationAdapter.class.getName());

    private final WebClient webClient;
    private final AppProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public WebhookCallNotificationAdapter(@Qualifier("webhookWebClient") WebClient webClient, AppProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    @Override
    public boolean send(CallNotification notification) {
        String category = notification.category();
        String url = resolveUrl(category);
        if (url == null) {
            log.warning(() -> "call.notification skipped reason=no_url category=" + category
                    + " callSid=" + notification.report().callSid());
            return false;
        }
        try {
            String body = objectMapper.writeValueAsString(payload(notification));
            webClient.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .toBodilessEntity()
                    .block(Duration.ofMillis(properties.getNotification().getTimeoutMs()));
            return true;
        } catch (Exception e) {
            log.log(Level.WARNING, e, () -> "call.notification post_failed category=" + category
                    + " callSid=" + notification.report().callSid());
            return false;
        }
    }

    String resolveUrl(String category) {
        Map<String, String> urls = properties.getNotification().getUrls();
        if (urls != null) {
            for (Map.Entry<String, String> entry : urls.entrySet()) {
                if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(category) && !isBlank(entry.getValue())) {
                    return entry.getValue().trim();
                }
            }
        }
        String fallback = properties.getNotification().getDefaultUrl();
        return isBlank(fallback) ? null : fallback.trim();
    }

    Map<String, Object> payload(CallNotification notification) {
        CallReport report = notification.report();
        GateSnapshot gates = report.gates();
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("category", notification.category().toLowerCase(Locale.ROOT));
        root.put("reason", report.decision().reason().name().toLowerCase(Locale.ROOT));
        root.put("trigger", report.trigger() == null ? null : report.trigger().name().toLowerCase(Locale.ROOT));
        root.put("call_sid", report.callSid());
        root.put("stream_sid", report.streamSid());
        root.put("caller", report.caller());
        root.put("called", report.called());
        root.put("started_at", report.startedAt() == null ? null : report.startedAt().toString());
        root.put("ended_at", report.endedAt() == null ? null : report.endedAt().toString());
        root.put("duration_seconds", report.durationSeconds());
        root.put("name", gates.name());
        root.put("name_from_memory", gates.nameFromMemory());
        root.put("message", gates.message());
        root.put("callback_requested", gates.callbackRequested());
        root.put("callback_number", gates.callbackNumber());
        root.put("callback_source", gates.callbackSource() == null
                ? null
                : gates.callbackSource().name().toLowerCase(Locale.ROOT));
        root.put("closing_forced", gates.closingForced());
        root.put("info_requested", gates.infoRequested());
        root.put("info_provided", gates.infoProvided());
        root.put("info_topics", gates.infoTopicTags());
        root.put("info_answer", gates.infoAnswer());
        root.put("media_frames", report.mediaFrames());
        root.put("provider_mode", report.providerMode());
        root.put("custom_parameters", report.customParameters());
        root.put("recording_url", notification.recordingUrl());
        root.put("recording_status", notification.recordingStatus());
        return root;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
