package me.go_gradually.phonedesk.infrastructure.recording.twilio;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.phonedesk.application.call.port.RecordingResolverPort;
import me.go_gradually.phonedesk.infrastructure.shared.config.AppProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

@Component
public class TwilioRecordingResolverAdapter implements RecordingResolverPort {
    private static final Logger log = Logger.getLogger(TwilioRecordingResolverAdapter.class.getName());
    private static final String RECORDINGS_PATH = "/2010-04-01/Accounts/{accountSid}/Recordings.json";

    private final WebClient webClient;
    private final AppProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public TwilioRecordingResolverAdapter(@Qualifier("twilioWebClient") WebClient webClient, AppProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    @Override
    public Optional<String> resolve(String callSid, Duration budget) {
        AppProperties.Twilio twilio = properties.getIntegrations().getTwilio();
        if (isBlank(callSid) || isBlank(twilio.getAccountSid()) || isBlank(twilio.getAuthToken())) {
            return Optional.empty();
        }
        AppProperties.Recording recording = properties.getRecording();
        long deadline = System.nanoTime() + Math.max(0L, budget == null ? 0L : budget.toNanos());
        long delayMs = Math.max(1L, recording.getInitialRetryDelayMs());
        int attempt = 0;
        while (true) {
            long remainingMs = remainingMillis(deadline);
            if (remainingMs <= 0) {
                int attempts = attempt;
                log.info(() -> "call.recording.missing callSid=" + callSid + " attempts=" + attempts);
                return Optional.empty();
            }
            attempt++;
            Optional<String> found = fetchOnce(twilio, callSid, attempt, Duration.ofMillis(remainingMs));
            if (found.isPresent()) {
                return found;
            }
            remainingMs = remainingMillis(deadline);
            if (remainingMs <= 0) {
                continue;
            }
            if (!sleep(Math.min(delayMs, remainingMs))) {
                return Optional.empty();
            }
            delayMs = Math.min(recording.getMaxRetryDelayMs(), (long) Math.ceil(delayMs * recording.getBackoffMultiplier()));
        }
    }

    private Optional<String> fetchOnce(AppProperties.Twilio twilio, String callSid, int attempt, Duration timeout) {
        try {
            String response = webClient.get()
                    .uri(uriBuilder -> uriBuilder.path(RECORDINGS_PATH)
                            .queryParam("CallSid", callSid)
                            .build(twilio.getAccountSid()))
                    .headers(headers -> headers.setBasicAuth(twilio.getAccountSid(), twilio.getAuthToken()))
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(timeout);
            return parseMediaUrl(response, twilio.getBaseUrl());
        } catch (Exception e) {
            log.log(Level.FINE, e, () -> "call.recording.lookup_failed callSid=" + callSid + " attempt=" + attempt);
            return Optional.empty();
        }
    }

    Optional<String> parseMediaUrl(String response, String baseUrl) throws Exception {
        if (isBlank(response)) {
            return Optional.empty();
        }
        JsonNode recordings = objectMapper.readTree(response).path("recordings");
        if (!recordings.isArray()) {
            return Optional.empty();
        }
        for (JsonNode recording : recordings) {
            String status = recording.path("status").asText("completed");
            if (!"completed".equalsIgnoreCase(status)) {
                continue;
            }
            String mediaUrl = recording.path("media_url").asText("");
            if (!isBlank(mediaUrl)) {
                return Optional.of(mediaUrl);
            }
            String uri = recording.path("uri").asText("");
            if (!isBlank(uri)) {
                // uri는 메타데이터(.json)를 가리키므로 확장자를 떼면 오디오 주소가 된다.
                String path = uri.endsWith(".json") ? uri.substring(0, uri.length() - ".json".length()) : uri;
                return Optional.of(trimTrailingSlash(baseUrl) + path);
            }
        }
        return Optional.empty();
    }

    private static long remainingMillis(long deadline) {
        return Duration.ofNanos(deadline - System.nanoTime()).toMillis();
    }

    private boolean sleep(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String trimTrailingSlash(String value) {
        if (value == null) {
            return "";
        }
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
