package me.go_gradually.phonedesk.infrastructure.recording.twilio;

import me.go_gradually.phonedesk.infrastructure.shared.config.AppProperties;
import me.go_gradually.phonedesk.infrastructure.shared.config.WebClientConfig;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Base64;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TwilioRecordingResolverAdapterTest {
    private MockWebServer server;
    private AppProperties properties;
    private TwilioRecordingResolverAdapter adapter;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        properties = new AppProperties();
        String baseUrl = "http://" + server.getHostName() + ":" + server.getPort();
        properties.getIntegrations().getTwilio().setBaseUrl(baseUrl);
        properties.getIntegrations().getTwilio().setAccountSid("AC123");
        properties.getIntegrations().getTwilio().setAuthToken("secret");
        properties.getRecording().setInitialRetryDelayMs(10);
        properties.getRecording().setMaxRetryDelayMs(20);
        adapter = new TwilioRecordingResolverAdapter(new WebClientConfig().twilioWebClient(properties), properties);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void resolve_returnsMediaUrlOfFirstCompletedRecording() throws Exception {
        server.enqueue(json("""
                {"recordings":[{"sid":"RE1","status":"completed","uri":"/2010-04-01/Accounts/AC123/Recordings/RE1.json"}]}
                """));

        Optional<String> url = adapter.resolve("CA1", Duration.ofSeconds(2));

        assertEquals(Optional.of("http://" + server.getHostName() + ":" + server.getPort()
                + "/2010-04-01/Accounts/AC123/Recordings/RE1"), url);
        RecordedRequest request = server.takeRequest();
        assertEquals("GET", request.getMethod());
        assertEquals("/2010-04-01/Accounts/AC123/Recordings.json?CallSid=CA1", request.getPath());
        String expectedAuth = "Basic " + Base64.getEncoder()
                .encodeToString("AC123:secret".getBytes(StandardCharsets.UTF_8));
        assertEquals(expectedAuth, request.getHeader("Authorization"));
    }

    @Test
    void resolve_retriesUntilRecordingAppears() {
        server.enqueue(json("{\"recordings\":[]}"));
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(json("{\"recordings\":[{\"sid\":\"RE2\",\"status\":\"processing\",\"uri\":\"/r/RE2.json\"}]}"));
        server.enqueue(json("{\"recordings\":[{\"sid\":\"RE2\",\"media_url\":\"https://media.example/RE2\"}]}"));

        Optional<String> url = adapter.resolve("CA2", Duration.ofSeconds(3));

        assertEquals(Optional.of("https://media.example/RE2"), url);
        assertEquals(4, server.getRequestCount());
    }

    @Test
    void resolve_givesUpWhenBudgetIsSpent() {
        for (int i = 0; i < 50; i++) {
            server.enqueue(json("{\"recordings\":[]}"));
        }

        Optional<String> url = adapter.resolve("CA3", Duration.ofMillis(100));

        assertTrue(url.isEmpty());
        assertTrue(server.getRequestCount() >= 1);
    }

    @Test
    void resolve_slowLookupStillEndsWithinBudget() {
        server.enqueue(json("{\"recordings\":[{\"sid\":\"RE5\",\"media_url\":\"https://media.example/RE5\"}]}")
                .setHeadersDelay(3, TimeUnit.SECONDS));

        long startedAt = System.nanoTime();
        Optional<String> url = adapter.resolve("CA5", Duration.ofMillis(500));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);

        assertTrue(url.isEmpty());
        assertTrue(elapsedMs < 1500, "elapsedMs=" + elapsedMs);
    }

    @Test
    void resolve_withoutCredentialsSkipsLookup() {
        properties.getIntegrations().getTwilio().setAuthToken("");

        assertTrue(adapter.resolve("CA4", Duration.ofSeconds(1)).isEmpty());
        assertEquals(0, server.getRequestCount());
    }

    private MockResponse json(String body) {
        return new MockResponse()
                .setResponseCode(200)
                .setHeader("Content-Type", "application/json")
                .setBody(body);
    }
}
