package me.go_gradually.phonedesk.infrastructure.voice.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.go_gradually.phonedesk.application.call.model.TurnRequest;
import me.go_gradually.phonedesk.application.call.model.VoiceBackendEventListener;
import me.go_gradually.phonedesk.application.call.model.VoiceBackendSession;
import me.go_gradually.phonedesk.application.call.model.VoiceSessionConfig;
import me.go_gradually.phonedesk.application.call.port.VoiceBackendGateway;
import me.go_gradually.phonedesk.infrastructure.shared.config.AppProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

@Component
public class OpenAiRealtimeVoiceGateway implements VoiceBackendGateway {
    private static final Logger log = Logger.getLogger(OpenAiRealtimeVoiceGateway.class.getName());
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final String REALTIME_PATH = "/v1/realtime";
    static final String AUDIO_FORMAT = "g711_ulaw";

    private final AppProperties properties;
    private final HttpClient httpClient = HttpClient.newBuilder().connectTimeout(CONNECT_TIMEOUT).build();
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OpenAiRealtimeVoiceGateway(AppProperties properties) {
        this.properties = properties;
    }

    @Override
    public VoiceBackendSession connect(String sessionKey, VoiceBackendEventListener listener) {
        AppProperties.Openai openai = properties.getIntegrations().getOpenai();
        if (isBlank(openai.getApiKey())) {
            throw new IllegalStateException("OpenAI API key is not configured");
        }
        ResponseTracker tracker = new ResponseTracker();
        WebSocket.Listener socketListener = new RealtimeSocketListener(sessionKey, listener, tracker, objectMapper);
        CompletableFuture<WebSocket> opening = httpClient.newWebSocketBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .header("Authorization", "Bearer " + openai.getApiKey())
                .header("OpenAI-Beta", "realtime=v1")
                .buildAsync(toRealtimeUri(openai.getBaseUrl(), openai.getModel()), socketListener);
        WebSocket webSocket;
        try {
            webSocket = opening.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new IllegalStateException("realtime handshake failed for session " + sessionKey, cause);
        }
        log.info(() -> "call.backend.connected session=" + sessionKey + " model=" + openai.getModel());
        return new RealtimeVoiceSession(webSocket, objectMapper, tracker, openai);
    }

    // https://host/prefix 를 wss://host/prefix/v1/realtime?model=... 로 바꾼다.
    URI toRealtimeUri(String baseUrl, String model) {
        UriComponents base = UriComponentsBuilder.fromHttpUrl(baseUrl).build();
        return UriComponentsBuilder.newInstance()
                .scheme("https".equalsIgnoreCase(base.getScheme()) ? "wss" : "ws")
                .host(base.getHost())
                .port(base.getPort())
                .path(base.getPath())
                .path(REALTIME_PATH)
                .queryParam("model", model)
                .encode()
                .build()
                .toUri();
    }

    static final class RealtimeVoiceSession implements VoiceBackendSession {
        private final WebSocket webSocket;
        private final ObjectMapper objectMapper;
        private final ResponseTracker tracker;
        private final AppProperties.Openai openai;
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private final AtomicLong eventSequence = new AtomicLong(0);

        RealtimeVoiceSession(WebSocket webSocket,
                             ObjectMapper objectMapper,
                             ResponseTracker tracker,
                             AppProperties.Openai openai) {
            this.webSocket = webSocket;
            this.objectMapper = objectMapper;
            this.tracker = tracker;
            this.openai = openai;
        }

        @Override
        public void configure(VoiceSessionConfig config) {
            if (!closed.get()) {
                send(sessionUpdate(config));
            }
        }

        @Override
        public void appendAudio(String base64Audio) {
            if (closed.get() || isBlank(base64Audio)) {
                return;
            }
            send(event("input_audio_buffer.append").put("audio", base64Audio));
        }

        @Override
        public void createTurn(TurnRequest request) {
            if (closed.get()) {
                return;
            }
            String eventId = "turn-" + request.turnId() + "-" + eventSequence.incrementAndGet();
            tracker.register(eventId, request.turnId());
            try {
                if (request.kind().isScripted()) {
                    send(scriptedItem(request.utterance()));
                }
                send(responseCreate(eventId, request));
            } catch (RuntimeException e) {
                tracker.discard(eventId);
                throw e;
            }
        }

        @Override
        public void cancelTurn() {
            if (!closed.get()) {
                send(event("response.cancel"));
            }
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            tracker.clear();
            webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "call ended")
                    .whenComplete((ignored, error) -> {
                        if (error != null) {
                            log.log(Level.FINE, error, () -> "call.backend.close_failed");
                        }
                    });
        }

        private void send(ObjectNode event) {
            String text;
            try {
                text = objectMapper.writeValueAsString(event);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("realtime event could not be serialized", e);
            }
            try {
                webSocket.sendText(text, true).join();
            } catch (CompletionException e) {
                throw new IllegalStateException("realtime event " + event.path("type").asText() + " was not sent", e);
            }
        }

        private ObjectNode event(String type) {
            return objectMapper.createObjectNode().put("type", type);
        }

        private ObjectNode sessionUpdate(VoiceSessionConfig config) {
            ObjectNode update = event("session.update");
            ObjectNode session = update.putObject("session");
            if (!isBlank(config.instructions())) {
                session.put("instructions", config.instructions());
            }
            session.put("voice", isBlank(config.voice()) ? openai.getVoice() : config.voice())
                    .put("input_audio_format", AUDIO_FORMAT)
                    .put("output_audio_format", AUDIO_FORMAT);
            // 턴 끝은 서버 VAD가 알려 주고, 응답 생성과 끼어들기는 통화 세션이 정한다.
            AppProperties.Vad vad = openai.getVad();
            session.putObject("turn_detection")
                    .put("type", "server_vad")
                    .put("threshold", vad.getThreshold())
                    .put("prefix_padding_ms", vad.getPrefixPaddingMs())
                    .put("silence_duration_ms", vad.getSilenceDurationMs())
                    .put("create_response", false)
                    .put("interrupt_response", false);
            if (!isBlank(openai.getTranscriptionModel())) {
                session.putObject("input_audio_transcription").put("model", openai.getTranscriptionModel());
            }
            return update;
        }

        private ObjectNode scriptedItem(String utterance) {
            ObjectNode create = event("conversation.item.create");
            ObjectNode item = create.putObject("item")
                    .put("type", "message")
                    .put("role", "system");
            item.putArray("content").addObject()
                    .put("type", "input_text")
                    .put("text", "Say exactly the following sentence: " + utterance);
            return create;
        }

        private ObjectNode responseCreate(String eventId, TurnRequest request) {
            ObjectNode create = event("response.create").put("event_id", eventId);
            ObjectNode response = create.putObject("response");
            if (request.kind().isScripted()) {
                response.put("instructions",
                        "Read the following text exactly as written. Do not add or remove words: " + request.utterance());
            }
            // response.created에서 응답 id를 턴에 다시 묶는 열쇠
            response.putObject("metadata").put("turnId", Long.toString(request.turnId()));
            return create;
        }
    }

    static final class RealtimeSocketListener implements WebSocket.Listener {
        private final String sessionKey;
        private final VoiceBackendEventListener listener;
        private final ResponseTracker tracker;
        private final ObjectMapper objectMapper;
        private final StringBuilder partialFrame = new StringBuilder();
        private final AtomicBoolean ready = new AtomicBoolean(false);
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private static final List<List<String>> IGNORABLE_ERRORS = List.of(
                List.of("cancellation failed", "no active response"),
                List.of("input audio buffer", "buffer too small")
        );

        RealtimeSocketListener(String sessionKey,
                               VoiceBackendEventListener listener,
                               ResponseTracker tracker,
                               ObjectMapper objectMapper) {
            this.sessionKey = sessionKey;
            this.listener = listener;
            this.tracker = tracker;
            this.objectMapper = objectMapper;
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            // 조각난 프레임은 마지막 조각이 올 때까지 모은다.
            partialFrame.append(data);
            if (last) {
                String frame = partialFrame.toString();
                partialFrame.setLength(0);
                handleMessage(frame);
            }
            return WebSocket.Listener.super.onText(webSocket, data, last);
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            emitClosed("closed status=" + statusCode + " reason=" + reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            emitClosed(error == null || error.getMessage() == null ? "websocket error" : error.getMessage());
        }

        void handleMessage(String payload) {
            JsonNode root;
            try {
                root = objectMapper.readTree(payload);
            } catch (JsonProcessingException e) {
                log.fine(() -> "call.backend.malformed session=" + sessionKey);
                return;
            }
            switch (root.path("type").asText("")) {
                case "session.created" -> {
                    if (ready.compareAndSet(false, true)) {
                        listener.onReady();
                    }
                }
                case "input_audio_buffer.speech_started" -> listener.onSpeechStarted();
                case "input_audio_buffer.speech_stopped" -> listener.onSpeechStopped();
                case "response.created" -> {
                    Long accepted = tracker.bind(root.path("event_id").asText(""),
                            root.at("/response/id").asText(""),
                            root.at("/response/metadata"));
                    if (accepted != null) {
                        listener.onTurnAccepted(accepted);
                    }
                }
                // GA(output_audio.*)와 beta(audio.*) 이벤트명을 모두 받는다.
                case "response.output_audio.delta", "response.audio.delta" -> {
                    Long speaking = tracker.turnFor(responseIdOf(root));
                    String chunk = root.path("delta").asText("");
                    if (speaking != null && !chunk.isEmpty()) {
                        listener.onAssistantAudio(speaking, chunk);
                    }
                }
                case "response.output_audio.done", "response.audio.done" ->
                        Optional.ofNullable(tracker.turnFor(responseIdOf(root)))
                                .ifPresent(listener::onAssistantAudioDone);
                case "response.output_audio_transcript.delta", "response.audio_transcript.delta" ->
                        tracker.appendTranscript(responseIdOf(root), root.path("delta").asText(""));
                case "response.output_audio_transcript.done", "response.audio_transcript.done" -> {
                    String responseId = responseIdOf(root);
                    Long turnId = tracker.turnFor(responseId);
                    String transcript = tracker.takeTranscript(responseId, root.path("transcript").asText(""));
                    if (turnId != null && !transcript.isBlank()) {
                        listener.onAssistantTranscript(turnId, transcript);
                    }
                }
                case "conversation.item.input_audio_transcription.completed" -> {
                    String transcript = root.path("transcript").asText("");
                    if (!transcript.isBlank()) {
                        listener.onCallerTranscript(transcript);
                    }
                }
                case "response.done", "response.completed" -> finishResponse(root);
                case "error" -> reportError(root);
                default -> {
                    // 나머지 이벤트는 쓰지 않는다.
                }
            }
        }

        private void finishResponse(JsonNode root) {
            Long turnId = tracker.complete(responseIdOf(root));
            if (turnId == null) {
                return;
            }
            JsonNode response = root.path("response");
            if (!"failed".equalsIgnoreCase(response.path("status").asText())) {
                listener.onTurnCompleted(turnId);
                return;
            }
            JsonNode reason = response.at("/status_details/error/message");
            listener.onTurnFailed(turnId, reason.isTextual() ? reason.asText() : "realtime response failed");
        }

        private void reportError(JsonNode root) {
            JsonNode error = root.path("error");
            String text = fieldOf(error, root, "message");
            String message = text.isEmpty() ? "realtime error" : text;
            if (isIgnorableRealtimeError(message)) {
                log.fine(() -> "call.backend.error_ignored session=" + sessionKey + " message=" + message);
                return;
            }
            // 응답 id로 먼저 찾고, 아직 응답이 없으면 보낸 이벤트 id로 찾는다.
            Long failed = tracker.complete(fieldOf(error, root, "response_id"));
            if (failed == null) {
                failed = tracker.discard(fieldOf(error, root, "event_id"));
            }
            if (failed == null) {
                listener.onError(message);
            } else {
                listener.onTurnFailed(failed, message);
            }
        }

        private void emitClosed(String reason) {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            tracker.clear();
            listener.onClosed(reason);
        }

        private static String responseIdOf(JsonNode root) {
            String direct = root.path("response_id").asText("");
            return direct.isBlank() ? root.at("/response/id").asText("") : direct;
        }

        private static String fieldOf(JsonNode error, JsonNode root, String field) {
            String nested = error.path(field).asText("");
            return nested.isBlank() ? root.path(field).asText("") : nested;
        }

        private boolean isIgnorableRealtimeError(String message) {
            String lowered = message.toLowerCase(Locale.ROOT);
            // 끼어들기 직후 이미 끝난 응답을 취소하는 경합, 너무 짧은 입력 버퍼
            return IGNORABLE_ERRORS.stream()
                    .anyMatch(phrases -> phrases.stream().allMatch(lowered::contains));
        }
    }

    static final class ResponseTracker {
        private final Map<String, Long> turnByEventId = new ConcurrentHashMap<>();
        private final Map<String, Long> turnByResponseId = new ConcurrentHashMap<>();
        private final Map<String, StringBuilder> transcriptByResponseId = new ConcurrentHashMap<>();
        private final Deque<Long> unboundTurns = new ConcurrentLinkedDeque<>();
        private final Set<String> finishedResponses = ConcurrentHashMap.newKeySet();

        void register(String eventId, long turnId) {
            turnByEventId.put(eventId, turnId);
            unboundTurns.addLast(turnId);
        }

        Long bind(String eventId, String responseId, JsonNode metadata) {
            if (isBlank(responseId)) {
                return null;
            }
            // metadata의 turnId를 우선하고, 없으면 event_id, 그것도 없으면 가장 오래된 대기 턴으로 묶는다.
            Long requested = parseTurnId(metadata);
            Long bySentEvent = isBlank(eventId) ? null : turnByEventId.remove(eventId);
            Long turnId = requested != null ? requested : bySentEvent;
            if (turnId == null) {
                turnId = unboundTurns.pollFirst();
            } else {
                unboundTurns.removeFirstOccurrence(turnId);
            }
            if (turnId == null) {
                return null;
            }
            Long bound = turnId;
            turnByEventId.values().removeIf(bound::equals);
            turnByResponseId.put(responseId, bound);
            return bound;
        }

        Long turnFor(String responseId) {
            return isBlank(responseId) ? null : turnByResponseId.get(responseId);
        }

        void appendTranscript(String responseId, String delta) {
            if (isBlank(responseId) || delta == null || delta.isEmpty()) {
                return;
            }
            transcriptByResponseId.computeIfAbsent(responseId, ignored -> new StringBuilder()).append(delta);
        }

        String takeTranscript(String responseId, String finalTranscript) {
            StringBuilder buffered = isBlank(responseId) ? null : transcriptByResponseId.remove(responseId);
            if (!isBlank(finalTranscript)) {
                return finalTranscript.trim();
            }
            return buffered == null ? "" : buffered.toString().trim();
        }

        Long complete(String responseId) {
            if (isBlank(responseId) || !finishedResponses.add(responseId)) {
                return null;
            }
            transcriptByResponseId.remove(responseId);
            return turnByResponseId.remove(responseId);
        }

        Long discard(String eventId) {
            if (isBlank(eventId)) {
                return null;
            }
            Long turnId = turnByEventId.remove(eventId);
            if (turnId != null) {
                unboundTurns.removeFirstOccurrence(turnId);
            }
            return turnId;
        }

        void clear() {
            turnByEventId.clear();
            turnByResponseId.clear();
            transcriptByResponseId.clear();
            unboundTurns.clear();
            finishedResponses.clear();
        }

        private Long parseTurnId(JsonNode metadata) {
            if (metadata == null || !metadata.isObject()) {
                return null;
            }
            JsonNode node = metadata.has("turnId") ? metadata.get("turnId") : metadata.path("turn_id");
            if (node.isIntegralNumber()) {
                return node.longValue();
            }
            String text = node.isTextual() ? node.asText().trim() : "";
            return text.matches("\\d+") ? Long.valueOf(text) : null;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
