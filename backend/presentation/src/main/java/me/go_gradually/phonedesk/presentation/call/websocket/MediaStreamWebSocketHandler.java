package me.go_gradually.phonedesk.presentation.call.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.phonedesk.application.call.model.CallSessionHandle;
import me.go_gradually.phonedesk.application.call.model.CallStartCommand;
import me.go_gradually.phonedesk.application.call.model.TelephonyChannel;
import me.go_gradually.phonedesk.application.call.usecase.CallSessionUseCase;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

@Component
public class MediaStreamWebSocketHandler extends TextWebSocketHandler {
    private static final Logger log = Logger.getLogger(MediaStreamWebSocketHandler.class.getName());
    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final CallSessionUseCase callSessionUseCase;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, CallSessionHandle> handleBySocketId = new ConcurrentHashMap<>();

    public MediaStreamWebSocketHandler(CallSessionUseCase callSessionUseCase) {
        this.callSessionUseCase = callSessionUseCase;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession rawSession) throws Exception {
        WebSocketSession session = new ConcurrentWebSocketSessionDecorator(rawSession, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        try {
            CallSessionHandle handle = callSessionUseCase.open(session.getId(), new SocketTelephonyChannel(session));
            handleBySocketId.put(session.getId(), handle);
            log.info(() -> "call.socket.opened socket=" + session.getId());
        } catch (RuntimeException e) {
            log.log(Level.WARNING, e, () -> "call.socket.open_failed socket=" + session.getId());
            session.close(CloseStatus.SERVER_ERROR.withReason("call session unavailable"));
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        CallSessionHandle handle = handleBySocketId.get(session.getId());
        if (handle == null) {
            return;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(message.getPayload());
        } catch (Exception e) {
            log.fine(() -> "call.socket.malformed socket=" + session.getId());
            return;
        }
        String event = root.path("event").asText("");
        switch (event) {
            case "start" -> handle.start(toStartCommand(root));
            case "media" -> {
                JsonNode media = root.path("media");
                // 발신자 쪽 음성만 받는다. track이 없으면 inbound로 본다.
                String track = media.path("track").asText("inbound");
                if (!"inbound".equalsIgnoreCase(track)) {
                    return;
                }
                handle.appendCallerAudio(firstNonBlank(readString(root, "streamSid"), readString(media, "streamSid")),
                        readString(media, "payload"));
            }
            case "stop" -> handle.stop(firstNonBlank(readString(root.path("stop"), "callSid"), readString(root, "callSid")));
            case "connected", "mark", "dtmf" -> {
                // 쓰지 않는 이벤트
            }
            default -> log.fine(() -> "call.socket.unknown_event socket=" + session.getId() + " event=" + event);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.log(Level.WARNING, exception, () -> "call.socket.transport_error socket=" + session.getId());
        CallSessionHandle handle = handleBySocketId.remove(session.getId());
        if (handle != null) {
            handle.close();
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        CallSessionHandle handle = handleBySocketId.remove(session.getId());
        if (handle != null) {
            log.info(() -> "call.socket.closed socket=" + session.getId() + " status=" + status.getCode());
            handle.close();
        }
    }

    int activeSessions() {
        return handleBySocketId.size();
    }

    CallStartCommand toStartCommand(JsonNode root) {
        JsonNode start = root.path("start");
        Map<String, String> customParameters = readCustomParameters(start.path("customParameters"));

        CallStartCommand command = new CallStartCommand();
        command.setStreamSid(firstNonBlank(readString(start, "streamSid"), readString(root, "streamSid")));
        command.setCallSid(readString(start, "callSid"));
        command.setCustomParameters(customParameters);
        command.setCaller(firstNonBlank(customParameters.get("caller"), customParameters.get("From")));
        command.setCalled(firstNonBlank(customParameters.get("called"), customParameters.get("To")));
        return command;
    }

    private Map<String, String> readCustomParameters(JsonNode node) {
        Map<String, String> values = new LinkedHashMap<>();
        if (node == null || !node.isObject()) {
            return values;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isValueNode() && !value.isNull()) {
                values.put(field.getKey(), value.asText());
            }
        }
        return values;
    }

    private String readString(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isTextual() ? value.asText() : null;
    }

    private static String firstNonBlank(String first, String second) {
        if (!isBlank(first)) {
            return first;
        }
        return isBlank(second) ? null : second;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private final class SocketTelephonyChannel implements TelephonyChannel {
        private final WebSocketSession session;

        private SocketTelephonyChannel(WebSocketSession session) {
            this.session = session;
        }

        @Override
        public void sendMedia(String streamSid, String base64Audio) {
            Map<String, Object> envelope = new LinkedHashMap<>();
            envelope.put("event", "media");
            envelope.put("streamSid", streamSid);
            envelope.put("media", Map.of("payload", base64Audio));
            send(envelope);
        }

        @Override
        public void sendClear(String streamSid) {
            Map<String, Object> envelope = new LinkedHashMap<>();
            envelope.put("event", "clear");
            envelope.put("streamSid", streamSid);
            send(envelope);
        }

        @Override
        public void hangup(String reason) {
            if (!session.isOpen()) {
                return;
            }
            try {
                session.close(CloseStatus.NORMAL.withReason(reason == null ? "" : reason));
            } catch (Exception e) {
                log.log(Level.FINE, e, () -> "call.socket.close_failed socket=" + session.getId());
            }
        }

        private void send(Map<String, Object> envelope) {
            if (!session.isOpen()) {
                return;
            }
            try {
                session.sendMessage(new TextMessage(objectMapper.writeValueAsString(envelope)));
            } catch (Exception e) {
                log.log(Level.FINE, e, () -> "call.socket.send_failed socket=" + session.getId());
            }
        }
    }
}
