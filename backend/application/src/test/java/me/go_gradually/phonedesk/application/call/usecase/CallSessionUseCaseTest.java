package me.go_gradually.phonedesk.application.call.usecase;

import me.go_gradually.phonedesk.application.call.model.CallNotification;
import me.go_gradually.phonedesk.application.call.model.CallScript;
import me.go_gradually.phonedesk.application.call.model.CallSessionHandle;
import me.go_gradually.phonedesk.application.call.model.CallStartCommand;
import me.go_gradually.phonedesk.application.call.model.PromptTemplates;
import me.go_gradually.phonedesk.application.call.model.TelephonyChannel;
import me.go_gradually.phonedesk.application.call.model.TurnRequest;
import me.go_gradually.phonedesk.application.call.model.VoiceBackendEventListener;
import me.go_gradually.phonedesk.application.call.model.VoiceBackendSession;
import me.go_gradually.phonedesk.application.call.model.VoiceSessionConfig;
import me.go_gradually.phonedesk.application.call.policy.CallPolicy;
import me.go_gradually.phonedesk.application.call.port.CallNotificationPort;
import me.go_gradually.phonedesk.application.call.port.CallScriptPort;
import me.go_gradually.phonedesk.application.call.port.CallerMemoryPort;
import me.go_gradually.phonedesk.application.call.port.RecordingResolverPort;
import me.go_gradually.phonedesk.application.call.port.VoiceBackendGateway;
import me.go_gradually.phonedesk.application.shared.port.AsyncExecutor;
import me.go_gradually.phonedesk.application.shared.port.CallScheduler;
import me.go_gradually.phonedesk.application.shared.port.MetricsPort;
import me.go_gradually.phonedesk.domain.caller.CallerMemory;
import me.go_gradually.phonedesk.domain.disposition.Disposition;
import me.go_gradually.phonedesk.domain.disposition.DispositionTrigger;
import me.go_gradually.phonedesk.domain.disposition.InfoPrecedence;
import me.go_gradually.phonedesk.domain.gate.GatePolicy;
import me.go_gradually.phonedesk.domain.turn.TurnKind;
import me.go_gradually.phonedesk.domain.turn.TurnTimings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CallSessionUseCaseTest {
    private static final String GREETING = "Hello, you've reached {{business}}. May I have your name?";
    private static final String CLOSING = "Thank you for calling {{business}}, goodbye.";

    @Mock
    private VoiceBackendGateway gateway;
    @Mock
    private VoiceBackendSession backend;
    @Mock
    private CallerMemoryPort callerMemory;
    @Mock
    private CallScriptPort callScriptPort;
    @Mock
    private RecordingResolverPort recordingResolver;
    @Mock
    private CallNotificationPort notificationPort;
    @Mock
    private TelephonyChannel telephony;
    @Mock
    private MetricsPort metrics;

    private final AsyncExecutor inline = Runnable::run;
    private final ManualScheduler scheduler = new ManualScheduler();
    private final MutableClock clock = new MutableClock(1_700_000_000_000L);
    private CallSessionUseCase useCase;
    private ArgumentCaptor<VoiceBackendEventListener> captor;
    private VoiceBackendEventListener listener;

    @BeforeEach
    void setUp() {
        ArgumentCaptor<VoiceBackendEventListener> listenerCaptor = ArgumentCaptor.forClass(VoiceBackendEventListener.class);
        lenient().when(gateway.connect(eq("ws-1"), listenerCaptor.capture())).thenReturn(backend);
        lenient().when(callScriptPort.load()).thenReturn(new CallScript(
                Map.of("business", "Acme"),
                new PromptTemplates("You answer calls for {{business}}.", GREETING, "Welcome back {{name}}!", CLOSING),
                List.of()
        ));
        lenient().when(recordingResolver.resolve(anyString(), any())).thenReturn(Optional.of("https://recordings/RE1"));
        lenient().when(notificationPort.send(any())).thenReturn(true);
        lenient().when(callerMemory.lookup(anyString())).thenReturn(Optional.empty());

        CallPolicy policy = new TestPolicy(TurnTimings.defaults());
        CallDispositionUseCase dispositionUseCase = new CallDispositionUseCase(
                recordingResolver, notificationPort, inline, policy, metrics, clock);
        useCase = new CallSessionUseCase(gateway, callerMemory, callScriptPort, dispositionUseCase,
                scheduler, inline, policy, metrics, clock);
        captor = listenerCaptor;
    }

    @Test
    void open_configuresBackendAndGreetsOnceStartedAndReady() {
        CallSessionHandle handle = open();

        listener.onReady();
        verify(backend).configure(new VoiceSessionConfig("You answer calls for Acme.", null));
        verify(backend, never()).createTurn(any());

        handle.start(start("CA1", "MZ1", null));

        verify(backend).createTurn(new TurnRequest(1L, TurnKind.OPENING,
                "Hello, you've reached Acme. May I have your name?"));
    }

    @Test
    void start_returningCallerGetsPersonalGreeting() {
        when(callerMemory.lookup("+972501234567"))
                .thenReturn(Optional.of(new CallerMemory("+972501234567", "Dana", 3, Instant.EPOCH)));
        CallSessionHandle handle = open();
        listener.onReady();

        handle.start(start("CA1", "MZ1", "+972501234567"));

        verify(callerMemory).upsertCall("+972501234567");
        verify(backend).createTurn(new TurnRequest(1L, TurnKind.OPENING, "Welcome back Dana!"));
    }

    @Test
    void appendCallerAudio_buffersUntilBackendConfiguredThenFlushesInOrder() {
        CallSessionHandle handle = open();
        handle.start(start("CA1", "MZ1", null));
        handle.appendCallerAudio("MZ1", "a1");
        handle.appendCallerAudio("MZ1", "a2");
        handle.appendCallerAudio("MZ1", "a3");
        verify(backend, never()).appendAudio(anyString());

        listener.onReady();
        handle.appendCallerAudio("MZ1", "a4");

        InOrder order = inOrder(backend);
        order.verify(backend).configure(any());
        order.verify(backend).appendAudio("a1");
        order.verify(backend).appendAudio("a2");
        order.verify(backend).appendAudio("a3");
        order.verify(backend).appendAudio("a4");
    }

    @Test
    void speechStopped_requestsFreeFormTurnAfterGreetingCompletes() {
        CallSessionHandle handle = activeCall();
        completeTurn(1L);

        callerFrames(handle, 4);
        clock.advance(1_000);
        listener.onSpeechStopped();

        verify(backend).createTurn(new TurnRequest(2L, TurnKind.FREE_FORM, null));
        verify(metrics, times(2)).incrementTurnRequested();
    }

    @Test
    void speechStopped_whileGreetingInFlightIsRetriedAfterCompletion() {
        CallSessionHandle handle = activeCall();
        listener.onTurnAccepted(1L);
        callerFrames(handle, 4);
        clock.advance(1_000);

        listener.onSpeechStopped();
        verify(backend, never()).createTurn(new TurnRequest(2L, TurnKind.FREE_FORM, null));

        listener.onTurnCompleted(1L);
        verify(backend).createTurn(new TurnRequest(2L, TurnKind.FREE_FORM, null));
    }

    @Test
    void bargeIn_cancelsTurnAndClearsTelephonyPlayback() {
        activeCall();
        listener.onTurnAccepted(1L);
        listener.onAssistantAudio(1L, "g1");
        verify(telephony).sendMedia("MZ1", "g1");

        listener.onSpeechStarted();
        assertEquals(Duration.ofMillis(250), scheduler.lastDelay());
        clock.advance(300);
        scheduler.runPending();

        verify(backend).cancelTurn();
        verify(telephony).sendClear("MZ1");
        verify(metrics).incrementBargeIn();

        listener.onAssistantAudio(1L, "g2");
        verify(telephony, never()).sendMedia("MZ1", "g2");
    }

    @Test
    void bargeIn_shortSpeechBurstDoesNotCancel() {
        activeCall();
        listener.onTurnAccepted(1L);
        listener.onAssistantAudio(1L, "g1");

        listener.onSpeechStarted();
        clock.advance(100);
        listener.onSpeechStopped();
        scheduler.runPending();

        verify(backend, never()).cancelTurn();
        verify(telephony, never()).sendClear(anyString());
    }

    @Test
    void closingPhrase_dispatchesOnceSpeaksClosingAndHangsUp() {
        CallSessionHandle handle = activeCall();
        completeTurn(1L);
        listener.onAssistantTranscript(1L, "Hello, you've reached Acme. May I have your name?");
        listener.onCallerTranscript("Dana");

        listener.onCallerTranscript("That's all, bye");

        verify(backend).createTurn(new TurnRequest(2L, TurnKind.CLOSING, "Thank you for calling Acme, goodbye."));
        ArgumentCaptor<CallNotification> sent = ArgumentCaptor.forClass(CallNotification.class);
        verify(notificationPort).send(sent.capture());
        assertEquals(Disposition.PARTIAL, sent.getValue().report().decision().disposition());
        assertEquals(DispositionTrigger.CLOSING_FORCED, sent.getValue().report().trigger());
        assertEquals("Dana", sent.getValue().report().gates().name());
        verify(callerMemory, never()).saveName(anyString(), anyString());

        listener.onTurnAccepted(2L);
        listener.onTurnCompleted(2L);
        assertEquals(Duration.ofMillis(2_500), scheduler.lastDelay());
        scheduler.runPending();
        verify(telephony).hangup("closing_complete");

        handle.stop("CA1");
        handle.close();
        verify(notificationPort, times(1)).send(any());
    }

    @Test
    void closingTurnDroppedByBackendErrorStillHangsUp() {
        activeCall();
        completeTurn(1L);
        listener.onAssistantTranscript(1L, "Hello, you've reached Acme. May I have your name?");
        listener.onCallerTranscript("Dana");
        listener.onCallerTranscript("That's all, bye");
        verify(backend).createTurn(new TurnRequest(2L, TurnKind.CLOSING, "Thank you for calling Acme, goodbye."));

        listener.onError("conversation_already_has_active_response");

        assertEquals(Duration.ofMillis(2_500), scheduler.lastDelay());
        scheduler.runPending();
        verify(telephony).hangup("closing_complete");
    }

    @Test
    void backendErrorDuringFreeFormTurnDoesNotHangUp() {
        activeCall();
        completeTurn(1L);

        listener.onError("rate_limited");
        scheduler.runPending();

        verify(telephony, never()).hangup(anyString());
    }

    @Test
    void close_withoutStopDispatchesAbandonedOnce() {
        CallSessionHandle handle = activeCall();

        handle.close();
        handle.close();

        ArgumentCaptor<CallNotification> sent = ArgumentCaptor.forClass(CallNotification.class);
        verify(notificationPort, times(1)).send(sent.capture());
        assertEquals(Disposition.ABANDONED, sent.getValue().report().decision().disposition());
        assertEquals(DispositionTrigger.TRANSPORT_CLOSE, sent.getValue().report().trigger());
        assertEquals("https://recordings/RE1", sent.getValue().recordingUrl());
        verify(backend).close();
        verify(metrics).recordCallDuration(any());
    }

    @Test
    void stopThenClose_sendsSingleNotification() {
        CallSessionHandle handle = activeCall();

        handle.stop("CA1");
        handle.close();

        ArgumentCaptor<CallNotification> sent = ArgumentCaptor.forClass(CallNotification.class);
        verify(notificationPort, times(1)).send(sent.capture());
        assertEquals(DispositionTrigger.TRANSPORT_STOP, sent.getValue().report().trigger());
    }

    @Test
    void close_withoutStartEventSkipsDisposition() {
        CallSessionHandle handle = open();

        handle.close();

        verify(notificationPort, never()).send(any());
    }

    @Test
    void backendClosed_resetsTurnStateAndHangsUp() {
        activeCall();

        listener.onClosed("socket closed");

        verify(telephony).hangup("ai_connection_lost");
    }

    @Test
    void backendConnectFailure_hangsUpCaller() {
        when(gateway.connect(eq("ws-2"), any())).thenThrow(new IllegalStateException("refused"));

        useCase.open("ws-2", telephony);

        verify(telephony).hangup("ai_connection_lost");
    }

    @Test
    void assistantAudio_isBufferedUntilStreamSidKnown() {
        CallSessionHandle handle = open();
        listener.onReady();
        handle.start(start("CA1", null, null));
        listener.onAssistantAudio(1L, "g1");
        verify(telephony, never()).sendMedia(anyString(), anyString());

        handle.appendCallerAudio("MZ-late", "c1");

        verify(telephony).sendMedia("MZ-late", "g1");
    }

    @Test
    void capturedName_isSavedToCallerMemory() {
        CallSessionHandle handle = open();
        listener.onReady();
        handle.start(start("CA1", "MZ1", "+972501234567"));

        listener.onCallerTranscript("Hi, my name is Omer");

        verify(callerMemory).saveName("+972501234567", "Omer");
    }

    private CallSessionHandle open() {
        CallSessionHandle handle = useCase.open("ws-1", telephony);
        listener = captor.getValue();
        return handle;
    }

    private CallSessionHandle activeCall() {
        CallSessionHandle handle = open();
        listener.onReady();
        handle.start(start("CA1", "MZ1", null));
        return handle;
    }

    private void completeTurn(long turnId) {
        listener.onTurnAccepted(turnId);
        listener.onAssistantAudioDone(turnId);
        listener.onTurnCompleted(turnId);
    }

    private static void callerFrames(CallSessionHandle handle, int count) {
        for (int i = 0; i < count; i++) {
            handle.appendCallerAudio("MZ1", "c" + i);
        }
    }

    private static CallStartCommand start(String callSid, String streamSid, String caller) {
        CallStartCommand command = new CallStartCommand();
        command.setCallSid(callSid);
        command.setStreamSid(streamSid);
        command.setCaller(caller);
        command.setCalled("+97231234567");
        return command;
    }

    private static final class ManualScheduler implements CallScheduler {
        private final List<Entry> entries = new ArrayList<>();

        @Override
        public ScheduledTask schedule(Runnable task, Duration delay) {
            Entry entry = new Entry(task, delay);
            entries.add(entry);
            return () -> entry.cancelled = true;
        }

        Duration lastDelay() {
            assertTrue(!entries.isEmpty());
            return entries.get(entries.size() - 1).delay;
        }

        void runPending() {
            List<Entry> pending = new ArrayList<>(entries);
            entries.clear();
            for (Entry entry : pending) {
                if (!entry.cancelled) {
                    entry.task.run();
                }
            }
        }

        private static final class Entry {
            private final Runnable task;
            private final Duration delay;
            private boolean cancelled;

            private Entry(Runnable task, Duration delay) {
                this.task = task;
                this.delay = delay;
            }
        }
    }

    private static final class MutableClock extends Clock {
        private long millis;

        private MutableClock(long millis) {
            this.millis = millis;
        }

        void advance(long deltaMillis) {
            millis += deltaMillis;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public long millis() {
            return millis;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis);
        }
    }

    private record TestPolicy(TurnTimings turnTimings) implements CallPolicy {
        @Override
        public int audioQueueCapacity() {
            return 400;
        }

        @Override
        public GatePolicy gatePolicy() {
            return new GatePolicy(false, 20_000, 600);
        }

        @Override
        public int maxNameChars() {
            return 22;
        }

        @Override
        public int maxNameWords() {
            return 3;
        }

        @Override
        public List<String> extraNameStopwords() {
            return List.of();
        }

        @Override
        public InfoPrecedence infoPrecedence() {
            return InfoPrecedence.REGARDLESS_OF_NAME;
        }

        @Override
        public Duration recordingTimeout() {
            return Duration.ofSeconds(12);
        }

        @Override
        public Duration hangupAfterClosing() {
            return Duration.ofMillis(2_500);
        }

        @Override
        public String providerMode() {
            return "openai-realtime";
        }
    }
}
