package me.go_gradually.phonedesk.application.call.usecase;

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
import me.go_gradually.phonedesk.application.call.port.CallScriptPort;
import me.go_gradually.phonedesk.application.call.port.CallerMemoryPort;
import me.go_gradually.phonedesk.application.call.port.VoiceBackendGateway;
import me.go_gradually.phonedesk.application.shared.concurrent.SerialExecutor;
import me.go_gradually.phonedesk.application.shared.port.AsyncExecutor;
import me.go_gradually.phonedesk.application.shared.port.CallScheduler;
import me.go_gradually.phonedesk.application.shared.port.MetricsPort;
import me.go_gradually.phonedesk.domain.audio.AudioFrame;
import me.go_gradually.phonedesk.domain.call.CallIdentity;
import me.go_gradually.phonedesk.domain.call.CallLifecycle;
import me.go_gradually.phonedesk.domain.call.CallSession;
import me.go_gradually.phonedesk.domain.caller.CallerMemory;
import me.go_gradually.phonedesk.domain.disposition.DispositionTrigger;
import me.go_gradually.phonedesk.domain.gate.GateEvent;
import me.go_gradually.phonedesk.domain.gate.GateRuleTable;
import me.go_gradually.phonedesk.domain.gate.GateStateMachine;
import me.go_gradually.phonedesk.domain.gate.NameValidator;
import me.go_gradually.phonedesk.domain.gate.Utterance;
import me.go_gradually.phonedesk.domain.turn.TurnKind;
import me.go_gradually.phonedesk.domain.turn.TurnOrchestrator;
import me.go_gradually.phonedesk.domain.util.TextUtils;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

public class CallSessionUseCase {
    private static final Logger log = Logger.getLogger(CallSessionUseCase.class.getName());
    private static final String INBOUND = "inbound";
    private static final String OUTBOUND = "outbound";

    private final VoiceBackendGateway voiceBackendGateway;
    private final CallerMemoryPort callerMemory;
    private final CallScriptPort callScriptPort;
    private final CallDispositionUseCase dispositionUseCase;
    private final CallScheduler scheduler;
    private final AsyncExecutor asyncExecutor;
    private final CallPolicy callPolicy;
    private final MetricsPort metrics;
    private final Clock clock;

    public CallSessionUseCase(VoiceBackendGateway voiceBackendGateway,
                              CallerMemoryPort callerMemory,
                              CallScriptPort callScriptPort,
                              CallDispositionUseCase dispositionUseCase,
                              CallScheduler scheduler,
                              AsyncExecutor asyncExecutor,
                              CallPolicy callPolicy,
                              MetricsPort metrics,
                              Clock clock) {
        this.voiceBackendGateway = voiceBackendGateway;
        this.callerMemory = callerMemory;
        this.callScriptPort = callScriptPort;
        this.dispositionUseCase = dispositionUseCase;
        this.scheduler = scheduler;
        this.asyncExecutor = asyncExecutor;
        this.callPolicy = callPolicy;
        this.metrics = metrics;
        this.clock = clock;
    }

    public CallSessionHandle open(String sessionKey, TelephonyChannel telephony) {
        if (TextUtils.isBlank(sessionKey) || telephony == null) {
            throw new IllegalArgumentException("sessionKey and telephony channel are required");
        }
        CallScript script = callScriptPort.load();
        long now = clock.millis();
        GateStateMachine gates = new GateStateMachine(
                GateRuleTable.defaults().withLeading(script.rules()),
                new NameValidator(callPolicy.maxNameChars(), callPolicy.maxNameWords(), callPolicy.extraNameStopwords()),
                callPolicy.gatePolicy(),
                now
        );
        CallSession session = new CallSession(sessionKey, now, callPolicy.turnTimings(),
                callPolicy.audioQueueCapacity(), gates);
        CallContext context = new CallContext(session, telephony, script);
        log.info(() -> "call.session.opened session=" + sessionKey);
        asyncExecutor.execute(context::connectBackend);
        return context;
    }

    private final class CallContext implements CallSessionHandle {
        private final CallSession session;
        private final TelephonyChannel telephony;
        private final CallScript script;
        private final SerialExecutor mailbox;
        private final VoiceBackendEventListener backendEvents = new BackendEvents();
        private VoiceBackendSession backend;
        private CallScheduler.ScheduledTask bargeInTask;
        private CallScheduler.ScheduledTask hangupTask;
        private String returningName;

        private CallContext(CallSession session, TelephonyChannel telephony, CallScript script) {
            this.session = session;
            this.telephony = telephony;
            this.script = script;
            this.mailbox = new SerialExecutor("call-" + session.sessionKey(), asyncExecutor);
        }

        private void post(Runnable task) {
            mailbox.execute(task);
        }

        private void connectBackend() {
            try {
                VoiceBackendSession connected = voiceBackendGateway.connect(session.sessionKey(), backendEvents);
                post(() -> attachBackend(connected));
            } catch (RuntimeException e) {
                log.log(Level.WARNING, e, () -> "call.backend.connect failure session=" + session.sessionKey());
                post(() -> handleBackendLost("connect_failed"));
            }
        }

        private void attachBackend(VoiceBackendSession connected) {
            if (session.isEnded()) {
                connected.close();
                return;
            }
            backend = connected;
            configureIfReady();
        }

        private void configureIfReady() {
            if (backend == null || !session.isAiReady() || session.isAiConfigured() || session.isEnded()) {
                return;
            }
            try {
                backend.configure(new VoiceSessionConfig(
                        PromptTemplates.render(script.templates().instructions(), templateValues()),
                        script.setting("voice")
                ));
            } catch (IllegalStateException e) {
                log.log(Level.WARNING, e, () -> "call.backend.configure failure session=" + session.sessionKey());
                return;
            }
            session.markAiConfigured();
            log.info(() -> "call.backend.configured session=" + session.sessionKey()
                    + " bufferedFrames=" + session.inboundQueue().size());
            flushInbound();
            if (session.turns().consumePending()) {
                handleDecision(session.turns().evaluate(clock.millis(), true));
            }
            maybeGreet();
        }

        @Override
        public void start(CallStartCommand command) {
            post(() -> handleStart(command));
        }

        private void handleStart(CallStartCommand command) {
            if (command == null || session.isEnded()) {
                return;
            }
            CallIdentity identity = new CallIdentity(
                    command.getCallSid(),
                    command.getStreamSid(),
                    command.getCaller(),
                    command.getCalled(),
                    command.getCustomParameters()
            );
            if (!session.start(identity, clock.millis())) {
                log.fine(() -> "call.start ignored reason=duplicate session=" + session.sessionKey());
                return;
            }
            log.info(() -> "call.started callSid=" + identity.callSid()
                    + " streamSid=" + identity.streamSid()
                    + " caller=" + identity.caller()
                    + " called=" + identity.called());
            flushOutbound();
            lookupCaller(identity.caller());
        }

        private void lookupCaller(String callerAddress) {
            if (TextUtils.isBlank(callerAddress)) {
                onMemoryResolved(Optional.empty());
                return;
            }
            asyncExecutor.execute(() -> {
                Optional<CallerMemory> memory;
                try {
                    callerMemory.upsertCall(callerAddress);
                    memory = callerMemory.lookup(callerAddress);
                } catch (RuntimeException e) {
                    log.log(Level.WARNING, e, () -> "caller.memory.lookup failure session=" + session.sessionKey());
                    memory = Optional.empty();
                }
                Optional<CallerMemory> resolved = memory;
                post(() -> onMemoryResolved(resolved));
            });
        }

        private void onMemoryResolved(Optional<CallerMemory> memory) {
            if (session.isEnded()) {
                return;
            }
            memory.flatMap(CallerMemory::knownName).ifPresent(name -> {
                if (session.gates().preloadName(name)) {
                    returningName = name;
                    log.info(() -> "caller.memory.returning callSid=" + session.callSid()
                            + " calls=" + memory.get().callCount());
                }
            });
            session.markMemoryResolved();
            maybeGreet();
        }

        private void maybeGreet() {
            if (session.isEnded() || session.isOpeningRequested() || !session.isAiConfigured()
                    || !session.isStarted() || !session.isMemoryResolved()) {
                return;
            }
            String greeting = greetingText();
            session.markOpeningRequested();
            if (greeting.isBlank()) {
                return;
            }
            TurnOrchestrator.TurnDecision decision = session.turns().requestOpening(clock.millis(), true);
            if (!decision.requested()) {
                log.fine(() -> "call.greeting skipped reason=" + decision.reason() + " callSid=" + session.callSid());
                return;
            }
            sendTurn(decision, greeting);
        }

        private String greetingText() {
            PromptTemplates templates = script.templates();
            if (returningName != null && !TextUtils.isBlank(templates.returningGreeting())) {
                return PromptTemplates.render(templates.returningGreeting(), templateValues());
            }
            return PromptTemplates.render(templates.greeting(), templateValues());
        }

        private Map<String, String> templateValues() {
            Map<String, String> values = new HashMap<>(script.settings());
            if (returningName != null) {
                values.put("name", returningName);
            }
            return values;
        }

        @Override
        public void appendCallerAudio(String streamSid, String base64Audio) {
            post(() -> handleCallerAudio(streamSid, base64Audio));
        }

        private void handleCallerAudio(String streamSid, String base64Audio) {
            if (session.isEnded() || TextUtils.isBlank(base64Audio)) {
                return;
            }
            if (session.streamSid() == null) {
                session.rememberStreamSid(streamSid);
                flushOutbound();
            }
            session.countMediaFrame();
            TurnOrchestrator turns = session.turns();
            if (turns.shouldDropInbound()) {
                return;
            }
            turns.recordCallerFrame();
            AudioFrame frame = session.nextInboundFrame(base64Audio);
            if (backend == null || !session.isAiConfigured()) {
                int dropped = session.inboundQueue().offer(frame);
                if (dropped > 0) {
                    metrics.incrementAudioFramesDropped(INBOUND, dropped);
                }
                return;
            }
            flushInbound();
            forwardToBackend(frame);
        }

        private void flushInbound() {
            if (backend == null) {
                return;
            }
            for (AudioFrame frame : session.inboundQueue().drain()) {
                forwardToBackend(frame);
            }
        }

        private void forwardToBackend(AudioFrame frame) {
            try {
                backend.appendAudio(frame.payload());
            } catch (IllegalStateException e) {
                log.fine(() -> "call.backend.append failure session=" + session.sessionKey()
                        + " reason=" + e.getMessage());
            }
        }

        private void forwardToCaller(String base64Audio) {
            AudioFrame frame = session.nextOutboundFrame(base64Audio);
            String streamSid = session.streamSid();
            if (streamSid == null) {
                int dropped = session.outboundQueue().offer(frame);
                if (dropped > 0) {
                    metrics.incrementAudioFramesDropped(OUTBOUND, dropped);
                }
                return;
            }
            flushOutbound();
            telephony.sendMedia(streamSid, frame.payload());
        }

        private void flushOutbound() {
            String streamSid = session.streamSid();
            if (streamSid == null || session.outboundQueue().isEmpty()) {
                return;
            }
            for (AudioFrame frame : session.outboundQueue().drain()) {
                telephony.sendMedia(streamSid, frame.payload());
            }
        }

        @Override
        public void stop(String callSid) {
            post(() -> handleStop(callSid));
        }

        private void handleStop(String callSid) {
            if (session.isEnded()) {
                return;
            }
            log.info(() -> "call.stop callSid=" + TextUtils.firstNonBlank(callSid, session.callSid()));
            session.moveTo(CallLifecycle.ENDING);
            dispositionUseCase.dispatch(session, DispositionTrigger.TRANSPORT_STOP);
        }

        @Override
        public void close() {
            post(this::handleClose);
        }

        private void handleClose() {
            if (!session.end(clock.millis())) {
                return;
            }
            cancelBargeInTimer();
            if (hangupTask != null) {
                hangupTask.cancel();
                hangupTask = null;
            }
            closeBackend();
            dispositionUseCase.dispatch(session, DispositionTrigger.TRANSPORT_CLOSE);
            if (session.startedAt() != null) {
                metrics.recordCallDuration(Duration.ofMillis(session.endedAt() - session.startedAt()));
            }
            log.info(() -> "call.session.closed session=" + session.sessionKey()
                    + " callSid=" + session.callSid()
                    + " mediaFrames=" + session.mediaFrames());
        }

        private void closeBackend() {
            VoiceBackendSession current = backend;
            backend = null;
            if (current == null) {
                return;
            }
            try {
                current.close();
            } catch (RuntimeException e) {
                log.log(Level.FINE, e, () -> "call.backend.close failure session=" + session.sessionKey());
            }
        }

        private void handleDecision(TurnOrchestrator.TurnDecision decision) {
            if (!decision.requested()) {
                log.fine(() -> "call.turn skipped reason=" + decision.reason() + " callSid=" + session.callSid());
                return;
            }
            String utterance = decision.kind() == TurnKind.CLOSING
                    ? PromptTemplates.render(script.templates().closingUtterance(), templateValues())
                    : null;
            sendTurn(decision, utterance);
        }

        private void sendTurn(TurnOrchestrator.TurnDecision decision, String utterance) {
            metrics.incrementTurnRequested();
            try {
                if (backend == null) {
                    throw new IllegalStateException("voice backend is not connected");
                }
                backend.createTurn(new TurnRequest(decision.turnId(), decision.kind(), utterance));
                log.fine(() -> "call.turn requested kind=" + decision.kind() + " turnId=" + decision.turnId()
                        + " callSid=" + session.callSid());
            } catch (IllegalStateException | IllegalArgumentException e) {
                log.log(Level.WARNING, e, () -> "call.turn.send failure kind=" + decision.kind()
                        + " callSid=" + session.callSid());
                session.turns().cancelInFlight();
                if (decision.kind() == TurnKind.CLOSING) {
                    hangup("closing_failed");
                }
            }
        }

        private void handleClosing() {
            log.info(() -> "call.closing forced callSid=" + session.callSid());
            dispositionUseCase.dispatch(session, DispositionTrigger.CLOSING_FORCED);
            session.moveTo(CallLifecycle.ENDING);
            TurnOrchestrator turns = session.turns();
            turns.enterClosing();
            cancelBargeInTimer();
            if (turns.isResponseInFlight()) {
                cancelBackendTurn();
                clearCallerPlayback();
                turns.cancelInFlight();
            }
            if (TextUtils.isBlank(script.templates().closingUtterance())) {
                scheduleHangup();
                return;
            }
            handleDecision(turns.evaluate(clock.millis(), session.isAiConfigured()));
        }

        private void onSpeechStarted() {
            if (!session.turns().onSpeechStarted(clock.millis())) {
                return;
            }
            cancelBargeInTimer();
            bargeInTask = scheduler.schedule(() -> post(this::onBargeInTimer),
                    Duration.ofMillis(session.turns().timings().bargeInMinMs()));
        }

        private void onBargeInTimer() {
            bargeInTask = null;
            if (session.isEnded() || !session.turns().onBargeInTimer(clock.millis())) {
                return;
            }
            metrics.incrementBargeIn();
            log.info(() -> "call.barge_in callSid=" + session.callSid());
            cancelBackendTurn();
            clearCallerPlayback();
        }

        private void cancelBackendTurn() {
            if (backend == null) {
                return;
            }
            try {
                backend.cancelTurn();
            } catch (IllegalStateException e) {
                log.fine(() -> "call.backend.cancel failure callSid=" + session.callSid() + " reason=" + e.getMessage());
            }
        }

        private void clearCallerPlayback() {
            session.outboundQueue().clear();
            String streamSid = session.streamSid();
            if (streamSid != null) {
                telephony.sendClear(streamSid);
            }
        }

        private void cancelBargeInTimer() {
            if (bargeInTask != null) {
                bargeInTask.cancel();
                bargeInTask = null;
            }
        }

        private void scheduleHangup() {
            if (hangupTask != null || session.isEnded()) {
                return;
            }
            hangupTask = scheduler.schedule(() -> post(() -> hangup("closing_complete")), callPolicy.hangupAfterClosing());
        }

        private void hangup(String reason) {
            if (session.isEnded()) {
                return;
            }
            log.info(() -> "call.hangup reason=" + reason + " callSid=" + session.callSid());
            session.moveTo(CallLifecycle.ENDING);
            telephony.hangup(reason);
        }

        private void handleBackendLost(String reason) {
            if (session.isEnded()) {
                return;
            }
            log.warning(() -> "call.backend.lost reason=" + reason + " callSid=" + session.callSid());
            backend = null;
            session.markAiLost();
            session.turns().onConnectionLost();
            cancelBargeInTimer();
            hangup("ai_connection_lost");
        }

        private void handleCallerTranscript(String text) {
            if (session.isEnded()) {
                return;
            }
            List<GateEvent> events = session.gates().onCallerUtterance(Utterance.caller(text, clock.millis()));
            if (events.isEmpty()) {
                return;
            }
            log.fine(() -> "call.gates caller events=" + events + " callSid=" + session.callSid());
            if (events.contains(GateEvent.NAME_CAPTURED)) {
                saveName(session.gates().state().name());
            }
            if (events.contains(GateEvent.CLOSING_FORCED)) {
                handleClosing();
            }
        }

        private void saveName(String name) {
            String callerAddress = session.identity() == null ? null : session.identity().caller();
            if (TextUtils.isBlank(callerAddress)) {
                return;
            }
            asyncExecutor.execute(() -> callerMemory.saveName(callerAddress, name));
        }

        private void handleTurnCompleted(long turnId, boolean failed) {
            TurnOrchestrator.TurnCompletion completion = session.turns().markCompleted(turnId);
            if (!completion.matched()) {
                return;
            }
            if (completion.kind() == TurnKind.CLOSING) {
                scheduleHangup();
                return;
            }
            if (completion.retryWarranted() && !failed) {
                handleDecision(session.turns().evaluate(clock.millis(), session.isAiConfigured()));
            }
        }

        private final class BackendEvents implements VoiceBackendEventListener {
            @Override
            public void onReady() {
                post(() -> {
                    if (session.markAiReady()) {
                        configureIfReady();
                    }
                });
            }

            @Override
            public void onSpeechStarted() {
                post(() -> {
                    if (!session.isEnded()) {
                        CallContext.this.onSpeechStarted();
                    }
                });
            }

            @Override
            public void onSpeechStopped() {
                post(() -> {
                    if (session.isEnded()) {
                        return;
                    }
                    cancelBargeInTimer();
                    handleDecision(session.turns().onSpeechStopped(clock.millis(), session.isAiConfigured()));
                });
            }

            @Override
            public void onTurnAccepted(long turnId) {
                post(() -> session.turns().markAccepted(turnId));
            }

            @Override
            public void onAssistantAudio(long turnId, String base64Audio) {
                post(() -> {
                    if (session.isEnded() || TextUtils.isBlank(base64Audio)) {
                        return;
                    }
                    if (session.turns().admitAssistantAudio(turnId, clock.millis())) {
                        forwardToCaller(base64Audio);
                    }
                });
            }

            @Override
            public void onAssistantAudioDone(long turnId) {
                post(() -> session.turns().markAudioDone(turnId));
            }

            @Override
            public void onAssistantTranscript(long turnId, String text) {
                post(() -> {
                    if (session.isEnded()) {
                        return;
                    }
                    List<GateEvent> events = session.gates().onAssistantUtterance(Utterance.assistant(text, clock.millis()));
                    if (!events.isEmpty()) {
                        log.fine(() -> "call.gates assistant events=" + events + " callSid=" + session.callSid());
                    }
                });
            }

            @Override
            public void onCallerTranscript(String text) {
                post(() -> handleCallerTranscript(text));
            }

            @Override
            public void onTurnCompleted(long turnId) {
                post(() -> handleTurnCompleted(turnId, false));
            }

            @Override
            public void onTurnFailed(long turnId, String message) {
                post(() -> {
                    log.warning(() -> "call.turn failed turnId=" + turnId + " callSid=" + session.callSid()
                            + " message=" + message);
                    handleTurnCompleted(turnId, true);
                });
            }

            @Override
            public void onError(String message) {
                post(() -> {
                    log.warning(() -> "call.backend.error callSid=" + session.callSid() + " message=" + message);
                    session.turns().abandonUnaccepted()
                            .filter(kind -> kind == TurnKind.CLOSING)
                            .ifPresent(kind -> scheduleHangup());
                });
            }

            @Override
            public void onClosed(String reason) {
                post(() -> handleBackendLost(TextUtils.firstNonBlank(reason, "closed")));
            }
        }
    }
}
