package me.go_gradually.phonedesk.domain.call;

import me.go_gradually.phonedesk.domain.audio.AudioFrame;
import me.go_gradually.phonedesk.domain.audio.AudioFrameQueue;
import me.go_gradually.phonedesk.domain.disposition.DispositionLatch;
import me.go_gradually.phonedesk.domain.gate.GateStateMachine;
import me.go_gradually.phonedesk.domain.turn.TurnOrchestrator;
import me.go_gradually.phonedesk.domain.turn.TurnTimings;

public final class CallSession {
    private final String sessionKey;
    private final long openedAt;
    private final AudioFrameQueue inboundQueue;
    private final AudioFrameQueue outboundQueue;
    private final TurnOrchestrator turns;
    private final GateStateMachine gates;
    private final DispositionLatch dispositionLatch = new DispositionLatch();

    private CallLifecycle lifecycle = CallLifecycle.OPEN;
    private CallIdentity identity;
    private String fallbackStreamSid;
    private Long startedAt;
    private Long endedAt;
    private boolean aiReady;
    private boolean aiConfigured;
    private boolean memoryResolved;
    private boolean openingRequested;
    private long mediaFrames;
    private long inboundSequence;
    private long outboundSequence;

    public CallSession(String sessionKey, long openedAt, TurnTimings timings, int queueCapacity, GateStateMachine gates) {
        if (sessionKey == null || sessionKey.isBlank()) {
            throw new IllegalArgumentException("sessionKey is required");
        }
        if (gates == null) {
            throw new IllegalArgumentException("gates is required");
        }
        this.sessionKey = sessionKey;
        this.openedAt = openedAt;
        this.inboundQueue = new AudioFrameQueue(queueCapacity);
        this.outboundQueue = new AudioFrameQueue(queueCapacity);
        this.turns = new TurnOrchestrator(timings);
        this.gates = gates;
    }

    // start 이벤트로 식별자를 확정한다. 두 번째 호출은 무시된다.
    public boolean start(CallIdentity identity, long now) {
        if (this.identity != null || identity == null) {
            return false;
        }
        this.identity = identity;
        this.startedAt = now;
        moveTo(CallLifecycle.ACTIVE);
        gates.useCallerAddress(identity.caller());
        return true;
    }

    public boolean moveTo(CallLifecycle next) {
        if (!lifecycle.canMoveTo(next)) {
            return false;
        }
        lifecycle = next;
        return true;
    }

    public boolean end(long now) {
        if (!moveTo(CallLifecycle.ENDED)) {
            return false;
        }
        endedAt = now;
        inboundQueue.clear();
        outboundQueue.clear();
        return true;
    }

    public void rememberStreamSid(String streamSid) {
        if (fallbackStreamSid == null && streamSid != null && !streamSid.isBlank()) {
            fallbackStreamSid = streamSid;
        }
    }

    public String streamSid() {
        if (identity != null && identity.streamSid() != null && !identity.streamSid().isBlank()) {
            return identity.streamSid();
        }
        return fallbackStreamSid;
    }

    public String callSid() {
        return identity == null ? null : identity.callSid();
    }

    public AudioFrame nextInboundFrame(String payload) {
        return new AudioFrame(inboundSequence++, payload);
    }

    public AudioFrame nextOutboundFrame(String payload) {
        return new AudioFrame(outboundSequence++, payload);
    }

    public void countMediaFrame() {
        mediaFrames++;
    }

    public boolean markAiReady() {
        if (aiReady) {
            return false;
        }
        aiReady = true;
        return true;
    }

    public boolean markAiConfigured() {
        if (aiConfigured) {
            return false;
        }
        aiConfigured = true;
        return true;
    }

    public void markAiLost() {
        aiReady = false;
        aiConfigured = false;
    }

    public void markMemoryResolved() {
        memoryResolved = true;
    }

    public boolean markOpeningRequested() {
        if (openingRequested) {
            return false;
        }
        openingRequested = true;
        return true;
    }

    public boolean isOpeningRequested() {
        return openingRequested;
    }

    public boolean isEnded() {
        return lifecycle == CallLifecycle.ENDED;
    }

    public boolean isStarted() {
        return identity != null;
    }

    public String sessionKey() {
        return sessionKey;
    }

    public long openedAt() {
        return openedAt;
    }

    public CallIdentity identity() {
        return identity;
    }

    public Long startedAt() {
        return startedAt;
    }

    public Long endedAt() {
        return endedAt;
    }

    public CallLifecycle lifecycle() {
        return lifecycle;
    }

    public boolean isAiReady() {
        return aiReady;
    }

    public boolean isAiConfigured() {
        return aiConfigured;
    }

    public boolean isMemoryResolved() {
        return memoryResolved;
    }

    public long mediaFrames() {
        return mediaFrames;
    }

    public AudioFrameQueue inboundQueue() {
        return inboundQueue;
    }

    public AudioFrameQueue outboundQueue() {
        return outboundQueue;
    }

    public TurnOrchestrator turns() {
        return turns;
    }

    public GateStateMachine gates() {
        return gates;
    }

    public DispositionLatch dispositionLatch() {
        return dispositionLatch;
    }
}
