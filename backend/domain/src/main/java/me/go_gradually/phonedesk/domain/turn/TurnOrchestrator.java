package me.go_gradually.phonedesk.domain.turn;

import java.util.Optional;

// 시각은 호출자가 epoch millis로 넘긴다.
public final class TurnOrchestrator {
    private static final long NEVER = Long.MIN_VALUE;

    private final TurnTimings timings;
    private TurnPhase phase = TurnPhase.IDLE;
    private TurnKind currentKind;
    private long currentTurnId;
    private long turnSequence;
    private long lastTurnRequestAt = NEVER;
    private int activitySinceLastTurn;
    private boolean assistantSpeaking;
    private boolean speechActive;
    private long speechStartedAt = NEVER;
    private long lastBargeInAt = NEVER;
    private long audioDropUntil = NEVER;
    private boolean pendingUntilReady;
    private boolean retryWarranted;
    private boolean closingMode;
    private boolean closingIssued;

    public TurnOrchestrator(TurnTimings timings) {
        this.timings = timings == null ? TurnTimings.defaults() : timings;
    }

    public void recordCallerFrame() {
        if (activitySinceLastTurn < Integer.MAX_VALUE) {
            activitySinceLastTurn++;
        }
    }

    public boolean shouldDropInbound() {
        return timings.interruptionMode() == InterruptionMode.HALF_DUPLEX && assistantSpeaking;
    }

    public TurnDecision onSpeechStopped(long now, boolean backendConfigured) {
        speechActive = false;
        return evaluate(now, backendConfigured);
    }

    public TurnDecision evaluate(long now, boolean backendConfigured) {
        if (closingIssued) {
            return TurnDecision.skipped(DecisionReason.SUPPRESSED_AFTER_CLOSING);
        }
        if (phase != TurnPhase.IDLE) {
            // 진행 중인 턴이 끝나면 다시 평가한다.
            retryWarranted = true;
            return TurnDecision.skipped(DecisionReason.REJECTED_IN_FLIGHT);
        }
        if (!backendConfigured) {
            pendingUntilReady = true;
            return TurnDecision.skipped(DecisionReason.DEFERRED_NOT_READY);
        }
        if (closingMode) {
            return request(now, TurnKind.CLOSING);
        }
        if (lastTurnRequestAt != NEVER && now - lastTurnRequestAt < timings.debounceMs()) {
            return TurnDecision.skipped(DecisionReason.SKIPPED_DEBOUNCE);
        }
        if (activitySinceLastTurn < timings.minActivityFrames()) {
            return TurnDecision.skipped(DecisionReason.SKIPPED_LOW_ACTIVITY);
        }
        return request(now, TurnKind.FREE_FORM);
    }

    public TurnDecision requestOpening(long now, boolean backendConfigured) {
        if (closingMode || closingIssued) {
            return TurnDecision.skipped(DecisionReason.SUPPRESSED_AFTER_CLOSING);
        }
        if (phase != TurnPhase.IDLE) {
            return TurnDecision.skipped(DecisionReason.REJECTED_IN_FLIGHT);
        }
        if (!backendConfigured) {
            return TurnDecision.skipped(DecisionReason.DEFERRED_NOT_READY);
        }
        return request(now, TurnKind.OPENING);
    }

    public boolean consumePending() {
        boolean pending = pendingUntilReady;
        pendingUntilReady = false;
        return pending;
    }

    public boolean markAccepted(long turnId) {
        if (phase != TurnPhase.TURN_REQUESTED || !isCurrent(turnId)) {
            return false;
        }
        phase = TurnPhase.SPEAKING;
        return true;
    }

    public boolean admitAssistantAudio(long turnId, long now) {
        if (phase == TurnPhase.IDLE || !isCurrent(turnId)) {
            return false;
        }
        if (audioDropUntil != NEVER && now < audioDropUntil) {
            return false;
        }
        if (phase == TurnPhase.TURN_REQUESTED) {
            phase = TurnPhase.SPEAKING;
        }
        assistantSpeaking = true;
        return true;
    }

    public void markAudioDone(long turnId) {
        if (isCurrent(turnId)) {
            assistantSpeaking = false;
        }
    }

    public TurnCompletion markCompleted(long turnId) {
        if (phase == TurnPhase.IDLE || !isCurrent(turnId)) {
            return TurnCompletion.ignored();
        }
        TurnKind kind = currentKind;
        boolean retry = retryWarranted && kind != TurnKind.CLOSING;
        phase = TurnPhase.IDLE;
        assistantSpeaking = false;
        retryWarranted = false;
        return new TurnCompletion(true, kind, retry);
    }

    public boolean onSpeechStarted(long now) {
        speechActive = true;
        speechStartedAt = now;
        return bargeInEligible();
    }

    // 타이머 만료 시점에 발화가 계속되고 쿨다운이 지났으면 진행 중인 턴을 취소 상태로 돌린다.
    public boolean onBargeInTimer(long now) {
        if (!speechActive || !bargeInEligible()) {
            return false;
        }
        if (now - speechStartedAt < timings.bargeInMinMs()) {
            return false;
        }
        if (lastBargeInAt != NEVER && now - lastBargeInAt < timings.bargeInCooldownMs()) {
            return false;
        }
        lastBargeInAt = now;
        audioDropUntil = now + timings.audioDropWindowMs();
        resetInFlight();
        return true;
    }

    public boolean enterClosing() {
        if (closingMode) {
            return false;
        }
        closingMode = true;
        return true;
    }

    public boolean cancelInFlight() {
        if (phase == TurnPhase.IDLE) {
            return false;
        }
        resetInFlight();
        return true;
    }

    // 아직 수락되지 않은 턴을 버리고, 버린 턴의 종류를 돌려준다.
    public Optional<TurnKind> abandonUnaccepted() {
        if (phase != TurnPhase.TURN_REQUESTED) {
            return Optional.empty();
        }
        resetInFlight();
        return Optional.of(currentKind);
    }

    public void onConnectionLost() {
        resetInFlight();
        pendingUntilReady = false;
        speechActive = false;
    }

    private boolean bargeInEligible() {
        return timings.interruptionMode() == InterruptionMode.BARGE_IN
                && phase == TurnPhase.SPEAKING
                && currentKind != TurnKind.CLOSING;
    }

    private boolean isCurrent(long turnId) {
        return turnId == 0L || turnId == currentTurnId;
    }

    private void resetInFlight() {
        phase = TurnPhase.IDLE;
        assistantSpeaking = false;
        retryWarranted = false;
    }

    private TurnDecision request(long now, TurnKind kind) {
        phase = TurnPhase.TURN_REQUESTED;
        currentKind = kind;
        currentTurnId = ++turnSequence;
        lastTurnRequestAt = now;
        activitySinceLastTurn = 0;
        retryWarranted = false;
        if (kind == TurnKind.CLOSING) {
            closingIssued = true;
        }
        return new TurnDecision(DecisionReason.REQUESTED, kind, currentTurnId);
    }

    public TurnPhase phase() {
        return phase;
    }

    public boolean isResponseInFlight() {
        return phase != TurnPhase.IDLE;
    }

    public boolean isAssistantSpeaking() {
        return assistantSpeaking;
    }

    public boolean isSpeechActive() {
        return speechActive;
    }

    public boolean isClosingMode() {
        return closingMode;
    }

    public boolean isPendingUntilReady() {
        return pendingUntilReady;
    }

    public long currentTurnId() {
        return currentTurnId;
    }

    public TurnKind currentKind() {
        return currentKind;
    }

    public int activitySinceLastTurn() {
        return activitySinceLastTurn;
    }

    public TurnTimings timings() {
        return timings;
    }

    public enum DecisionReason {
        REQUESTED,
        REJECTED_IN_FLIGHT,
        DEFERRED_NOT_READY,
        SKIPPED_DEBOUNCE,
        SKIPPED_LOW_ACTIVITY,
        SUPPRESSED_AFTER_CLOSING
    }

    public record TurnDecision(DecisionReason reason, TurnKind kind, long turnId) {
        private static TurnDecision skipped(DecisionReason reason) {
            return new TurnDecision(reason, null, 0L);
        }

        public boolean requested() {
            return reason == DecisionReason.REQUESTED;
        }
    }

    public record TurnCompletion(boolean matched, TurnKind kind, boolean retryWarranted) {
        private static TurnCompletion ignored() {
            return new TurnCompletion(false, null, false);
        }
    }
}
