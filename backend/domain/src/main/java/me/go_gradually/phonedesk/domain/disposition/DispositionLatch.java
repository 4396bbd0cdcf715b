package me.go_gradually.phonedesk.domain.disposition;

import java.util.Optional;
import java.util.function.Supplier;

// 통화당 한 번만 결정하고 한 범주만 발송한다.
public final class DispositionLatch {
    private DispositionDecision decision;
    private DispositionTrigger trigger;
    private Disposition sent;

    public Optional<DispositionDecision> decideOnce(Supplier<DispositionDecision> decider, DispositionTrigger trigger) {
        if (decision != null) {
            return Optional.empty();
        }
        DispositionDecision decided = decider.get();
        if (decided == null) {
            throw new IllegalStateException("decider returned no decision");
        }
        this.decision = decided;
        this.trigger = trigger;
        return Optional.of(decided);
    }

    public boolean markSent(Disposition category) {
        if (sent != null || category == null) {
            return false;
        }
        sent = category;
        return true;
    }

    public boolean isDecided() {
        return decision != null;
    }

    public Optional<DispositionDecision> decision() {
        return Optional.ofNullable(decision);
    }

    public Optional<DispositionTrigger> trigger() {
        return Optional.ofNullable(trigger);
    }

    public Optional<Disposition> sent() {
        return Optional.ofNullable(sent);
    }
}
