package me.go_gradually.phonedesk.domain.disposition;

import me.go_gradually.phonedesk.domain.gate.GateSnapshot;

public final class DispositionPolicy {
    private DispositionPolicy() {
    }

    public static DispositionDecision decide(GateSnapshot gates, InfoPrecedence precedence) {
        GateSnapshot snapshot = gates == null ? GateSnapshot.empty() : gates;
        InfoPrecedence infoPrecedence = precedence == null ? InfoPrecedence.REGARDLESS_OF_NAME : precedence;
        boolean callbackMissing = snapshot.callbackRequested() && !snapshot.hasCallbackNumber();

        if (snapshot.hasName() && snapshot.hasMessage() && !callbackMissing) {
            return new DispositionDecision(Disposition.FINAL, DispositionDecision.Reason.ALL_FACTS_CAPTURED);
        }
        if (infoPrecedence == InfoPrecedence.REGARDLESS_OF_NAME && snapshot.infoProvided()) {
            return info();
        }
        if (snapshot.hasName() && !snapshot.hasMessage()) {
            return new DispositionDecision(Disposition.PARTIAL, DispositionDecision.Reason.NAME_WITHOUT_MESSAGE);
        }
        if (snapshot.hasName() && callbackMissing) {
            return new DispositionDecision(Disposition.PARTIAL, DispositionDecision.Reason.CALLBACK_NUMBER_MISSING);
        }
        if (snapshot.infoProvided() && !snapshot.hasName()) {
            return info();
        }
        if (!snapshot.hasName()) {
            return new DispositionDecision(Disposition.ABANDONED, DispositionDecision.Reason.NO_NAME);
        }
        // 도달하지 않아야 하지만 이름이 있으면 결정 없음 대신 PARTIAL.
        return new DispositionDecision(Disposition.PARTIAL, DispositionDecision.Reason.NAME_ONLY_FALLBACK);
    }

    private static DispositionDecision info() {
        return new DispositionDecision(Disposition.INFO, DispositionDecision.Reason.INFO_ANSWERED);
    }
}
