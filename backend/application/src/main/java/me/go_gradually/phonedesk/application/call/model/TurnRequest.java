package me.go_gradually.phonedesk.application.call.model;

import me.go_gradually.phonedesk.domain.turn.TurnKind;

public record TurnRequest(long turnId, TurnKind kind, String utterance) {
    public TurnRequest {
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        if (kind.isScripted() && (utterance == null || utterance.isBlank())) {
            throw new IllegalArgumentException("scripted turn requires an utterance");
        }
    }
}
