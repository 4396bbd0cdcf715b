package me.go_gradually.phonedesk.domain.disposition;

public record DispositionDecision(Disposition disposition, Reason reason) {
    public DispositionDecision {
        if (disposition == null || reason == null) {
            throw new IllegalArgumentException("disposition and reason are required");
        }
    }

    public enum Reason {
        ALL_FACTS_CAPTURED,
        NAME_WITHOUT_MESSAGE,
        CALLBACK_NUMBER_MISSING,
        INFO_ANSWERED,
        NO_NAME,
        NAME_ONLY_FALLBACK
    }
}
