package me.go_gradually.phonedesk.domain.disposition;

public enum DispositionTrigger {
    CLOSING_FORCED,
    TRANSPORT_STOP,
    TRANSPORT_CLOSE
}
