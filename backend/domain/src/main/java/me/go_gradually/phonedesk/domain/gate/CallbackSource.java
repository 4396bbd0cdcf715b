package me.go_gradually.phonedesk.domain.gate;

public enum CallbackSource {
    CALLER_ID,
    SPOKEN
}
