package me.go_gradually.phonedesk.domain.turn;

public enum InterruptionMode {
    BARGE_IN,
    HALF_DUPLEX,
    NONE
}
