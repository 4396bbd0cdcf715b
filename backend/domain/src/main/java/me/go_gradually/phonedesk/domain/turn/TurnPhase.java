package me.go_gradually.phonedesk.domain.turn;

public enum TurnPhase {
    IDLE,
    TURN_REQUESTED,
    SPEAKING
}
