package me.go_gradually.phonedesk.domain.turn;

public enum TurnKind {
    OPENING,
    FREE_FORM,
    CLOSING;

    public boolean isScripted() {
        return this != FREE_FORM;
    }
}
