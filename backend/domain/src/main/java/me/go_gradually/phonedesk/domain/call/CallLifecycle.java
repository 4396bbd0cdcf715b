package me.go_gradually.phonedesk.domain.call;

// OPEN → ACTIVE → ENDING → ENDED, 뒤로 돌아가지 않는다.
public enum CallLifecycle {
    OPEN,
    ACTIVE,
    ENDING,
    ENDED;

    public boolean canMoveTo(CallLifecycle next) {
        return next != null && next.ordinal() > ordinal();
    }
}
