package me.go_gradually.phonedesk.domain.disposition;

public enum Disposition {
    FINAL,
    PARTIAL,
    INFO,
    ABANDONED
}
