package me.go_gradually.phonedesk.domain.gate;

public record GatePolicy(boolean earlyNameCapture, long earlyNameWindowMs, int infoAnswerMaxChars) {
    public GatePolicy {
        if (earlyNameWindowMs < 0) {
            throw new IllegalArgumentException("earlyNameWindowMs must not be negative");
        }
        if (infoAnswerMaxChars <= 0) {
            throw new IllegalArgumentException("infoAnswerMaxChars must be positive");
        }
    }

    public static GatePolicy defaults() {
        return new GatePolicy(true, 20_000, 600);
    }
}
