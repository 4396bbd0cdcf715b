package me.go_gradually.phonedesk.domain.turn;

public record TurnTimings(long debounceMs,
                          int minActivityFrames,
                          InterruptionMode interruptionMode,
                          long bargeInMinMs,
                          long bargeInCooldownMs,
                          long audioDropWindowMs) {
    public TurnTimings {
        if (debounceMs < 0 || minActivityFrames < 0 || bargeInMinMs < 0 || bargeInCooldownMs < 0 || audioDropWindowMs < 0) {
            throw new IllegalArgumentException("turn timings must not be negative");
        }
        interruptionMode = interruptionMode == null ? InterruptionMode.BARGE_IN : interruptionMode;
    }

    public static TurnTimings defaults() {
        return new TurnTimings(350, 4, InterruptionMode.BARGE_IN, 250, 600, 300);
    }
}
