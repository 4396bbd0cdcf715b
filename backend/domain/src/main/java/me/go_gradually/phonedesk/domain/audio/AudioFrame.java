package me.go_gradually.phonedesk.domain.audio;

public record AudioFrame(long sequence, String payload) {
    public AudioFrame {
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must not be negative");
        }
        if (payload == null || payload.isEmpty()) {
            throw new IllegalArgumentException("payload is required");
        }
    }
}
