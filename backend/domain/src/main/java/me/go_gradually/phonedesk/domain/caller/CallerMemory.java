package me.go_gradually.phonedesk.domain.caller;

import java.time.Instant;
import java.util.Optional;

public record CallerMemory(String callerKey, String name, long callCount, Instant lastCallAt) {
    public CallerMemory {
        if (callerKey == null || callerKey.isBlank()) {
            throw new IllegalArgumentException("callerKey is required");
        }
        if (callCount < 0) {
            throw new IllegalArgumentException("callCount must not be negative");
        }
    }

    public Optional<String> knownName() {
        return name == null || name.isBlank() ? Optional.empty() : Optional.of(name.trim());
    }
}
