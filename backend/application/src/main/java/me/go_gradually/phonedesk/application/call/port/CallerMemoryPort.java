package me.go_gradually.phonedesk.application.call.port;

import me.go_gradually.phonedesk.domain.caller.CallerMemory;

import java.util.Optional;

public interface CallerMemoryPort {
    Optional<CallerMemory> lookup(String callerAddress);

    void upsertCall(String callerAddress);

    void saveName(String callerAddress, String name);
}
