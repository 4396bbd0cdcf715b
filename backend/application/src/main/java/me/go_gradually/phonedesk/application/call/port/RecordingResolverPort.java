package me.go_gradually.phonedesk.application.call.port;

import java.time.Duration;
import java.util.Optional;

public interface RecordingResolverPort {
    Optional<String> resolve(String callSid, Duration budget);
}
