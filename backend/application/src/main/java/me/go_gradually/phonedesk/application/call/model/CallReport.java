package me.go_gradually.phonedesk.application.call.model;

import me.go_gradually.phonedesk.domain.disposition.DispositionDecision;
import me.go_gradually.phonedesk.domain.disposition.DispositionTrigger;
import me.go_gradually.phonedesk.domain.gate.GateSnapshot;

import java.time.Instant;
import java.util.Map;

public record CallReport(String callSid,
                         String streamSid,
                         String caller,
                         String called,
                         Instant startedAt,
                         Instant endedAt,
                         long durationSeconds,
                         long mediaFrames,
                         String providerMode,
                         Map<String, String> customParameters,
                         DispositionDecision decision,
                         DispositionTrigger trigger,
                         GateSnapshot gates) {
    public CallReport {
        customParameters = customParameters == null ? Map.of() : Map.copyOf(customParameters);
    }
}
