package me.go_gradually.phonedesk.application.call.policy;

import me.go_gradually.phonedesk.domain.disposition.InfoPrecedence;
import me.go_gradually.phonedesk.domain.gate.GatePolicy;
import me.go_gradually.phonedesk.domain.turn.TurnTimings;

import java.time.Duration;
import java.util.List;

public interface CallPolicy {
    TurnTimings turnTimings();

    int audioQueueCapacity();

    GatePolicy gatePolicy();

    int maxNameChars();

    int maxNameWords();

    List<String> extraNameStopwords();

    InfoPrecedence infoPrecedence();

    Duration recordingTimeout();

    Duration hangupAfterClosing();

    String providerMode();
}
