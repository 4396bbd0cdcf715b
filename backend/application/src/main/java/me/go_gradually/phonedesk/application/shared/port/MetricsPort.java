package me.go_gradually.phonedesk.application.shared.port;

import java.time.Duration;

public interface MetricsPort {
    void recordCallDuration(Duration duration);

    void recordRecordingResolveLatency(Duration duration);

    void incrementTurnRequested();

    void incrementBargeIn();

    void incrementAudioFramesDropped(String direction, int count);

    void incrementDisposition(String category);

    void incrementNotificationFailed();

    void incrementRecordingMissing();
}
