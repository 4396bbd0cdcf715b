package me.go_gradually.phonedesk.infrastructure.shared.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import me.go_gradually.phonedesk.application.shared.port.MetricsPort;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class MicrometerMetricsAdapter implements MetricsPort {
    private final MeterRegistry meterRegistry;

    public MicrometerMetricsAdapter(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void recordCallDuration(Duration duration) {
        record("call.duration", duration);
    }

    @Override
    public void recordRecordingResolveLatency(Duration duration) {
        record("call.recording.resolve.latency", duration);
    }

    @Override
    public void incrementTurnRequested() {
        meterRegistry.counter("call.turns.requested").increment();
    }

    @Override
    public void incrementBargeIn() {
        meterRegistry.counter("call.bargeins").increment();
    }

    @Override
    public void incrementAudioFramesDropped(String direction, int count) {
        if (count <= 0) {
            return;
        }
        meterRegistry.counter("call.audio.frames_dropped", "direction", direction).increment(count);
    }

    @Override
    public void incrementDisposition(String category) {
        meterRegistry.counter("call.dispositions", "category", category).increment();
    }

    @Override
    public void incrementNotificationFailed() {
        meterRegistry.counter("call.notifications.failed").increment();
    }

    @Override
    public void incrementRecordingMissing() {
        meterRegistry.counter("call.recordings.missing").increment();
    }

    private void record(String name, Duration duration) {
        Timer.builder(name)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(duration);
    }
}
