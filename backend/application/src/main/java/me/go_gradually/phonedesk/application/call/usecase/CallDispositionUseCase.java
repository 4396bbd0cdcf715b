package me.go_gradually.phonedesk.application.call.usecase;

import me.go_gradually.phonedesk.application.call.model.CallNotification;
import me.go_gradually.phonedesk.application.call.model.CallReport;
import me.go_gradually.phonedesk.application.call.policy.CallPolicy;
import me.go_gradually.phonedesk.application.call.port.CallNotificationPort;
import me.go_gradually.phonedesk.application.call.port.RecordingResolverPort;
import me.go_gradually.phonedesk.application.shared.port.AsyncExecutor;
import me.go_gradually.phonedesk.application.shared.port.MetricsPort;
import me.go_gradually.phonedesk.domain.call.CallIdentity;
import me.go_gradually.phonedesk.domain.call.CallSession;
import me.go_gradually.phonedesk.domain.disposition.DispositionDecision;
import me.go_gradually.phonedesk.domain.disposition.DispositionLatch;
import me.go_gradually.phonedesk.domain.disposition.DispositionPolicy;
import me.go_gradually.phonedesk.domain.disposition.DispositionTrigger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

public class CallDispositionUseCase {
    private static final Logger log = Logger.getLogger(CallDispositionUseCase.class.getName());

    private final RecordingResolverPort recordingResolver;
    private final CallNotificationPort notificationPort;
    private final AsyncExecutor asyncExecutor;
    private final CallPolicy callPolicy;
    private final MetricsPort metrics;
    private final Clock clock;

    public CallDispositionUseCase(RecordingResolverPort recordingResolver,
                                  CallNotificationPort notificationPort,
                                  AsyncExecutor asyncExecutor,
                                  CallPolicy callPolicy,
                                  MetricsPort metrics,
                                  Clock clock) {
        this.recordingResolver = recordingResolver;
        this.notificationPort = notificationPort;
        this.asyncExecutor = asyncExecutor;
        this.callPolicy = callPolicy;
        this.metrics = metrics;
        this.clock = clock;
    }

    // 세션 메일박스 안에서만 호출한다. 처음 호출만 결정을 내리고, 녹음 조회와 발송은 비동기로 넘긴다.
    public Optional<DispositionDecision> dispatch(CallSession session, DispositionTrigger trigger) {
        if (!session.isStarted()) {
            log.fine(() -> "call.disposition skipped reason=no_start_event session=" + session.sessionKey()
                    + " trigger=" + trigger);
            return Optional.empty();
        }
        DispositionLatch latch = session.dispositionLatch();
        Optional<DispositionDecision> decided = latch.decideOnce(
                () -> DispositionPolicy.decide(session.gates().snapshot(), callPolicy.infoPrecedence()),
                trigger
        );
        if (decided.isEmpty()) {
            return Optional.empty();
        }
        DispositionDecision decision = decided.get();
        if (!latch.markSent(decision.disposition())) {
            return Optional.empty();
        }
        CallReport report = report(session, decision, trigger, clock.instant());
        metrics.incrementDisposition(decision.disposition().name());
        log.info(() -> "call.disposition decided callSid=" + report.callSid()
                + " category=" + decision.disposition()
                + " reason=" + decision.reason()
                + " trigger=" + trigger);
        asyncExecutor.execute(() -> deliver(report));
        return decided;
    }

    void deliver(CallReport report) {
        Instant resolveStartedAt = clock.instant();
        Optional<String> recording = resolveRecording(report.callSid());
        metrics.recordRecordingResolveLatency(Duration.between(resolveStartedAt, clock.instant()));
        if (recording.isEmpty()) {
            metrics.incrementRecordingMissing();
        }

        CallNotification notification = new CallNotification(report, recording.orElse(null));
        boolean delivered;
        try {
            delivered = notificationPort.send(notification);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, e, () -> "call.notification failure callSid=" + report.callSid());
            delivered = false;
        }
        if (delivered) {
            log.info(() -> "call.notification delivered callSid=" + report.callSid()
                    + " category=" + notification.category()
                    + " recording=" + notification.recordingStatus());
        } else {
            metrics.incrementNotificationFailed();
            log.warning(() -> "call.notification undelivered callSid=" + report.callSid()
                    + " category=" + notification.category());
        }
    }

    private Optional<String> resolveRecording(String callSid) {
        try {
            return recordingResolver.resolve(callSid, callPolicy.recordingTimeout());
        } catch (RuntimeException e) {
            log.log(Level.WARNING, e, () -> "call.recording.resolve failure callSid=" + callSid);
            return Optional.empty();
        }
    }

    private CallReport report(CallSession session,
                              DispositionDecision decision,
                              DispositionTrigger trigger,
                              Instant decidedAt) {
        CallIdentity identity = session.identity();
        Instant startedAt = Instant.ofEpochMilli(session.startedAt());
        Instant endedAt = session.endedAt() == null ? decidedAt : Instant.ofEpochMilli(session.endedAt());
        long durationSeconds = Math.max(0L, Duration.between(startedAt, endedAt).getSeconds());
        return new CallReport(
                identity.callSid(),
                session.streamSid(),
                identity.caller(),
                identity.called(),
                startedAt,
                endedAt,
                durationSeconds,
                session.mediaFrames(),
                callPolicy.providerMode(),
                identity.customParameters(),
                decision,
                trigger,
                session.gates().snapshot()
        );
    }
}
