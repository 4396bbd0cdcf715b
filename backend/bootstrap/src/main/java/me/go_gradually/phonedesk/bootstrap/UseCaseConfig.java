package me.go_gradually.phonedesk.bootstrap;

import me.go_gradually.phonedesk.application.call.policy.CallPolicy;
import me.go_gradually.phonedesk.application.call.port.CallNotificationPort;
import me.go_gradually.phonedesk.application.call.port.CallScriptPort;
import me.go_gradually.phonedesk.application.call.port.CallerMemoryPort;
import me.go_gradually.phonedesk.application.call.port.RecordingResolverPort;
import me.go_gradually.phonedesk.application.call.port.VoiceBackendGateway;
import me.go_gradually.phonedesk.application.call.usecase.CallDispositionUseCase;
import me.go_gradually.phonedesk.application.call.usecase.CallSessionUseCase;
import me.go_gradually.phonedesk.application.shared.port.AsyncExecutor;
import me.go_gradually.phonedesk.application.shared.port.CallScheduler;
import me.go_gradually.phonedesk.application.shared.port.MetricsPort;
import me.go_gradually.phonedesk.infrastructure.shared.scheduling.ExecutorCallScheduler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
public class UseCaseConfig {
    private static final int TIMER_THREADS = 2;

    @Bean(destroyMethod = "shutdown")
    public ExecutorService callExecutorService() {
        return Executors.newCachedThreadPool();
    }

    @Bean
    public AsyncExecutor asyncExecutor(ExecutorService callExecutorService) {
        return callExecutorService::execute;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService callTimerExecutor() {
        return Executors.newScheduledThreadPool(TIMER_THREADS);
    }

    @Bean
    public CallScheduler callScheduler(ScheduledExecutorService callTimerExecutor) {
        return new ExecutorCallScheduler(callTimerExecutor);
    }

    @Bean
    public CallDispositionUseCase callDispositionUseCase(RecordingResolverPort recordingResolver,
                                                         CallNotificationPort notificationPort,
                                                         AsyncExecutor asyncExecutor,
                                                         CallPolicy callPolicy,
                                                         MetricsPort metricsPort,
                                                         Clock clock) {
        return new CallDispositionUseCase(recordingResolver, notificationPort, asyncExecutor, callPolicy, metricsPort, clock);
    }

    @Bean
    public CallSessionUseCase callSessionUseCase(VoiceBackendGateway voiceBackendGateway,
                                                 CallerMemoryPort callerMemory,
                                                 CallScriptPort callScriptPort,
                                                 CallDispositionUseCase callDispositionUseCase,
                                                 CallScheduler callScheduler,
                                                 AsyncExecutor asyncExecutor,
                                                 CallPolicy callPolicy,
                                                 MetricsPort metricsPort,
                                                 Clock clock) {
        return new CallSessionUseCase(
                voiceBackendGateway,
                callerMemory,
                callScriptPort,
                callDispositionUseCase,
                callScheduler,
                asyncExecutor,
                callPolicy,
                metricsPort,
                clock
        );
    }
}
