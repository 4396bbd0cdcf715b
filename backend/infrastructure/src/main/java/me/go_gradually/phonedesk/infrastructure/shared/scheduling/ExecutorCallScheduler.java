package me.go_gradually.phonedesk.infrastructure.shared.scheduling;

import me.go_gradually.phonedesk.application.shared.port.CallScheduler;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

public class ExecutorCallScheduler implements CallScheduler {
    private static final Logger log = Logger.getLogger(ExecutorCallScheduler.class.getName());

    private final ScheduledExecutorService executor;

    public ExecutorCallScheduler(ScheduledExecutorService executor) {
        this.executor = executor;
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        long delayMs = Math.max(0L, delay == null ? 0L : delay.toMillis());
        ScheduledFuture<?> future = executor.schedule(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, e, () -> "call.timer.failed delayMs=" + delayMs);
            }
        }, delayMs, TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }
}
