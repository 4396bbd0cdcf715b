package me.go_gradually.phonedesk.application.shared.port;

import java.time.Duration;

public interface CallScheduler {
    ScheduledTask schedule(Runnable task, Duration delay);

    interface ScheduledTask {
        void cancel();
    }
}
