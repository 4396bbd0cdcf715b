package me.go_gradually.phonedesk.application.shared.port;

@FunctionalInterface
public interface AsyncExecutor {
    void execute(Runnable task);
}
