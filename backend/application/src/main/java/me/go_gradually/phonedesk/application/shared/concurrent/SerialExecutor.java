package me.go_gradually.phonedesk.application.shared.concurrent;

import me.go_gradually.phonedesk.application.shared.port.AsyncExecutor;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class SerialExecutor {
    private static final Logger log = Logger.getLogger(SerialExecutor.class.getName());

    private final String name;
    private final AsyncExecutor delegate;
    private final Queue<Runnable> tasks = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);

    public SerialExecutor(String name, AsyncExecutor delegate) {
        this.name = name;
        this.delegate = delegate;
    }

    public void execute(Runnable task) {
        if (task == null) {
            return;
        }
        tasks.add(task);
        schedule();
    }

    private void schedule() {
        if (tasks.isEmpty() || !draining.compareAndSet(false, true)) {
            return;
        }
        try {
            delegate.execute(this::drain);
        } catch (RuntimeException e) {
            draining.set(false);
            log.log(Level.WARNING, e, () -> "call.mailbox.rejected name=" + name + " pending=" + tasks.size());
            throw e;
        }
    }

    private void drain() {
        try {
            Runnable task;
            while ((task = tasks.poll()) != null) {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.log(Level.WARNING, e, () -> "call.mailbox.task_failed name=" + name);
                }
            }
        } finally {
            draining.set(false);
        }
        schedule();
    }

    public int pending() {
        return tasks.size();
    }
}
