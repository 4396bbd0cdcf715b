package me.go_gradually.phonedesk.application.shared.policy;

public interface ServiceStatusPolicy {
    String serviceName();

    String providerMode();

    boolean notificationConfigured();
}
