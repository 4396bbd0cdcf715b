package me.go_gradually.phonedesk.presentation.health.controller;

import me.go_gradually.phonedesk.application.shared.policy.ServiceStatusPolicy;
import me.go_gradually.phonedesk.presentation.health.dto.HealthResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

@RestController
public class HealthController {
    private final ServiceStatusPolicy statusPolicy;
    private final Clock clock;

    public HealthController(ServiceStatusPolicy statusPolicy, Clock clock) {
        this.statusPolicy = statusPolicy;
        this.clock = clock;
    }

    @GetMapping("/health")
    public HealthResponse health() {
        String providerMode = statusPolicy.providerMode();
        return new HealthResponse(
                true,
                statusPolicy.serviceName(),
                clock.instant().toString(),
                statusPolicy.notificationConfigured(),
                providerMode == null || providerMode.isBlank() ? null : providerMode
        );
    }
}
