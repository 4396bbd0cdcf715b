package me.go_gradually.phonedesk.domain.gate;

public record GateMatch(GateRule rule, String captured) {
    public GateTransition transition() {
        return rule.transition();
    }
}
