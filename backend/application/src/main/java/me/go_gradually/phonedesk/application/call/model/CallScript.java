package me.go_gradually.phonedesk.application.call.model;

import me.go_gradually.phonedesk.domain.gate.GateRule;

import java.util.List;
import java.util.Map;

public record CallScript(Map<String, String> settings, PromptTemplates templates, List<GateRule> rules) {
    public CallScript {
        settings = settings == null ? Map.of() : Map.copyOf(settings);
        rules = rules == null ? List.of() : List.copyOf(rules);
        if (templates == null) {
            throw new IllegalArgumentException("templates are required");
        }
    }

    public String setting(String key) {
        return settings.get(key);
    }
}
