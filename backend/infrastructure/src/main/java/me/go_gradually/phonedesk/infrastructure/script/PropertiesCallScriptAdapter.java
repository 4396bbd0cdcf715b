package me.go_gradually.phonedesk.infrastructure.script;

import me.go_gradually.phonedesk.application.call.model.CallScript;
import me.go_gradually.phonedesk.application.call.model.PromptTemplates;
import me.go_gradually.phonedesk.application.call.port.CallScriptPort;
import me.go_gradually.phonedesk.domain.gate.GateRule;
import me.go_gradually.phonedesk.infrastructure.shared.config.AppProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.PatternSyntaxException;

@Component
public class PropertiesCallScriptAdapter implements CallScriptPort {
    private static final Logger log = Logger.getLogger(PropertiesCallScriptAdapter.class.getName());

    private final CallScript script;

    public PropertiesCallScriptAdapter(AppProperties properties) {
        this.script = build(properties.getScript());
        log.info(() -> "call.script loaded settings=" + script.settings().keySet() + " rules=" + script.rules().size());
    }

    @Override
    public CallScript load() {
        return script;
    }

    private CallScript build(AppProperties.Script source) {
        PromptTemplates templates = new PromptTemplates(
                source.getInstructions(),
                source.getGreeting(),
                source.getReturningGreeting(),
                source.getClosingUtterance()
        );
        return new CallScript(source.getSettings(), templates, rules(source.getRules()));
    }

    private List<GateRule> rules(List<AppProperties.Rule> configured) {
        List<GateRule> rules = new ArrayList<>();
        if (configured == null) {
            return rules;
        }
        for (int i = 0; i < configured.size(); i++) {
            AppProperties.Rule rule = configured.get(i);
            String id = rule.getId() == null || rule.getId().isBlank() ? "script.rule-" + i : rule.getId().trim();
            if (rule.getPattern() == null || rule.getPattern().isBlank() || rule.getTransition() == null) {
                throw new IllegalArgumentException("Gate rule requires pattern and transition: " + id);
            }
            try {
                rules.add(GateRule.of(id, rule.getPattern(), rule.getTransition()));
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid gate rule pattern: " + id, e);
            }
        }
        return rules;
    }
}
