package me.go_gradually.phonedesk.infrastructure.script;

import me.go_gradually.phonedesk.application.call.model.CallScript;
import me.go_gradually.phonedesk.domain.gate.GateTransition;
import me.go_gradually.phonedesk.infrastructure.shared.config.AppProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PropertiesCallScriptAdapterTest {

    @Test
    void load_buildsTemplatesSettingsAndRules() {
        AppProperties properties = new AppProperties();
        properties.getScript().getSettings().put("business", "Acme");
        properties.getScript().setGreeting("Hello from {{business}}");
        properties.getScript().setClosingUtterance("Goodbye");
        properties.getScript().getRules().add(rule("acme.hours", "when do you open", GateTransition.INFO_HOURS));

        PropertiesCallScriptAdapter adapter = new PropertiesCallScriptAdapter(properties);
        CallScript script = adapter.load();

        assertEquals("Acme", script.setting("business"));
        assertEquals("Hello from {{business}}", script.templates().greeting());
        assertEquals("Goodbye", script.templates().closingUtterance());
        assertEquals(1, script.rules().size());
        assertEquals("acme.hours", script.rules().get(0).id());
        assertEquals(GateTransition.INFO_HOURS, script.rules().get(0).transition());
        assertSame(script, adapter.load());
    }

    @Test
    void constructor_rejectsInvalidPattern() {
        AppProperties properties = new AppProperties();
        properties.getScript().getRules().add(rule("broken", "([a-z", GateTransition.CLOSING));

        assertThrows(IllegalArgumentException.class, () -> new PropertiesCallScriptAdapter(properties));
    }

    @Test
    void constructor_rejectsRuleWithoutTransition() {
        AppProperties properties = new AppProperties();
        properties.getScript().getRules().add(rule("partial", "bye", null));

        assertThrows(IllegalArgumentException.class, () -> new PropertiesCallScriptAdapter(properties));
    }

    private AppProperties.Rule rule(String id, String pattern, GateTransition transition) {
        AppProperties.Rule rule = new AppProperties.Rule();
        rule.setId(id);
        rule.setPattern(pattern);
        rule.setTransition(transition);
        return rule;
    }
}
