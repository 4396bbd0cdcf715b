package me.go_gradually.phonedesk.application.call.model;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public record PromptTemplates(String instructions,
                              String greeting,
                              String returningGreeting,
                              String closingUtterance) {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_.-]+)\\s*}}");

    // {{key}} 자리를 값으로 채운다. 값이 없는 자리는 빈 문자열이 된다.
    public static String render(String template, Map<String, String> values) {
        if (template == null) {
            return "";
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder rendered = new StringBuilder();
        while (matcher.find()) {
            String value = values == null ? null : values.get(matcher.group(1));
            matcher.appendReplacement(rendered, Matcher.quoteReplacement(value == null ? "" : value));
        }
        matcher.appendTail(rendered);
        return rendered.toString().replaceAll("\\s{2,}", " ").trim();
    }
}
