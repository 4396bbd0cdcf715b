package me.go_gradually.phonedesk.domain.gate;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public record GateRule(String id, Pattern pattern, GateTransition transition) {
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    public GateRule {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("rule id is required");
        }
        if (pattern == null || transition == null) {
            throw new IllegalArgumentException("pattern and transition are required");
        }
    }

    public static GateRule of(String id, String regex, GateTransition transition) {
        return new GateRule(id, Pattern.compile(regex, FLAGS), transition);
    }

    public Optional<GateMatch> match(Utterance.Source source, String normalizedText) {
        if (source != transition.source() || normalizedText == null) {
            return Optional.empty();
        }
        Matcher matcher = pattern.matcher(normalizedText);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String captured = null;
        if (transition.isIntroduction()) {
            captured = matcher.groupCount() >= 1 && matcher.group(1) != null
                    ? matcher.group(1)
                    : normalizedText.substring(matcher.end());
        }
        return Optional.of(new GateMatch(this, captured));
    }
}
