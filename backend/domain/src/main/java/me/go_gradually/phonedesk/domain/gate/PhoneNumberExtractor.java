package me.go_gradually.phonedesk.domain.gate;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class PhoneNumberExtractor {
    private static final int MIN_DIGITS = 9;
    private static final int MAX_DIGITS = 10;
    private static final String INTERNATIONAL_PREFIX = "972";

    private static final Map<String, String> DIGIT_WORDS = Map.ofEntries(
            Map.entry("zero", "0"),
            Map.entry("one", "1"), Map.entry("two", "2"), Map.entry("three", "3"),
            Map.entry("four", "4"), Map.entry("five", "5"), Map.entry("six", "6"),
            Map.entry("seven", "7"), Map.entry("eight", "8"), Map.entry("nine", "9"),
            Map.entry("אפס", "0"),
            Map.entry("אחת", "1"), Map.entry("אחד", "1"),
            Map.entry("שתיים", "2"), Map.entry("שניים", "2"), Map.entry("שתים", "2"),
            Map.entry("שלוש", "3"), Map.entry("שלושה", "3"),
            Map.entry("ארבע", "4"), Map.entry("ארבעה", "4"),
            Map.entry("חמש", "5"), Map.entry("חמישה", "5"),
            Map.entry("שש", "6"), Map.entry("שישה", "6"),
            Map.entry("שבע", "7"), Map.entry("שבעה", "7"),
            Map.entry("שמונה", "8"),
            Map.entry("תשע", "9"), Map.entry("תשעה", "9")
    );

    private PhoneNumberExtractor() {
    }

    public static Optional<String> extract(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String[] tokens = text.toLowerCase(Locale.ROOT).split("[\\s,]+");
        StringBuilder group = new StringBuilder();
        for (String raw : tokens) {
            String digits = toDigits(raw);
            if (digits != null) {
                group.append(digits);
                continue;
            }
            Optional<String> accepted = accept(group);
            if (accepted.isPresent()) {
                return accepted;
            }
            group.setLength(0);
        }
        return accept(group);
    }

    private static Optional<String> accept(StringBuilder group) {
        if (group.length() == 0) {
            return Optional.empty();
        }
        String digits = group.toString();
        if (digits.startsWith(INTERNATIONAL_PREFIX) && digits.length() > MAX_DIGITS) {
            digits = "0" + digits.substring(INTERNATIONAL_PREFIX.length());
        }
        if (digits.length() < MIN_DIGITS || digits.length() > MAX_DIGITS) {
            return Optional.empty();
        }
        return Optional.of(digits);
    }

    private static String toDigits(String raw) {
        String token = raw.replaceAll("^[^\\p{L}\\p{N}+]+|[^\\p{L}\\p{N}]+$", "");
        if (token.isEmpty()) {
            return null;
        }
        String stripped = token.replaceAll("[+\\-.()]", "");
        if (!stripped.isEmpty() && stripped.chars().allMatch(Character::isDigit)) {
            return stripped;
        }
        String word = DIGIT_WORDS.get(token);
        if (word != null) {
            return word;
        }
        if (token.length() > 1 && token.charAt(0) == 'ו') {
            return DIGIT_WORDS.get(token.substring(1));
        }
        return null;
    }
}
