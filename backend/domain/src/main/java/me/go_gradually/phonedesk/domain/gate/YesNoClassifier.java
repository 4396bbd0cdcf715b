package me.go_gradually.phonedesk.domain.gate;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

public final class YesNoClassifier {
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    private static final Set<String> AFFIRMATIVE_EXACT = Set.of(
            "yes", "yeah", "yep", "ya", "yup", "uh huh", "uh-huh", "ok", "okay",
            "sure", "correct", "right", "absolutely", "definitely", "that's right",
            "כן", "נכון", "בטח", "בסדר", "אוקיי", "כן כן"
    );

    private static final Set<String> NEGATIVE_EXACT = Set.of(
            "no", "nope", "nah", "no thanks", "not that one", "different number",
            "לא", "לא לא", "ממש לא", "לא תודה"
    );

    private static final Pattern AFFIRMATIVE_PATTERN = Pattern.compile(
            "\\b(?:yes|yeah|yep|yup|ok|okay|sure|correct|right|absolutely|definitely|כן|נכון|בטח|בסדר)\\b",
            FLAGS
    );

    private static final Pattern NEGATIVE_PATTERN = Pattern.compile(
            "\\b(?:no|nope|nah|not|don't|dont|different|another|other|לא|אחר)\\b",
            FLAGS
    );

    private YesNoClassifier() {
    }

    public static Answer classify(String text) {
        if (text == null || text.isBlank()) {
            return Answer.UNKNOWN;
        }
        String normalized = text.replace('’', '\'')
                .replaceAll("[.!?,]+", " ")
                .trim()
                .replaceAll("\\s+", " ")
                .toLowerCase(Locale.ROOT);

        if (AFFIRMATIVE_EXACT.contains(normalized)) {
            return Answer.YES;
        }
        if (NEGATIVE_EXACT.contains(normalized)) {
            return Answer.NO;
        }
        boolean affirmative = AFFIRMATIVE_PATTERN.matcher(normalized).find();
        boolean negative = NEGATIVE_PATTERN.matcher(normalized).find();
        if (affirmative && negative) {
            return Answer.UNKNOWN;
        }
        if (affirmative) {
            return Answer.YES;
        }
        return negative ? Answer.NO : Answer.UNKNOWN;
    }

    public enum Answer {
        YES,
        NO,
        UNKNOWN
    }
}
