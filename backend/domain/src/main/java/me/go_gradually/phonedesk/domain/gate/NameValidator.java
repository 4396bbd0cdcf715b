package me.go_gradually.phonedesk.domain.gate;

import me.go_gradually.phonedesk.domain.util.TextUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

public final class NameValidator {
    public static final int DEFAULT_MAX_CHARS = 22;
    public static final int DEFAULT_MAX_WORDS = 3;

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;
    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[^\\p{L}]+|[^\\p{L}]+$");
    private static final Pattern ALLOWED = Pattern.compile("[\\p{L}' \\-]+");
    private static final Pattern SENTENCE_END = Pattern.compile(".*[.,!?;:]$");
    private static final Pattern LEAD_IN = Pattern.compile(
            "^(?:yes|yeah|sure|ok|okay|hi|hello|um|uh|so|well|it's|it is|this is|my name is|my name's|name's|i'm|i am"
                    + "|כן|שלום|היי|אה|שמי|קוראים לי|זה|אני)[,.]?\\s+",
            FLAGS);
    private static final Pattern TRAILING = Pattern.compile("\\s+(?:here|speaking|מדבר|מדברת)[.!]?$", FLAGS);

    private static final Set<String> STOPWORDS = Set.of(
            "um", "uh", "umm", "uhh", "hmm", "er", "ah", "oh", "like", "well", "so", "okay", "ok",
            "yes", "yeah", "yep", "no", "nope", "hi", "hello", "hey", "thanks", "thank", "please",
            "good", "morning", "afternoon", "evening", "bye", "goodbye", "sorry", "sure", "fine", "great",
            "calling", "call", "called", "about", "regarding", "just", "here", "speaking", "want", "wanted",
            "would", "need", "looking", "trying", "leave", "message", "number", "name", "not", "what", "who",
            "the", "a", "an", "and", "or", "but", "to", "for", "from", "with", "of", "at", "in", "on", "by",
            "is", "am", "are", "was", "be", "it", "it's", "this", "that", "my", "your", "me", "i", "i'm",
            "we", "they", "he", "she", "you", "can", "could", "do", "don't", "have", "has", "again",
            "שלום", "היי", "הלו", "תודה", "בבקשה", "בוקר", "ערב", "טוב", "אה", "אמ", "אממ", "רגע",
            "רוצה", "צריך", "צריכה", "מתקשר", "מתקשרת", "הודעה", "מספר", "שם", "ביי", "להתראות"
    );

    // 히브리어 접두 문자(ו,ה,ב,ל,מ,ש,כ)가 붙어도 기능어로 본다.
    private static final Set<String> FUNCTION_WORDS = Set.of(
            "כן", "לא", "אני", "זה", "זאת", "מה", "מי", "יש", "אין", "של", "את", "על", "עם", "אל",
            "גם", "רק", "פשוט", "בקשר", "אתה", "אנחנו", "הוא", "היא", "עוד", "כבר", "פה", "כאן"
    );
    private static final String HEBREW_PREFIXES = "והבלמשכ";

    private final int maxChars;
    private final int maxWords;
    private final Set<String> stopwords;

    public NameValidator(int maxChars, int maxWords, Collection<String> extraStopwords) {
        if (maxChars <= 0 || maxWords <= 0) {
            throw new IllegalArgumentException("name limits must be positive");
        }
        this.maxChars = maxChars;
        this.maxWords = maxWords;
        Set<String> merged = new HashSet<>(STOPWORDS);
        if (extraStopwords != null) {
            for (String word : extraStopwords) {
                if (word != null && !word.isBlank()) {
                    merged.add(word.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        this.stopwords = Set.copyOf(merged);
    }

    public static NameValidator defaults() {
        return new NameValidator(DEFAULT_MAX_CHARS, DEFAULT_MAX_WORDS, List.of());
    }

    // 후보 전체가 이름 형태일 때만 정리된 이름을 돌려준다.
    public Optional<String> validate(String candidate) {
        if (candidate == null || TextUtils.containsDigit(candidate)) {
            return Optional.empty();
        }
        String name = EDGE_PUNCTUATION.matcher(candidate.trim()).replaceAll("").replaceAll("\\s+", " ");
        if (name.isEmpty() || name.length() > maxChars) {
            return Optional.empty();
        }
        if (!ALLOWED.matcher(name).matches()) {
            return Optional.empty();
        }
        String[] words = name.split(" ");
        if (words.length > maxWords) {
            return Optional.empty();
        }
        for (String word : words) {
            if (word.length() < 2 || isStopword(word)) {
                return Optional.empty();
            }
        }
        return Optional.of(name);
    }

    // 자기소개 뒤에 이어지는 말에서 이름 부분만 떼어 낸다. "Dana from Acme" → "Dana".
    public Optional<String> extractLeading(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        List<String> taken = new ArrayList<>();
        for (String token : text.trim().split("\\s+")) {
            String word = EDGE_PUNCTUATION.matcher(token).replaceAll("");
            if (word.isEmpty() || isStopword(word)) {
                break;
            }
            taken.add(word);
            if (taken.size() == maxWords || SENTENCE_END.matcher(token).matches()) {
                break;
            }
        }
        if (taken.isEmpty()) {
            return Optional.empty();
        }
        return validate(String.join(" ", taken));
    }

    // 이름을 물은 직후의 대답. "it's Dana", "שמי דנה" 같은 머리말을 걷어 내고 읽는다.
    public Optional<String> fromAnswer(String answer) {
        if (answer == null) {
            return Optional.empty();
        }
        String text = answer.trim();
        String previous;
        do {
            previous = text;
            text = LEAD_IN.matcher(text).replaceFirst("");
        } while (!text.equals(previous));
        text = TRAILING.matcher(text).replaceFirst("");
        return extractLeading(text);
    }

    private boolean isStopword(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        if (stopwords.contains(lower) || FUNCTION_WORDS.contains(lower)) {
            return true;
        }
        return lower.length() > 2
                && HEBREW_PREFIXES.indexOf(lower.charAt(0)) >= 0
                && FUNCTION_WORDS.contains(lower.substring(1));
    }

    public int maxChars() {
        return maxChars;
    }

    public int maxWords() {
        return maxWords;
    }
}
