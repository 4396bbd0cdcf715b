package me.go_gradually.phonedesk.domain.util;

public final class TextUtils {
    private TextUtils() {
    }

    public static String trimToLength(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxChars) {
            return text;
        }
        return text.substring(0, Math.max(0, maxChars - 1)).trim();
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public static String firstNonBlank(String first, String second) {
        return isBlank(first) ? second : first;
    }

    public static int countLettersOrDigits(String text) {
        if (text == null) {
            return 0;
        }
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (Character.isLetterOrDigit(text.charAt(i))) {
                count++;
            }
        }
        return count;
    }

    public static boolean containsDigit(String text) {
        if (text == null) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (Character.isDigit(text.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    // 전사 결과의 둥근 따옴표를 ASCII 아포스트로피로 통일한다.
    public static String normalizeQuotes(String text) {
        if (text == null) {
            return "";
        }
        return text.replace('’', '\'').replace('‘', '\'');
    }
}
