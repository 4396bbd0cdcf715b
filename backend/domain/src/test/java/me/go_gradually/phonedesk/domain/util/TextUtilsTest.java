package me.go_gradually.phonedesk.domain.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TextUtilsTest {

    @Test
    void trimToLength_returnsOriginalWhenShortEnough() {
        assertEquals("abc", TextUtils.trimToLength("abc", 5));
    }

    @Test
    void trimToLength_truncatesAtMaxMinusOne() {
        assertEquals("abcd", TextUtils.trimToLength("abcdef", 5));
    }

    @Test
    void trimToLength_returnsEmptyForNull() {
        assertEquals("", TextUtils.trimToLength(null, 5));
    }

    @Test
    void countLettersOrDigits_ignoresPunctuationAndSpaces() {
        assertEquals(4, TextUtils.countLettersOrDigits(" a-b, c1 "));
        assertEquals(0, TextUtils.countLettersOrDigits(null));
    }

    @Test
    void containsDigit_detectsAnyDigit() {
        assertTrue(TextUtils.containsDigit("Dana 2"));
        assertFalse(TextUtils.containsDigit("Dana"));
    }

    @Test
    void normalizeQuotes_mapsCurlyApostrophes() {
        assertEquals("my name's", TextUtils.normalizeQuotes("my name’s"));
    }

    @Test
    void firstNonBlank_fallsBackOnBlank() {
        assertEquals("b", TextUtils.firstNonBlank(" ", "b"));
        assertEquals("a", TextUtils.firstNonBlank("a", "b"));
    }
}
