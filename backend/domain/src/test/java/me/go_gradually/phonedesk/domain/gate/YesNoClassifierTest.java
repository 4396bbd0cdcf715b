package me.go_gradually.phonedesk.domain.gate;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class YesNoClassifierTest {

    @Test
    void classify_recognizesAffirmatives() {
        assertEquals(YesNoClassifier.Answer.YES, YesNoClassifier.classify("Yes"));
        assertEquals(YesNoClassifier.Answer.YES, YesNoClassifier.classify("Sure, that's right."));
        assertEquals(YesNoClassifier.Answer.YES, YesNoClassifier.classify("כן"));
    }

    @Test
    void classify_recognizesNegatives() {
        assertEquals(YesNoClassifier.Answer.NO, YesNoClassifier.classify("No, a different number."));
        assertEquals(YesNoClassifier.Answer.NO, YesNoClassifier.classify("לא"));
    }

    @Test
    void classify_returnsUnknownForMixedOrUnrelatedAnswers() {
        assertEquals(YesNoClassifier.Answer.UNKNOWN, YesNoClassifier.classify("yes no"));
        assertEquals(YesNoClassifier.Answer.UNKNOWN, YesNoClassifier.classify("tomorrow morning"));
        assertEquals(YesNoClassifier.Answer.UNKNOWN, YesNoClassifier.classify("  "));
    }
}
