package me.go_gradually.phonedesk.domain.disposition;

import me.go_gradually.phonedesk.domain.gate.CallbackSource;
import me.go_gradually.phonedesk.domain.gate.GateSnapshot;
import me.go_gradually.phonedesk.domain.gate.InfoTopic;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DispositionPolicyTest {

    @Test
    void decide_finalWhenNameAndMessageWithoutPendingCallback() {
        DispositionDecision decision = DispositionPolicy.decide(
                snapshot("Dana", "call me", false, null, false), InfoPrecedence.REGARDLESS_OF_NAME);

        assertEquals(Disposition.FINAL, decision.disposition());
        assertEquals(DispositionDecision.Reason.ALL_FACTS_CAPTURED, decision.reason());
    }

    @Test
    void decide_partialWhenCallbackNumberMissing() {
        DispositionDecision decision = DispositionPolicy.decide(
                snapshot("Dana", "call me", true, null, false), InfoPrecedence.REGARDLESS_OF_NAME);

        assertEquals(Disposition.PARTIAL, decision.disposition());
        assertEquals(DispositionDecision.Reason.CALLBACK_NUMBER_MISSING, decision.reason());
    }

    @Test
    void decide_partialWhenMessageMissing() {
        DispositionDecision decision = DispositionPolicy.decide(
                snapshot("Dana", null, true, "501234567", false), InfoPrecedence.REGARDLESS_OF_NAME);

        assertEquals(Disposition.PARTIAL, decision.disposition());
        assertEquals(DispositionDecision.Reason.NAME_WITHOUT_MESSAGE, decision.reason());
    }

    @Test
    void decide_infoPrecedenceControlsNamedCallersWhoGotAnAnswer() {
        GateSnapshot namedInfo = snapshot("Dana", null, false, null, true);

        assertEquals(Disposition.INFO,
                DispositionPolicy.decide(namedInfo, InfoPrecedence.REGARDLESS_OF_NAME).disposition());
        assertEquals(Disposition.PARTIAL,
                DispositionPolicy.decide(namedInfo, InfoPrecedence.REQUIRE_NO_NAME).disposition());
    }

    @Test
    void decide_answeredQuestionOutranksPendingCallbackNumberUnlessNameExcludesInfo() {
        GateSnapshot gates = snapshot("Dana", "call me", true, null, true);

        DispositionDecision regardless = DispositionPolicy.decide(gates, InfoPrecedence.REGARDLESS_OF_NAME);
        assertEquals(Disposition.INFO, regardless.disposition());
        assertEquals(DispositionDecision.Reason.INFO_ANSWERED, regardless.reason());

        DispositionDecision requireNoName = DispositionPolicy.decide(gates, InfoPrecedence.REQUIRE_NO_NAME);
        assertEquals(Disposition.PARTIAL, requireNoName.disposition());
        assertEquals(DispositionDecision.Reason.CALLBACK_NUMBER_MISSING, requireNoName.reason());
    }

    @Test
    void decide_infoWithoutNameUnderEitherPrecedence() {
        GateSnapshot anonymousInfo = snapshot(null, null, false, null, true);

        assertEquals(Disposition.INFO,
                DispositionPolicy.decide(anonymousInfo, InfoPrecedence.REGARDLESS_OF_NAME).disposition());
        assertEquals(Disposition.INFO,
                DispositionPolicy.decide(anonymousInfo, InfoPrecedence.REQUIRE_NO_NAME).disposition());
    }

    @Test
    void decide_abandonedWhenNothingCaptured() {
        DispositionDecision decision = DispositionPolicy.decide(GateSnapshot.empty(), null);

        assertEquals(Disposition.ABANDONED, decision.disposition());
        assertEquals(DispositionDecision.Reason.NO_NAME, decision.reason());
    }

    @Test
    void decide_isIdempotentForIdenticalState() {
        GateSnapshot gates = snapshot("Dana", null, false, null, false);

        assertEquals(DispositionPolicy.decide(gates, InfoPrecedence.REQUIRE_NO_NAME),
                DispositionPolicy.decide(gates, InfoPrecedence.REQUIRE_NO_NAME));
    }

    private static GateSnapshot snapshot(String name, String message, boolean callbackRequested,
                                         String callbackNumber, boolean infoProvided) {
        return new GateSnapshot(name, false, message, callbackRequested, callbackNumber,
                callbackNumber == null ? null : CallbackSource.SPOKEN, false, infoProvided, infoProvided,
                infoProvided ? List.of(InfoTopic.HOURS) : List.of(), infoProvided ? "9 to 5" : null);
    }
}
