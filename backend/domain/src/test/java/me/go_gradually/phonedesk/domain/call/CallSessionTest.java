package me.go_gradually.phonedesk.domain.call;

import me.go_gradually.phonedesk.domain.audio.AudioFrame;
import me.go_gradually.phonedesk.domain.gate.GatePolicy;
import me.go_gradually.phonedesk.domain.gate.GateRuleTable;
import me.go_gradually.phonedesk.domain.gate.GateStateMachine;
import me.go_gradually.phonedesk.domain.gate.NameValidator;
import me.go_gradually.phonedesk.domain.turn.TurnTimings;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CallSessionTest {

    @Test
    void start_setsIdentityOnce() {
        CallSession session = session();
        CallIdentity first = new CallIdentity("CA1", "MZ1", "+972501234567", "+97231234567", Map.of("caller", "+972501234567"));
        CallIdentity second = new CallIdentity("CA2", "MZ2", null, null, null);

        assertTrue(session.start(first, 1_000));
        assertFalse(session.start(second, 2_000));

        assertEquals("CA1", session.callSid());
        assertEquals(1_000L, session.startedAt());
        assertEquals(CallLifecycle.ACTIVE, session.lifecycle());
    }

    @Test
    void streamSid_fallsBackToMediaEventValue() {
        CallSession session = session();
        session.rememberStreamSid("MZ-fallback");
        session.rememberStreamSid("MZ-other");

        assertEquals("MZ-fallback", session.streamSid());

        session.start(new CallIdentity("CA1", "MZ1", null, null, null), 0);
        assertEquals("MZ1", session.streamSid());
    }

    @Test
    void lifecycle_onlyMovesForward() {
        CallSession session = session();

        assertTrue(session.moveTo(CallLifecycle.ENDING));
        assertFalse(session.moveTo(CallLifecycle.ACTIVE));
        assertTrue(session.end(5_000));
        assertFalse(session.end(6_000));

        assertEquals(5_000L, session.endedAt());
        assertTrue(session.isEnded());
    }

    @Test
    void end_discardsBufferedAudio() {
        CallSession session = session();
        session.inboundQueue().offer(session.nextInboundFrame("a"));
        session.outboundQueue().offer(session.nextOutboundFrame("b"));

        session.end(1_000);

        assertTrue(session.inboundQueue().isEmpty());
        assertTrue(session.outboundQueue().isEmpty());
    }

    @Test
    void frameSequences_increasePerDirection() {
        CallSession session = session();

        AudioFrame first = session.nextInboundFrame("a");
        AudioFrame second = session.nextInboundFrame("b");
        AudioFrame outbound = session.nextOutboundFrame("c");

        assertEquals(0L, first.sequence());
        assertEquals(1L, second.sequence());
        assertEquals(0L, outbound.sequence());
        assertNull(session.endedAt());
    }

    private static CallSession session() {
        GateStateMachine gates = new GateStateMachine(GateRuleTable.defaults(), NameValidator.defaults(),
                GatePolicy.defaults(), 0L);
        return new CallSession("ws-1", 0L, TurnTimings.defaults(), 10, gates);
    }
}
