package me.go_gradually.phonedesk.domain.gate;

import me.go_gradually.phonedesk.domain.util.TextUtils;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

// 전이마다 처음 일치한 규칙 하나만 채택한다.
public final class GateRuleTable {
    private static final List<GateRule> DEFAULT_RULES = List.of(
            GateRule.of("assistant.ask-name",
                    "what(?:'s| is) your (?:full )?name|(?:may|can) i (?:have|ask|get) your name|who am i speaking (?:with|to)"
                            + "|your name,? please|מה (?:השם|שמך)|איך קוראים ל(?:ך|כם)|אפשר (?:את )?(?:השם|שם)",
                    GateTransition.ARM_NAME),
            GateRule.of("assistant.ask-message",
                    "what (?:message|would you like (?:me )?to (?:pass|relay|tell|leave))|(?:leave|pass on|relay) a message"
                            + "|what should i (?:pass on|tell|relay)|מה (?:תרצה|תרצי|תרצו) (?:שאעביר|להעביר|להשאיר)"
                            + "|(?:להשאיר|להעביר) הודעה|מה ההודעה",
                    GateTransition.ARM_MESSAGE),
            GateRule.of("assistant.confirm-caller-number",
                    "(?:call you back|reach you|return (?:the|your) call) (?:at|on) (?:this|the) number"
                            + "|(?:the|this) number you(?:'re| are) calling from"
                            + "|המספר (?:ש)?ממנו (?:אתה|את|אתם) (?:מתקשר|מתקשרת|מתקשרים)|לחזור (?:אליך |אלייך )?ל?מספר הזה",
                    GateTransition.ARM_CALLBACK_CONFIRM),
            GateRule.of("assistant.ask-callback-number",
                    "(?:what|which) (?:is the |'s the )?(?:best )?(?:phone )?number (?:should|can|to|for)|what number should"
                            + "|לאיזה מספר|מה המספר (?:שלך|לחזרה)",
                    GateTransition.ARM_CALLBACK_NUMBER),
            GateRule.of("caller.closing",
                    "\\b(?:bye|goodbye|good bye|bye bye|that'?s all|that is all|that will be all|nothing else"
                            + "|have a (?:good|nice|great) (?:day|one|evening))\\b"
                            + "|\\b(?:ביי|להתראות|זהו זה|זה הכל|זה הכול)\\b",
                    GateTransition.CLOSING),
            GateRule.of("caller.callback-request",
                    "\\b(?:call (?:me )?back|callback|return my call|get back to me|(?:have|ask) (?:him|her|them|someone) (?:to )?call me)\\b"
                            + "|(?:יחזור|יחזרו|תחזור|תחזרו|לחזור) אלי",
                    GateTransition.CALLBACK_REQUEST),
            GateRule.of("caller.info-hours",
                    "\\b(?:hours|opening times?|(?:are|is) (?:you|it|the office) open|when do you (?:open|close)|what time do you)\\b"
                            + "|שעות (?:ה)?(?:פתיחה|פעילות)|מתי (?:אתם )?פתוחים",
                    GateTransition.INFO_HOURS),
            GateRule.of("caller.info-address",
                    "\\b(?:address|where are you located|where is (?:the|your) office|directions)\\b|כתובת|איפה (?:אתם|המשרד)",
                    GateTransition.INFO_ADDRESS),
            GateRule.of("caller.info-phone",
                    "\\b(?:office (?:phone|number)|phone number (?:of|for) (?:the|your) office|fax)\\b|הטלפון של המשרד",
                    GateTransition.INFO_PHONE),
            GateRule.of("caller.info-email",
                    "\\be-?mail\\b|מייל|דוא\"ל",
                    GateTransition.INFO_EMAIL),
            GateRule.of("caller.self-introduction",
                    "(?:\\bmy name is|\\bmy name's|\\bname's|קוראים לי|שמי)\\s+([\\p{L}][\\p{L}'\\- ]{0,40})",
                    GateTransition.SELF_INTRODUCTION),
            GateRule.of("caller.tentative-introduction",
                    "\\b(?:this is|i am|i'm)\\s+([\\p{L}][\\p{L}'\\- ]{0,40})",
                    GateTransition.TENTATIVE_INTRODUCTION)
    );

    private final List<GateRule> rules;

    public GateRuleTable(List<GateRule> rules) {
        this.rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public static GateRuleTable defaults() {
        return new GateRuleTable(DEFAULT_RULES);
    }

    // 설정에서 온 규칙을 기본 규칙보다 앞에 둔 새 표를 만든다.
    public GateRuleTable withLeading(List<GateRule> configured) {
        if (configured == null || configured.isEmpty()) {
            return this;
        }
        List<GateRule> merged = new ArrayList<>(configured);
        merged.addAll(rules);
        return new GateRuleTable(merged);
    }

    public List<GateMatch> match(Utterance utterance) {
        if (utterance == null || utterance.isBlank()) {
            return List.of();
        }
        String normalized = TextUtils.normalizeQuotes(utterance.text());
        Set<GateTransition> seen = EnumSet.noneOf(GateTransition.class);
        List<GateMatch> matches = new ArrayList<>();
        for (GateRule rule : rules) {
            if (seen.contains(rule.transition())) {
                continue;
            }
            Optional<GateMatch> match = rule.match(utterance.source(), normalized);
            if (match.isPresent()) {
                seen.add(rule.transition());
                matches.add(match.get());
            }
        }
        return matches;
    }

    public List<GateRule> rules() {
        return rules;
    }
}
