package me.go_gradually.phonedesk.domain.gate;

import me.go_gradually.phonedesk.domain.util.TextUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 확정된 발화를 규칙 표에 대어 이름, 메시지, 콜백, 안내 요청, 종료 의사를 뽑아낸다.
 * 어시스턴트 발화는 게이트를 무장시키고, 발신자 발화는 무장된 게이트를 채운다.
 */
public final class GateStateMachine {
    private static final Pattern FILLERS = Pattern.compile(
            "\\b(?:um+|uh+|hmm+|ah+|er|eh|אה+|אמ+|אממ+)\\b",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS);
    private static final int MIN_MEANINGFUL_CHARS = 2;
    private static final int BARE_ANSWER_MAX_WORDS = 2;

    private final GateRuleTable rules;
    private final NameValidator nameValidator;
    private final GatePolicy policy;
    private final long startedAt;
    private final GateState state = new GateState();
    private String callerAddress;

    public GateStateMachine(GateRuleTable rules, NameValidator nameValidator, GatePolicy policy, long startedAt) {
        this.rules = rules == null ? GateRuleTable.defaults() : rules;
        this.nameValidator = nameValidator == null ? NameValidator.defaults() : nameValidator;
        this.policy = policy == null ? GatePolicy.defaults() : policy;
        this.startedAt = startedAt;
    }

    // 재통화 발신자의 저장된 이름으로 이름 게이트를 미리 채운다.
    public boolean preloadName(String name) {
        if (TextUtils.isBlank(name)) {
            return false;
        }
        return state.captureName(name.trim(), true);
    }

    public void useCallerAddress(String address) {
        this.callerAddress = TextUtils.isBlank(address) ? null : address.trim();
    }

    public List<GateEvent> onAssistantUtterance(Utterance utterance) {
        List<GateEvent> events = new ArrayList<>();
        if (state.isClosingForced() || utterance == null || utterance.isBlank()) {
            return events;
        }
        if (state.provideInfo(TextUtils.trimToLength(utterance.text(), policy.infoAnswerMaxChars()))) {
            events.add(GateEvent.INFO_PROVIDED);
        }
        for (GateMatch match : rules.match(utterance)) {
            switch (match.transition()) {
                case ARM_NAME -> addIf(events, state.armName(), GateEvent.NAME_ARMED);
                case ARM_MESSAGE -> addIf(events, state.armMessage(), GateEvent.MESSAGE_ARMED);
                case ARM_CALLBACK_CONFIRM ->
                        addIf(events, state.armCallbackConfirm(), GateEvent.CALLBACK_CONFIRM_ARMED);
                case ARM_CALLBACK_NUMBER ->
                        addIf(events, state.armCallbackNumber(), GateEvent.CALLBACK_NUMBER_ARMED);
                default -> {
                }
            }
        }
        return events;
    }

    public List<GateEvent> onCallerUtterance(Utterance utterance) {
        List<GateEvent> events = new ArrayList<>();
        if (state.isClosingForced() || utterance == null || utterance.isBlank()) {
            return events;
        }
        List<GateMatch> matches = rules.match(utterance);
        if (find(matches, GateTransition.CLOSING).isPresent()) {
            state.forceClosing();
            events.add(GateEvent.CLOSING_FORCED);
            return events;
        }
        String text = utterance.text();

        if (state.isExpectingCallbackConfirm() && handleCallbackConfirm(text, events)) {
            return events;
        }
        if (state.isExpectingCallbackNumber()) {
            Optional<String> number = PhoneNumberExtractor.extract(text);
            if (number.isPresent()) {
                addIf(events, state.requestCallback(), GateEvent.CALLBACK_REQUESTED);
                addIf(events, state.captureCallbackNumber(number.get(), CallbackSource.SPOKEN),
                        GateEvent.CALLBACK_NUMBER_CAPTURED);
                return events;
            }
        }
        if (find(matches, GateTransition.CALLBACK_REQUEST).isPresent()) {
            addIf(events, state.requestCallback(), GateEvent.CALLBACK_REQUESTED);
        }

        boolean consumed = captureIntroducedName(matches, events);
        boolean infoAsked = false;
        for (GateMatch match : matches) {
            InfoTopic topic = match.transition().infoTopic();
            if (topic != null) {
                state.requestInfo(topic);
                infoAsked = true;
            }
        }
        if (infoAsked) {
            events.add(GateEvent.INFO_REQUESTED);
            consumed = true;
        }
        if (!consumed && state.isExpectingName()) {
            consumed = nameValidator.fromAnswer(text)
                    .map(name -> captureName(name, events))
                    .orElse(false);
        }
        if (!consumed && withinEarlyNameWindow(utterance)) {
            consumed = nameValidator.validate(text)
                    .map(name -> captureName(name, events))
                    .orElse(false);
        }
        if (!consumed && state.isExpectingMessage() && isMeaningful(text)) {
            addIf(events, state.captureMessage(text), GateEvent.MESSAGE_CAPTURED);
        }
        return events;
    }

    private boolean handleCallbackConfirm(String text, List<GateEvent> events) {
        Optional<String> spoken = PhoneNumberExtractor.extract(text);
        if (spoken.isPresent()) {
            addIf(events, state.requestCallback(), GateEvent.CALLBACK_REQUESTED);
            addIf(events, state.captureCallbackNumber(spoken.get(), CallbackSource.SPOKEN),
                    GateEvent.CALLBACK_NUMBER_CAPTURED);
            return true;
        }
        YesNoClassifier.Answer answer = YesNoClassifier.classify(text);
        if (answer == YesNoClassifier.Answer.UNKNOWN) {
            // 대답이 아니면 확인 게이트를 풀고 일반 발화로 처리한다.
            state.disarmCallbackConfirm();
            return false;
        }
        addIf(events, state.requestCallback(), GateEvent.CALLBACK_REQUESTED);
        state.disarmCallbackConfirm();
        if (answer == YesNoClassifier.Answer.YES && callerAddress != null) {
            addIf(events, state.captureCallbackNumber(callerAddress, CallbackSource.CALLER_ID),
                    GateEvent.CALLBACK_NUMBER_CAPTURED);
        } else {
            addIf(events, state.armCallbackNumber(), GateEvent.CALLBACK_NUMBER_ARMED);
        }
        return true;
    }

    private boolean captureIntroducedName(List<GateMatch> matches, List<GateEvent> events) {
        if (state.name() != null) {
            return false;
        }
        Optional<GateMatch> strong = find(matches, GateTransition.SELF_INTRODUCTION);
        if (strong.isPresent()) {
            Optional<String> name = nameValidator.extractLeading(strong.get().captured());
            if (name.isPresent()) {
                return captureName(name.get(), events);
            }
        }
        Optional<GateMatch> tentative = find(matches, GateTransition.TENTATIVE_INTRODUCTION);
        if (tentative.isPresent() && looksLikeProperNoun(tentative.get().captured())) {
            Optional<String> name = nameValidator.extractLeading(tentative.get().captured());
            if (name.isPresent()) {
                return captureName(name.get(), events);
            }
        }
        return false;
    }

    private boolean captureName(String name, List<GateEvent> events) {
        boolean captured = state.captureName(name, false);
        addIf(events, captured, GateEvent.NAME_CAPTURED);
        return captured;
    }

    // "I'm calling about..." 같은 문장을 걸러내기 위해 라틴 문자는 대문자로 시작해야 한다.
    private static boolean looksLikeProperNoun(String captured) {
        if (TextUtils.isBlank(captured)) {
            return false;
        }
        int first = captured.trim().codePointAt(0);
        if (Character.UnicodeScript.of(first) != Character.UnicodeScript.LATIN) {
            return true;
        }
        return Character.isUpperCase(first);
    }

    private boolean withinEarlyNameWindow(Utterance utterance) {
        return policy.earlyNameCapture()
                && state.name() == null
                && !state.anyGateArmed()
                && utterance.receivedAt() - startedAt <= policy.earlyNameWindowMs();
    }

    private static boolean isMeaningful(String text) {
        String withoutFillers = FILLERS.matcher(text).replaceAll(" ");
        if (TextUtils.countLettersOrDigits(withoutFillers) < MIN_MEANINGFUL_CHARS) {
            return false;
        }
        boolean bareAnswer = YesNoClassifier.classify(text) != YesNoClassifier.Answer.UNKNOWN
                && text.trim().split("\\s+").length <= BARE_ANSWER_MAX_WORDS;
        return !bareAnswer;
    }

    private static Optional<GateMatch> find(List<GateMatch> matches, GateTransition transition) {
        return matches.stream().filter(m -> m.transition() == transition).findFirst();
    }

    private static void addIf(List<GateEvent> events, boolean condition, GateEvent event) {
        if (condition) {
            events.add(event);
        }
    }

    public GateState state() {
        return state;
    }

    public GateSnapshot snapshot() {
        return state.snapshot();
    }
}
