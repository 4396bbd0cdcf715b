package me.go_gradually.phonedesk.domain.gate;

public enum GateTransition {
    ARM_NAME(Utterance.Source.ASSISTANT, null),
    ARM_MESSAGE(Utterance.Source.ASSISTANT, null),
    ARM_CALLBACK_CONFIRM(Utterance.Source.ASSISTANT, null),
    ARM_CALLBACK_NUMBER(Utterance.Source.ASSISTANT, null),
    SELF_INTRODUCTION(Utterance.Source.CALLER, null),
    TENTATIVE_INTRODUCTION(Utterance.Source.CALLER, null),
    CALLBACK_REQUEST(Utterance.Source.CALLER, null),
    INFO_HOURS(Utterance.Source.CALLER, InfoTopic.HOURS),
    INFO_ADDRESS(Utterance.Source.CALLER, InfoTopic.ADDRESS),
    INFO_PHONE(Utterance.Source.CALLER, InfoTopic.PHONE),
    INFO_EMAIL(Utterance.Source.CALLER, InfoTopic.EMAIL),
    CLOSING(Utterance.Source.CALLER, null);

    private final Utterance.Source source;
    private final InfoTopic infoTopic;

    GateTransition(Utterance.Source source, InfoTopic infoTopic) {
        this.source = source;
        this.infoTopic = infoTopic;
    }

    public Utterance.Source source() {
        return source;
    }

    public InfoTopic infoTopic() {
        return infoTopic;
    }

    public boolean isIntroduction() {
        return this == SELF_INTRODUCTION || this == TENTATIVE_INTRODUCTION;
    }
}
