package me.go_gradually.phonedesk.domain.gate;

import java.util.List;

public record GateSnapshot(String name,
                           boolean nameFromMemory,
                           String message,
                           boolean callbackRequested,
                           String callbackNumber,
                           CallbackSource callbackSource,
                           boolean closingForced,
                           boolean infoRequested,
                           boolean infoProvided,
                           List<InfoTopic> infoTopics,
                           String infoAnswer) {
    public GateSnapshot {
        infoTopics = infoTopics == null ? List.of() : List.copyOf(infoTopics);
    }

    public static GateSnapshot empty() {
        return new GateSnapshot(null, false, null, false, null, null, false, false, false, List.of(), null);
    }

    public boolean hasName() {
        return name != null;
    }

    public boolean hasMessage() {
        return message != null;
    }

    public boolean hasCallbackNumber() {
        return callbackNumber != null;
    }

    public List<String> infoTopicTags() {
        return infoTopics.stream().map(InfoTopic::tag).toList();
    }
}
