package me.go_gradually.phonedesk.domain.gate;

public enum InfoTopic {
    HOURS("hours"),
    ADDRESS("address"),
    PHONE("phone"),
    EMAIL("email");

    private final String tag;

    InfoTopic(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
