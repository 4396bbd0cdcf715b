package me.go_gradually.phonedesk.domain.gate;

public record Utterance(Source source, String text, long receivedAt) {
    public Utterance {
        if (source == null) {
            throw new IllegalArgumentException("source is required");
        }
        text = text == null ? "" : text.trim();
    }

    public static Utterance caller(String text, long receivedAt) {
        return new Utterance(Source.CALLER, text, receivedAt);
    }

    public static Utterance assistant(String text, long receivedAt) {
        return new Utterance(Source.ASSISTANT, text, receivedAt);
    }

    public boolean isBlank() {
        return text.isBlank();
    }

    public enum Source {
        CALLER,
        ASSISTANT
    }
}
