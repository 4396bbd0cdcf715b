package me.go_gradually.phonedesk.application.call.model;

public interface VoiceBackendSession {
    void configure(VoiceSessionConfig config);

    void appendAudio(String base64Audio);

    void createTurn(TurnRequest request);

    void cancelTurn();

    void close();
}
