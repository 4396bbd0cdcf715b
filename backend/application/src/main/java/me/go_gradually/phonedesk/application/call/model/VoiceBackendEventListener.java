package me.go_gradually.phonedesk.application.call.model;

public interface VoiceBackendEventListener {
    void onReady();

    void onSpeechStarted();

    void onSpeechStopped();

    void onTurnAccepted(long turnId);

    void onAssistantAudio(long turnId, String base64Audio);

    void onAssistantAudioDone(long turnId);

    void onAssistantTranscript(long turnId, String text);

    void onCallerTranscript(String text);

    void onTurnCompleted(long turnId);

    void onTurnFailed(long turnId, String message);

    void onError(String message);

    void onClosed(String reason);
}
