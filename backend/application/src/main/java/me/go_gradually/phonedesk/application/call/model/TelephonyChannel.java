package me.go_gradually.phonedesk.application.call.model;

public interface TelephonyChannel {
    void sendMedia(String streamSid, String base64Audio);

    void sendClear(String streamSid);

    void hangup(String reason);
}
