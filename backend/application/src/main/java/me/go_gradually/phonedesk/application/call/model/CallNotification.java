package me.go_gradually.phonedesk.application.call.model;

public record CallNotification(CallReport report, String recordingUrl) {
    public static final String RECORDING_RESOLVED = "resolved";
    public static final String RECORDING_MISSING = "missing";

    public String recordingStatus() {
        return recordingUrl == null ? RECORDING_MISSING : RECORDING_RESOLVED;
    }

    public String category() {
        return report.decision().disposition().name();
    }
}
