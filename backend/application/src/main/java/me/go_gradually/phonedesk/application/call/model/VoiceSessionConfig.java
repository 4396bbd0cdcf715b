package me.go_gradually.phonedesk.application.call.model;

public record VoiceSessionConfig(String instructions, String voice) {
}
