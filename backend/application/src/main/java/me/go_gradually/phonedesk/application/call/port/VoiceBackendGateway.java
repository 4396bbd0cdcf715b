package me.go_gradually.phonedesk.application.call.port;

import me.go_gradually.phonedesk.application.call.model.VoiceBackendEventListener;
import me.go_gradually.phonedesk.application.call.model.VoiceBackendSession;

public interface VoiceBackendGateway {
    /**
     * 통화당 하나의 음성 백엔드 연결을 연다. 연결에 실패하면 예외를 던진다.
     */
    VoiceBackendSession connect(String sessionKey, VoiceBackendEventListener listener);
}
