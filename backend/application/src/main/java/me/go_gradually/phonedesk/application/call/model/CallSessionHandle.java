package me.go_gradually.phonedesk.application.call.model;

/**
 * 전화 쪽 연결 하나에 묶인 통화 세션. 모든 호출은 세션 메일박스로 넘어가므로 어느 스레드에서 불러도 된다.
 */
public interface CallSessionHandle {
    void start(CallStartCommand command);

    void appendCallerAudio(String streamSid, String base64Audio);

    void stop(String callSid);

    void close();
}
