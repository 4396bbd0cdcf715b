package me.go_gradually.phonedesk.application.call.port;

import me.go_gradually.phonedesk.application.call.model.CallNotification;

public interface CallNotificationPort {
    /**
     * @return 전달이 확인되면 true. 실패는 예외 대신 false로 알린다.
     */
    boolean send(CallNotification notification);
}
