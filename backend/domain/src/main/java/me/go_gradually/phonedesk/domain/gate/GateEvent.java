package me.go_gradually.phonedesk.domain.gate;

public enum GateEvent {
    NAME_ARMED,
    MESSAGE_ARMED,
    CALLBACK_CONFIRM_ARMED,
    CALLBACK_NUMBER_ARMED,
    NAME_CAPTURED,
    MESSAGE_CAPTURED,
    CALLBACK_REQUESTED,
    CALLBACK_NUMBER_CAPTURED,
    INFO_REQUESTED,
    INFO_PROVIDED,
    CLOSING_FORCED
}
