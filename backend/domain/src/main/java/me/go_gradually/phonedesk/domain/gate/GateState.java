package me.go_gradually.phonedesk.domain.gate;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class GateState {
    private boolean expectingName;
    private boolean expectingMessage;
    private boolean expectingCallbackConfirm;
    private boolean expectingCallbackNumber;
    private String name;
    private boolean nameFromMemory;
    private String message;
    private boolean callbackRequested;
    private String callbackNumber;
    private CallbackSource callbackSource;
    private boolean closingForced;
    private boolean infoRequested;
    private boolean infoProvided;
    private final Set<InfoTopic> infoTopics = new LinkedHashSet<>();
    private String infoAnswer;

    boolean captureName(String value, boolean fromMemory) {
        if (name != null || value == null) {
            return false;
        }
        name = value;
        nameFromMemory = fromMemory;
        expectingName = false;
        return true;
    }

    boolean captureMessage(String value) {
        if (message != null || value == null) {
            return false;
        }
        message = value;
        expectingMessage = false;
        return true;
    }

    boolean requestCallback() {
        if (callbackRequested) {
            return false;
        }
        callbackRequested = true;
        return true;
    }

    boolean captureCallbackNumber(String value, CallbackSource source) {
        if (callbackNumber != null || value == null) {
            return false;
        }
        callbackNumber = value;
        callbackSource = source;
        expectingCallbackConfirm = false;
        expectingCallbackNumber = false;
        return true;
    }

    boolean forceClosing() {
        if (closingForced) {
            return false;
        }
        closingForced = true;
        disarmAll();
        return true;
    }

    boolean requestInfo(InfoTopic topic) {
        boolean first = !infoRequested;
        infoRequested = true;
        infoTopics.add(topic);
        return first;
    }

    boolean provideInfo(String answer) {
        if (!infoRequested || infoProvided) {
            return false;
        }
        infoProvided = true;
        infoAnswer = answer;
        return true;
    }

    boolean armName() {
        if (name != null || expectingName) {
            return false;
        }
        expectingName = true;
        return true;
    }

    boolean armMessage() {
        if (message != null || expectingMessage) {
            return false;
        }
        expectingMessage = true;
        return true;
    }

    boolean armCallbackConfirm() {
        if (callbackNumber != null || expectingCallbackConfirm) {
            return false;
        }
        expectingCallbackConfirm = true;
        return true;
    }

    boolean armCallbackNumber() {
        if (callbackNumber != null || expectingCallbackNumber) {
            return false;
        }
        expectingCallbackNumber = true;
        return true;
    }

    void disarmCallbackConfirm() {
        expectingCallbackConfirm = false;
    }

    void disarmAll() {
        expectingName = false;
        expectingMessage = false;
        expectingCallbackConfirm = false;
        expectingCallbackNumber = false;
    }

    boolean anyGateArmed() {
        return expectingName || expectingMessage || expectingCallbackConfirm || expectingCallbackNumber;
    }

    public GateSnapshot snapshot() {
        return new GateSnapshot(name, nameFromMemory, message, callbackRequested, callbackNumber, callbackSource,
                closingForced, infoRequested, infoProvided, List.copyOf(infoTopics), infoAnswer);
    }

    public boolean isExpectingName() {
        return expectingName;
    }

    public boolean isExpectingMessage() {
        return expectingMessage;
    }

    public boolean isExpectingCallbackConfirm() {
        return expectingCallbackConfirm;
    }

    public boolean isExpectingCallbackNumber() {
        return expectingCallbackNumber;
    }

    public String name() {
        return name;
    }

    public String message() {
        return message;
    }

    public String callbackNumber() {
        return callbackNumber;
    }

    public boolean isCallbackRequested() {
        return callbackRequested;
    }

    public boolean isClosingForced() {
        return closingForced;
    }

    public boolean isInfoRequested() {
        return infoRequested;
    }

    public boolean isInfoProvided() {
        return infoProvided;
    }
}
