package me.go_gradually.phonedesk.application.call.model;

import java.util.LinkedHashMap;
import java.util.Map;

public class CallStartCommand {
    private String callSid;
    private String streamSid;
    private String caller;
    private String called;
    private Map<String, String> customParameters = new LinkedHashMap<>();

    public String getCallSid() {
        return callSid;
    }

    public void setCallSid(String callSid) {
        this.callSid = callSid;
    }

    public String getStreamSid() {
        return streamSid;
    }

    public void setStreamSid(String streamSid) {
        this.streamSid = streamSid;
    }

    public String getCaller() {
        return caller;
    }

    public void setCaller(String caller) {
        this.caller = caller;
    }

    public String getCalled() {
        return called;
    }

    public void setCalled(String called) {
        this.called = called;
    }

    public Map<String, String> getCustomParameters() {
        return customParameters;
    }

    public void setCustomParameters(Map<String, String> customParameters) {
        this.customParameters = customParameters == null ? new LinkedHashMap<>() : new LinkedHashMap<>(customParameters);
    }
}
