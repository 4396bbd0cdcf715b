package me.go_gradually.phonedesk.domain.call;

import java.util.Map;

public record CallIdentity(String callSid,
                           String streamSid,
                           String caller,
                           String called,
                           Map<String, String> customParameters) {
    public CallIdentity {
        customParameters = customParameters == null ? Map.of() : Map.copyOf(customParameters);
    }
}
