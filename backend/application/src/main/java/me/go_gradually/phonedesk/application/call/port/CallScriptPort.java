package me.go_gradually.phonedesk.application.call.port;

import me.go_gradually.phonedesk.application.call.model.CallScript;

public interface CallScriptPort {
    CallScript load();
}
