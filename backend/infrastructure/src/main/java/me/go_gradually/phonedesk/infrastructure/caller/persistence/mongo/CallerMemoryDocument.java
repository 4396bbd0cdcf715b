package me.go_gradually.phonedesk.infrastructure.caller.persistence.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "caller_memory")
public class CallerMemoryDocument {
    @Id
    private String callerKey;
    private String callerIdE164;
    private String name;
    private long callCount;
    private Instant lastCallAt;
    private Instant createdAt = Instant.now();
    private Instant updatedAt = Instant.now();

    public String getCallerKey() {
        return callerKey;
    }

    public void setCallerKey(String callerKey) {
        this.callerKey = callerKey;
    }

    public String getCallerIdE164() {
        return callerIdE164;
    }

    public void setCallerIdE164(String callerIdE164) {
        this.callerIdE164 = callerIdE164;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public long getCallCount() {
        return callCount;
    }

    public void setCallCount(long callCount) {
        this.callCount = callCount;
    }

    public Instant getLastCallAt() {
        return lastCallAt;
    }

    public void setLastCallAt(Instant lastCallAt) {
        this.lastCallAt = lastCallAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
