package me.go_gradually.phonedesk.infrastructure.caller.persistence.mongo;

import me.go_gradually.phonedesk.application.call.port.CallerMemoryPort;
import me.go_gradually.phonedesk.domain.caller.CallerAddress;
import me.go_gradually.phonedesk.domain.caller.CallerMemory;
import me.go_gradually.phonedesk.infrastructure.shared.config.AppProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

@Component
public class CallerMemoryMongoAdapter implements CallerMemoryPort {
    private static final Logger log = Logger.getLogger(CallerMemoryMongoAdapter.class.getName());

    private final CallerMemoryMongoRepository repository;
    private final AppProperties properties;
    private final Clock clock;

    public CallerMemoryMongoAdapter(CallerMemoryMongoRepository repository, AppProperties properties) {
        this(repository, properties, Clock.systemUTC());
    }

    CallerMemoryMongoAdapter(CallerMemoryMongoRepository repository, AppProperties properties, Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public Optional<CallerMemory> lookup(String callerAddress) {
        Optional<String> key = callerKey(callerAddress);
        if (key.isEmpty()) {
            return Optional.empty();
        }
        try {
            return repository.findById(key.get()).map(this::toDomain);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, e, () -> "caller.memory.lookup_failed caller=" + key.get());
            return Optional.empty();
        }
    }

    @Override
    public void upsertCall(String callerAddress) {
        Optional<String> key = callerKey(callerAddress);
        if (key.isEmpty()) {
            return;
        }
        try {
            Instant now = clock.instant();
            CallerMemoryDocument doc = repository.findById(key.get()).orElseGet(() -> newDocument(key.get(), now));
            doc.setCallCount(doc.getCallCount() + 1);
            doc.setLastCallAt(now);
            doc.setUpdatedAt(now);
            repository.save(doc);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, e, () -> "caller.memory.upsert_failed caller=" + key.get());
        }
    }

    @Override
    public void saveName(String callerAddress, String name) {
        Optional<String> key = callerKey(callerAddress);
        if (key.isEmpty() || name == null || name.isBlank()) {
            return;
        }
        try {
            Instant now = clock.instant();
            CallerMemoryDocument doc = repository.findById(key.get()).orElseGet(() -> newDocument(key.get(), now));
            doc.setName(name.trim());
            doc.setUpdatedAt(now);
            repository.save(doc);
            log.fine(() -> "caller.memory.name_saved caller=" + key.get());
        } catch (RuntimeException e) {
            log.log(Level.WARNING, e, () -> "caller.memory.save_name_failed caller=" + key.get());
        }
    }

    private Optional<String> callerKey(String callerAddress) {
        if (!properties.getMemory().isEnabled()) {
            return Optional.empty();
        }
        return CallerAddress.normalizeE164(callerAddress);
    }

    private CallerMemoryDocument newDocument(String key, Instant now) {
        CallerMemoryDocument doc = new CallerMemoryDocument();
        doc.setCallerKey(key);
        doc.setCallerIdE164(key);
        doc.setCallCount(0);
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);
        return doc;
    }

    private CallerMemory toDomain(CallerMemoryDocument doc) {
        return new CallerMemory(doc.getCallerKey(), doc.getName(), Math.max(0L, doc.getCallCount()), doc.getLastCallAt());
    }
}
