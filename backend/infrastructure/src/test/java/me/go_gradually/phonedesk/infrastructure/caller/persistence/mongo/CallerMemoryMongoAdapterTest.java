package me.go_gradually.phonedesk.infrastructure.caller.persistence.mongo;

import me.go_gradually.phonedesk.domain.caller.CallerMemory;
import me.go_gradually.phonedesk.infrastructure.shared.config.AppProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CallerMemoryMongoAdapterTest {
    private static final Instant NOW = Instant.parse("2024-05-01T09:30:00Z");

    @Mock
    private CallerMemoryMongoRepository repository;

    private AppProperties properties;
    private CallerMemoryMongoAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new AppProperties();
        properties.getMemory().setEnabled(true);
        adapter = new CallerMemoryMongoAdapter(repository, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void lookup_mapsDocumentByNormalizedAddress() {
        when(repository.findById("+972501234567")).thenReturn(Optional.of(document("+972501234567", "Dana", 2)));

        Optional<CallerMemory> memory = adapter.lookup("972-50-123-4567");

        assertTrue(memory.isPresent());
        assertEquals("Dana", memory.get().name());
        assertEquals(2, memory.get().callCount());
    }

    @Test
    void upsertCall_createsRecordAndCountsFirstCall() {
        when(repository.findById("+972501234567")).thenReturn(Optional.empty());

        adapter.upsertCall("+972501234567");

        ArgumentCaptor<CallerMemoryDocument> captor = ArgumentCaptor.forClass(CallerMemoryDocument.class);
        verify(repository).save(captor.capture());
        CallerMemoryDocument saved = captor.getValue();
        assertEquals("+972501234567", saved.getCallerKey());
        assertEquals("+972501234567", saved.getCallerIdE164());
        assertEquals(1, saved.getCallCount());
        assertEquals(NOW, saved.getLastCallAt());
        assertEquals(NOW, saved.getCreatedAt());
    }

    @Test
    void upsertCall_incrementsExistingCounter() {
        when(repository.findById("+972501234567")).thenReturn(Optional.of(document("+972501234567", "Dana", 4)));

        adapter.upsertCall("+972501234567");

        ArgumentCaptor<CallerMemoryDocument> captor = ArgumentCaptor.forClass(CallerMemoryDocument.class);
        verify(repository).save(captor.capture());
        assertEquals(5, captor.getValue().getCallCount());
        assertEquals("Dana", captor.getValue().getName());
    }

    @Test
    void saveName_storesTrimmedName() {
        when(repository.findById("+972501234567")).thenReturn(Optional.of(document("+972501234567", null, 1)));

        adapter.saveName("+972501234567", "  Omer ");

        ArgumentCaptor<CallerMemoryDocument> captor = ArgumentCaptor.forClass(CallerMemoryDocument.class);
        verify(repository).save(captor.capture());
        assertEquals("Omer", captor.getValue().getName());
        assertEquals(NOW, captor.getValue().getUpdatedAt());
    }

    @Test
    void lookup_swallowsRepositoryFailure() {
        when(repository.findById(any())).thenThrow(new IllegalStateException("mongo down"));

        assertTrue(adapter.lookup("+972501234567").isEmpty());
    }

    @Test
    void unusableAddressOrDisabledMemoryIsIgnored() {
        adapter.upsertCall("anonymous");
        properties.getMemory().setEnabled(false);
        adapter.saveName("+972501234567", "Dana");

        verifyNoInteractions(repository);
    }

    private CallerMemoryDocument document(String key, String name, long callCount) {
        CallerMemoryDocument doc = new CallerMemoryDocument();
        doc.setCallerKey(key);
        doc.setCallerIdE164(key);
        doc.setName(name);
        doc.setCallCount(callCount);
        doc.setLastCallAt(Instant.parse("2024-04-01T08:00:00Z"));
        return doc;
    }
}
