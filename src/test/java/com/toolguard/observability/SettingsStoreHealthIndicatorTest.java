package com.toolguard.observability;

import com.toolguard.settings.SecuritySettingsStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SettingsStoreHealthIndicatorTest {

    @Mock
    private SecuritySettingsStore store;

    @Test
    void outOfServiceUntilInitialized() {
        when(store.getPersistenceStatus()).thenReturn(new SecuritySettingsStore.PersistenceStatus(
                SecuritySettingsStore.State.INITIALIZING, 0, 0, false, null, null));

        Health health = new SettingsStoreHealthIndicator(store).health();

        assertEquals(Status.OUT_OF_SERVICE, health.getStatus());
    }

    @Test
    void upWhenLastWriteSucceeded() {
        when(store.getPersistenceStatus()).thenReturn(new SecuritySettingsStore.PersistenceStatus(
                SecuritySettingsStore.State.READY, 3, 0, false, null, null));

        Health health = new SettingsStoreHealthIndicator(store).health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(3L, health.getDetails().get("successfulWrites"));
    }

    @Test
    void downWhenLastWriteFailed() {
        when(store.getPersistenceStatus()).thenReturn(new SecuritySettingsStore.PersistenceStatus(
                SecuritySettingsStore.State.READY, 1, 2, true, "save: disk full",
                Instant.parse("2026-02-01T00:00:00Z")));

        Health health = new SettingsStoreHealthIndicator(store).health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("save: disk full", health.getDetails().get("lastError"));
    }
}
