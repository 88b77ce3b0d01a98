package com.toolguard.observability;

import com.toolguard.settings.SecuritySettingsStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports whether the settings store has finished loading and whether its
 * last durable write went through. A failed write leaves policy decisions
 * correct but means the current settings would be lost on restart.
 */
@Component
public class SettingsStoreHealthIndicator implements HealthIndicator {

    private final SecuritySettingsStore store;

    public SettingsStoreHealthIndicator(SecuritySettingsStore store) {
        this.store = store;
    }

    @Override
    public Health health() {
        SecuritySettingsStore.PersistenceStatus status = store.getPersistenceStatus();
        if (status.state() != SecuritySettingsStore.State.READY) {
            return Health.outOfService()
                    .withDetail("state", status.state().name())
                    .build();
        }

        Health.Builder builder = status.lastWriteFailed() ? Health.down() : Health.up();
        builder.withDetail("state", status.state().name())
                .withDetail("successfulWrites", status.successfulWrites())
                .withDetail("failedWrites", status.failedWrites());
        if (status.lastError() != null) {
            builder.withDetail("lastError", status.lastError());
            builder.withDetail("lastErrorAt", String.valueOf(status.lastErrorAt()));
        }
        return builder.build();
    }
}
