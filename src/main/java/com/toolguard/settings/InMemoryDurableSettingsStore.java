package com.toolguard.settings;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local durable store for development and tests.
 * Nothing survives a restart; configure toolguard.settings.durable-file for that.
 */
public class InMemoryDurableSettingsStore implements DurableSettingsStore {

    private final AtomicReference<String> document = new AtomicReference<>();

    public InMemoryDurableSettingsStore() {}

    public InMemoryDurableSettingsStore(String initialDocument) {
        document.set(initialDocument);
    }

    @Override
    public String load() {
        return document.get();
    }

    @Override
    public void save(String value) {
        document.set(value);
    }

    @Override
    public void reset() {
        document.set(null);
    }
}
