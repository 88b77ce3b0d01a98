package com.toolguard.settings;

/**
 * Durable, encrypted-at-rest storage for the serialized settings document.
 * Implementations may throw any runtime exception; the settings store
 * catches, logs and absorbs it.
 */
public interface DurableSettingsStore {

    /**
     * Returns the stored document, or null when nothing has been stored.
     */
    String load();

    void save(String document);

    /**
     * Removes the stored document.
     */
    void reset();
}
