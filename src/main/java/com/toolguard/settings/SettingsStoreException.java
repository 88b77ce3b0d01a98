package com.toolguard.settings;

public class SettingsStoreException extends RuntimeException {

    public SettingsStoreException(String message) {
        super(message);
    }

    public SettingsStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
