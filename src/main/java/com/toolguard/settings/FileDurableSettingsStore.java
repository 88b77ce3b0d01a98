package com.toolguard.settings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Stores the settings document in a single file. Writes go to a sibling temp
 * file first and are moved into place, so a crash never leaves a torn document.
 * Encryption at rest is left to the volume the file lives on.
 */
public class FileDurableSettingsStore implements DurableSettingsStore {

    private static final Logger log = LoggerFactory.getLogger(FileDurableSettingsStore.class);

    private final Path file;

    public FileDurableSettingsStore(Path file) {
        this.file = file;
    }

    @Override
    public String load() {
        if (!Files.exists(file)) return null;
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SettingsStoreException("Failed to read settings from " + file, e);
        }
    }

    @Override
    public void save(String document) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.writeString(temp, document, StandardCharsets.UTF_8);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new SettingsStoreException("Failed to write settings to " + file, e);
        }
    }

    @Override
    public void reset() {
        try {
            if (Files.deleteIfExists(file)) {
                log.info("Deleted stored security settings at {}", file);
            }
        } catch (IOException e) {
            throw new SettingsStoreException("Failed to delete settings at " + file, e);
        }
    }
}
