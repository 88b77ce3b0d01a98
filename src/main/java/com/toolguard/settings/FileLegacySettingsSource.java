package com.toolguard.settings;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Legacy plaintext settings file. A missing or empty file means there is
 * nothing to migrate.
 */
public class FileLegacySettingsSource implements LegacySettingsSource {

    private final Path file;

    public FileLegacySettingsSource(Path file) {
        this.file = file;
    }

    @Override
    public Optional<String> read() {
        if (!Files.isRegularFile(file)) return Optional.empty();
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            return content.isBlank() ? Optional.empty() : Optional.of(content);
        } catch (IOException e) {
            throw new SettingsStoreException("Failed to read legacy settings from " + file, e);
        }
    }

    @Override
    public void delete() {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new SettingsStoreException("Failed to delete legacy settings at " + file, e);
        }
    }
}
