package com.toolguard.settings;

import java.util.Optional;

/**
 * Used when no legacy settings location is configured.
 */
public class NoLegacySettingsSource implements LegacySettingsSource {

    @Override
    public Optional<String> read() {
        return Optional.empty();
    }

    @Override
    public void delete() {
        // nothing to delete
    }
}
