package com.toolguard.settings;

import java.util.Optional;

/**
 * Unencrypted settings blob left behind by earlier releases. Read once during
 * initialization and then deleted.
 */
public interface LegacySettingsSource {

    Optional<String> read();

    void delete();
}
