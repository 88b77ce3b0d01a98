package com.toolguard.settings;

import com.toolguard.config.ToolguardProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Objects;

/**
 * Time-boxed "approve everything" window stored in
 * {@link SecuritySettings#getSessionOverrideUntil()}.
 * <p>
 * Expiry is lazy. Nothing clears an elapsed deadline until {@link #remaining()}
 * or {@link #isActive()} is called, so the raw field may hold a past deadline.
 */
@Component
public class SessionOverride {

    private static final Logger log = LoggerFactory.getLogger(SessionOverride.class);

    static final long MILLIS_PER_MINUTE = 60_000L;

    private final SecuritySettingsStore store;
    private final Clock clock;
    private final int maxMinutes;

    public SessionOverride(SecuritySettingsStore store, Clock clock, ToolguardProperties properties) {
        this.store = store;
        this.clock = clock;
        this.maxMinutes = Math.max(0, properties.getSessionOverride().getMaxMinutes());
    }

    /**
     * Opens the window for the given number of minutes, capped at the
     * configured maximum when one is set. A non-positive duration clears the
     * window instead.
     *
     * @return the new deadline in epoch millis, or null when cleared
     */
    public Long activate(int minutes) {
        if (minutes <= 0) {
            clear();
            return null;
        }
        int effective = maxMinutes > 0 ? Math.min(minutes, maxMinutes) : minutes;
        if (effective < minutes) {
            log.info("Session override of {} min capped at {} min", minutes, maxMinutes);
        }
        long until = clock.millis() + effective * MILLIS_PER_MINUTE;
        store.update(settings -> {
            settings.setSessionOverrideUntil(until);
            return settings;
        });
        log.info("Session override active for {} min", effective);
        return until;
    }

    public void clear() {
        store.update(settings -> {
            settings.setSessionOverrideUntil(null);
            return settings;
        });
        log.info("Session override cleared");
    }

    /**
     * Milliseconds left in the window, or 0. An elapsed deadline is cleared
     * and the clear persisted before returning.
     */
    public long remaining() {
        Long until = store.load().getSessionOverrideUntil();
        if (until == null) return 0;

        long now = clock.millis();
        if (now < until) {
            return until - now;
        }

        // only clear the deadline we observed; a concurrent activate wins
        store.update(settings -> {
            if (Objects.equals(settings.getSessionOverrideUntil(), until)) {
                settings.setSessionOverrideUntil(null);
            }
            return settings;
        });
        log.info("Session override expired");
        return 0;
    }

    public boolean isActive() {
        return remaining() > 0;
    }
}
