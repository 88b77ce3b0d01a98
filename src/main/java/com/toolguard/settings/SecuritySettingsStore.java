package com.toolguard.settings;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.toolguard.config.ToolguardProperties;
import com.toolguard.observability.ToolguardMetrics;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Holds the active {@link SecuritySettings}. Reads are served from an in-memory
 * value that is swapped wholesale on every change; durable writes are queued
 * and flushed on a background executor.
 * <p>
 * Only the newest pending write is kept. A write always flushes the cache as it
 * is at flush time, so the durable copy converges on the last save even when
 * an earlier flush failed.
 */
@Service
public class SecuritySettingsStore {

    private static final Logger log = LoggerFactory.getLogger(SecuritySettingsStore.class);

    static final int MAX_ROTATION_INTERVAL_DAYS = 365;

    public enum State { UNINITIALIZED, INITIALIZING, READY }

    public record PersistenceStatus(State state,
                                    long successfulWrites,
                                    long failedWrites,
                                    boolean lastWriteFailed,
                                    String lastError,
                                    Instant lastErrorAt) {}

    private enum PendingWrite { SAVE, RESET }

    private static final SecuritySettings DEFAULTS = SecuritySettingsDefaults.create();

    private final DurableSettingsStore durableStore;
    private final LegacySettingsSource legacySource;
    private final ObjectMapper objectMapper;
    private final Executor hydrationExecutor;
    private final Executor persistenceExecutor;
    private final ToolguardMetrics metrics;
    private final Clock clock;
    private final Duration initTimeout;

    private final AtomicReference<SecuritySettings> cache = new AtomicReference<>();
    private final AtomicReference<State> state = new AtomicReference<>(State.UNINITIALIZED);
    private final AtomicReference<CompletableFuture<Void>> initialization = new AtomicReference<>();

    private final AtomicReference<PendingWrite> pending = new AtomicReference<>();
    private final AtomicBoolean draining = new AtomicBoolean();

    private final AtomicLong successfulWrites = new AtomicLong();
    private final AtomicLong failedWrites = new AtomicLong();
    private final AtomicBoolean lastWriteFailed = new AtomicBoolean();
    private final AtomicReference<String> lastError = new AtomicReference<>();
    private final AtomicReference<Instant> lastErrorAt = new AtomicReference<>();

    public SecuritySettingsStore(DurableSettingsStore durableStore,
                                 LegacySettingsSource legacySource,
                                 ObjectMapper objectMapper,
                                 @Qualifier("settingsHydrationExecutor") Executor hydrationExecutor,
                                 @Qualifier("settingsPersistenceExecutor") Executor persistenceExecutor,
                                 ToolguardProperties properties,
                                 ToolguardMetrics metrics,
                                 Clock clock) {
        this.durableStore = Objects.requireNonNull(durableStore, "durableStore");
        this.legacySource = Objects.requireNonNull(legacySource, "legacySource");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.hydrationExecutor = Objects.requireNonNull(hydrationExecutor, "hydrationExecutor");
        this.persistenceExecutor = Objects.requireNonNull(persistenceExecutor, "persistenceExecutor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        Duration configured = properties.getSettings().getInitTimeout();
        this.initTimeout = configured != null && !configured.isNegative() && !configured.isZero()
                ? configured : Duration.ofSeconds(5);
    }

    @PostConstruct
    void start() {
        init();
    }

    /**
     * Hydrates the cache from the durable store, migrating and deleting any
     * legacy plaintext blob first. Runs once; later calls return the same
     * future. The future always completes normally: on failure or timeout the
     * store falls back to defaults.
     * <p>
     * Hydration runs on its own executor, so a durable store that hangs while
     * loading does not hold up later writes.
     */
    public CompletableFuture<Void> init() {
        CompletableFuture<Void> existing = initialization.get();
        if (existing != null) return existing;

        CompletableFuture<Void> done = new CompletableFuture<>();
        if (!initialization.compareAndSet(null, done)) {
            return initialization.get();
        }
        state.set(State.INITIALIZING);

        CompletableFuture<SecuritySettings> hydration;
        try {
            hydration = CompletableFuture.supplyAsync(this::hydrate, hydrationExecutor);
        } catch (RejectedExecutionException e) {
            hydration = CompletableFuture.failedFuture(e);
        }

        hydration.orTimeout(initTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((hydrated, error) -> {
                    if (error != null) {
                        log.warn("Failed to load security settings, using defaults: {}", describe(error));
                        metrics.recordSettingsPersist("init", "failure");
                        cache.compareAndSet(null, SecuritySettingsDefaults.create());
                    } else {
                        metrics.recordSettingsPersist("init", "success");
                        if (!cache.compareAndSet(null, hydrated)) {
                            log.info("Security settings changed during initialization, keeping the newer value");
                        }
                    }
                    state.set(State.READY);
                    done.complete(null);
                });
        return done;
    }

    public SecuritySettings load() {
        SecuritySettings current = cache.get();
        return (current != null ? current : DEFAULTS).copy();
    }

    /**
     * Replaces the active settings. The new value is visible to {@link #load()}
     * as soon as this returns; the durable write happens later and its failure
     * is never reported to the caller.
     */
    public void save(SecuritySettings settings) {
        Objects.requireNonNull(settings, "settings");
        cache.set(normalize(settings.copy()));
        enqueue(PendingWrite.SAVE);
    }

    /**
     * Read-modify-write against the current value. The operator receives a
     * private copy and may mutate and return it. Returns a copy of the value
     * that was stored; when the operator changes nothing no write is queued.
     */
    public SecuritySettings update(UnaryOperator<SecuritySettings> mutation) {
        Objects.requireNonNull(mutation, "mutation");
        while (true) {
            SecuritySettings current = cache.get();
            SecuritySettings base = current != null ? current : DEFAULTS;
            SecuritySettings next = mutation.apply(base.copy());
            if (next == null) {
                throw new IllegalArgumentException("Settings mutation returned null");
            }
            next = normalize(next);
            if (next.equals(base)) {
                return next.copy();
            }
            if (cache.compareAndSet(current, next)) {
                enqueue(PendingWrite.SAVE);
                return next.copy();
            }
        }
    }

    /**
     * Restores defaults and clears the durable row. The clear goes through the
     * same write queue as saves, so whichever of the two was called last also
     * lands last.
     */
    public void reset() {
        cache.set(SecuritySettingsDefaults.create());
        enqueue(PendingWrite.RESET);
        log.info("Security settings reset to defaults");
    }

    public State getState() {
        return state.get();
    }

    public PersistenceStatus getPersistenceStatus() {
        return new PersistenceStatus(state.get(), successfulWrites.get(), failedWrites.get(),
                lastWriteFailed.get(), lastError.get(), lastErrorAt.get());
    }

    // --- hydration ---

    private SecuritySettings hydrate() {
        migrateLegacy();

        String document = durableStore.load();
        if (document == null || document.isBlank()) {
            log.info("No stored security settings found, using defaults");
            return SecuritySettingsDefaults.create();
        }
        SecuritySettings merged = mergeOverDefaults(document);
        log.info("Loaded security settings: {}", merged);
        return merged;
    }

    private void migrateLegacy() {
        try {
            Optional<String> legacy = legacySource.read();
            if (legacy.isEmpty()) return;

            SecuritySettings parsed;
            try {
                parsed = mergeOverDefaults(legacy.get());
            } catch (SettingsStoreException e) {
                log.warn("Discarding unreadable legacy security settings: {}", e.getMessage());
                return;
            }

            String existing = durableStore.load();
            if (existing == null || existing.isBlank()) {
                durableStore.save(serialize(parsed));
                metrics.recordSettingsPersist("migrate", "success");
                log.info("Migrated legacy security settings into the durable store");
            } else {
                log.info("Durable security settings already present, legacy copy ignored");
            }
        } finally {
            try {
                legacySource.delete();
            } catch (RuntimeException e) {
                log.warn("Failed to delete legacy security settings: {}", e.getMessage());
            }
        }
    }

    private SecuritySettings mergeOverDefaults(String document) {
        try {
            SecuritySettings merged = objectMapper.readerForUpdating(SecuritySettingsDefaults.create())
                    .readValue(document);
            return normalize(merged);
        } catch (IOException e) {
            throw new SettingsStoreException("Malformed security settings document", e);
        }
    }

    // --- write queue ---

    private void enqueue(PendingWrite write) {
        pending.set(write);
        scheduleDrain();
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) return;
        try {
            persistenceExecutor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            PendingWrite dropped = pending.getAndSet(null);
            if (dropped != null) {
                recordFailure(operationName(dropped), e);
            }
        }
    }

    private void drain() {
        try {
            PendingWrite write;
            while ((write = pending.getAndSet(null)) != null) {
                flush(write);
            }
        } finally {
            draining.set(false);
        }
        // a write queued between the last poll and releasing the flag
        if (pending.get() != null) {
            scheduleDrain();
        }
    }

    private void flush(PendingWrite write) {
        String operation = operationName(write);
        try {
            if (write == PendingWrite.RESET) {
                durableStore.reset();
            } else {
                durableStore.save(serialize(load()));
            }
            successfulWrites.incrementAndGet();
            lastWriteFailed.set(false);
            metrics.recordSettingsPersist(operation, "success");
        } catch (RuntimeException e) {
            recordFailure(operation, e);
        }
    }

    private void recordFailure(String operation, Exception e) {
        log.warn("Failed to persist security settings ({}): {}", operation, e.getMessage());
        failedWrites.incrementAndGet();
        lastWriteFailed.set(true);
        lastError.set(operation + ": " + e.getMessage());
        lastErrorAt.set(clock.instant());
        metrics.recordSettingsPersist(operation, "failure");
    }

    private String serialize(SecuritySettings settings) {
        try {
            return objectMapper.writeValueAsString(settings);
        } catch (JsonProcessingException e) {
            throw new SettingsStoreException("Failed to serialize security settings", e);
        }
    }

    private static String operationName(PendingWrite write) {
        return write == PendingWrite.RESET ? "reset" : "save";
    }

    private static String describe(Throwable error) {
        Throwable cause = error;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getSimpleName();
    }

    /**
     * Drops blank and duplicate patterns (first occurrence wins) and clamps
     * the rotation interval. Mutates and returns the given instance.
     */
    static SecuritySettings normalize(SecuritySettings settings) {
        settings.setCommandAllowlist(cleanPatterns(settings.getCommandAllowlist()));
        settings.setCommandDenylist(cleanPatterns(settings.getCommandDenylist()));
        int days = settings.getTokenRotationIntervalDays();
        settings.setTokenRotationIntervalDays(Math.max(0, Math.min(MAX_ROTATION_INTERVAL_DAYS, days)));
        return settings;
    }

    private static List<String> cleanPatterns(List<String> patterns) {
        Set<String> kept = new LinkedHashSet<>();
        for (String pattern : patterns) {
            if (pattern != null && !pattern.isBlank()) kept.add(pattern);
        }
        return new ArrayList<>(kept);
    }
}
