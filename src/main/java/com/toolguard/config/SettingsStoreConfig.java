package com.toolguard.config;

import com.toolguard.regex.SafeRegexEvaluator;
import com.toolguard.settings.DurableSettingsStore;
import com.toolguard.settings.FileDurableSettingsStore;
import com.toolguard.settings.FileLegacySettingsSource;
import com.toolguard.settings.InMemoryDurableSettingsStore;
import com.toolguard.settings.LegacySettingsSource;
import com.toolguard.settings.NoLegacySettingsSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the settings store collaborators. A deployment that ships its own
 * encrypted store only has to declare a {@link DurableSettingsStore} bean.
 */
@Configuration
public class SettingsStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(SettingsStoreConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Single thread, so durable writes land in the order they were flushed.
     */
    @Bean(name = "settingsPersistenceExecutor", destroyMethod = "shutdown")
    public ExecutorService settingsPersistenceExecutor() {
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "toolguard-settings-persist");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Separate from the write thread; a load stuck past the init timeout is
     * abandoned here and interrupted on shutdown.
     */
    @Bean(name = "settingsHydrationExecutor", destroyMethod = "shutdownNow")
    public ExecutorService settingsHydrationExecutor() {
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "toolguard-settings-load");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    @ConditionalOnMissingBean
    public DurableSettingsStore durableSettingsStore(ToolguardProperties properties) {
        String file = properties.getSettings().getDurableFile();
        if (file == null || file.isBlank()) {
            log.warn("No toolguard.settings.durable-file configured, security settings will not survive a restart");
            return new InMemoryDurableSettingsStore();
        }
        log.info("Security settings stored at {}", file);
        return new FileDurableSettingsStore(Path.of(file));
    }

    @Bean
    @ConditionalOnMissingBean
    public LegacySettingsSource legacySettingsSource(ToolguardProperties properties) {
        String file = properties.getSettings().getLegacyFile();
        if (file == null || file.isBlank()) {
            return new NoLegacySettingsSource();
        }
        return new FileLegacySettingsSource(Path.of(file));
    }

    @Bean
    public SafeRegexEvaluator safeRegexEvaluator(ToolguardProperties properties) {
        ToolguardProperties.RegexProperties regex = properties.getRegex();
        return new SafeRegexEvaluator(
                regex.getMatchTimeout() != null ? regex.getMatchTimeout() : SafeRegexEvaluator.DEFAULT_MATCH_TIMEOUT,
                regex.getCacheSize());
    }
}
