package com.toolguard.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "toolguard")
public class ToolguardProperties {

    private SettingsProperties settings = new SettingsProperties();
    private RegexProperties regex = new RegexProperties();
    private SessionOverrideProperties sessionOverride = new SessionOverrideProperties();
    private LoggingProperties logging = new LoggingProperties();

    public SettingsProperties getSettings() { return settings; }
    public void setSettings(SettingsProperties settings) { this.settings = settings; }

    public RegexProperties getRegex() { return regex; }
    public void setRegex(RegexProperties regex) { this.regex = regex; }

    public SessionOverrideProperties getSessionOverride() { return sessionOverride; }
    public void setSessionOverride(SessionOverrideProperties sessionOverride) { this.sessionOverride = sessionOverride; }

    public LoggingProperties getLogging() { return logging; }
    public void setLogging(LoggingProperties logging) { this.logging = logging; }

    public static class SettingsProperties {
        private Duration initTimeout = Duration.ofSeconds(5);
        private String durableFile;
        private String legacyFile;

        public Duration getInitTimeout() { return initTimeout; }
        public void setInitTimeout(Duration initTimeout) { this.initTimeout = initTimeout; }
        public String getDurableFile() { return durableFile; }
        public void setDurableFile(String durableFile) { this.durableFile = durableFile; }
        public String getLegacyFile() { return legacyFile; }
        public void setLegacyFile(String legacyFile) { this.legacyFile = legacyFile; }
    }

    public static class RegexProperties {
        private Duration matchTimeout = Duration.ofMillis(100);
        private int cacheSize = 512;

        public Duration getMatchTimeout() { return matchTimeout; }
        public void setMatchTimeout(Duration matchTimeout) { this.matchTimeout = matchTimeout; }
        public int getCacheSize() { return cacheSize; }
        public void setCacheSize(int cacheSize) { this.cacheSize = cacheSize; }
    }

    public static class SessionOverrideProperties {
        // 0 leaves the window uncapped
        private int maxMinutes = 0;

        public int getMaxMinutes() { return maxMinutes; }
        public void setMaxMinutes(int maxMinutes) { this.maxMinutes = maxMinutes; }
    }

    public static class LoggingProperties {
        private List<String> redactPatterns = new ArrayList<>();

        public List<String> getRedactPatterns() { return redactPatterns; }
        public void setRedactPatterns(List<String> redactPatterns) { this.redactPatterns = redactPatterns; }
    }
}
