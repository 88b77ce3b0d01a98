package com.toolguard.config;

import com.toolguard.observability.SecretRedactionConverter;
import com.toolguard.regex.SafeRegexEvaluator;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Pushes configured redaction patterns into the Logback
 * {@link SecretRedactionConverter}. Audited command lines routinely carry
 * credentials, so the converter is active even without extra patterns.
 */
@Configuration
public class LoggingConfig {

    private static final Logger log = LoggerFactory.getLogger(LoggingConfig.class);

    private final ToolguardProperties properties;

    public LoggingConfig(ToolguardProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void configureSecretRedaction() {
        List<String> patterns = properties.getLogging().getRedactPatterns();
        if (patterns != null && !patterns.isEmpty()) {
            List<String> accepted = new ArrayList<>();
            for (String pattern : patterns) {
                String problem = SafeRegexEvaluator.validateRegexPattern(pattern);
                if (problem != null) {
                    log.warn("Ignoring log redaction pattern '{}': {}", pattern, problem);
                } else {
                    accepted.add(pattern);
                }
            }
            SecretRedactionConverter.setConfiguredPatterns(accepted);
            log.info("Configured {} additional log redaction patterns", accepted.size());
        } else {
            log.info("Using default log redaction patterns (bearer tokens, passwords, API keys)");
        }
    }
}
