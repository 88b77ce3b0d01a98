package com.toolguard.config;

import io.micrometer.observation.ObservationRegistry;
import io.micrometer.observation.aop.ObservedAspect;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Turns {@code @Observed} on {@code ApprovalAdvisor.evaluate} into the
 * {@code toolguard.approval.evaluate} timer. Without the aspect the annotation
 * is inert.
 */
@Configuration
public class ObservabilityConfig {

    @Bean
    public ObservedAspect approvalObservedAspect(ObservationRegistry observationRegistry) {
        return new ObservedAspect(observationRegistry);
    }
}
