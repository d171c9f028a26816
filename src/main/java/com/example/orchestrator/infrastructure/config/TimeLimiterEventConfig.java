package com.example.orchestrator.infrastructure.config;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;

/**
 * Logs time limiter events of the outbound user and payment calls.
 */
@Configuration
public class TimeLimiterEventConfig {

    private static final Logger log = LoggerFactory.getLogger(TimeLimiterEventConfig.class);

    private final TimeLimiterRegistry timeLimiterRegistry;

    public TimeLimiterEventConfig(TimeLimiterRegistry timeLimiterRegistry) {
        this.timeLimiterRegistry = timeLimiterRegistry;
    }

    @PostConstruct
    public void registerEventListeners() {
        timeLimiterRegistry.getAllTimeLimiters().forEach(this::registerTimeLimiterEventListener);
        timeLimiterRegistry.getEventPublisher()
                .onEntryAdded(event -> registerTimeLimiterEventListener(event.getAddedEntry()));
    }

    private void registerTimeLimiterEventListener(TimeLimiter timeLimiter) {
        timeLimiter.getEventPublisher()
                .onTimeout(event -> log.warn(
                        "[TIMEOUT] name={}, call exceeded its time limit",
                        event.getTimeLimiterName()))
                .onSuccess(event -> log.debug(
                        "[TL_SUCCESS] name={}, completed within time limit",
                        event.getTimeLimiterName()))
                .onError(event -> log.error(
                        "[TL_ERROR] name={}, error={}",
                        event.getTimeLimiterName(),
                        event.getThrowable().getMessage()));
    }
}
