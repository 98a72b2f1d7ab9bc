/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Duration;

/**
 * Bounded retry with exponential backoff for idempotent reads. Mutations never use it.
 */
@Slf4j
@Configuration
@ConfigurationProperties(prefix = "qdocs.read-retry")
@Getter
@Setter
public class ReadRetryConfig {

    private int maxAttempts = 3;
    private Duration initialBackoff = Duration.ofMillis(100);
    private double backoffMultiplier = 2.0;

    @Bean("readRetry")
    public Retry readRetry() {
        var config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoff, backoffMultiplier))
                .retryExceptions(
                        TransientDataAccessException.class,
                        RecoverableDataAccessException.class,
                        CannotCreateTransactionException.class)
                .build();
        var retry = Retry.of("control-read", config);
        retry.getEventPublisher().onRetry(event -> log.warn("Retrying read (attempt {}): {}",
                event.getNumberOfRetryAttempts(), event.getLastThrowable().toString()));
        return retry;
    }
}
