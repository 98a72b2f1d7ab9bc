/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ClaimTokenGeneratorTest {

    @Test
    @DisplayName("Should generate URL-safe tokens without padding")
    void shouldGenerateUrlSafeTokens() {
        var generator = new ClaimTokenGenerator();

        var token = generator.nextToken();

        assertEquals(43, token.length());
        assertTrue(token.matches("[A-Za-z0-9_-]+"));
    }

    @Test
    @DisplayName("Should generate distinct tokens")
    void shouldGenerateDistinctTokens() {
        var generator = new ClaimTokenGenerator();
        var tokens = new HashSet<String>();

        for (int i = 0; i < 1000; i++) {
            tokens.add(generator.nextToken());
        }

        assertEquals(1000, tokens.size());
    }

    @Test
    @DisplayName("Should handle concurrent token generation")
    void shouldHandleConcurrentGeneration() throws InterruptedException {
        var generator = new ClaimTokenGenerator();
        int numThreads = 20;
        Set<String> tokens = ConcurrentHashMap.newKeySet();
        var latch = new CountDownLatch(numThreads);

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        try {
            for (int i = 0; i < numThreads; i++) {
                executor.submit(() -> {
                    try {
                        tokens.add(generator.nextToken());
                    } finally {
                        latch.countDown();
                    }
                });
            }
            assertTrue(latch.await(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }

        assertEquals(numThreads, tokens.size());
    }
}
