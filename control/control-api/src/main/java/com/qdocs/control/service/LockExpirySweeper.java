/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.service;

import com.qdocs.control.config.SweeperConfig;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Background reclaim of expired edit locks and login sessions.
 * Runs on a single dedicated thread with a fixed delay between passes.
 */
@Slf4j
@Component
public class LockExpirySweeper {

    private final EditLockService editLockService;
    private final SessionService sessionService;
    private final SweeperConfig sweeperConfig;
    private ScheduledExecutorService sweepExecutor;

    public LockExpirySweeper(EditLockService editLockService, SessionService sessionService,
                             SweeperConfig sweeperConfig) {
        this.editLockService = editLockService;
        this.sessionService = sessionService;
        this.sweeperConfig = sweeperConfig;
    }

    @PostConstruct
    public void startSweepTask() {
        if (!sweeperConfig.isEnabled()) {
            log.info("Lock expiry sweeper disabled");
            return;
        }
        sweepExecutor = Executors.newSingleThreadScheduledExecutor(namedThreads("lock-sweeper-"));
        sweepExecutor.scheduleWithFixedDelay(
                this::runSweep,
                sweeperConfig.getInitialDelay().toMillis(),
                sweeperConfig.getInterval().toMillis(),
                TimeUnit.MILLISECONDS
        );
        log.info("Lock expiry sweeper started with interval: {}", sweeperConfig.getInterval());
    }

    @PreDestroy
    public void stopSweepTask() {
        if (sweepExecutor != null) {
            sweepExecutor.shutdown();
            try {
                if (!sweepExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    sweepExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                sweepExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * One pass over expired locks, then expired sessions. Each record is reclaimed in
     * its own transaction; an interrupt stops the pass between two records.
     */
    public SweepReport sweepOnce() {
        int batchSize = sweeperConfig.getBatchSize();
        int locks = reclaim(editLockService.findExpiredLockIds(batchSize), editLockService::reclaimExpired);
        int sessions = reclaim(sessionService.findExpiredSessionIds(batchSize), sessionService::reclaimExpired);
        return new SweepReport(locks, sessions);
    }

    private void runSweep() {
        try {
            var report = sweepOnce();
            if (report.total() > 0) {
                log.info("Sweep reclaimed {} expired locks and {} expired sessions",
                        report.locksReclaimed(), report.sessionsExpired());
            }
        } catch (RuntimeException e) {
            // An exception escaping here would cancel every later run.
            log.error("Lock expiry sweep failed", e);
        }
    }

    private static int reclaim(List<Long> ids, Function<Long, Boolean> reclaimer) {
        int reclaimed = 0;
        for (var id : ids) {
            if (Thread.currentThread().isInterrupted()) {
                log.info("Sweep interrupted after {} of {} records", reclaimed, ids.size());
                break;
            }
            if (reclaimer.apply(id)) {
                reclaimed++;
            }
        }
        return reclaimed;
    }

    private static ThreadFactory namedThreads(String prefix) {
        var counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Counts of records one pass closed.
     */
    public record SweepReport(int locksReclaimed, int sessionsExpired) {
        public int total() {
            return locksReclaimed + sessionsExpired;
        }
    }
}
