/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.service;

import com.qdocs.control.model.ControlResult;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Transaction boundaries for control operations.
 *
 * <p>Each mutation runs in exactly one transaction, and a failure result rolls it back
 * so a rejected operation never leaves a partial write. Mutations are not retried.
 * Idempotent reads run through the read retry.
 */
@Slf4j
@Component
public class ControlTransactions {

    private final TransactionTemplate writeTemplate;
    private final TransactionTemplate readTemplate;
    private final Retry readRetry;

    public ControlTransactions(PlatformTransactionManager transactionManager,
                               @Qualifier("readRetry") Retry readRetry) {
        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate.setReadOnly(true);
        this.readRetry = readRetry;
    }

    /**
     * Runs a mutation; commits on success, rolls back on a failure result.
     */
    public <T> ControlResult<T> write(Supplier<ControlResult<T>> work) {
        return write(work, () -> Optional.empty());
    }

    /**
     * Runs a mutation. If the store rejects it with a uniqueness violation (two callers
     * raced to create the same exclusive row) the transaction is gone, and
     * {@code onConflict} is consulted in a fresh read to describe the winner.
     */
    public <T> ControlResult<T> write(Supplier<ControlResult<T>> work,
                                      Supplier<Optional<ControlResult<T>>> onConflict) {
        try {
            return writeTemplate.execute(status -> {
                var result = work.get();
                if (!result.isSuccess()) {
                    status.setRollbackOnly();
                }
                return result;
            });
        } catch (DataIntegrityViolationException e) {
            var translated = readTemplate.execute(status -> onConflict.get());
            if (translated == null || translated.isEmpty()) {
                throw e;
            }
            log.debug("Uniqueness race resolved as {}", translated.get().reason());
            return translated.get();
        }
    }

    /**
     * Runs work in a write transaction with no result-based rollback.
     */
    public <T> T inTransaction(Supplier<T> work) {
        return writeTemplate.execute(status -> work.get());
    }

    /**
     * Runs an idempotent read, retrying transient store failures with backoff.
     */
    public <T> T read(Supplier<T> work) {
        return readRetry.executeSupplier(() -> readTemplate.execute(status -> work.get()));
    }

    /**
     * Runs idempotent work that may touch a record (such as a sliding expiry),
     * retrying transient store failures with backoff.
     */
    public <T> T idempotentWrite(Supplier<T> work) {
        return readRetry.executeSupplier(() -> writeTemplate.execute(status -> work.get()));
    }
}
