/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.qdocs.control.config.AuditConfig;
import com.qdocs.control.entity.AuditLogEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Map;

/**
 * Computes the hash chain over audit entries. Each entry's hash covers its own fields
 * and the previous entry's hash, so altering, removing or reordering any entry breaks
 * every hash after it.
 */
@Slf4j
@Component
public class AuditChainHasher {

    private static final String GENESIS_SEED = "QDOCS-AUDIT-GENESIS";

    private final ObjectMapper sortedKeyMapper;
    private final String algorithm;

    public AuditChainHasher(AuditConfig auditConfig) {
        this.algorithm = auditConfig.getAlgorithm();
        this.sortedKeyMapper = new ObjectMapper();
        this.sortedKeyMapper.configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    public String computeGenesisHash() {
        return hash(GENESIS_SEED);
    }

    /**
     * Hash of a fully populated entry; the entry's own {@code hash} field is ignored.
     */
    public String computeHash(AuditLogEntry entry) {
        return hash(canonicalize(entry));
    }

    /**
     * Serializes details as JSON with keys in sorted order, or null for no details.
     */
    public String canonicalDetails(Map<String, ?> details) {
        if (details == null || details.isEmpty()) {
            return null;
        }
        try {
            return sortedKeyMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            throw new AuditLedgerException("Audit details are not serializable: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * JSON array of every hashed field in a fixed order. An array keeps field
     * boundaries unambiguous whatever the field values contain.
     */
    String canonicalize(AuditLogEntry entry) {
        var fields = Arrays.asList(
                entry.getSequenceNumber(),
                epochMillis(entry.getOccurredAt()),
                entry.getActorId(),
                entry.getAction() != null ? entry.getAction().name() : null,
                entry.getTargetType() != null ? entry.getTargetType().name() : null,
                entry.getTargetId(),
                entry.getFromState(),
                entry.getToState(),
                entry.getComment(),
                entry.getDetails(),
                entry.getClientAddress(),
                entry.getUserAgent(),
                entry.getPreviousHash());
        try {
            return sortedKeyMapper.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new AuditLedgerException("Failed to canonicalize audit entry " + entry.getSequenceNumber(), e);
        }
    }

    private static Long epochMillis(Instant instant) {
        return instant != null ? instant.toEpochMilli() : null;
    }

    private String hash(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance(algorithm);
            byte[] hashBytes = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hashBytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Hash algorithm not available: " + algorithm, e);
        }
    }
}
