/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.config;

import com.qdocs.control.model.WorkflowAction;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.EnumSet;
import java.util.Set;

/**
 * Configuration for the version workflow.
 */
@Configuration
@ConfigurationProperties(prefix = "qdocs.workflow")
@Getter
@Setter
public class WorkflowConfig {

    /** Actions that need the actor to re-enter their credential as an e-signature */
    private Set<WorkflowAction> signatureRequired = EnumSet.of(
            WorkflowAction.APPROVE,
            WorkflowAction.REJECT_REVIEW,
            WorkflowAction.REJECT_APPROVAL);

    /** Recorded on the version alongside an approval signature */
    private String approvalSignatureMeaning = "Approved";

    public boolean requiresSignature(WorkflowAction action) {
        return signatureRequired.contains(action);
    }
}
