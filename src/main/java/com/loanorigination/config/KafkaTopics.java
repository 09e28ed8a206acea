package com.loanorigination.config;

/**
 * Centralized Kafka topic names.
 */
public class KafkaTopics {

    // Outbound: audit sink entries (action, actor, details, timestamp)
    public static final String AUDIT_EVENTS = "loan.audit.events";

    // Outbound: every stage change and workflow switch
    public static final String WORKFLOW_TRANSITIONED = "loan.workflow.transitioned";

    // Outbound: quality evaluation results
    public static final String QUALITY_CHECK_COMPLETED = "loan.quality.completed";

    // Inbound: stage decisions submitted by the phase controllers
    public static final String STAGE_DECISIONS = "loan.stage.decisions";

    private KafkaTopics() {
    }
}
