package com.loanorigination.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.loanorigination.config.WorkflowProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Workflow services on top of the JPA slice, with a fixed clock.
 */
@TestConfiguration
@EnableConfigurationProperties(WorkflowProperties.class)
@Import({
        WorkflowStateMachine.class,
        WorkflowQueryService.class,
        ManualReviewQueueService.class,
        AuditTrailService.class,
        OutboxService.class,
        StageRouter.class
})
class WorkflowTestConfig {

    static final Instant NOW = Instant.parse("2025-01-15T10:00:00Z");

    @Bean
    Clock clock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    @Bean
    ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
