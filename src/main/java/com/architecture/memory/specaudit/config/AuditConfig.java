package com.architecture.memory.specaudit.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;

/**
 * Core audit wiring: JSON mapper, clock and the CI gate thresholds from application.yml.
 */
@Configuration
@Slf4j
public class AuditConfig {

    @Value("${spec-audit.thresholds.max-isolation-percentage:20.0}")
    private double maxIsolationPercentage;

    @Value("${spec-audit.thresholds.min-density:1.5}")
    private double minDensity;

    @Value("${spec-audit.thresholds.max-high-priority-gaps:10}")
    private int maxHighPriorityGaps;

    @Value("${spec-audit.thresholds.max-duplicates:5}")
    private int maxDuplicates;

    @Value("${spec-audit.thresholds.min-average-quality:70.0}")
    private double minAverageQuality;

    @Value("${spec-audit.thresholds.max-empty-descriptions-per-layer:5}")
    private int maxEmptyDescriptions;

    @Value("${spec-audit.thresholds.max-generic-descriptions-per-layer:10}")
    private int maxGenericDescriptions;

    @Value("${spec-audit.thresholds.max-completeness-issues:0}")
    private int maxCompletenessIssues;

    @Value("${spec-audit.thresholds.max-high-confidence-overlaps:3}")
    private int maxHighConfidenceOverlaps;

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return ObjectMapperFactory.create();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public QualityThresholds qualityThresholds() {
        QualityThresholds thresholds = QualityThresholds.builder()
                .maxIsolationPercentage(maxIsolationPercentage)
                .minDensity(minDensity)
                .maxHighPriorityGaps(maxHighPriorityGaps)
                .maxDuplicates(maxDuplicates)
                .minAverageQuality(minAverageQuality)
                .maxEmptyDescriptionsPerLayer(maxEmptyDescriptions)
                .maxGenericDescriptionsPerLayer(maxGenericDescriptions)
                .maxCompletenessIssues(maxCompletenessIssues)
                .maxHighConfidenceOverlaps(maxHighConfidenceOverlaps)
                .build();
        log.debug("[Audit Config] Quality thresholds: {}", thresholds);
        return thresholds;
    }
}
