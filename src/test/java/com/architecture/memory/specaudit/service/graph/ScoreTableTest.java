package com.architecture.memory.specaudit.service.graph;

import com.architecture.memory.specaudit.dto.finding.Confidence;
import com.architecture.memory.specaudit.dto.finding.Priority;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ScoreTableTest {

    @Test
    void mapsDuplicateConfidenceToAlignment() {
        assertThat(ScoreTable.duplicateAlignment(Confidence.HIGH)).isEqualTo(25);
        assertThat(ScoreTable.duplicateAlignment(Confidence.MEDIUM)).isEqualTo(55);
        assertThat(ScoreTable.duplicateAlignment(Confidence.LOW)).isEqualTo(80);
    }

    @Test
    void derivesGapAlignmentAsComplementOfImpact() {
        for (Priority priority : Priority.values()) {
            assertThat(ScoreTable.gapAlignment(priority)).isEqualTo(100 - ScoreTable.gapImpact(priority));
        }
        assertThat(ScoreTable.gapImpact(Priority.HIGH)).isEqualTo(85);
        assertThat(ScoreTable.gapAlignment(Priority.LOW)).isEqualTo(75);
    }

    @Test
    void routesHighAlignmentToCriticalReview() {
        assertThat(ScoreTable.isCriticalReview(80)).isTrue();
        assertThat(ScoreTable.isCriticalReview(79)).isFalse();
        assertThat(ScoreTable.isCriticalReview(ScoreTable.duplicateAlignment(Confidence.LOW))).isTrue();
    }

    @Test
    void mapsAlignmentBackToPriority() {
        assertThat(ScoreTable.priorityForAlignment(15)).isEqualTo(Priority.HIGH);
        assertThat(ScoreTable.priorityForAlignment(45)).isEqualTo(Priority.MEDIUM);
        assertThat(ScoreTable.priorityForAlignment(75)).isEqualTo(Priority.LOW);
    }
}
