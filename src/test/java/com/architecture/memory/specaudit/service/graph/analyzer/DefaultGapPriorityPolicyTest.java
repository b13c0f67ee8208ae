package com.architecture.memory.specaudit.service.graph.analyzer;

import com.architecture.memory.specaudit.dto.finding.GapCandidate;
import com.architecture.memory.specaudit.dto.finding.Priority;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultGapPriorityPolicyTest {

    private final DefaultGapPriorityPolicy policy = new DefaultGapPriorityPolicy();

    @Test
    void ranksHigh_whenLayerHasNoRelationships() {
        assertThat(policy.assess(context(0, "glossary", false, GapCandidate.Origin.LAYER_HUB, null)))
                .isEqualTo(Priority.HIGH);
    }

    @Test
    void ranksHigh_forIsolatedSourceOfCitedTemplate() {
        assertThat(policy.assess(context(4, "actor", true, GapCandidate.Origin.TEMPLATE, "ArchiMate 3.2 §6.2")))
                .isEqualTo(Priority.HIGH);
    }

    @Test
    void ranksMedium_forContainerTypesAndOtherIsolatedSources() {
        assertThat(policy.assess(context(4, "applicationComponent", false, GapCandidate.Origin.SIMILAR_NODE_TYPE, null)))
                .isEqualTo(Priority.MEDIUM);
        assertThat(policy.assess(context(4, "event", true, GapCandidate.Origin.LAYER_HUB, null)))
                .isEqualTo(Priority.MEDIUM);
    }

    @Test
    void ranksLow_forConnectedNonContainerSource() {
        assertThat(policy.assess(context(4, "event", false, GapCandidate.Origin.SIMILAR_NODE_TYPE, null)))
                .isEqualTo(Priority.LOW);
    }

    private static GapPriorityPolicy.GapContext context(int layerRelationships, String type, boolean isolated,
                                                        GapCandidate.Origin origin, String reference) {
        return new GapPriorityPolicy.GapContext("business", layerRelationships, type, isolated, origin, reference);
    }
}
