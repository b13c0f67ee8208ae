package com.architecture.memory.specaudit.service.resolution;

import com.architecture.memory.specaudit.dto.resolution.ActionKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ActionClassifierTest {

    private final ActionClassifier classifier = new ActionClassifier();

    @Test
    void classifiesGeneratedSuggestions() {
        assertThat(classifier.classify("Create relationship business.actor assigned-to business.role"))
                .isEqualTo(ActionKind.CREATE_RELATIONSHIP);
        assertThat(classifier.classify("Remove duplicate relationship a.b.uses.a.c (predicate 'uses' overlaps 'depends-on')"))
                .isEqualTo(ActionKind.REMOVE_DUPLICATE);
        assertThat(classifier.classify("Move node type application.interface to layer business"))
                .isEqualTo(ActionKind.MOVE);
        assertThat(classifier.classify("Collapse node type data.orders into data.order as an enum value of attribute 'kind'"))
                .isEqualTo(ActionKind.ENUM_COLLAPSE);
        assertThat(classifier.classify("Add attribute 'owner' to business.actor"))
                .isEqualTo(ActionKind.ADD_ATTRIBUTE);
        assertThat(classifier.classify("Remove relationship business.process.serves.application.interface or reverse it"))
                .isEqualTo(ActionKind.REMOVE);
        assertThat(classifier.classify("Clarify description of business.actor"))
                .isEqualTo(ActionKind.CLARIFY);
    }

    @Test
    void prefersDuplicateRemovalOverPlainRemoval() {
        assertThat(classifier.classify("Merge the two relationships into one")).isEqualTo(ActionKind.REMOVE_DUPLICATE);
    }

    @Test
    void fallsBackToOther_whenNothingMatches() {
        assertThat(classifier.classify("Review the naming conventions with the architects")).isEqualTo(ActionKind.OTHER);
        assertThat(classifier.classify("  ")).isEqualTo(ActionKind.OTHER);
        assertThat(classifier.classify(null)).isEqualTo(ActionKind.OTHER);
    }
}
