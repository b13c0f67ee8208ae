package com.architecture.memory.specaudit.service.resolution;

import com.architecture.memory.specaudit.dto.resolution.ActionKind;
import com.architecture.memory.specaudit.dto.resolution.RoiTier;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RoiClassifierTest {

    private final RoiClassifier classifier = new RoiClassifier();

    @Test
    void placesHighImpactActionsByEffort() {
        assertThat(classifier.classify(85, ActionKind.CREATE_RELATIONSHIP)).isEqualTo(RoiTier.QUICK_WIN);
        assertThat(classifier.classify(85, ActionKind.ENUM_COLLAPSE)).isEqualTo(RoiTier.MAJOR_PROJECT);
        assertThat(classifier.classify(85, ActionKind.MOVE)).isEqualTo(RoiTier.MAJOR_PROJECT);
    }

    @Test
    void placesLowImpactActionsByEffort() {
        assertThat(classifier.classify(20, ActionKind.CLARIFY)).isEqualTo(RoiTier.FILL_IN);
        assertThat(classifier.classify(20, ActionKind.REMOVE)).isEqualTo(RoiTier.FILL_IN);
        assertThat(classifier.classify(20, ActionKind.OTHER)).isEqualTo(RoiTier.LOW_VALUE);
    }

    @Test
    void treatsThresholdAsHighImpact() {
        assertThat(classifier.classify(RoiClassifier.HIGH_IMPACT, ActionKind.REMOVE_DUPLICATE)).isEqualTo(RoiTier.QUICK_WIN);
        assertThat(classifier.classify(RoiClassifier.HIGH_IMPACT - 1, ActionKind.REMOVE_DUPLICATE)).isEqualTo(RoiTier.FILL_IN);
    }
}
