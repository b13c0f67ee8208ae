package com.architecture.memory.specaudit.service.resolution;

import com.architecture.memory.specaudit.dto.resolution.ActionKind;
import com.architecture.memory.specaudit.dto.resolution.RoiTier;
import org.springframework.stereotype.Component;

/**
 * Places an action on the impact/effort grid. Impact is {@code 100 - alignment}.
 */
@Component
public class RoiClassifier {

    static final int HIGH_IMPACT = 50;

    public RoiTier classify(int impactScore, ActionKind kind) {
        ActionKind.Effort effort = kind.getEffort();
        if (impactScore >= HIGH_IMPACT) {
            return effort == ActionKind.Effort.LOW ? RoiTier.QUICK_WIN : RoiTier.MAJOR_PROJECT;
        }
        return effort == ActionKind.Effort.HIGH ? RoiTier.LOW_VALUE : RoiTier.FILL_IN;
    }
}
