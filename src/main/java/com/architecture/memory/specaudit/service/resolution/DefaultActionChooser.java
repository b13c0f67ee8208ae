package com.architecture.memory.specaudit.service.resolution;

import com.architecture.memory.specaudit.dto.finding.FindingType;
import com.architecture.memory.specaudit.dto.resolution.ChosenAction;
import com.architecture.memory.specaudit.dto.resolution.ResolutionQueueItem;

import java.util.EnumSet;
import java.util.Set;

/**
 * Fixed defaults for autonomous runs: structural fixes are applied, anything that needs
 * judgement is skipped.
 */
public class DefaultActionChooser implements ActionChooser {

    private static final Set<FindingType> APPLIED_BY_DEFAULT = EnumSet.of(
            FindingType.GAP_CANDIDATE,
            FindingType.DUPLICATE_CANDIDATE,
            FindingType.COMPLETENESS_ISSUE);

    @Override
    public ChosenAction chooseAction(ResolutionQueueItem item) {
        if (APPLIED_BY_DEFAULT.contains(item.getFindingType())) {
            return ChosenAction.applyPrimary("Default for " + item.getFindingType() + ": apply primary suggestion");
        }
        return ChosenAction.skip("Default for " + item.getFindingType() + ": requires review");
    }

    @Override
    public boolean isAutonomous() {
        return true;
    }
}
