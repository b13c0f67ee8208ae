package com.architecture.memory.specaudit.service.resolution;

import com.architecture.memory.specaudit.dto.resolution.ChosenAction;
import com.architecture.memory.specaudit.dto.resolution.ResolutionQueueItem;

/**
 * Selects exactly one action for a queue item. The engine does not know which implementation
 * is active.
 */
public interface ActionChooser {

    ChosenAction chooseAction(ResolutionQueueItem item);

    /**
     * Whether choices are made without a human in the loop. Recorded in the resolution summary.
     */
    default boolean isAutonomous() {
        return false;
    }
}
