package com.architecture.memory.specaudit.dto.resolution;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The single action selected for one queue item.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChosenAction {

    public enum Choice {
        APPLY_PRIMARY,
        APPLY_ALTERNATIVE,
        SKIP,
        CUSTOM
    }

    private Choice choice;

    // Free text for CUSTOM, classified and executed like a suggestion
    private String customText;

    private String rationale;

    public static ChosenAction applyPrimary(String rationale) {
        return ChosenAction.builder().choice(Choice.APPLY_PRIMARY).rationale(rationale).build();
    }

    public static ChosenAction applyAlternative(String rationale) {
        return ChosenAction.builder().choice(Choice.APPLY_ALTERNATIVE).rationale(rationale).build();
    }

    public static ChosenAction skip(String rationale) {
        return ChosenAction.builder().choice(Choice.SKIP).rationale(rationale).build();
    }

    public static ChosenAction custom(String text) {
        return ChosenAction.builder().choice(Choice.CUSTOM).customText(text).rationale("Custom action").build();
    }
}
