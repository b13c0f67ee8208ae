package com.architecture.memory.specaudit.dto.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LayerDelta {
    private String layer;
    private int relationshipsBefore;
    private int relationshipsAfter;
    private double densityBefore;
    private double densityAfter;
    private double isolationBefore;
    private double isolationAfter;
    private int gapsBefore;
    private int gapsAfter;
}
