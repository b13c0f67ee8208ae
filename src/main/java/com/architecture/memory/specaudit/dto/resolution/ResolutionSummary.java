package com.architecture.memory.specaudit.dto.resolution;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolutionSummary {

    private String reportFile;
    private String specRoot;
    private boolean autonomous;
    private int queueSize;

    @Builder.Default
    private Map<Disposition, Integer> dispositions = new EnumMap<>(Disposition.class);

    @Builder.Default
    private List<SessionLogEntry> entries = new ArrayList<>();

    private String sessionLogFile;

    public int count(Disposition disposition) {
        return dispositions.getOrDefault(disposition, 0);
    }
}
