package com.architecture.memory.specaudit.service.pipeline;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineOptions {

    private String layerFilter;
    private boolean enableExternal;

    @Builder.Default
    private AbortSignal abortSignal = new AbortSignal();
}
