package com.architecture.memory.specaudit.service.graph.analyzer;

import com.architecture.memory.specaudit.dto.finding.GapCandidate;
import com.architecture.memory.specaudit.dto.finding.Priority;

/**
 * Decides the priority of a proposed relationship. Scores are derived from the priority
 * through the fixed score table, so a policy can only move a gap between tiers.
 */
public interface GapPriorityPolicy {

    Priority assess(GapContext context);

    /**
     * @param layerId                 layer of the source node type
     * @param layerRelationshipCount  relationships sourced in that layer
     * @param sourceType              type name of the source node type (without layer prefix)
     * @param sourceIsolated          the source node type has no incident relationships
     * @param origin                  how the candidate was produced
     * @param standardReference       citation of the template that produced it, if any
     */
    record GapContext(String layerId,
                      int layerRelationshipCount,
                      String sourceType,
                      boolean sourceIsolated,
                      GapCandidate.Origin origin,
                      String standardReference) {
    }
}
