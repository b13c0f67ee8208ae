package com.architecture.memory.specaudit.service.graph.analyzer;

import com.architecture.memory.specaudit.dto.finding.GapCandidate;
import com.architecture.memory.specaudit.dto.finding.Priority;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Layers without any relationship and isolated sources backed by a cited standard come first,
 * container-like types and other isolated sources next.
 */
@Component
public class DefaultGapPriorityPolicy implements GapPriorityPolicy {

    private static final List<String> CONTAINER_TYPES = List.of("component", "container", "service", "module");

    @Override
    public Priority assess(GapContext context) {
        if (context.layerRelationshipCount() == 0) {
            return Priority.HIGH;
        }
        if (context.sourceIsolated()
                && context.origin() == GapCandidate.Origin.TEMPLATE
                && context.standardReference() != null) {
            return Priority.HIGH;
        }

        String type = context.sourceType() == null ? "" : context.sourceType().toLowerCase(Locale.ROOT);
        if (CONTAINER_TYPES.stream().anyMatch(type::contains)) {
            return Priority.MEDIUM;
        }
        if (context.sourceIsolated()) {
            return Priority.MEDIUM;
        }
        return Priority.LOW;
    }
}
