package com.architecture.memory.specaudit.service.llm;

import com.architecture.memory.specaudit.dto.recommendation.EvaluationRequest;
import com.architecture.memory.specaudit.model.AttributeDefinition;
import com.architecture.memory.specaudit.model.NodeType;
import com.architecture.memory.specaudit.model.RelationshipType;

import java.util.List;

/**
 * Prompt text for relationship recommendations.
 */
public final class PromptTemplates {

    public static final String SYSTEM_PROMPT = """
            You are an enterprise architecture modeling expert reviewing a layered specification \
            of node types and the relationship types between them. You propose missing relationship \
            types only when they are justified by the node type definitions or by the cited standard.

            Answer with a single JSON array inside a ```json fenced block. Each element has the fields:
              "sourceNodeType"      composite id of the source node type (layer.type)
              "destinationNodeType" composite id of the destination node type (layer.type)
              "predicate"           one of the available predicates
              "justification"       one sentence explaining the relationship
              "priority"            "high", "medium" or "low"
              "standardReference"   the standard section supporting it, or null
            Answer with an empty array when nothing is missing.
            """;

    private PromptTemplates() {
    }

    public static String userPrompt(EvaluationRequest request) {
        StringBuilder prompt = new StringBuilder();
        switch (request.getKind()) {
            case NODE_TYPE -> prompt.append("The node type below has no relationship types. ")
                    .append("Propose the relationships it should participate in.\n\n");
            case LAYER -> prompt.append("Some node types of the layer below are isolated. ")
                    .append("Propose the relationships that would connect them.\n\n");
            case NODE_TYPE_PAIR -> prompt.append("The two node types below are connected by relationship types ")
                    .append("that may be duplicates. Propose the single relationship that should remain.\n\n");
        }

        if (request.getLayer() != null) {
            prompt.append("## Layer ").append(request.getLayer().getId())
                    .append(" (").append(request.getLayer().getNumber()).append(")\n");
            appendLine(prompt, "Name", request.getLayer().getName());
            appendLine(prompt, "Description", request.getLayer().getDescription());
            appendLine(prompt, "Standard", request.getLayer().getStandardReference());
            prompt.append('\n');
        }

        prompt.append("## Node types\n");
        for (NodeType nodeType : request.getNodeTypes()) {
            appendNodeType(prompt, nodeType);
        }

        prompt.append("\n## Existing relationship types\n");
        appendRelationships(prompt, request.getExistingRelationships());

        prompt.append("\n## Available predicates\n")
                .append(String.join(", ", request.getAvailablePredicates())).append('\n');

        if (request.getContext() != null && !request.getContext().isBlank()) {
            prompt.append("\n## Context\n").append(request.getContext()).append('\n');
        }
        return prompt.toString();
    }

    private static void appendNodeType(StringBuilder prompt, NodeType nodeType) {
        prompt.append("- ").append(nodeType.getSpecNodeId());
        if (nodeType.getTitle() != null) {
            prompt.append(" (").append(nodeType.getTitle()).append(')');
        }
        prompt.append(": ").append(nodeType.getDescription() == null ? "" : nodeType.getDescription()).append('\n');
        for (AttributeDefinition attribute : nodeType.getAttributes()) {
            prompt.append("    ").append(attribute.getName()).append(" : ").append(attribute.getType());
            if (attribute.isRequired()) {
                prompt.append(" (required)");
            }
            if (attribute.getDescription() != null) {
                prompt.append(" - ").append(attribute.getDescription());
            }
            prompt.append('\n');
        }
    }

    private static void appendRelationships(StringBuilder prompt, List<RelationshipType> relationships) {
        if (relationships.isEmpty()) {
            prompt.append("(none)\n");
            return;
        }
        for (RelationshipType rel : relationships) {
            prompt.append("- ").append(rel.getSourceSpecNodeId()).append(" -[").append(rel.getPredicate())
                    .append("]-> ").append(rel.getDestinationSpecNodeId()).append('\n');
        }
    }

    private static void appendLine(StringBuilder prompt, String label, String value) {
        if (value != null && !value.isBlank()) {
            prompt.append(label).append(": ").append(value).append('\n');
        }
    }
}
