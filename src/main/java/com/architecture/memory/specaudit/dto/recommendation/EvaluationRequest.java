package com.architecture.memory.specaudit.dto.recommendation;

import com.architecture.memory.specaudit.model.Layer;
import com.architecture.memory.specaudit.model.NodeType;
import com.architecture.memory.specaudit.model.RelationshipType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Well-formed description of one node type, one layer or one node type pair sent to the
 * recommendation source.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluationRequest {

    public enum Kind {
        NODE_TYPE,
        LAYER,
        NODE_TYPE_PAIR
    }

    private Kind kind;
    private Layer layer;

    // One entry for NODE_TYPE, two for NODE_TYPE_PAIR, the layer members for LAYER
    @Builder.Default
    private List<NodeType> nodeTypes = new ArrayList<>();

    @Builder.Default
    private List<RelationshipType> existingRelationships = new ArrayList<>();

    @Builder.Default
    private List<String> availablePredicates = new ArrayList<>();

    // Why the request was made, e.g. the duplicate candidate under review
    private String context;

    public String describe() {
        return switch (kind) {
            case NODE_TYPE -> "node type " + nodeTypes.get(0).getSpecNodeId();
            case LAYER -> "layer " + layer.getId();
            case NODE_TYPE_PAIR -> "node type pair " + nodeTypes.get(0).getSpecNodeId() + " / "
                    + nodeTypes.get(1).getSpecNodeId();
        };
    }
}
