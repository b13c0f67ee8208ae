package com.architecture.memory.specaudit.service.resolution;

import com.architecture.memory.specaudit.dto.finding.CompletenessIssue;
import com.architecture.memory.specaudit.dto.finding.DuplicateCandidate;
import com.architecture.memory.specaudit.dto.resolution.ActionKind;
import com.architecture.memory.specaudit.dto.resolution.ResolutionQueueItem;
import com.architecture.memory.specaudit.exception.ActionConflictException;
import com.architecture.memory.specaudit.model.Layer;
import com.architecture.memory.specaudit.model.NodeType;
import com.architecture.memory.specaudit.model.RelationshipType;
import com.architecture.memory.specaudit.model.SchemaGraph;
import com.architecture.memory.specaudit.service.graph.SchemaDocumentCodec;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a classified suggestion into a {@link SchemaTransaction} against the live graph.
 *
 * Nothing is written here. Targets that are already in the requested state short-circuit to
 * already-implemented; targets that diverged from what the finding assumed raise
 * {@link ActionConflictException}; suggestions that cannot be executed mechanically are
 * deferred.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RemediationPlanner {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.DOTALL;
    private static final Pattern MOVE = Pattern.compile(
            "\\b(?:move|relocate)\\s+(?:node\\s+type\\s+)?(\\S+)\\s+(?:from\\s+(?:layer\\s+)?\\S+\\s+)?to\\s+(?:layer\\s+)?(\\S+)", FLAGS);
    private static final Pattern COLLAPSE = Pattern.compile(
            "\\bcollapse\\s+(?:node\\s+type\\s+)?(\\S+)\\s+into\\s+(\\S+)(?:.*?\\battribute\\s+'([\\w-]+)')?", FLAGS);
    private static final Pattern CREATE_RELATIONSHIP = Pattern.compile(
            "\\b(?:create|add)\\s+relationship\\s+([\\w-]+\\.[\\w-]+)\\s+([\\w-]+)\\s+([\\w-]+\\.[\\w-]+)", FLAGS);
    private static final Pattern ADD_ATTRIBUTE = Pattern.compile(
            "\\badd\\s+attribute\\s+'?([\\w-]+)'?(?:\\s+of\\s+type\\s+'?(\\w+)'?)?\\s+to\\s+(?:node\\s+type\\s+)?(\\S+)", FLAGS);
    private static final Pattern REMOVE_DUPLICATE = Pattern.compile(
            "\\bremove\\s+duplicate\\s+relationship\\s+(\\S+)", FLAGS);
    private static final Pattern REMOVE = Pattern.compile(
            "\\b(?:remove|delete|drop)\\s+(?:the\\s+)?(?:node\\s+type\\s+|relationship\\s+)?(\\S+)", FLAGS);
    private static final Pattern CLARIFY = Pattern.compile(
            "\\bdescription\\s+of\\s+(?:node\\s+type\\s+)?(\\S+?)\\s*(?:to|:)\\s*\"(.+)\"", FLAGS);

    static final String DEFAULT_ENUM_ATTRIBUTE = "kind";

    private final SchemaDocumentCodec codec;

    public RemediationPlan plan(SchemaGraph graph, ResolutionQueueItem item, ActionKind kind, String suggestion) {
        return switch (kind) {
            case MOVE -> planMove(graph, suggestion);
            case ENUM_COLLAPSE -> planEnumCollapse(graph, suggestion);
            case REMOVE -> planRemove(graph, item, suggestion);
            case CLARIFY -> planClarify(graph, suggestion);
            case ADD_ATTRIBUTE -> planAddAttribute(graph, suggestion);
            case CREATE_RELATIONSHIP -> planCreateRelationship(graph, suggestion);
            case REMOVE_DUPLICATE -> planRemoveDuplicate(graph, item, suggestion);
            case OTHER -> RemediationPlan.deferred("No mechanical action for: " + suggestion);
        };
    }

    // ========================= MOVE =========================

    private RemediationPlan planMove(SchemaGraph graph, String suggestion) {
        Matcher m = MOVE.matcher(suggestion);
        if (!m.find()) {
            return RemediationPlan.deferred("Move target not recognized in: " + suggestion);
        }
        String nodeId = clean(m.group(1));
        String targetLayer = clean(m.group(2));

        if (graph.findLayer(targetLayer).isEmpty()) {
            throw new ActionConflictException("Target layer " + targetLayer + " does not exist");
        }
        Optional<NodeType> found = graph.findNodeType(nodeId);
        if (found.isEmpty()) {
            return RemediationPlan.alreadyImplemented("Node type " + nodeId + " no longer exists");
        }
        NodeType nodeType = found.get();
        if (nodeType.getLayerId().equals(targetLayer)) {
            return RemediationPlan.alreadyImplemented(nodeId + " is already in layer " + targetLayer);
        }
        String newId = NodeType.compositeId(targetLayer, nodeType.getType());
        if (graph.findNodeType(newId).isPresent()) {
            throw new ActionConflictException("Layer " + targetLayer + " already declares a node type named "
                    + nodeType.getType() + " (" + newId + ")");
        }

        Path newPath = SchemaDocumentCodec.nodeTypePath(graph.getSpecRoot(), targetLayer, nodeType.getType());
        if (Files.exists(newPath)) {
            throw new ActionConflictException("Schema file " + newPath + " already exists");
        }

        Draft draft = new Draft(graph);
        ObjectNode moved = codec.withLayer(codec.readTree(nodeType.getSourceFile()), targetLayer, nodeType.getType());
        draft.tx.write(newPath, codec.render(moved));
        draft.tx.delete(nodeType.getSourceFile());
        draft.removeMember(nodeType.getLayerId(), nodeId);
        draft.addMember(targetLayer, newId);
        int rewired = draft.rewire(nodeId, newId, false);
        draft.flush();

        return RemediationPlan.apply(draft.tx, "Move " + nodeId + " to " + newId + ", rewiring " + rewired
                + " relationship types");
    }

    // ========================= ENUM COLLAPSE =========================

    private RemediationPlan planEnumCollapse(SchemaGraph graph, String suggestion) {
        Matcher m = COLLAPSE.matcher(suggestion);
        if (!m.find()) {
            return RemediationPlan.deferred("Collapse target not recognized in: " + suggestion);
        }
        String collapsedId = clean(m.group(1));
        String targetId = clean(m.group(2));
        String attributeName = m.group(3) != null ? m.group(3) : DEFAULT_ENUM_ATTRIBUTE;

        NodeType target = graph.findNodeType(targetId)
                .orElseThrow(() -> new ActionConflictException("Collapse target " + targetId + " does not exist"));
        Optional<NodeType> collapsed = graph.findNodeType(collapsedId);
        String value = collapsed.map(NodeType::getType).orElse(collapsedId.substring(collapsedId.indexOf('.') + 1));
        boolean enumPresent = target.findAttribute(attributeName)
                .map(a -> a.getEnumValues().contains(value))
                .orElse(false);
        if (collapsed.isEmpty()) {
            return RemediationPlan.alreadyImplemented(enumPresent
                    ? targetId + "." + attributeName + " already lists '" + value + "'"
                    : "Node type " + collapsedId + " no longer exists");
        }
        if (collapsedId.equals(targetId)) {
            throw new ActionConflictException("Cannot collapse " + collapsedId + " into itself");
        }

        Draft draft = new Draft(graph);
        if (!enumPresent) {
            ObjectNode document = codec.readTree(target.getSourceFile());
            ObjectNode attributes = codec.attributeProperties(document);
            JsonNode existing = attributes.get(attributeName);
            ObjectNode attribute = existing instanceof ObjectNode ? (ObjectNode) existing : attributes.putObject(attributeName);
            if (!attribute.has("type")) {
                attribute.put("type", "string");
            }
            JsonNode existingEnum = attribute.get("enum");
            ArrayNode values = existingEnum instanceof ArrayNode ? (ArrayNode) existingEnum : attribute.putArray("enum");
            if (values.isEmpty()) {
                values.add(target.getType());
            }
            values.add(value);
            draft.tx.write(target.getSourceFile(), codec.render(document));
        }
        draft.tx.delete(collapsed.get().getSourceFile());
        draft.removeMember(collapsed.get().getLayerId(), collapsedId);
        int rewired = draft.rewire(collapsedId, targetId, true);
        draft.flush();

        return RemediationPlan.apply(draft.tx, "Collapse " + collapsedId + " into " + targetId + "." + attributeName
                + ", rewiring " + rewired + " relationship types");
    }

    // ========================= REMOVE =========================

    private RemediationPlan planRemove(SchemaGraph graph, ResolutionQueueItem item, String suggestion) {
        if (item.getFinding() instanceof CompletenessIssue issue && suggestion.equals(item.getPrimarySuggestion())) {
            return planRemoveForIssue(graph, issue);
        }
        Matcher m = REMOVE.matcher(suggestion);
        if (!m.find()) {
            return RemediationPlan.deferred("Removal target not recognized in: " + suggestion);
        }
        String target = clean(m.group(1));

        Optional<NodeType> nodeType = graph.findNodeType(target);
        if (nodeType.isPresent()) {
            Draft draft = new Draft(graph);
            draft.tx.delete(nodeType.get().getSourceFile());
            draft.removeMember(nodeType.get().getLayerId(), target);
            int removed = draft.dropRelationshipsOf(target);
            draft.flush();
            return RemediationPlan.apply(draft.tx, "Remove node type " + target + " and " + removed
                    + " dependent relationship types");
        }
        Optional<RelationshipType> relationship = findRelationship(graph, target);
        if (relationship.isPresent()) {
            SchemaTransaction tx = new SchemaTransaction().delete(relationship.get().getSourceFile());
            return RemediationPlan.apply(tx, "Remove relationship type " + target);
        }
        if (target.contains(".")) {
            return RemediationPlan.alreadyImplemented(target + " no longer exists");
        }
        return RemediationPlan.deferred("Removal target " + target + " is not a node type or relationship type");
    }

    private RemediationPlan planRemoveForIssue(SchemaGraph graph, CompletenessIssue issue) {
        if (issue.getKind() == CompletenessIssue.Kind.MISSING_SCHEMA && issue.getLayer() != null) {
            Layer layer = graph.findLayer(issue.getLayer())
                    .orElseThrow(() -> new ActionConflictException("Layer " + issue.getLayer() + " does not exist"));
            if (!layer.getNodeTypeIds().contains(issue.getElement())) {
                return RemediationPlan.alreadyImplemented(issue.getElement() + " is no longer listed in layer "
                        + layer.getId());
            }
            Draft draft = new Draft(graph);
            draft.removeMember(layer.getId(), issue.getElement());
            draft.flush();
            return RemediationPlan.apply(draft.tx, "Remove " + issue.getElement() + " from the membership of layer "
                    + layer.getId());
        }
        if (issue.getFile() == null) {
            return RemediationPlan.deferred("Completeness issue names no file");
        }
        Path file = Paths.get(issue.getFile());
        if (!Files.exists(file)) {
            return RemediationPlan.alreadyImplemented(file + " no longer exists");
        }
        return RemediationPlan.apply(new SchemaTransaction().delete(file), "Delete " + file);
    }

    // ========================= CLARIFY =========================

    private RemediationPlan planClarify(SchemaGraph graph, String suggestion) {
        Matcher m = CLARIFY.matcher(suggestion);
        if (!m.find()) {
            return RemediationPlan.deferred("Clarification needs the new description text: " + suggestion);
        }
        String nodeId = clean(m.group(1));
        String description = m.group(2).trim();
        Optional<NodeType> nodeType = graph.findNodeType(nodeId);
        if (nodeType.isEmpty()) {
            return RemediationPlan.alreadyImplemented("Node type " + nodeId + " no longer exists");
        }
        if (description.equals(nodeType.get().getDescription())) {
            return RemediationPlan.alreadyImplemented("Description of " + nodeId + " is already up to date");
        }
        ObjectNode document = codec.readTree(nodeType.get().getSourceFile());
        document.put("description", description);
        return RemediationPlan.apply(new SchemaTransaction().write(nodeType.get().getSourceFile(), codec.render(document)),
                "Update description of " + nodeId);
    }

    // ========================= ADD ATTRIBUTE =========================

    private RemediationPlan planAddAttribute(SchemaGraph graph, String suggestion) {
        Matcher m = ADD_ATTRIBUTE.matcher(suggestion);
        if (!m.find()) {
            return RemediationPlan.deferred("Attribute not recognized in: " + suggestion);
        }
        String name = m.group(1);
        String type = m.group(2) != null ? m.group(2) : "string";
        String nodeId = clean(m.group(3));

        NodeType nodeType = graph.findNodeType(nodeId)
                .orElseThrow(() -> new ActionConflictException("Node type " + nodeId + " does not exist"));
        if (nodeType.findAttribute(name).isPresent()) {
            return RemediationPlan.alreadyImplemented(nodeId + " already has attribute " + name);
        }
        ObjectNode document = codec.readTree(nodeType.getSourceFile());
        codec.attributeProperties(document).putObject(name).put("type", type);
        return RemediationPlan.apply(new SchemaTransaction().write(nodeType.getSourceFile(), codec.render(document)),
                "Add attribute " + name + " (" + type + ") to " + nodeId);
    }

    // ========================= RELATIONSHIPS =========================

    private RemediationPlan planCreateRelationship(SchemaGraph graph, String suggestion) {
        Matcher m = CREATE_RELATIONSHIP.matcher(suggestion);
        if (!m.find()) {
            return RemediationPlan.deferred("Relationship endpoints not recognized in: " + suggestion);
        }
        String sourceId = m.group(1);
        String predicate = m.group(2);
        String destinationId = clean(m.group(3));

        if (graph.hasRelationship(sourceId, predicate, destinationId)) {
            return RemediationPlan.alreadyImplemented("Relationship " + sourceId + " " + predicate + " "
                    + destinationId + " already exists");
        }
        NodeType source = graph.findNodeType(sourceId)
                .orElseThrow(() -> new ActionConflictException("Source node type " + sourceId + " does not exist"));
        NodeType destination = graph.findNodeType(destinationId)
                .orElseThrow(() -> new ActionConflictException("Destination node type " + destinationId + " does not exist"));
        if (!graph.getPredicates().isEmpty() && graph.getPredicate(predicate).isEmpty()) {
            throw new ActionConflictException("Predicate " + predicate + " is not in the catalog");
        }

        RelationshipType rel = RelationshipType.builder()
                .id(RelationshipType.compositeId(source.getSpecNodeId(), predicate, destination.getSpecNodeId()))
                .sourceSpecNodeId(source.getSpecNodeId())
                .sourceLayer(source.getLayerId())
                .destinationSpecNodeId(destination.getSpecNodeId())
                .destinationLayer(destination.getLayerId())
                .predicate(predicate)
                .build();
        Path path = SchemaDocumentCodec.relationshipPath(graph.getSpecRoot(), rel);
        if (Files.exists(path)) {
            throw new ActionConflictException(path + " already exists but does not define " + rel.getId());
        }
        return RemediationPlan.apply(new SchemaTransaction().write(path, codec.render(codec.relationshipDocument(rel))),
                "Create relationship type " + rel.getId());
    }

    private RemediationPlan planRemoveDuplicate(SchemaGraph graph, ResolutionQueueItem item, String suggestion) {
        Matcher m = REMOVE_DUPLICATE.matcher(suggestion);
        if (!m.find()) {
            return RemediationPlan.deferred("Duplicate relationship not recognized in: " + suggestion);
        }
        String removedId = clean(m.group(1));
        Optional<RelationshipType> removed = findRelationship(graph, removedId);
        if (removed.isEmpty()) {
            return RemediationPlan.alreadyImplemented("Relationship type " + removedId + " no longer exists");
        }
        if (item.getFinding() instanceof DuplicateCandidate duplicate) {
            String survivorId = removedId.equals(duplicate.getRelationshipA())
                    ? duplicate.getRelationshipB() : duplicate.getRelationshipA();
            if (findRelationship(graph, survivorId).isEmpty()) {
                throw new ActionConflictException("Relationship type " + survivorId
                        + " is gone; removing " + removedId + " would drop both duplicates");
            }
        }
        return RemediationPlan.apply(new SchemaTransaction().delete(removed.get().getSourceFile()),
                "Remove duplicate relationship type " + removedId);
    }

    // ========================= HELPERS =========================

    private static Optional<RelationshipType> findRelationship(SchemaGraph graph, String id) {
        return graph.getRelationships().stream().filter(r -> r.getId().equals(id)).findFirst();
    }

    private static String clean(String token) {
        String cleaned = token.trim();
        while (!cleaned.isEmpty() && ".,;:)'\"".indexOf(cleaned.charAt(cleaned.length() - 1)) >= 0) {
            cleaned = cleaned.substring(0, cleaned.length() - 1);
        }
        return cleaned;
    }

    /**
     * Transaction under construction plus pending membership edits, which are merged per layer
     * so one manifest is written at most once.
     */
    private final class Draft {

        private final SchemaGraph graph;
        private final SchemaTransaction tx = new SchemaTransaction();
        private final Map<String, Set<String>> membership = new TreeMap<>();

        private Draft(SchemaGraph graph) {
            this.graph = graph;
        }

        void removeMember(String layerId, String nodeId) {
            members(layerId).ifPresent(set -> set.remove(nodeId));
        }

        void addMember(String layerId, String nodeId) {
            members(layerId).ifPresent(set -> set.add(nodeId));
        }

        // Only layers that list their members are edited
        private Optional<Set<String>> members(String layerId) {
            Optional<Layer> layer = graph.findLayer(layerId).filter(Layer::declaresMembership);
            if (layer.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(membership.computeIfAbsent(layerId, id -> new TreeSet<>(layer.get().getNodeTypeIds())));
        }

        /**
         * Re-points every relationship type touching {@code fromId} at {@code toId}. With
         * {@code dropExisting}, rewired triples that already exist are deleted instead.
         */
        int rewire(String fromId, String toId, boolean dropExisting) {
            NodeType target = graph.findNodeType(toId).orElse(null);
            String toLayer = target != null ? target.getLayerId() : toId.substring(0, toId.indexOf('.'));
            Set<String> planned = new HashSet<>();
            int count = 0;
            for (RelationshipType rel : touching(fromId)) {
                String source = rel.getSourceSpecNodeId().equals(fromId) ? toId : rel.getSourceSpecNodeId();
                String destination = rel.getDestinationSpecNodeId().equals(fromId) ? toId : rel.getDestinationSpecNodeId();
                RelationshipType rewired = rel.toBuilder()
                        .id(RelationshipType.compositeId(source, rel.getPredicate(), destination))
                        .sourceSpecNodeId(source)
                        .sourceLayer(source.equals(toId) ? toLayer : rel.getSourceLayer())
                        .destinationSpecNodeId(destination)
                        .destinationLayer(destination.equals(toId) ? toLayer : rel.getDestinationLayer())
                        .build();
                boolean exists = graph.hasRelationship(source, rel.getPredicate(), destination)
                        || !planned.add(rewired.tripleKey());
                if (!(exists && dropExisting)) {
                    Path newPath = SchemaDocumentCodec.relationshipPath(graph.getSpecRoot(), rewired);
                    ObjectNode document = codec.withEndpoints(codec.readTree(rel.getSourceFile()), rewired);
                    tx.write(newPath, codec.render(document));
                }
                tx.delete(rel.getSourceFile());
                count++;
            }
            return count;
        }

        int dropRelationshipsOf(String nodeId) {
            List<RelationshipType> dependent = touching(nodeId);
            dependent.forEach(rel -> tx.delete(rel.getSourceFile()));
            return dependent.size();
        }

        private List<RelationshipType> touching(String nodeId) {
            Map<String, RelationshipType> byId = new TreeMap<>();
            graph.outgoing(nodeId).forEach(r -> byId.put(r.getId(), r));
            graph.incoming(nodeId).forEach(r -> byId.put(r.getId(), r));
            return new ArrayList<>(byId.values());
        }

        void flush() {
            for (Map.Entry<String, Set<String>> entry : membership.entrySet()) {
                Layer layer = graph.findLayer(entry.getKey()).orElseThrow();
                ObjectNode manifest = codec.withMembership(codec.readTree(layer.getSourceFile()), entry.getValue());
                tx.write(layer.getSourceFile(), codec.render(manifest));
            }
        }
    }
}
