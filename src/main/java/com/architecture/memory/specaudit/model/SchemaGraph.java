package com.architecture.memory.specaudit.model;

import com.architecture.memory.specaudit.dto.finding.CompletenessIssue;
import lombok.Getter;

import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;

/**
 * In-memory view of one loaded specification. Immutable once built; every analyzer receives
 * it explicitly instead of reading the file system itself.
 *
 * Layers are ordered by number, node types and relationship types by id, so every iteration
 * over the graph is deterministic.
 */
@Getter
public final class SchemaGraph {

    private final Path specRoot;
    private final ModelMetadata metadata;
    private final List<Layer> layers;
    private final Map<String, NodeType> nodeTypes;
    private final List<RelationshipType> relationships;
    private final Map<String, Predicate> predicates;

    // Problems found while loading; surfaced as completeness findings, never thrown
    private final List<CompletenessIssue> loadIssues;

    private final Map<String, List<RelationshipType>> outgoing;
    private final Map<String, List<RelationshipType>> incoming;
    private final Set<String> tripleKeys;

    public SchemaGraph(Path specRoot,
                       ModelMetadata metadata,
                       Collection<Layer> layers,
                       Collection<NodeType> nodeTypes,
                       Collection<RelationshipType> relationships,
                       Map<String, Predicate> predicates,
                       List<CompletenessIssue> loadIssues) {
        this.specRoot = specRoot;
        this.metadata = metadata != null ? metadata : ModelMetadata.defaults();
        this.layers = layers.stream()
                .sorted(Comparator.comparingInt(Layer::getNumber).thenComparing(Layer::getId))
                .collect(Collectors.toUnmodifiableList());

        Map<String, NodeType> sortedNodes = new TreeMap<>();
        nodeTypes.forEach(n -> sortedNodes.put(n.getSpecNodeId(), n));
        this.nodeTypes = Collections.unmodifiableMap(sortedNodes);

        this.relationships = relationships.stream()
                .sorted(Comparator.comparing(RelationshipType::getId))
                .collect(Collectors.toUnmodifiableList());
        this.predicates = Collections.unmodifiableMap(new TreeMap<>(predicates));
        this.loadIssues = loadIssues != null ? List.copyOf(loadIssues) : List.of();

        Map<String, List<RelationshipType>> out = new HashMap<>();
        Map<String, List<RelationshipType>> in = new HashMap<>();
        Set<String> keys = new HashSet<>();
        for (RelationshipType rel : this.relationships) {
            out.computeIfAbsent(rel.getSourceSpecNodeId(), k -> new ArrayList<>()).add(rel);
            in.computeIfAbsent(rel.getDestinationSpecNodeId(), k -> new ArrayList<>()).add(rel);
            keys.add(rel.tripleKey());
        }
        this.outgoing = Collections.unmodifiableMap(out);
        this.incoming = Collections.unmodifiableMap(in);
        this.tripleKeys = Collections.unmodifiableSet(keys);
    }

    public Optional<Layer> findLayer(String layerId) {
        return layers.stream().filter(l -> l.getId().equals(layerId)).findFirst();
    }

    public Optional<NodeType> findNodeType(String specNodeId) {
        return Optional.ofNullable(nodeTypes.get(specNodeId));
    }

    public Optional<Predicate> getPredicate(String name) {
        return Optional.ofNullable(predicates.get(name));
    }

    /**
     * Node types declaring the given layer, sorted by id.
     */
    public List<NodeType> nodeTypesInLayer(String layerId) {
        return nodeTypes.values().stream()
                .filter(n -> layerId.equals(n.getLayerId()))
                .collect(Collectors.toList());
    }

    public List<RelationshipType> outgoing(String specNodeId) {
        return outgoing.getOrDefault(specNodeId, List.of());
    }

    public List<RelationshipType> incoming(String specNodeId) {
        return incoming.getOrDefault(specNodeId, List.of());
    }

    /**
     * Incident edges in either direction. A self-loop counts once.
     */
    public int degree(String specNodeId) {
        int selfLoops = (int) outgoing(specNodeId).stream()
                .filter(r -> r.getDestinationSpecNodeId().equals(specNodeId))
                .count();
        return outgoing(specNodeId).size() + incoming(specNodeId).size() - selfLoops;
    }

    public boolean isIsolated(String specNodeId) {
        return outgoing(specNodeId).isEmpty() && incoming(specNodeId).isEmpty();
    }

    public List<RelationshipType> relationshipsBetween(String sourceId, String destinationId) {
        return outgoing(sourceId).stream()
                .filter(r -> r.getDestinationSpecNodeId().equals(destinationId))
                .collect(Collectors.toList());
    }

    public boolean hasRelationship(String sourceId, String predicate, String destinationId) {
        return tripleKeys.contains(RelationshipType.tripleKey(sourceId, predicate, destinationId));
    }

    public int layerNumber(String layerId) {
        return findLayer(layerId).map(Layer::getNumber).orElse(Integer.MAX_VALUE);
    }

    /**
     * Returns a new graph carrying the extra relationship types on top of this one.
     * Triples already present are ignored. Nothing is written to disk.
     */
    public SchemaGraph withProjectedRelationships(Collection<RelationshipType> projected) {
        Map<String, RelationshipType> merged = new LinkedHashMap<>();
        relationships.forEach(r -> merged.put(r.tripleKey(), r));
        for (RelationshipType rel : projected) {
            merged.putIfAbsent(rel.tripleKey(), rel);
        }
        return new SchemaGraph(specRoot, metadata, layers, nodeTypes.values(),
                merged.values(), predicates, loadIssues);
    }
}
