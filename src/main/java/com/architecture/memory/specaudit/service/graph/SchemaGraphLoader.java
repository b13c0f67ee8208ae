package com.architecture.memory.specaudit.service.graph;

import com.architecture.memory.specaudit.dto.finding.CompletenessIssue;
import com.architecture.memory.specaudit.exception.AuditExecutionException;
import com.architecture.memory.specaudit.exception.SchemaLinkException;
import com.architecture.memory.specaudit.exception.SchemaParseException;
import com.architecture.memory.specaudit.model.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads a file-backed specification into a {@link SchemaGraph}.
 *
 * Files are read in parallel and assembled in path order. A bad file never fails the load:
 * parse and link problems are excluded from the graph and recorded as completeness issues.
 * Only a missing root or an unreadable directory is fatal.
 */
@Service
@Slf4j
public class SchemaGraphLoader {

    private static final String MANIFEST = "manifest.yaml";
    private static final String BASE_DIR = "base";
    private static final String PREDICATES_FILE = "predicates.json";

    private final SchemaDocumentCodec codec;
    private final ExecutorService executor;

    public SchemaGraphLoader(SchemaDocumentCodec codec,
                             @Qualifier("schemaLoadExecutor") ExecutorService executor) {
        this.codec = codec;
        this.executor = executor;
    }

    public SchemaGraph load(Path specRoot) {
        if (specRoot == null || !Files.isDirectory(specRoot)) {
            throw new AuditExecutionException("Specification root does not exist or is not a directory: " + specRoot);
        }
        log.info("Loading specification from {}", specRoot);

        List<CompletenessIssue> issues = new ArrayList<>();
        ModelMetadata metadata = loadMetadata(specRoot, issues);
        Map<String, Predicate> predicates = loadPredicates(specRoot, issues);

        Path schemasDir = specRoot.resolve("schemas");
        List<Path> layerFiles = listFiles(specRoot.resolve("layers"), SchemaDocumentCodec.LAYER_SUFFIX, false);
        List<Path> nodeFiles = listFiles(schemasDir, SchemaDocumentCodec.NODE_SUFFIX, true);
        List<Path> relationshipFiles = listFiles(schemasDir, SchemaDocumentCodec.RELATIONSHIP_SUFFIX, true);

        List<Layer> layers = collect(readAll(layerFiles, codec::readLayer), issues);
        List<NodeType> nodeTypes = collect(readAll(nodeFiles, codec::readNodeType), issues);
        List<RelationshipType> candidates = collect(readAll(relationshipFiles, codec::readRelationship), issues);

        Map<String, Layer> layersById = indexLayers(layers, issues);
        Map<String, NodeType> nodesById = indexNodeTypes(nodeTypes, layersById, issues);
        checkMembership(layersById.values(), nodesById.values(), issues);
        List<RelationshipType> relationships = linkRelationships(candidates, nodesById, predicates, issues);

        log.info("Loaded {} layers, {} node types, {} relationship types, {} predicates ({} issues)",
                layersById.size(), nodesById.size(), relationships.size(), predicates.size(), issues.size());

        return new SchemaGraph(specRoot, metadata, layersById.values(), nodesById.values(),
                relationships, predicates, issues);
    }

    // ========================= FILE READING =========================

    private ModelMetadata loadMetadata(Path specRoot, List<CompletenessIssue> issues) {
        Path manifest = specRoot.resolve(MANIFEST);
        if (!Files.isRegularFile(manifest)) {
            return ModelMetadata.defaults();
        }
        try {
            return codec.readManifest(manifest);
        } catch (SchemaParseException e) {
            log.warn("Ignoring unreadable manifest: {}", e.getMessage());
            issues.add(parseIssue(e));
            return ModelMetadata.defaults();
        } catch (UncheckedIOException e) {
            throw new AuditExecutionException("Cannot read " + manifest, e);
        }
    }

    private Map<String, Predicate> loadPredicates(Path specRoot, List<CompletenessIssue> issues) {
        Path catalog = specRoot.resolve("schemas").resolve(BASE_DIR).resolve(PREDICATES_FILE);
        if (!Files.isRegularFile(catalog)) {
            log.warn("Predicate catalog not found at {}", catalog);
            issues.add(CompletenessIssue.builder()
                    .kind(CompletenessIssue.Kind.MISSING_SCHEMA)
                    .element(PREDICATES_FILE)
                    .file(catalog.toString())
                    .message("Predicate catalog is missing; every relationship type will fail to link")
                    .suggestion("Create " + catalog)
                    .build());
            return Map.of();
        }
        try {
            return codec.readPredicates(catalog);
        } catch (SchemaParseException e) {
            log.warn("Predicate catalog is malformed: {}", e.getMessage());
            issues.add(parseIssue(e));
            return Map.of();
        } catch (UncheckedIOException e) {
            throw new AuditExecutionException("Cannot read " + catalog, e);
        }
    }

    private List<Path> listFiles(Path dir, String suffix, boolean recursive) {
        if (!Files.isDirectory(dir)) {
            log.debug("Directory {} does not exist, nothing to load", dir);
            return List.of();
        }
        try (Stream<Path> stream = recursive ? Files.walk(dir) : Files.list(dir)) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(suffix))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            throw new AuditExecutionException("Cannot read directory " + dir, e);
        }
    }

    /**
     * Parses every file on the loader executor. Results keep the order of {@code files}.
     */
    private <T> List<Outcome<T>> readAll(List<Path> files, Function<Path, T> parser) {
        List<Future<T>> futures = new ArrayList<>(files.size());
        for (Path file : files) {
            futures.add(executor.submit(() -> parser.apply(file)));
        }

        List<Outcome<T>> outcomes = new ArrayList<>(files.size());
        for (int i = 0; i < futures.size(); i++) {
            Path file = files.get(i);
            try {
                outcomes.add(Outcome.success(futures.get(i).get()));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof SchemaParseException parseError) {
                    log.warn("Skipping malformed schema: {}", parseError.getMessage());
                    outcomes.add(Outcome.failure(parseIssue(parseError)));
                } else {
                    throw new AuditExecutionException("Cannot read " + file, cause);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AuditExecutionException("Interrupted while reading " + file, e);
            }
        }
        return outcomes;
    }

    private <T> List<T> collect(List<Outcome<T>> outcomes, List<CompletenessIssue> issues) {
        List<T> values = new ArrayList<>();
        for (Outcome<T> outcome : outcomes) {
            if (outcome.value() != null) {
                values.add(outcome.value());
            } else {
                issues.add(outcome.issue());
            }
        }
        return values;
    }

    // ========================= LINKING =========================

    private Map<String, Layer> indexLayers(List<Layer> layers, List<CompletenessIssue> issues) {
        Map<String, Layer> byId = new LinkedHashMap<>();
        for (Layer layer : layers) {
            if (byId.putIfAbsent(layer.getId(), layer) != null) {
                issues.add(CompletenessIssue.builder()
                        .kind(CompletenessIssue.Kind.PARSE_ERROR)
                        .layer(layer.getId())
                        .element(layer.getId())
                        .file(String.valueOf(layer.getSourceFile()))
                        .message("Layer '" + layer.getId() + "' is declared by more than one manifest")
                        .suggestion("Remove the duplicate manifest " + layer.getSourceFile())
                        .build());
            }
        }
        return byId;
    }

    private Map<String, NodeType> indexNodeTypes(List<NodeType> nodeTypes, Map<String, Layer> layers,
                                                 List<CompletenessIssue> issues) {
        Map<String, NodeType> byId = new LinkedHashMap<>();
        Set<String> reportedLayers = new HashSet<>();
        for (NodeType nodeType : nodeTypes) {
            if (byId.containsKey(nodeType.getSpecNodeId())) {
                issues.add(CompletenessIssue.builder()
                        .kind(CompletenessIssue.Kind.PARSE_ERROR)
                        .layer(nodeType.getLayerId())
                        .element(nodeType.getSpecNodeId())
                        .file(String.valueOf(nodeType.getSourceFile()))
                        .message("Node type '" + nodeType.getSpecNodeId() + "' is declared by more than one schema")
                        .suggestion("Remove the duplicate schema " + nodeType.getSourceFile())
                        .build());
                continue;
            }
            byId.put(nodeType.getSpecNodeId(), nodeType);

            if (!layers.containsKey(nodeType.getLayerId()) && reportedLayers.add(nodeType.getLayerId())) {
                issues.add(CompletenessIssue.builder()
                        .kind(CompletenessIssue.Kind.UNKNOWN_LAYER)
                        .layer(nodeType.getLayerId())
                        .element(nodeType.getLayerId())
                        .file(String.valueOf(nodeType.getSourceFile()))
                        .message("Node types declare layer '" + nodeType.getLayerId() + "' but no layer manifest exists")
                        .suggestion("Add layers/" + nodeType.getLayerId() + SchemaDocumentCodec.LAYER_SUFFIX)
                        .build());
            }
        }
        return byId;
    }

    /**
     * A non-empty membership list must equal the set of node types declaring the layer.
     */
    private void checkMembership(Collection<Layer> layers, Collection<NodeType> nodeTypes,
                                 List<CompletenessIssue> issues) {
        Map<String, Set<String>> declared = new HashMap<>();
        for (NodeType nodeType : nodeTypes) {
            declared.computeIfAbsent(nodeType.getLayerId(), k -> new TreeSet<>()).add(nodeType.getSpecNodeId());
        }

        for (Layer layer : layers) {
            if (!layer.declaresMembership()) {
                continue;
            }
            Set<String> listed = new TreeSet<>(layer.getNodeTypeIds());
            Set<String> actual = declared.getOrDefault(layer.getId(), Set.of());

            for (String id : listed) {
                if (!actual.contains(id)) {
                    issues.add(CompletenessIssue.builder()
                            .kind(CompletenessIssue.Kind.MISSING_SCHEMA)
                            .layer(layer.getId())
                            .element(id)
                            .file(String.valueOf(layer.getSourceFile()))
                            .message("Layer '" + layer.getId() + "' lists '" + id + "' but no node schema declares it")
                            .suggestion("Remove " + id + " from the layer manifest or add its node schema")
                            .build());
                }
            }
            for (String id : actual) {
                if (!listed.contains(id)) {
                    issues.add(CompletenessIssue.builder()
                            .kind(CompletenessIssue.Kind.ORPHANED_SCHEMA)
                            .layer(layer.getId())
                            .element(id)
                            .file(String.valueOf(layer.getSourceFile()))
                            .message("Node type '" + id + "' declares layer '" + layer.getId()
                                    + "' but is not listed in its manifest")
                            .suggestion("Add " + id + " to the layer manifest")
                            .build());
                }
            }
        }
    }

    private List<RelationshipType> linkRelationships(List<RelationshipType> candidates,
                                                     Map<String, NodeType> nodeTypes,
                                                     Map<String, Predicate> predicates,
                                                     List<CompletenessIssue> issues) {
        List<RelationshipType> linked = new ArrayList<>();
        Set<String> seenTriples = new HashSet<>();
        Set<String> seenIds = new HashSet<>();

        for (RelationshipType rel : candidates) {
            try {
                link(rel, nodeTypes, predicates);
            } catch (SchemaLinkException e) {
                log.warn("Excluding unlinked relationship: {}", e.getMessage());
                issues.add(CompletenessIssue.builder()
                        .kind(CompletenessIssue.Kind.LINK_ERROR)
                        .layer(rel.getSourceLayer())
                        .element(rel.getId())
                        .file(String.valueOf(e.getFile()))
                        .message(e.getMessage())
                        .suggestion("Fix or remove relationship " + rel.getId())
                        .build());
                continue;
            }

            if (!seenTriples.add(rel.tripleKey()) || !seenIds.add(rel.getId())) {
                log.warn("Excluding duplicate relationship {} from {}", rel.getId(), rel.getSourceFile());
                issues.add(CompletenessIssue.builder()
                        .kind(CompletenessIssue.Kind.DUPLICATE_RELATIONSHIP)
                        .layer(rel.getSourceLayer())
                        .element(rel.getId())
                        .file(String.valueOf(rel.getSourceFile()))
                        .message("Relationship " + rel.tripleKey() + " is declared more than once")
                        .suggestion("Remove the duplicate file " + rel.getSourceFile())
                        .build());
                continue;
            }
            linked.add(rel);
        }
        return linked;
    }

    private void link(RelationshipType rel, Map<String, NodeType> nodeTypes, Map<String, Predicate> predicates) {
        NodeType source = nodeTypes.get(rel.getSourceSpecNodeId());
        if (source == null) {
            throw new SchemaLinkException(rel.getSourceFile(), "unknown source node type " + rel.getSourceSpecNodeId());
        }
        NodeType destination = nodeTypes.get(rel.getDestinationSpecNodeId());
        if (destination == null) {
            throw new SchemaLinkException(rel.getSourceFile(),
                    "unknown destination node type " + rel.getDestinationSpecNodeId());
        }
        if (!predicates.containsKey(rel.getPredicate())) {
            throw new SchemaLinkException(rel.getSourceFile(), "unknown predicate " + rel.getPredicate());
        }
        if (!source.getLayerId().equals(rel.getSourceLayer())
                || !destination.getLayerId().equals(rel.getDestinationLayer())) {
            throw new SchemaLinkException(rel.getSourceFile(), "declared layers " + rel.getSourceLayer() + " -> "
                    + rel.getDestinationLayer() + " do not match the endpoint node types");
        }
    }

    private CompletenessIssue parseIssue(SchemaParseException e) {
        return CompletenessIssue.builder()
                .kind(CompletenessIssue.Kind.PARSE_ERROR)
                .layer(layerFromPath(e.getFile()))
                .element(e.getFile().getFileName().toString())
                .file(e.getFile().toString())
                .message(e.getMessage())
                .suggestion("Repair malformed schema file " + e.getFile())
                .build();
    }

    private static String layerFromPath(Path file) {
        Path parent = file.getParent();
        if (parent != null && SchemaDocumentCodec.RELATIONSHIPS_DIR.equals(String.valueOf(parent.getFileName()))) {
            parent = parent.getParent();
        }
        return parent != null ? String.valueOf(parent.getFileName()) : null;
    }

    private record Outcome<T>(T value, CompletenessIssue issue) {
        static <T> Outcome<T> success(T value) {
            return new Outcome<>(value, null);
        }

        static <T> Outcome<T> failure(CompletenessIssue issue) {
            return new Outcome<>(null, issue);
        }
    }
}
