package com.architecture.memory.specaudit.service.graph;

import com.architecture.memory.specaudit.exception.SchemaParseException;
import com.architecture.memory.specaudit.model.*;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Reads and renders the on-disk schema documents: layer manifests, node schemas,
 * relationship schemas, the predicate catalog and the optional model manifest.
 *
 * Content problems raise {@link SchemaParseException}; I/O problems raise {@link UncheckedIOException}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SchemaDocumentCodec {

    public static final String LAYER_SUFFIX = ".layer.json";
    public static final String NODE_SUFFIX = ".node.schema.json";
    public static final String RELATIONSHIP_SUFFIX = ".relationship.schema.json";
    public static final String RELATIONSHIPS_DIR = "relationships";

    private final ObjectMapper objectMapper;

    // ========================= RAW DOCUMENTS =========================

    public ObjectNode readTree(Path file) {
        String content = readString(file);
        try {
            JsonNode node = objectMapper.readTree(content);
            if (node == null || !node.isObject()) {
                throw new SchemaParseException(file, "expected a JSON object");
            }
            return (ObjectNode) node;
        } catch (JsonProcessingException e) {
            throw new SchemaParseException(file, "malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    public String render(JsonNode document) {
        try {
            return objectMapper.writeValueAsString(document) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render schema document", e);
        }
    }

    // ========================= LAYERS =========================

    public Layer readLayer(Path file) {
        ObjectNode root = readTree(file);
        String id = text(root, "id");
        if (id == null) {
            throw new SchemaParseException(file, "layer manifest has no id");
        }
        if (!root.path("number").canConvertToInt()) {
            throw new SchemaParseException(file, "layer manifest has no numeric 'number'");
        }

        List<String> nodeTypeIds = new ArrayList<>();
        root.path("node_types").forEach(n -> nodeTypeIds.add(n.asText()));

        return Layer.builder()
                .id(id)
                .number(root.path("number").asInt())
                .name(Optional.ofNullable(text(root, "name")).orElse(id))
                .description(text(root, "description"))
                .standardReference(standardReference(root.path("inspired_by")))
                .nodeTypeIds(nodeTypeIds)
                .sourceFile(file)
                .build();
    }

    private String standardReference(JsonNode inspiredBy) {
        if (inspiredBy.isTextual()) {
            return inspiredBy.asText();
        }
        if (inspiredBy.isObject()) {
            String standard = text(inspiredBy, "standard");
            String version = text(inspiredBy, "version");
            if (standard != null && version != null) {
                return standard + " " + version;
            }
            return standard;
        }
        return null;
    }

    /**
     * Rewrites the membership list of a layer manifest, keeping every other field.
     */
    public ObjectNode withMembership(ObjectNode layerDocument, Collection<String> nodeTypeIds) {
        ObjectNode copy = layerDocument.deepCopy();
        ArrayNode list = copy.putArray("node_types");
        new TreeSet<>(nodeTypeIds).forEach(list::add);
        return copy;
    }

    // ========================= NODE TYPES =========================

    public NodeType readNodeType(Path file) {
        ObjectNode root = readTree(file);
        JsonNode properties = root.path("properties");
        String specNodeId = constOf(properties, "spec_node_id");
        String layerId = constOf(properties, "layer_id");
        String type = constOf(properties, "type");
        if (specNodeId == null || layerId == null || type == null) {
            throw new SchemaParseException(file, "node schema is missing spec_node_id, layer_id or type const");
        }
        if (!specNodeId.equals(NodeType.compositeId(layerId, type))) {
            throw new SchemaParseException(file, "spec_node_id '" + specNodeId
                    + "' does not match layer_id and type '" + NodeType.compositeId(layerId, type) + "'");
        }

        JsonNode attributesNode = properties.path("attributes");
        Set<String> required = new HashSet<>();
        attributesNode.path("required").forEach(r -> required.add(r.asText()));

        List<AttributeDefinition> attributes = new ArrayList<>();
        attributesNode.path("properties").fields().forEachRemaining(entry -> {
            JsonNode attr = entry.getValue();
            List<String> enumValues = new ArrayList<>();
            attr.path("enum").forEach(v -> enumValues.add(v.asText()));
            attributes.add(AttributeDefinition.builder()
                    .name(entry.getKey())
                    .type(text(attr, "type"))
                    .format(text(attr, "format"))
                    .description(text(attr, "description"))
                    .required(required.contains(entry.getKey()))
                    .enumValues(enumValues)
                    .build());
        });

        return NodeType.builder()
                .specNodeId(specNodeId)
                .layerId(layerId)
                .type(type)
                .title(Optional.ofNullable(text(root, "title")).orElse(type))
                .description(text(root, "description"))
                .attributes(attributes)
                .sourceFile(file)
                .build();
    }

    /**
     * Re-homes a node schema document into another layer by rewriting its identity consts.
     */
    public ObjectNode withLayer(ObjectNode nodeDocument, String layerId, String type) {
        ObjectNode copy = nodeDocument.deepCopy();
        ObjectNode properties = child(copy, "properties");
        String previousId = constOf(properties, "spec_node_id");
        String newId = NodeType.compositeId(layerId, type);
        setConst(properties, "spec_node_id", newId);
        setConst(properties, "layer_id", layerId);
        setConst(properties, "type", type);
        String schemaId = text(copy, "$id");
        if (schemaId != null && previousId != null && schemaId.endsWith(previousId)) {
            copy.put("$id", schemaId.substring(0, schemaId.length() - previousId.length()) + newId);
        }
        return copy;
    }

    /**
     * Returns the attribute map of a node document, creating it when absent.
     */
    public ObjectNode attributeProperties(ObjectNode nodeDocument) {
        ObjectNode attributes = child(child(nodeDocument, "properties"), "attributes");
        if (!attributes.has("type")) {
            attributes.put("type", "object");
        }
        return child(attributes, "properties");
    }

    // ========================= RELATIONSHIPS =========================

    public RelationshipType readRelationship(Path file) {
        ObjectNode root = readTree(file);
        JsonNode properties = root.path("properties");
        String id = constOf(properties, "id");
        String source = constOf(properties, "source_spec_node_id");
        String destination = constOf(properties, "destination_spec_node_id");
        String predicate = constOf(properties, "predicate");
        if (id == null || source == null || destination == null || predicate == null) {
            throw new SchemaParseException(file,
                    "relationship schema is missing id, source_spec_node_id, destination_spec_node_id or predicate const");
        }

        try {
            return RelationshipType.builder()
                    .id(id)
                    .sourceSpecNodeId(source)
                    .sourceLayer(Optional.ofNullable(constOf(properties, "source_layer")).orElse(layerOf(source)))
                    .destinationSpecNodeId(destination)
                    .destinationLayer(Optional.ofNullable(constOf(properties, "destination_layer"))
                            .orElse(layerOf(destination)))
                    .predicate(predicate)
                    .cardinality(Cardinality.fromLabel(constOf(properties, "cardinality")))
                    .strength(Strength.fromLabel(constOf(properties, "strength")))
                    .sourceFile(file)
                    .build();
        } catch (IllegalArgumentException e) {
            throw new SchemaParseException(file, e.getMessage(), e);
        }
    }

    public ObjectNode relationshipDocument(RelationshipType rel) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("$schema", "http://json-schema.org/draft-07/schema#");
        root.put("title", rel.getSourceSpecNodeId() + " " + rel.getPredicate() + " " + rel.getDestinationSpecNodeId());
        root.put("type", "object");
        ObjectNode properties = root.putObject("properties");
        setConst(properties, "id", rel.getId());
        setConst(properties, "source_spec_node_id", rel.getSourceSpecNodeId());
        setConst(properties, "source_layer", rel.getSourceLayer());
        setConst(properties, "destination_spec_node_id", rel.getDestinationSpecNodeId());
        setConst(properties, "destination_layer", rel.getDestinationLayer());
        setConst(properties, "predicate", rel.getPredicate());
        setConst(properties, "cardinality", rel.getCardinality().getLabel());
        setConst(properties, "strength", rel.getStrength().getLabel());
        return root;
    }

    /**
     * Re-points an existing relationship document at new endpoints, keeping its other fields.
     */
    public ObjectNode withEndpoints(ObjectNode relationshipDocument, RelationshipType rel) {
        ObjectNode copy = relationshipDocument.deepCopy();
        ObjectNode properties = child(copy, "properties");
        setConst(properties, "id", rel.getId());
        setConst(properties, "source_spec_node_id", rel.getSourceSpecNodeId());
        setConst(properties, "source_layer", rel.getSourceLayer());
        setConst(properties, "destination_spec_node_id", rel.getDestinationSpecNodeId());
        setConst(properties, "destination_layer", rel.getDestinationLayer());
        copy.put("title", rel.getSourceSpecNodeId() + " " + rel.getPredicate() + " " + rel.getDestinationSpecNodeId());
        return copy;
    }

    /**
     * Canonical location of a relationship schema: under the source layer, named after its id.
     */
    public static Path relationshipPath(Path specRoot, RelationshipType rel) {
        return specRoot.resolve("schemas").resolve(rel.getSourceLayer())
                .resolve(RELATIONSHIPS_DIR).resolve(rel.getId() + RELATIONSHIP_SUFFIX);
    }

    public static Path nodeTypePath(Path specRoot, String layerId, String type) {
        return specRoot.resolve("schemas").resolve(layerId).resolve(type + NODE_SUFFIX);
    }

    // ========================= PREDICATES =========================

    public Map<String, Predicate> readPredicates(Path file) {
        ObjectNode root = readTree(file);
        JsonNode predicatesNode = root.has("predicates") ? root.path("predicates") : root;
        if (!predicatesNode.isObject()) {
            throw new SchemaParseException(file, "predicate catalog must be an object keyed by predicate name");
        }

        Map<String, Predicate> predicates = new TreeMap<>();
        predicatesNode.fields().forEachRemaining(entry -> {
            JsonNode p = entry.getValue();
            JsonNode semantics = p.path("semantics");
            String name = Optional.ofNullable(text(p, "predicate")).orElse(entry.getKey());
            predicates.put(name, Predicate.builder()
                    .name(name)
                    .inverse(text(p, "inverse"))
                    .category(text(p, "category"))
                    .description(text(p, "description"))
                    .semantics(PredicateSemantics.builder()
                            .directionality(Optional.ofNullable(text(semantics, "directionality"))
                                    .orElse("unidirectional"))
                            .transitive(semantics.path("transitivity").asBoolean(false))
                            .symmetric(semantics.path("symmetry").asBoolean(false))
                            .reflexive(semantics.path("reflexivity").asBoolean(false))
                            .build())
                    .build());
        });
        return predicates;
    }

    // ========================= MANIFEST =========================

    @SuppressWarnings("unchecked")
    public ModelMetadata readManifest(Path file) {
        Object loaded;
        try {
            loaded = new Yaml().load(readString(file));
        } catch (RuntimeException e) {
            throw new SchemaParseException(file, "malformed YAML: " + e.getMessage(), e);
        }
        if (!(loaded instanceof Map)) {
            throw new SchemaParseException(file, "manifest must be a YAML mapping");
        }
        Map<String, Object> manifest = (Map<String, Object>) loaded;
        ModelMetadata defaults = ModelMetadata.defaults();
        Object name = manifest.get("name");
        Object version = manifest.get("version");
        return ModelMetadata.builder()
                .name(name != null ? name.toString() : defaults.getName())
                .version(version != null ? version.toString() : defaults.getVersion())
                .build();
    }

    // ========================= HELPERS =========================

    private String readString(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static String constOf(JsonNode properties, String field) {
        return text(properties.path(field), "const");
    }

    private static void setConst(ObjectNode properties, String field, String value) {
        child(properties, field).put("const", value);
    }

    static ObjectNode child(ObjectNode parent, String field) {
        JsonNode existing = parent.get(field);
        if (existing instanceof ObjectNode) {
            return (ObjectNode) existing;
        }
        return parent.putObject(field);
    }

    static String layerOf(String specNodeId) {
        int dot = specNodeId.indexOf('.');
        return dot > 0 ? specNodeId.substring(0, dot) : null;
    }
}
