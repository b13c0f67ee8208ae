package com.architecture.memory.specaudit;

import com.architecture.memory.specaudit.config.ObjectMapperFactory;
import com.architecture.memory.specaudit.model.SchemaGraph;
import com.architecture.memory.specaudit.service.graph.SchemaDocumentCodec;
import com.architecture.memory.specaudit.service.graph.SchemaGraphLoader;
import com.architecture.memory.specaudit.service.graph.analyzer.BalanceAnalyzer;
import com.architecture.memory.specaudit.service.graph.analyzer.ConnectivityAnalyzer;
import com.architecture.memory.specaudit.service.graph.analyzer.CoverageAnalyzer;
import com.architecture.memory.specaudit.service.graph.analyzer.DefaultGapPriorityPolicy;
import com.architecture.memory.specaudit.service.graph.analyzer.DuplicateDetector;
import com.architecture.memory.specaudit.service.graph.analyzer.GapDetector;
import com.architecture.memory.specaudit.service.graph.analyzer.NodeAuditAnalyzer;
import com.architecture.memory.specaudit.service.graph.analyzer.PredicateSimilarity;
import com.architecture.memory.specaudit.service.graph.analyzer.RelationshipTemplateCatalog;
import com.architecture.memory.specaudit.service.report.ReportAssembler;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Writes a file-backed specification into a temporary directory.
 */
public final class SpecFixture {

    public static final ObjectMapper MAPPER = ObjectMapperFactory.create();
    public static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC);

    private static final ExecutorService LOADER_POOL = Executors.newFixedThreadPool(2, runnable -> {
        Thread thread = new Thread(runnable, "fixture-loader");
        thread.setDaemon(true);
        return thread;
    });

    private final Path root;
    private final ObjectNode predicates = MAPPER.createObjectNode();

    private SpecFixture(Path root) {
        this.root = root;
    }

    public static SpecFixture at(Path root) {
        return new SpecFixture(root);
    }

    public static SchemaDocumentCodec codec() {
        return new SchemaDocumentCodec(MAPPER);
    }

    public static SchemaGraphLoader loader() {
        return new SchemaGraphLoader(codec(), LOADER_POOL);
    }

    /**
     * Report assembler wired with the real analyzers and the fixed clock.
     */
    public static ReportAssembler assembler() {
        CoverageAnalyzer coverage = new CoverageAnalyzer();
        return new ReportAssembler(
                coverage,
                new GapDetector(coverage, new RelationshipTemplateCatalog(), new DefaultGapPriorityPolicy()),
                new DuplicateDetector(new PredicateSimilarity()),
                new BalanceAnalyzer(),
                new ConnectivityAnalyzer(),
                new NodeAuditAnalyzer(),
                CLOCK);
    }

    public Path root() {
        return root;
    }

    public SchemaGraph load() {
        return loader().load(root);
    }

    public SpecFixture manifest(String name, String version) {
        return write(root.resolve("manifest.yaml"), "name: " + name + "\nversion: \"" + version + "\"\n");
    }

    public SpecFixture layer(String id, int number, String... members) {
        ObjectNode layer = MAPPER.createObjectNode();
        layer.put("id", id);
        layer.put("number", number);
        layer.put("name", Character.toUpperCase(id.charAt(0)) + id.substring(1) + " Layer");
        layer.put("description", "The " + id + " layer of the architecture");
        ObjectNode inspiredBy = layer.putObject("inspired_by");
        inspiredBy.put("standard", "ArchiMate");
        inspiredBy.put("version", "3.2");
        if (members.length > 0) {
            ArrayNode list = layer.putArray("node_types");
            for (String member : members) {
                list.add(member);
            }
        }
        return writeJson(layerPath(id), layer);
    }

    public SpecFixture nodeType(String layer, String type, String description, String... attributes) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("$schema", "http://json-schema.org/draft-07/schema#");
        node.put("$id", "https://example.org/spec/" + layer + "." + type);
        node.put("title", type);
        if (description != null) {
            node.put("description", description);
        }
        ObjectNode properties = node.putObject("properties");
        properties.putObject("spec_node_id").put("const", layer + "." + type);
        properties.putObject("layer_id").put("const", layer);
        properties.putObject("type").put("const", type);
        ObjectNode attributeMap = properties.putObject("attributes");
        attributeMap.put("type", "object");
        ObjectNode attributeProperties = attributeMap.putObject("properties");
        for (String attribute : attributes) {
            ObjectNode definition = attributeProperties.putObject(attribute);
            definition.put("type", "string");
            definition.put("description", "The " + attribute + " of the " + type);
        }
        return writeJson(nodePath(layer, type), node);
    }

    public SpecFixture relationship(String source, String predicate, String destination) {
        String id = source + "." + predicate + "." + destination;
        String sourceLayer = source.substring(0, source.indexOf('.'));
        ObjectNode rel = MAPPER.createObjectNode();
        rel.put("title", source + " " + predicate + " " + destination);
        ObjectNode properties = rel.putObject("properties");
        properties.putObject("id").put("const", id);
        properties.putObject("source_spec_node_id").put("const", source);
        properties.putObject("source_layer").put("const", sourceLayer);
        properties.putObject("destination_spec_node_id").put("const", destination);
        properties.putObject("destination_layer").put("const", destination.substring(0, destination.indexOf('.')));
        properties.putObject("predicate").put("const", predicate);
        properties.putObject("cardinality").put("const", "many-to-many");
        properties.putObject("strength").put("const", "medium");
        return writeJson(relationshipPath(source, predicate, destination), rel);
    }

    public SpecFixture predicate(String name, String inverse, String category, boolean transitive) {
        ObjectNode predicate = predicates.putObject(name);
        predicate.put("predicate", name);
        if (inverse != null) {
            predicate.put("inverse", inverse);
        }
        predicate.put("category", category);
        predicate.put("description", name + " relationship");
        predicate.putObject("semantics").put("transitivity", transitive);
        ObjectNode catalog = MAPPER.createObjectNode();
        catalog.set("predicates", predicates);
        return writeJson(root.resolve("schemas").resolve("base").resolve("predicates.json"), catalog);
    }

    public SpecFixture predicates(String... names) {
        for (String name : names) {
            predicate(name, null, "structural", false);
        }
        return this;
    }

    public Path layerPath(String id) {
        return root.resolve("layers").resolve(id + SchemaDocumentCodec.LAYER_SUFFIX);
    }

    public Path nodePath(String layer, String type) {
        return root.resolve("schemas").resolve(layer).resolve(type + SchemaDocumentCodec.NODE_SUFFIX);
    }

    public Path relationshipPath(String source, String predicate, String destination) {
        String sourceLayer = source.substring(0, source.indexOf('.'));
        return root.resolve("schemas").resolve(sourceLayer).resolve(SchemaDocumentCodec.RELATIONSHIPS_DIR)
                .resolve(source + "." + predicate + "." + destination + SchemaDocumentCodec.RELATIONSHIP_SUFFIX);
    }

    public SpecFixture write(Path file, String content) {
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, content, StandardCharsets.UTF_8);
            return this;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private SpecFixture writeJson(Path file, ObjectNode document) {
        try {
            return write(file, MAPPER.writeValueAsString(document) + "\n");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Two layers with a handful of documented node types, used across service tests.
     * business (2): actor, role, process, service, event; application (4): component, interface.
     */
    public SpecFixture standardModel() {
        predicates("references", "assigned-to", "triggers", "realizes", "serves", "uses");
        predicate("composes", "composed-of", "structural", true);
        layer("business", 2);
        layer("application", 4);
        nodeType("business", "actor", "A person or organization that performs business behavior", "name");
        nodeType("business", "role", "The responsibility for performing specific behavior assigned to an actor", "name");
        nodeType("business", "process", "A sequence of business behaviors that achieves a specific outcome", "name");
        nodeType("business", "service", "Explicitly defined business behavior exposed to customers", "name");
        nodeType("business", "event", "A state change that triggers or interrupts business processes", "name");
        nodeType("application", "component", "An encapsulation of application functionality aligned to implementation", "name");
        nodeType("application", "interface", "A point of access where application services are made available", "name");
        relationship("business.actor", "assigned-to", "business.role");
        relationship("application.component", "realizes", "business.service");
        return this;
    }
}
