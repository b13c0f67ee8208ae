package com.architecture.memory.specaudit.service.report;

import com.architecture.memory.specaudit.dto.finding.*;
import com.architecture.memory.specaudit.dto.report.*;
import com.architecture.memory.specaudit.exception.AuditExecutionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Renders a report as JSON, Markdown or plain text.
 *
 * Markdown and text are produced from the same list of sections, so the two renderings
 * always carry the same rows; JSON is the serialized report object itself.
 */
@Component
@RequiredArgsConstructor
public class ReportRenderer {

    private final ObjectMapper objectMapper;

    private record Section(String title, List<String> headers, List<List<String>> rows) {
    }

    public String render(AuditReport report, ReportFormat format) {
        return switch (format) {
            case JSON -> json(report);
            case MARKDOWN -> markdown("Relationship Audit", header(report.getModel().getName(),
                    report.getModel().getVersion(), report.getTimestamp(), report.getLayerFilter()), sections(report));
            case TEXT -> text("RELATIONSHIP AUDIT", header(report.getModel().getName(),
                    report.getModel().getVersion(), report.getTimestamp(), report.getLayerFilter()), sections(report));
        };
    }

    public String render(NodeAuditReport report, ReportFormat format) {
        return switch (format) {
            case JSON -> json(report);
            case MARKDOWN -> markdown("Node Audit", header(report.getModel().getName(),
                    report.getModel().getVersion(), report.getTimestamp(), report.getLayerFilter()), sections(report));
            case TEXT -> text("NODE AUDIT", header(report.getModel().getName(),
                    report.getModel().getVersion(), report.getTimestamp(), report.getLayerFilter()), sections(report));
        };
    }

    public String json(Object value) {
        try {
            return objectMapper.writeValueAsString(value) + "\n";
        } catch (JsonProcessingException e) {
            throw new AuditExecutionException("Failed to serialize report", e);
        }
    }

    // ========================= SECTIONS =========================

    private List<String> header(String model, String version, Object timestamp, String layerFilter) {
        List<String> lines = new ArrayList<>();
        lines.add("Model: " + model + " " + version);
        lines.add("Generated: " + timestamp);
        if (layerFilter != null) {
            lines.add("Layer: " + layerFilter);
        }
        return lines;
    }

    private List<Section> sections(AuditReport report) {
        List<Section> sections = new ArrayList<>();

        List<List<String>> coverage = new ArrayList<>();
        for (CoverageMetric c : report.getCoverage()) {
            coverage.add(cells(c.getSubject(), c.getLayerNumber(), c.getNodeTypeCount(), c.getIntraLayerRelationships(),
                    c.getInterLayerRelationships(), c.getRelationshipCount(), c.getIsolationPercentage(),
                    c.getRelationshipsPerNodeType(), c.getUtilizationPercentage(), c.getIsolatedNodeTypes(),
                    c.getUsedPredicates(), c.getAlignmentScore(), c.getStandardReference(), c.getReasoning(),
                    c.getSuggestion()));
        }
        sections.add(new Section("Coverage", List.of("Layer", "Number", "Node Types", "Intra", "Inter",
                "Relationships", "Isolation %", "Density", "Utilization %", "Isolated", "Predicates Used",
                "Alignment", "Standard", "Reasoning", "Suggestion"), coverage));

        List<List<String>> gaps = new ArrayList<>();
        for (GapCandidate g : report.getGaps()) {
            gaps.add(cells(g.getSubject(), g.getSuggestedPredicate(), g.getOrigin(), g.getPriority().getLabel(),
                    g.getImpactScore(), g.getAlignmentScore(), g.getStandardReference(), g.getReasoning(),
                    g.getSuggestion()));
        }
        sections.add(new Section("Gaps", List.of("Candidate", "Predicate", "Origin", "Priority", "Impact",
                "Alignment", "Standard", "Reason", "Suggestion"), gaps));

        List<List<String>> duplicates = new ArrayList<>();
        for (DuplicateCandidate d : report.getDuplicates()) {
            duplicates.add(cells(d.getSubject(), d.getSourceNodeType() + " -> " + d.getDestinationNodeType(),
                    d.getPredicateA() + " / " + d.getPredicateB(), d.getConfidence().getLabel(),
                    d.getSimilarityScore(), d.getAlignmentScore(), d.getSiblingCount(), d.getFileA(), d.getFileB(),
                    d.getStandardReference(), d.getReasoning(), d.getSuggestion()));
        }
        sections.add(new Section("Duplicates", List.of("Pair", "Node Types", "Predicates", "Confidence",
                "Similarity", "Alignment", "Siblings", "File A", "File B", "Standard", "Reasoning", "Suggestion"),
                duplicates));

        if (report.getBalance() != null) {
            List<List<String>> layers = new ArrayList<>();
            for (LayerBalance b : report.getBalance().getLayers()) {
                List<String> counts = new ArrayList<>();
                b.getRelationshipCounts().forEach((nodeType, count) -> counts.add(nodeType + "=" + count));
                layers.add(cells(b.getLayer(), b.getNodeTypeCount(), b.getMinRelationships(),
                        b.getMedianRelationships(), b.getMaxRelationships(), counts));
            }
            sections.add(new Section("Balance", List.of("Layer", "Node Types", "Min", "Median", "Max",
                    "Relationship Counts"), layers));

            List<List<String>> issues = new ArrayList<>();
            for (BalanceIssue i : report.getBalance().getIssues()) {
                issues.add(cells(i.getSubject(), i.getLayer(), i.getStatus(), i.getRelationshipCount(),
                        i.getLayerMedian(), i.getCategory(), i.getTargetMin() + "-" + i.getTargetMax(),
                        i.getAlignmentScore(), i.getStandardReference(), i.getReasoning(), i.getSuggestion()));
            }
            sections.add(new Section("Balance Outliers", List.of("Node Type", "Layer", "Status", "Count", "Median",
                    "Category", "Target", "Alignment", "Standard", "Reasoning", "Suggestion"), issues));
        }

        if (report.getConnectivity() != null) {
            ConnectivityReport connectivity = report.getConnectivity();
            ConnectivityStats s = connectivity.getStats();
            sections.add(new Section("Connectivity", List.of("Metric", "Value"), List.of(
                    cells("Node types", s.getNodeTypeCount()),
                    cells("Relationships", s.getRelationshipCount()),
                    cells("Components", s.getComponentCount()),
                    cells("Largest component", s.getLargestComponentSize()),
                    cells("Isolated node types", s.getIsolatedCount()),
                    cells("Average degree", s.getAverageDegree()),
                    cells("Transitive chains", s.getTransitiveChainCount()),
                    cells("Layer compliance %", s.getLayerCompliancePercentage()))));

            List<List<String>> components = new ArrayList<>();
            for (int i = 0; i < connectivity.getComponents().size(); i++) {
                List<String> members = connectivity.getComponents().get(i);
                components.add(cells("#" + (i + 1), members.size(), members));
            }
            sections.add(new Section("Components", List.of("Component", "Size", "Node Types"), components));

            List<List<String>> isolated = new ArrayList<>();
            connectivity.getIsolatedNodeTypes().forEach(id -> isolated.add(cells(id)));
            sections.add(new Section("Isolated Node Types", List.of("Node Type"), isolated));

            List<List<String>> chains = new ArrayList<>();
            for (List<String> chain : connectivity.getTransitiveChains()) {
                chains.add(cells(String.join(" ", chain)));
            }
            sections.add(new Section("Transitive Chains", List.of("Chain"), chains));

            List<List<String>> issues = new ArrayList<>();
            for (ConnectivityIssue i : connectivity.getIssues()) {
                issues.add(cells(i.getSubject(), i.getKind(), i.getSourceNodeType() + " -> "
                                + i.getDestinationNodeType(), i.getSourceLayer() + " -> " + i.getDestinationLayer(),
                        i.getAlignmentScore(), i.getStandardReference(), i.getReasoning(), i.getSuggestion()));
            }
            sections.add(new Section("Layer Direction Violations", List.of("Relationship", "Kind", "Node Types",
                    "Layers", "Alignment", "Standard", "Reasoning", "Suggestion"), issues));
        }

        sections.add(completenessSection(report.getCompletenessIssues()));
        return sections;
    }

    private List<Section> sections(NodeAuditReport report) {
        List<Section> sections = new ArrayList<>();

        List<List<String>> summaries = new ArrayList<>();
        for (LayerSummary s : report.getLayerSummaries()) {
            summaries.add(cells(s.getLayer(), s.getLayerNumber(), s.getNodeTypeCount(), s.getAverageQuality(),
                    s.getEmptyDescriptions(), s.getGenericDescriptions(), s.getUndocumentedAttributes(),
                    s.getOverlapCount(), s.getCompletenessIssueCount()));
        }
        sections.add(new Section("Layer Summaries", List.of("Layer", "Number", "Node Types", "Avg Quality", "Empty",
                "Generic", "Undocumented Attrs", "Overlaps", "Completeness"), summaries));

        List<List<String>> quality = new ArrayList<>();
        for (DefinitionQualityFinding q : report.getDefinitionQuality()) {
            quality.add(cells(q.getSubject(), q.getLayer(), q.getQualityScore(), q.isEmptyDescription(),
                    q.isGenericDescription(), q.getAttributeCount(), q.getUndocumentedAttributes(),
                    q.getAlignmentScore(), q.getStandardReference(), q.getReasoning(), q.getSuggestion()));
        }
        sections.add(new Section("Definition Quality", List.of("Node Type", "Layer", "Score", "Empty", "Generic",
                "Attributes", "Undocumented", "Alignment", "Standard", "Reasoning", "Suggestion"), quality));

        List<List<String>> overlaps = new ArrayList<>();
        for (OverlapCandidate o : report.getOverlaps()) {
            overlaps.add(cells(o.getSubject(), o.getLayer(), o.getConfidence().getLabel(), o.getSimilarityScore(),
                    o.getAlignmentScore(), o.getStandardReference(), o.getReasoning(), o.getSuggestion()));
        }
        sections.add(new Section("Semantic Overlaps", List.of("Pair", "Layer", "Confidence", "Similarity",
                "Alignment", "Standard", "Reasoning", "Suggestion"), overlaps));

        sections.add(completenessSection(report.getCompletenessIssues()));

        List<List<String>> alignment = new ArrayList<>();
        for (LayerAlignmentIssue a : report.getLayerAlignment()) {
            alignment.add(cells(a.getSubject(), a.getCurrentLayer(), a.getSuggestedLayer(), a.getIntraLayerEdges(),
                    a.getCrossLayerEdges(), a.getAlignmentScore(), a.getStandardReference(), a.getReasoning(),
                    a.getSuggestion()));
        }
        sections.add(new Section("Layer Alignment", List.of("Node Type", "Current", "Suggested", "Intra-layer Edges",
                "Cross-layer Edges", "Alignment", "Standard", "Reasoning", "Suggestion"), alignment));
        return sections;
    }

    private Section completenessSection(List<CompletenessIssue> issues) {
        List<List<String>> rows = new ArrayList<>();
        for (CompletenessIssue c : issues) {
            rows.add(cells(c.getSubject(), c.getKind(), c.getLayer(), c.getFile(), c.getAlignmentScore(),
                    c.getStandardReference(), c.getMessage(), c.getSuggestion()));
        }
        return new Section("Completeness Issues", List.of("Element", "Kind", "Layer", "File", "Alignment",
                "Standard", "Message", "Suggestion"), rows);
    }

    // ========================= FORMATS =========================

    private String markdown(String title, List<String> header, List<Section> sections) {
        StringBuilder out = new StringBuilder();
        out.append("# ").append(title).append("\n\n");
        header.forEach(line -> out.append("- ").append(line).append('\n'));
        for (Section section : sections) {
            out.append("\n## ").append(section.title()).append(" (").append(section.rows().size()).append(")\n\n");
            if (section.rows().isEmpty()) {
                out.append("_None._\n");
                continue;
            }
            out.append("| ").append(String.join(" | ", section.headers())).append(" |\n");
            out.append("|").append("---|".repeat(section.headers().size())).append('\n');
            for (List<String> row : section.rows()) {
                out.append("| ");
                for (int i = 0; i < row.size(); i++) {
                    if (i > 0) {
                        out.append(" | ");
                    }
                    out.append(row.get(i).replace("|", "\\|"));
                }
                out.append(" |\n");
            }
        }
        return out.toString();
    }

    private String text(String title, List<String> header, List<Section> sections) {
        StringBuilder out = new StringBuilder();
        out.append(title).append('\n').append("=".repeat(title.length())).append('\n');
        header.forEach(line -> out.append(line).append('\n'));
        for (Section section : sections) {
            String heading = section.title().toUpperCase(Locale.ROOT) + " (" + section.rows().size() + ")";
            out.append('\n').append(heading).append('\n').append("-".repeat(heading.length())).append('\n');
            if (section.rows().isEmpty()) {
                out.append("  none\n");
                continue;
            }
            for (List<String> row : section.rows()) {
                out.append("* ").append(row.get(0)).append('\n');
                for (int i = 1; i < row.size(); i++) {
                    if (!row.get(i).isEmpty()) {
                        out.append("    ").append(section.headers().get(i)).append(": ").append(row.get(i)).append('\n');
                    }
                }
            }
        }
        return out.toString();
    }

    /**
     * One table row. Decimals print with two places, collections
     * comma-separated, missing values empty; every cell fits on one line.
     */
    private static List<String> cells(Object... values) {
        List<String> row = new ArrayList<>(values.length);
        for (Object value : values) {
            row.add(cell(value).replace('\n', ' ').replace('\r', ' '));
        }
        return row;
    }

    private static String cell(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double || value instanceof Float) {
            return String.format(Locale.ROOT, "%.2f", ((Number) value).doubleValue());
        }
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        if (value instanceof Collection<?> items) {
            return items.stream().map(ReportRenderer::cell).collect(Collectors.joining(", "));
        }
        return value.toString();
    }
}
