package com.architecture.memory.specaudit.service.graph.analyzer;

import com.architecture.memory.specaudit.dto.finding.BalanceIssue;
import com.architecture.memory.specaudit.dto.report.BalanceReport;
import com.architecture.memory.specaudit.dto.report.LayerBalance;
import com.architecture.memory.specaudit.model.Layer;
import com.architecture.memory.specaudit.model.NodeType;
import com.architecture.memory.specaudit.model.SchemaGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Flags node types whose relationship count is an outlier against their layer median.
 *
 * OVER: {@code count >= max(2 * median, median + 3)}.
 * UNDER: {@code median >= 2 && count <= floor(median / 4)}.
 */
@Service
@Slf4j
public class BalanceAnalyzer {

    private static final Pattern ENUMERATION = Pattern.compile(
            ".*(type|status|kind|level|priority|category|severity|mode|state)$");
    private static final Pattern BEHAVIORAL = Pattern.compile(
            ".*(process|function|event|interaction|operation|action|flow|workflow|step|trigger|task|activity).*");
    private static final Pattern STRUCTURAL = Pattern.compile(
            ".*(component|service|node|actor|role|object|entity|system|interface|module|container|device|screen|application).*");

    public BalanceReport analyze(SchemaGraph graph) {
        log.info("Running balance analysis for {} layers", graph.getLayers().size());
        List<LayerBalance> layers = new ArrayList<>();
        List<BalanceIssue> issues = new ArrayList<>();

        for (Layer layer : graph.getLayers()) {
            List<NodeType> nodeTypes = graph.nodeTypesInLayer(layer.getId());
            if (nodeTypes.isEmpty()) {
                continue;
            }
            Map<String, Integer> counts = new TreeMap<>();
            nodeTypes.forEach(n -> counts.put(n.getSpecNodeId(), graph.degree(n.getSpecNodeId())));

            List<Integer> sorted = new ArrayList<>(counts.values());
            Collections.sort(sorted);
            double median = median(sorted);

            layers.add(LayerBalance.builder()
                    .layer(layer.getId())
                    .nodeTypeCount(nodeTypes.size())
                    .minRelationships(sorted.get(0))
                    .medianRelationships(median)
                    .maxRelationships(sorted.get(sorted.size() - 1))
                    .relationshipCounts(counts)
                    .build());

            for (NodeType nodeType : nodeTypes) {
                int count = counts.get(nodeType.getSpecNodeId());
                statusFor(count, median).ifPresent(status ->
                        issues.add(issue(layer, nodeType, count, median, status)));
            }
        }

        log.info("Balance analysis flagged {} outliers", issues.size());
        return BalanceReport.builder().layers(layers).issues(issues).build();
    }

    static Optional<BalanceIssue.Status> statusFor(int count, double median) {
        if (count >= Math.max(2 * median, median + 3)) {
            return Optional.of(BalanceIssue.Status.OVER);
        }
        if (median >= 2 && count <= Math.floor(median / 4)) {
            return Optional.of(BalanceIssue.Status.UNDER);
        }
        return Optional.empty();
    }

    static BalanceIssue.Category categorize(NodeType nodeType) {
        String type = nodeType.getType().toLowerCase(Locale.ROOT);
        if (ENUMERATION.matcher(type).matches()) {
            return BalanceIssue.Category.ENUMERATION;
        }
        if (BEHAVIORAL.matcher(type).matches()) {
            return BalanceIssue.Category.BEHAVIORAL;
        }
        if (STRUCTURAL.matcher(type).matches()) {
            return BalanceIssue.Category.STRUCTURAL;
        }
        return BalanceIssue.Category.REFERENCE;
    }

    static int[] targetRange(BalanceIssue.Category category) {
        return switch (category) {
            case STRUCTURAL -> new int[]{2, 4};
            case BEHAVIORAL -> new int[]{3, 6};
            case ENUMERATION -> new int[]{0, 1};
            case REFERENCE -> new int[]{1, 2};
        };
    }

    private BalanceIssue issue(Layer layer, NodeType nodeType, int count, double median, BalanceIssue.Status status) {
        BalanceIssue.Category category = categorize(nodeType);
        int[] range = targetRange(category);
        int alignment = status == BalanceIssue.Status.OVER
                ? (int) Math.max(0, Math.round(100 - 100.0 * (count - median) / Math.max(count, 1)))
                : (int) Math.round(100.0 * count / Math.max(median, 1));

        return BalanceIssue.builder()
                .layer(layer.getId())
                .nodeType(nodeType.getSpecNodeId())
                .relationshipCount(count)
                .layerMedian(median)
                .status(status)
                .category(category)
                .targetMin(range[0])
                .targetMax(range[1])
                .alignmentScore(Math.min(alignment, 100))
                .reasoning(String.format(Locale.ROOT, "%s has %d relationships against a layer median of %.1f (%s target %d-%d)",
                        nodeType.getSpecNodeId(), count, median, category.name().toLowerCase(Locale.ROOT),
                        range[0], range[1]))
                .standardReference(layer.getStandardReference())
                .build();
    }

    static double median(List<Integer> sorted) {
        int size = sorted.size();
        if (size == 0) {
            return 0.0;
        }
        if (size % 2 == 1) {
            return sorted.get(size / 2);
        }
        return (sorted.get(size / 2 - 1) + sorted.get(size / 2)) / 2.0;
    }
}
