package com.architecture.memory.specaudit.service.graph.analyzer;

import com.architecture.memory.specaudit.SpecFixture;
import com.architecture.memory.specaudit.dto.finding.CoverageMetric;
import com.architecture.memory.specaudit.model.SchemaGraph;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CoverageAnalyzerTest {

    @TempDir
    Path specRoot;

    private final CoverageAnalyzer coverageAnalyzer = new CoverageAnalyzer();

    @Test
    void computesIsolationAndDensity_whenThreeOfFiveNodeTypesAreIsolated() {
        SchemaGraph graph = SpecFixture.at(specRoot)
                .predicates("references", "uses", "serves", "triggers")
                .layer("operations", 7)
                .nodeType("operations", "alert", "A notification raised when a monitored threshold is crossed")
                .nodeType("operations", "runbook", "Step by step instructions to resolve an alert")
                .nodeType("operations", "dashboard", "Visual overview of monitored metrics")
                .nodeType("operations", "metric", "A measured value collected from a running system")
                .nodeType("operations", "incident", "An unplanned interruption of a running service")
                .relationship("operations.alert", "references", "operations.runbook")
                .relationship("operations.runbook", "uses", "operations.alert")
                .load();

        CoverageMetric metric = coverageAnalyzer.analyze(graph).get(0);

        assertThat(metric.getLayer()).isEqualTo("operations");
        assertThat(metric.getNodeTypeCount()).isEqualTo(5);
        assertThat(metric.getIntraLayerRelationships()).isEqualTo(2);
        assertThat(metric.getInterLayerRelationships()).isZero();
        assertThat(metric.getIsolatedNodeTypes())
                .containsExactly("operations.dashboard", "operations.incident", "operations.metric");
        assertThat(metric.getIsolationPercentage()).isEqualTo(60.0);
        assertThat(metric.getRelationshipsPerNodeType()).isEqualTo(0.4);
        assertThat(metric.getAlignmentScore()).isEqualTo(40);
        assertThat(metric.getUsedPredicates()).containsExactly("references", "uses");
        assertThat(metric.getUtilizationPercentage()).isEqualTo(50.0);
    }

    @Test
    void reportsFullIsolation_whenLayerHasNoRelationships() {
        SchemaGraph graph = SpecFixture.at(specRoot)
                .predicates("references")
                .layer("data", 5)
                .nodeType("data", "entity", "A persisted business object with an identity")
                .nodeType("data", "table", "Physical storage structure for entities")
                .load();

        CoverageMetric metric = coverageAnalyzer.analyze(graph).get(0);

        assertThat(metric.getIsolationPercentage()).isEqualTo(100.0);
        assertThat(metric.getRelationshipsPerNodeType()).isZero();
        assertThat(metric.getAlignmentScore()).isZero();
        assertThat(metric.getSuggestion()).contains("data.entity", "data.table");
    }

    @Test
    void reportsFullIsolationWithoutDividingByZero_whenLayerIsEmpty() {
        SchemaGraph graph = SpecFixture.at(specRoot)
                .predicates("references")
                .layer("empty", 9)
                .load();

        CoverageMetric metric = coverageAnalyzer.analyze(graph).get(0);

        assertThat(metric.getNodeTypeCount()).isZero();
        assertThat(metric.getIsolationPercentage()).isEqualTo(100.0);
        assertThat(metric.getRelationshipsPerNodeType()).isZero();
    }

    @Test
    void attributesCrossLayerRelationshipToSourceLayerOnly() {
        SchemaGraph graph = SpecFixture.at(specRoot).standardModel().load();

        List<CoverageMetric> metrics = coverageAnalyzer.analyze(graph);
        CoverageMetric business = metrics.get(0);
        CoverageMetric application = metrics.get(1);

        assertThat(business.getRelationshipCount()).isEqualTo(1);
        assertThat(business.getInterLayerRelationships()).isEqualTo(1);
        assertThat(business.getIsolatedNodeTypes()).containsExactly("business.event", "business.process");
        assertThat(application.getRelationshipCount()).isEqualTo(1);
        assertThat(application.getIsolatedNodeTypes()).containsExactly("application.interface");
        assertThat(application.getIsolationPercentage()).isEqualTo(50.0);
    }
}
