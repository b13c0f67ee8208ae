package com.architecture.memory.specaudit.service.graph.analyzer;

import com.architecture.memory.specaudit.SpecFixture;
import com.architecture.memory.specaudit.dto.finding.BalanceIssue;
import com.architecture.memory.specaudit.dto.report.BalanceReport;
import com.architecture.memory.specaudit.dto.report.LayerBalance;
import com.architecture.memory.specaudit.model.NodeType;
import com.architecture.memory.specaudit.model.SchemaGraph;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BalanceAnalyzerTest {

    @TempDir
    Path specRoot;

    private final BalanceAnalyzer analyzer = new BalanceAnalyzer();

    @Test
    void flagsHubAsOverConnected_whenItExceedsTwiceTheMedian() {
        SpecFixture fixture = SpecFixture.at(specRoot)
                .predicates("uses")
                .layer("application", 4)
                .nodeType("application", "hub", "Central component everything talks to", "name");
        for (String spoke : List.of("alpha", "beta", "gamma", "delta", "epsilon")) {
            fixture.nodeType("application", spoke, "Satellite component " + spoke, "name")
                    .relationship("application." + spoke, "uses", "application.hub");
        }
        SchemaGraph graph = fixture.load();

        BalanceReport report = analyzer.analyze(graph);

        LayerBalance layer = report.getLayers().get(0);
        assertThat(layer.getMedianRelationships()).isEqualTo(1.0);
        assertThat(layer.getMaxRelationships()).isEqualTo(5);
        assertThat(report.getIssues()).singleElement().satisfies(issue -> {
            assertThat(issue.getNodeType()).isEqualTo("application.hub");
            assertThat(issue.getStatus()).isEqualTo(BalanceIssue.Status.OVER);
            assertThat(issue.getRelationshipCount()).isEqualTo(5);
            assertThat(issue.getAlignmentScore()).isEqualTo(20);
        });
    }

    @Test
    void reportsNoIssues_whenEveryNodeTypeHasTheSameDegree() {
        SchemaGraph graph = SpecFixture.at(specRoot)
                .predicates("uses")
                .layer("application", 4)
                .nodeType("application", "a", "First component", "name")
                .nodeType("application", "b", "Second component", "name")
                .relationship("application.a", "uses", "application.b")
                .load();

        assertThat(analyzer.analyze(graph).getIssues()).isEmpty();
    }

    @Test
    void classifiesStatusAgainstMedian() {
        assertThat(BalanceAnalyzer.statusFor(6, 2.0)).contains(BalanceIssue.Status.OVER);
        assertThat(BalanceAnalyzer.statusFor(4, 2.0)).isEmpty();
        assertThat(BalanceAnalyzer.statusFor(1, 4.0)).contains(BalanceIssue.Status.UNDER);
        assertThat(BalanceAnalyzer.statusFor(0, 1.0)).isEmpty();
    }

    @Test
    void categorizesNodeTypesByName() {
        assertThat(BalanceAnalyzer.categorize(node("orderStatus"))).isEqualTo(BalanceIssue.Category.ENUMERATION);
        assertThat(BalanceAnalyzer.categorize(node("businessProcess"))).isEqualTo(BalanceIssue.Category.BEHAVIORAL);
        assertThat(BalanceAnalyzer.categorize(node("component"))).isEqualTo(BalanceIssue.Category.STRUCTURAL);
        assertThat(BalanceAnalyzer.categorize(node("glossary"))).isEqualTo(BalanceIssue.Category.REFERENCE);
    }

    @Test
    void computesMedianOfEvenAndOddLists() {
        assertThat(BalanceAnalyzer.median(List.of(1, 2, 3))).isEqualTo(2.0);
        assertThat(BalanceAnalyzer.median(List.of(1, 2, 3, 6))).isEqualTo(2.5);
        assertThat(BalanceAnalyzer.median(List.of())).isZero();
    }

    private static NodeType node(String type) {
        return NodeType.builder().specNodeId("x." + type).layerId("x").type(type).build();
    }
}
