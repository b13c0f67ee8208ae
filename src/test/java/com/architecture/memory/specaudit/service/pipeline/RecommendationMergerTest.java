package com.architecture.memory.specaudit.service.pipeline;

import com.architecture.memory.specaudit.SpecFixture;
import com.architecture.memory.specaudit.dto.finding.GapCandidate;
import com.architecture.memory.specaudit.dto.finding.Priority;
import com.architecture.memory.specaudit.dto.recommendation.RecommendationRecord;
import com.architecture.memory.specaudit.model.RelationshipType;
import com.architecture.memory.specaudit.model.SchemaGraph;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RecommendationMergerTest {

    @TempDir
    Path specRoot;

    private final RecommendationMerger merger = new RecommendationMerger();

    @Test
    void leavesGapListUnchanged_whenSameRecordIsMergedTwice() {
        GapCandidate existing = GapCandidate.builder()
                .sourceNodeType("business.event").destinationNodeType("business.role")
                .suggestedPredicate("assigned-to").priority(Priority.MEDIUM).build();
        RecommendationRecord record = record("business.event", "triggers", "business.process", Priority.HIGH);

        List<GapCandidate> once = merger.merge(List.of(existing), List.of(record));
        List<GapCandidate> twice = merger.merge(once, List.of(record));

        assertThat(twice).isEqualTo(once).hasSize(2);
        assertThat(twice.get(1).getOrigin()).isEqualTo(GapCandidate.Origin.EXTERNAL);
        assertThat(twice.get(1).getAlignmentScore()).isEqualTo(15);
    }

    @Test
    void keepsExistingCandidate_whenRecordRepeatsItsTriple() {
        GapCandidate existing = GapCandidate.builder()
                .sourceNodeType("business.event").destinationNodeType("business.process")
                .suggestedPredicate("triggers").priority(Priority.LOW).reason("template").build();

        List<GapCandidate> merged = merger.merge(List.of(existing),
                List.of(record("business.event", "triggers", "business.process", Priority.HIGH)));

        assertThat(merged).containsExactly(existing);
    }

    @Test
    void defaultsMissingPriorityToMedium() {
        GapCandidate gap = merger.toGap(record("a.x", "uses", "a.y", null));

        assertThat(gap.getPriority()).isEqualTo(Priority.MEDIUM);
        assertThat(gap.getImpactScore()).isEqualTo(55);
        assertThat(gap.getReason()).isEqualTo("Recommended by external review");
    }

    @Test
    void acceptsOnlyRecordsThatFitTheGraph() {
        SchemaGraph graph = SpecFixture.at(specRoot).standardModel().load();
        RecommendationRecord valid = record("business.event", "triggers", "business.process", Priority.HIGH);

        List<RecommendationRecord> accepted = merger.acceptable(graph, List.of(
                valid,
                record("business.ghost", "triggers", "business.process", Priority.HIGH),
                record("business.event", "invents", "business.process", Priority.HIGH),
                record("business.actor", "assigned-to", "business.role", Priority.HIGH),
                valid));

        assertThat(accepted).containsExactly(valid);
    }

    @Test
    void buildsRelationshipWithEndpointLayers() {
        SchemaGraph graph = SpecFixture.at(specRoot).standardModel().load();

        RelationshipType rel = merger.toRelationship(graph,
                record("application.interface", "serves", "business.process", Priority.LOW));

        assertThat(rel.getId()).isEqualTo("application.interface.serves.business.process");
        assertThat(rel.getSourceLayer()).isEqualTo("application");
        assertThat(rel.getDestinationLayer()).isEqualTo("business");
    }

    private static RecommendationRecord record(String source, String predicate, String destination, Priority priority) {
        return RecommendationRecord.builder()
                .sourceNodeType(source)
                .predicate(predicate)
                .destinationNodeType(destination)
                .priority(priority)
                .build();
    }
}
