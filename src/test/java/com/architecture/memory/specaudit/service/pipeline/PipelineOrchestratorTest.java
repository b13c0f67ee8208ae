package com.architecture.memory.specaudit.service.pipeline;

import com.architecture.memory.specaudit.SpecFixture;
import com.architecture.memory.specaudit.dto.finding.GapCandidate;
import com.architecture.memory.specaudit.dto.finding.Priority;
import com.architecture.memory.specaudit.dto.recommendation.EvaluationRequest;
import com.architecture.memory.specaudit.dto.recommendation.RecommendationRecord;
import com.architecture.memory.specaudit.dto.report.PipelineResult;
import com.architecture.memory.specaudit.exception.EvaluatorUnavailableException;
import com.architecture.memory.specaudit.exception.RecommendationFormatException;
import com.architecture.memory.specaudit.model.SchemaGraph;
import com.architecture.memory.specaudit.service.llm.BoundedRecommendationInvoker;
import com.architecture.memory.specaudit.service.llm.RecommendationPort;
import com.architecture.memory.specaudit.service.report.ReportAssembler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelineOrchestratorTest {

    @TempDir
    Path specRoot;

    @Mock
    private RecommendationPort port;

    private final ExecutorService executor = Executors.newSingleThreadExecutor();
    private final ReportAssembler assembler = SpecFixture.assembler();

    private PipelineOrchestrator orchestrator;
    private SchemaGraph graph;

    @BeforeEach
    void setUp() {
        orchestrator = new PipelineOrchestrator(assembler,
                new BoundedRecommendationInvoker(port, executor, Duration.ofSeconds(5)),
                new RecommendationMerger(),
                new DifferentialAnalyzer());
        graph = SpecFixture.at(specRoot).standardModel().load();
    }

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    private static PipelineOptions external() {
        return PipelineOptions.builder().enableExternal(true).build();
    }

    @Test
    void returnsBaselineOnly_whenExternalStepIsDisabled() {
        PipelineResult result = orchestrator.run(graph, PipelineOptions.builder().build());

        assertThat(result.getExternalStatus()).isEqualTo(PipelineResult.ExternalStatus.DISABLED);
        assertThat(result.hasAfter()).isFalse();
        assertThat(result.publishedReport()).isSameAs(result.getBefore());
        verify(port, never()).submit(any());
    }

    @Test
    void stopsAfterFirstCallAndKeepsBaseline_whenSourceIsUnavailable() {
        when(port.submit(any())).thenThrow(new EvaluatorUnavailableException("connection refused"));

        PipelineResult result = orchestrator.run(graph, external());

        assertThat(result.getExternalStatus()).isEqualTo(PipelineResult.ExternalStatus.UNAVAILABLE);
        assertThat(result.getStatusMessage()).isEqualTo("connection refused");
        assertThat(result.hasAfter()).isFalse();
        assertThat(result.getDifferential()).isNull();
        assertThat(result.getRequestsSent()).isEqualTo(1);
        assertThat(result.getMergedGaps()).isEqualTo(result.getBefore().getGaps());
        verify(port, times(1)).submit(any());
    }

    @Test
    void reportsAborted_whenAbortIsRaisedBeforeTheRun() {
        PipelineOptions options = external();
        options.getAbortSignal().abort("interrupted by user");

        PipelineResult result = orchestrator.run(graph, options);

        assertThat(result.getExternalStatus()).isEqualTo(PipelineResult.ExternalStatus.ABORTED);
        assertThat(result.getBefore()).isNotNull();
        verify(port, never()).submit(any());
    }

    @Test
    void mergesAcceptedRecommendations_andProducesAfterReportAndDifferential() {
        when(port.submit(any())).thenReturn(List.of(
                record("business.event", "triggers", "business.process"),
                record("business.ghost", "triggers", "business.process"),
                record("business.actor", "assigned-to", "business.role")));

        PipelineResult result = orchestrator.run(graph, external());

        assertThat(result.getExternalStatus()).isEqualTo(PipelineResult.ExternalStatus.COMPLETED);
        assertThat(result.getRequestsSent()).isEqualTo(5);
        assertThat(result.getFailedRequests()).isZero();
        assertThat(result.getMergedGaps())
                .filteredOn(g -> g.getOrigin() == GapCandidate.Origin.EXTERNAL)
                .extracting(GapCandidate::key)
                .containsExactly("business.event|triggers|business.process");
        assertThat(result.getDifferential().getRelationshipsAdded()).isEqualTo(1);
        assertThat(result.getAfter().getCoverage().get(0).getIsolatedNodeTypes()).isEmpty();
        assertThat(result.publishedReport().getGaps()).isEqualTo(result.getMergedGaps());
    }

    @Test
    void countsFailedRequests_andContinues_whenAnswerIsMalformed() {
        when(port.submit(any()))
                .thenThrow(new RecommendationFormatException("not json"))
                .thenReturn(List.of());

        PipelineResult result = orchestrator.run(graph, external());

        assertThat(result.getExternalStatus()).isEqualTo(PipelineResult.ExternalStatus.COMPLETED);
        assertThat(result.getFailedRequests()).isEqualTo(1);
        assertThat(result.getRequestsSent()).isEqualTo(5);
        verify(port, times(5)).submit(any());
    }

    @Test
    void ordersRequests_isolatedNodesThenLayersThenDuplicatePairs() {
        List<EvaluationRequest> requests = orchestrator.buildRequests(graph, assembler.assembleRelationshipAudit(graph));

        assertThat(requests).extracting(EvaluationRequest::getKind).containsExactly(
                EvaluationRequest.Kind.NODE_TYPE, EvaluationRequest.Kind.NODE_TYPE, EvaluationRequest.Kind.NODE_TYPE,
                EvaluationRequest.Kind.LAYER, EvaluationRequest.Kind.LAYER);
        assertThat(requests).extracting(EvaluationRequest::describe).startsWith(
                "node type business.event", "node type business.process", "node type application.interface");
    }

    private static RecommendationRecord record(String source, String predicate, String destination) {
        return RecommendationRecord.builder()
                .sourceNodeType(source)
                .predicate(predicate)
                .destinationNodeType(destination)
                .priority(Priority.MEDIUM)
                .justification("needed")
                .build();
    }
}
