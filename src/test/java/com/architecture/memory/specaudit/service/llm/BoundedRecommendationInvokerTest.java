package com.architecture.memory.specaudit.service.llm;

import com.architecture.memory.specaudit.dto.recommendation.EvaluationRequest;
import com.architecture.memory.specaudit.dto.recommendation.RecommendationRecord;
import com.architecture.memory.specaudit.exception.EvaluatorUnavailableException;
import com.architecture.memory.specaudit.exception.RecommendationFormatException;
import com.architecture.memory.specaudit.model.Layer;
import com.architecture.memory.specaudit.service.pipeline.AbortSignal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BoundedRecommendationInvokerTest {

    @Mock
    private RecommendationPort port;

    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    private final EvaluationRequest request = EvaluationRequest.builder()
            .kind(EvaluationRequest.Kind.LAYER)
            .layer(Layer.builder().id("business").number(2).build())
            .build();

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    @Test
    void returnsRecords_whenPortAnswersInTime() {
        RecommendationRecord record = RecommendationRecord.builder()
                .sourceNodeType("business.event").destinationNodeType("business.process").predicate("triggers").build();
        when(port.submit(request)).thenReturn(List.of(record));
        BoundedRecommendationInvoker invoker = new BoundedRecommendationInvoker(port, executor, Duration.ofSeconds(5));

        assertThat(invoker.invoke(request, new AbortSignal())).containsExactly(record);
    }

    @Test
    void reportsUnavailable_whenCallExceedsTimeout() {
        CountDownLatch release = new CountDownLatch(1);
        when(port.submit(any())).thenAnswer(invocation -> {
            release.await(10, TimeUnit.SECONDS);
            return List.of();
        });
        BoundedRecommendationInvoker invoker = new BoundedRecommendationInvoker(port, executor, Duration.ofMillis(300));

        assertThatThrownBy(() -> invoker.invoke(request, new AbortSignal()))
                .isInstanceOf(EvaluatorUnavailableException.class)
                .hasMessageContaining("layer business")
                .hasMessageContaining("timed out");
        release.countDown();
    }

    @Test
    void stopsWaiting_whenAbortIsRaisedDuringCall() {
        AbortSignal abort = new AbortSignal();
        when(port.submit(any())).thenAnswer(invocation -> {
            abort.abort("user interrupt");
            Thread.sleep(5_000);
            return List.of();
        });
        BoundedRecommendationInvoker invoker = new BoundedRecommendationInvoker(port, executor, Duration.ofSeconds(30));

        assertThatThrownBy(() -> invoker.invoke(request, abort))
                .isInstanceOf(EvaluatorUnavailableException.class)
                .hasMessageContaining("user interrupt");
    }

    @Test
    void neverCallsPort_whenAlreadyAborted() {
        AbortSignal abort = new AbortSignal();
        abort.abort("shutdown");
        BoundedRecommendationInvoker invoker = new BoundedRecommendationInvoker(port, executor, Duration.ofSeconds(5));

        assertThatThrownBy(() -> invoker.invoke(request, abort)).isInstanceOf(EvaluatorUnavailableException.class);
        verify(port, never()).submit(any());
    }

    @Test
    void propagatesFormatException_fromPort() {
        when(port.submit(any())).thenThrow(new RecommendationFormatException("bad answer"));
        BoundedRecommendationInvoker invoker = new BoundedRecommendationInvoker(port, executor, Duration.ofSeconds(5));

        assertThatThrownBy(() -> invoker.invoke(request, new AbortSignal()))
                .isInstanceOf(RecommendationFormatException.class)
                .hasMessage("bad answer");
    }
}
