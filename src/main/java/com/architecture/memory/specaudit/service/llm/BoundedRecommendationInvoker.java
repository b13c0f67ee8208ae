package com.architecture.memory.specaudit.service.llm;

import com.architecture.memory.specaudit.dto.recommendation.EvaluationRequest;
import com.architecture.memory.specaudit.dto.recommendation.RecommendationRecord;
import com.architecture.memory.specaudit.exception.EvaluatorUnavailableException;
import com.architecture.memory.specaudit.model.LlmConfiguration;
import com.architecture.memory.specaudit.service.pipeline.AbortSignal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.*;

/**
 * Runs recommendation calls on the single recommender thread with an upper time bound.
 *
 * A call that exceeds the bound, is interrupted or is aborted is cancelled and reported as
 * {@link EvaluatorUnavailableException}. Other failures from the port propagate unchanged.
 */
@Component
@Slf4j
public class BoundedRecommendationInvoker {

    private static final long POLL_MILLIS = 100;

    private final RecommendationPort port;
    private final ExecutorService executor;
    private final Duration timeout;

    public BoundedRecommendationInvoker(RecommendationPort port,
                                        @Qualifier("recommendationExecutor") ExecutorService executor,
                                        @Qualifier("recommenderLlmConfiguration") LlmConfiguration config) {
        this(port, executor, Duration.ofSeconds(config.getTimeoutSeconds()));
    }

    public BoundedRecommendationInvoker(RecommendationPort port, ExecutorService executor, Duration timeout) {
        this.port = port;
        this.executor = executor;
        this.timeout = timeout;
    }

    public List<RecommendationRecord> invoke(EvaluationRequest request, AbortSignal abort) {
        if (abort.isAborted()) {
            throw new EvaluatorUnavailableException("Recommendation calls aborted: " + abort.getReason());
        }

        Future<List<RecommendationRecord>> future = executor.submit(() -> port.submit(request));
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            while (true) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    future.cancel(true);
                    throw new EvaluatorUnavailableException("Recommendation call for " + request.describe()
                            + " timed out after " + timeout.toSeconds() + "s");
                }
                try {
                    return future.get(Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(POLL_MILLIS)), TimeUnit.NANOSECONDS);
                } catch (TimeoutException e) {
                    if (abort.isAborted()) {
                        future.cancel(true);
                        throw new EvaluatorUnavailableException("Recommendation calls aborted: " + abort.getReason());
                    }
                }
            }
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new EvaluatorUnavailableException("Interrupted while waiting for recommendations", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new EvaluatorUnavailableException("Recommendation call failed: " + cause, cause);
        }
    }
}
