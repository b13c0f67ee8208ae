package com.architecture.memory.specaudit.service.llm;

import com.architecture.memory.specaudit.dto.recommendation.EvaluationRequest;
import com.architecture.memory.specaudit.dto.recommendation.RecommendationRecord;

import java.util.List;

/**
 * Boundary to the external recommendation source.
 */
public interface RecommendationPort {

    /**
     * Submits one request and blocks until the source answers.
     *
     * @throws com.architecture.memory.specaudit.exception.EvaluatorUnavailableException when the source cannot answer
     * @throws com.architecture.memory.specaudit.exception.RecommendationFormatException when the answer is unusable
     */
    List<RecommendationRecord> submit(EvaluationRequest request);
}
