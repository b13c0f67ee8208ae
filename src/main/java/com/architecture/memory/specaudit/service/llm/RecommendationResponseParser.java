package com.architecture.memory.specaudit.service.llm;

import com.architecture.memory.specaudit.dto.finding.Priority;
import com.architecture.memory.specaudit.dto.recommendation.RecommendationRecord;
import com.architecture.memory.specaudit.exception.RecommendationFormatException;
import com.architecture.memory.specaudit.service.graph.ScoreTable;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts recommendation records from free-form model output.
 *
 * Accepts a fenced ```json block or, failing that, the first bracketed array in the text.
 * Elements missing a source, destination or predicate are dropped.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RecommendationResponseParser {

    private static final Pattern FENCED_JSON = Pattern.compile("```(?:json)?\\s*(\\[.*?])\\s*```", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public List<RecommendationRecord> parse(String response) {
        if (response == null || response.isBlank()) {
            throw new RecommendationFormatException("Empty recommendation response");
        }
        JsonNode array = readArray(extractArray(response));

        List<RecommendationRecord> records = new ArrayList<>();
        for (JsonNode element : array) {
            String source = firstText(element, "sourceNodeType", "source");
            String destination = firstText(element, "destinationNodeType", "destination");
            String predicate = firstText(element, "predicate");
            if (source == null || destination == null || predicate == null) {
                log.debug("Dropping incomplete recommendation: {}", element);
                continue;
            }
            Priority priority = parsePriority(firstText(element, "priority"));
            records.add(RecommendationRecord.builder()
                    .sourceNodeType(source)
                    .destinationNodeType(destination)
                    .predicate(predicate)
                    .justification(firstText(element, "justification", "reason"))
                    .priority(priority)
                    .standardReference(firstText(element, "standardReference"))
                    .impactScore(ScoreTable.gapImpact(priority))
                    .alignmentScore(ScoreTable.gapAlignment(priority))
                    .build());
        }
        return records;
    }

    private String extractArray(String response) {
        Matcher fenced = FENCED_JSON.matcher(response);
        if (fenced.find()) {
            return fenced.group(1);
        }
        int start = response.indexOf('[');
        int end = response.lastIndexOf(']');
        if (start < 0 || end <= start) {
            throw new RecommendationFormatException("No JSON array in recommendation response");
        }
        return response.substring(start, end + 1);
    }

    private JsonNode readArray(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.isArray()) {
                throw new RecommendationFormatException("Recommendation response is not a JSON array");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new RecommendationFormatException("Malformed recommendation JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static Priority parsePriority(String label) {
        try {
            return Priority.fromLabel(label);
        } catch (IllegalArgumentException e) {
            log.debug("Unknown priority '{}', using medium", label);
            return Priority.MEDIUM;
        }
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return value.asText().trim();
            }
        }
        return null;
    }
}
