package com.architecture.memory.specaudit.service.report;

import com.architecture.memory.specaudit.dto.report.AuditReport;
import com.architecture.memory.specaudit.dto.report.LoadedReport;
import com.architecture.memory.specaudit.dto.report.NodeAuditReport;
import com.architecture.memory.specaudit.exception.AuditExecutionException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes rendered reports and reads JSON reports back for resolution.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ReportWriter {

    private final ObjectMapper objectMapper;

    public Path write(Path target, String content) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, content, StandardCharsets.UTF_8);
            log.info("Report written to {}", target);
            return target;
        } catch (IOException e) {
            throw new AuditExecutionException("Failed to write report " + target, e);
        }
    }

    /**
     * Reads a JSON report of either shape. The node-audit shape is recognized by its layer summaries.
     */
    public LoadedReport read(Path source) {
        if (!Files.isRegularFile(source)) {
            throw new AuditExecutionException("Report not found: " + source);
        }
        try {
            JsonNode root = objectMapper.readTree(Files.readString(source, StandardCharsets.UTF_8));
            if (root == null || !root.isObject()) {
                throw new AuditExecutionException("Report is not a JSON object: " + source);
            }
            if (root.has("layerSummaries") || root.has("definitionQuality")) {
                return LoadedReport.builder()
                        .nodeAudit(objectMapper.treeToValue(root, NodeAuditReport.class))
                        .build();
            }
            if (root.has("coverage") || root.has("gaps")) {
                return LoadedReport.builder()
                        .relationshipAudit(objectMapper.treeToValue(root, AuditReport.class))
                        .build();
            }
            throw new AuditExecutionException("Unrecognized report shape: " + source);
        } catch (IOException e) {
            throw new AuditExecutionException("Failed to read report " + source, e);
        }
    }
}
