package com.architecture.memory.specaudit.service.resolution;

import com.architecture.memory.specaudit.dto.report.LoadedReport;
import com.architecture.memory.specaudit.dto.resolution.*;
import com.architecture.memory.specaudit.exception.ActionConflictException;
import com.architecture.memory.specaudit.exception.WriteFailureException;
import com.architecture.memory.specaudit.model.SchemaGraph;
import com.architecture.memory.specaudit.service.graph.SchemaGraphLoader;
import com.architecture.memory.specaudit.service.report.ReportWriter;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Works through the resolution queue of a prior report, one item at a time.
 *
 * Each item is planned against a freshly loaded graph and either applied as one transaction
 * or recorded without touching any file. A write failure ends the session; the session log
 * is still written.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ResolutionQueueEngine {

    private final ReportWriter reportWriter;
    private final SchemaGraphLoader loader;
    private final ResolutionQueueBuilder queueBuilder;
    private final ActionClassifier actionClassifier;
    private final RemediationPlanner planner;
    private final SchemaFileWriter fileWriter;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ResolutionSummary resolve(Path reportFile, Path specRoot, ActionChooser chooser, Path logDirectory) {
        boolean autonomous = chooser.isAutonomous();
        Instant startedAt = Instant.now(clock);
        log.info("Starting {} resolution of {} against {}", autonomous ? "autonomous" : "interactive", reportFile, specRoot);

        LoadedReport report = reportWriter.read(reportFile);
        List<ResolutionQueueItem> queue = queueBuilder.build(report, loader.load(specRoot));
        SessionLog sessionLog = new SessionLog(objectMapper);

        Path logFile;
        try {
            for (ResolutionQueueItem item : queue) {
                sessionLog.append(process(item, specRoot, chooser));
            }
        } finally {
            logFile = sessionLog.write(logDirectory, startedAt);
            log.info("Resolution finished: {}", sessionLog.counts());
        }

        return ResolutionSummary.builder()
                .reportFile(reportFile.toString())
                .specRoot(specRoot.toString())
                .autonomous(autonomous)
                .queueSize(queue.size())
                .dispositions(sessionLog.counts())
                .entries(new ArrayList<>(sessionLog.getEntries()))
                .sessionLogFile(logFile.toString())
                .build();
    }

    SessionLogEntry process(ResolutionQueueItem item, Path specRoot, ActionChooser chooser) {
        ChosenAction chosen = chooser.chooseAction(item);
        SessionLogEntry.SessionLogEntryBuilder entry = SessionLogEntry.builder()
                .position(item.getPosition())
                .queue(item.getQueue())
                .findingType(item.getFindingType())
                .subject(item.getSubject())
                .alignmentScore(item.getAlignmentScore())
                .roiTier(item.getRoiTier())
                .choice(chosen.getChoice())
                .timestamp(Instant.now(clock));

        String suggestion;
        ActionKind kind;
        switch (chosen.getChoice()) {
            case SKIP -> {
                return entry.actionKind(item.getActionKind())
                        .disposition(Disposition.SKIPPED)
                        .reasoning(reasoning(item, item.getActionKind(), chosen, "Skipped"))
                        .build();
            }
            case APPLY_ALTERNATIVE -> {
                suggestion = item.getAlternativeSuggestion();
                kind = actionClassifier.classify(suggestion);
            }
            case CUSTOM -> {
                suggestion = chosen.getCustomText();
                kind = actionClassifier.classify(suggestion);
            }
            default -> {
                suggestion = item.getPrimarySuggestion();
                kind = item.getActionKind();
            }
        }
        entry.actionKind(kind).executedSuggestion(suggestion);

        SchemaGraph graph = loader.load(specRoot);
        RemediationPlan plan;
        try {
            plan = planner.plan(graph, item, kind, suggestion);
        } catch (ActionConflictException e) {
            log.warn("Conflict at queue position {}: {}", item.getPosition(), e.getMessage());
            return entry.disposition(Disposition.CONFLICT)
                    .reasoning(reasoning(item, kind, chosen, "Conflict: " + e.getMessage()))
                    .build();
        }

        if (plan.getDisposition() != Disposition.APPLIED) {
            return entry.disposition(plan.getDisposition())
                    .reasoning(reasoning(item, kind, chosen, plan.getReasoning()))
                    .build();
        }
        if (plan.getTransaction().isEmpty()) {
            return entry.disposition(Disposition.ALREADY_IMPLEMENTED)
                    .reasoning(reasoning(item, kind, chosen, "Nothing to change"))
                    .build();
        }

        try {
            plan.getTransaction().apply(fileWriter);
        } catch (WriteFailureException e) {
            log.error("Write failure at queue position {} on {} after {} completed files",
                    item.getPosition(), e.getFailedFile(), e.getCompletedFiles().size());
            throw e.atQueuePosition(item.getPosition());
        }

        return entry.disposition(Disposition.APPLIED)
                .reasoning(reasoning(item, kind, chosen, plan.getReasoning()))
                .filesWritten(plan.getTransaction().getWrites().keySet().stream().map(Path::toString).collect(Collectors.toList()))
                .filesDeleted(plan.getTransaction().getDeletes().stream().map(Path::toString).collect(Collectors.toList()))
                .build();
    }

    private static String reasoning(ResolutionQueueItem item, ActionKind kind, ChosenAction chosen, String outcome) {
        return String.format("%s in %s (alignment %d, %s, %s). %s. %s",
                item.getFindingType(), item.getQueue(), item.getAlignmentScore(), kind, item.getRoiTier(),
                chosen.getRationale(), outcome);
    }
}
