package com.architecture.memory.specaudit.cli;

import com.architecture.memory.specaudit.dto.report.*;
import com.architecture.memory.specaudit.dto.resolution.Disposition;
import com.architecture.memory.specaudit.dto.resolution.ResolutionSummary;
import com.architecture.memory.specaudit.exception.AuditExecutionException;
import com.architecture.memory.specaudit.exception.WriteFailureException;
import com.architecture.memory.specaudit.model.SchemaGraph;
import com.architecture.memory.specaudit.service.graph.SchemaGraphLoader;
import com.architecture.memory.specaudit.service.pipeline.PipelineOptions;
import com.architecture.memory.specaudit.service.pipeline.PipelineOrchestrator;
import com.architecture.memory.specaudit.service.report.ReportAssembler;
import com.architecture.memory.specaudit.service.report.ReportRenderer;
import com.architecture.memory.specaudit.service.report.ReportWriter;
import com.architecture.memory.specaudit.service.report.ThresholdGate;
import com.architecture.memory.specaudit.service.resolution.ActionChooser;
import com.architecture.memory.specaudit.service.resolution.ConsoleActionChooser;
import com.architecture.memory.specaudit.service.resolution.DefaultActionChooser;
import com.architecture.memory.specaudit.service.resolution.ResolutionQueueEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Command surface: {@code audit} and {@code resolve}.
 *
 * Exit codes: 0 success, 1 a quality threshold was violated (only with {@code --threshold}),
 * 2 execution error.
 */
@Component
@Slf4j
public class SpecAuditCommandRunner implements CommandLineRunner, ExitCodeGenerator {

    public static final int EXIT_OK = 0;
    public static final int EXIT_THRESHOLD_VIOLATED = 1;
    public static final int EXIT_ERROR = 2;

    private static final String LOG_PACKAGE = "com.architecture.memory";

    static final String USAGE = """
            Usage:
              audit   [--spec-root=<dir>] [--layer=<id>] [--format=json|markdown|text] [--output=<file>]
                      [--verbose] [--threshold] [--enable-external] [--nodes]
              resolve --report=<file> [--spec-root=<dir>] [--autonomous]
            """;

    private final SchemaGraphLoader loader;
    private final ReportAssembler reportAssembler;
    private final PipelineOrchestrator orchestrator;
    private final ReportRenderer renderer;
    private final ReportWriter reportWriter;
    private final ThresholdGate thresholdGate;
    private final ResolutionQueueEngine resolutionEngine;
    private final LoggingSystem loggingSystem;
    private final String defaultSpecRoot;
    private final String outputDir;

    private PrintStream out = System.out;
    private int exitCode = EXIT_OK;

    public SpecAuditCommandRunner(SchemaGraphLoader loader,
                                  ReportAssembler reportAssembler,
                                  PipelineOrchestrator orchestrator,
                                  ReportRenderer renderer,
                                  ReportWriter reportWriter,
                                  ThresholdGate thresholdGate,
                                  ResolutionQueueEngine resolutionEngine,
                                  LoggingSystem loggingSystem,
                                  @Value("${spec-audit.spec-root:spec}") String defaultSpecRoot,
                                  @Value("${spec-audit.output-dir:audit-output}") String outputDir) {
        this.loader = loader;
        this.reportAssembler = reportAssembler;
        this.orchestrator = orchestrator;
        this.renderer = renderer;
        this.reportWriter = reportWriter;
        this.thresholdGate = thresholdGate;
        this.resolutionEngine = resolutionEngine;
        this.loggingSystem = loggingSystem;
        this.defaultSpecRoot = defaultSpecRoot;
        this.outputDir = outputDir;
    }

    void setOut(PrintStream out) {
        this.out = out;
    }

    @Override
    public void run(String... args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    public int execute(String... args) {
        ApplicationArguments arguments = new DefaultApplicationArguments(args);
        List<String> commands = arguments.getNonOptionArgs();
        if (commands.isEmpty()) {
            out.print(USAGE);
            return EXIT_ERROR;
        }
        if (arguments.containsOption("verbose")) {
            loggingSystem.setLogLevel(LOG_PACKAGE, LogLevel.DEBUG);
        }

        try {
            return switch (commands.get(0)) {
                case "audit" -> audit(arguments);
                case "resolve" -> resolve(arguments);
                default -> {
                    out.println("Unknown command: " + commands.get(0));
                    out.print(USAGE);
                    yield EXIT_ERROR;
                }
            };
        } catch (WriteFailureException e) {
            log.error("Write failure at queue position {} on {}; completed files: {}",
                    e.getQueuePosition(), e.getFailedFile(), e.getCompletedFiles(), e);
            return EXIT_ERROR;
        } catch (AuditExecutionException | UncheckedIOException | IllegalArgumentException e) {
            log.error("Execution failed: {}", e.getMessage(), e);
            return EXIT_ERROR;
        } catch (RuntimeException e) {
            log.error("Unexpected failure: {}", e.getMessage(), e);
            return EXIT_ERROR;
        }
    }

    // ========================= AUDIT =========================

    private int audit(ApplicationArguments arguments) {
        Path specRoot = Paths.get(option(arguments, "spec-root", defaultSpecRoot));
        String layer = option(arguments, "layer", null);
        ReportFormat format = ReportFormat.fromName(option(arguments, "format", "text"));
        String output = option(arguments, "output", null);

        SchemaGraph graph = loader.load(specRoot);
        ThresholdCheckResult gate;

        if (arguments.containsOption("nodes")) {
            NodeAuditReport report = reportAssembler.assembleNodeAudit(graph, layer);
            emit(renderer.render(report, format), output);
            gate = thresholdGate.check(report);
        } else {
            PipelineOptions options = PipelineOptions.builder()
                    .layerFilter(layer)
                    .enableExternal(arguments.containsOption("enable-external"))
                    .build();
            PipelineResult result = orchestrator.run(graph, options);
            if (result.getExternalStatus() == PipelineResult.ExternalStatus.UNAVAILABLE
                    || result.getExternalStatus() == PipelineResult.ExternalStatus.ABORTED) {
                log.warn("External evaluation {}: {}; reporting baseline only",
                        result.getExternalStatus(), result.getStatusMessage());
            }
            AuditReport report = result.publishedReport();
            emit(renderer.render(report, format), output);
            if (result.hasAfter()) {
                emitProjection(result, format, output);
            }
            gate = thresholdGate.check(report);
        }

        if (arguments.containsOption("threshold") && !gate.isPassed()) {
            out.println("Quality thresholds violated:");
            gate.getViolations().forEach(v -> out.println("  - " + v));
            return EXIT_THRESHOLD_VIOLATED;
        }
        return EXIT_OK;
    }

    private void emitProjection(PipelineResult result, ReportFormat format, String output) {
        if (output == null) {
            out.println();
            out.print(renderer.json(result.getDifferential()));
            return;
        }
        Path target = Paths.get(output);
        String name = target.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        reportWriter.write(target.resolveSibling(base + ".after." + format.getExtension()),
                renderer.render(result.getAfter(), format));
        reportWriter.write(target.resolveSibling(base + ".differential.json"), renderer.json(result.getDifferential()));
    }

    private void emit(String content, String output) {
        if (output == null) {
            out.print(content);
        } else {
            reportWriter.write(Paths.get(output), content);
        }
    }

    // ========================= RESOLVE =========================

    private int resolve(ApplicationArguments arguments) {
        String report = option(arguments, "report", null);
        if (report == null) {
            out.println("resolve requires --report=<file>");
            out.print(USAGE);
            return EXIT_ERROR;
        }
        Path specRoot = Paths.get(option(arguments, "spec-root", defaultSpecRoot));
        ActionChooser chooser = arguments.containsOption("autonomous")
                ? new DefaultActionChooser()
                : new ConsoleActionChooser(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), out);

        ResolutionSummary summary = resolutionEngine.resolve(Paths.get(report), specRoot, chooser, Paths.get(outputDir));
        out.printf("Resolved %d items: %d applied, %d already implemented, %d skipped, %d conflicts, %d deferred%n",
                summary.getQueueSize(), summary.count(Disposition.APPLIED), summary.count(Disposition.ALREADY_IMPLEMENTED),
                summary.count(Disposition.SKIPPED), summary.count(Disposition.CONFLICT), summary.count(Disposition.DEFERRED));
        out.println("Session log: " + summary.getSessionLogFile());
        return EXIT_OK;
    }

    private static String option(ApplicationArguments arguments, String name, String fallback) {
        List<String> values = arguments.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return fallback;
        }
        return values.get(values.size() - 1);
    }
}
