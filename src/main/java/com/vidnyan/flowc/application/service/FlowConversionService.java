package com.vidnyan.flowc.application.service;

import com.vidnyan.flowc.application.emit.CodeEmitter;
import com.vidnyan.flowc.application.emit.EmittedProgram;
import com.vidnyan.flowc.application.lowering.LoweringEngine;
import com.vidnyan.flowc.application.lowering.LoweringResult;
import com.vidnyan.flowc.application.port.in.ConvertFlowUseCase;
import com.vidnyan.flowc.domain.analysis.ConversionReport;
import com.vidnyan.flowc.domain.analysis.Finding;
import com.vidnyan.flowc.domain.analysis.GraphAnalyzer;
import com.vidnyan.flowc.domain.analysis.Severity;
import com.vidnyan.flowc.domain.converter.ConverterRegistry;
import com.vidnyan.flowc.domain.document.FlowDocument;
import com.vidnyan.flowc.domain.ir.FlowGraph;
import com.vidnyan.flowc.domain.ir.FlowGraphBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

/**
 * Main application service that orchestrates the conversion pipeline.
 * Implements the primary use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FlowConversionService implements ConvertFlowUseCase {

    private final FlowGraphBuilder graphBuilder;
    private final GraphAnalyzer graphAnalyzer;
    private final ConverterRegistry converterRegistry;
    private final LoweringEngine loweringEngine;
    private final CodeEmitter codeEmitter;

    @Override
    public ConversionResult convert(ConversionRequest request) {
        Instant startTime = Instant.now();
        log.info("Starting conversion of: {}", request.document().name());

        // Step 1: Build IR
        log.info("Step 1: Building IR...");
        FlowGraph graph = graphBuilder.build(request.document());
        log.info("Built: {} nodes, {} edges", graph.nodeCount(), graph.edgeCount());

        // Step 2: Analyze
        log.info("Step 2: Analyzing graph...");
        ConversionReport report = graphAnalyzer.analyze(graph, converterRegistry);
        logFindings(report);

        if (report.hasStructuralErrors()) {
            long elapsed = Duration.between(startTime, Instant.now()).toMillis();
            log.error("Conversion aborted: {} structural errors", report.structuralErrors().size());
            return new ConversionResult(report, null,
                    new ConversionStats(graph.nodeCount(), graph.edgeCount(), 0, 0, elapsed));
        }

        // Step 3: Lower nodes
        log.info("Step 3: Lowering {} nodes...", graph.nodeCount());
        LoweringResult lowering = loweringEngine.lower(graph, request.context());
        log.info("Lowered: {} nodes into {} fragments", lowering.loweredNodeIds().size(),
                lowering.fragments().size());
        lowering.findings().forEach(this::logFinding);

        ConversionReport finalReport = report.toBuilder()
                .findings(lowering.findings())
                .fallbackNodeIds(lowering.order().fallbackNodeIds())
                .build();

        // Step 4: Emit
        log.info("Step 4: Emitting {} code...", request.context().target().tag());
        EmittedProgram program = codeEmitter.emit(lowering, request.context());

        Duration totalDuration = Duration.between(startTime, Instant.now());
        ConversionStats stats = new ConversionStats(
                graph.nodeCount(),
                graph.edgeCount(),
                lowering.loweredNodeIds().size(),
                lowering.fragments().size(),
                totalDuration.toMillis()
        );

        log.info("Conversion complete: {} dependencies, {} warnings, {} errors in {}ms",
                program.dependencies().size(),
                finalReport.count(Severity.WARN),
                finalReport.errors().size(),
                stats.totalDurationMs());

        return new ConversionResult(finalReport, program, stats);
    }

    @Override
    public ConversionReport validate(FlowDocument document) {
        log.info("Validating: {}", document.name());
        FlowGraph graph = graphBuilder.build(document);
        ConversionReport report = graphAnalyzer.analyze(graph, converterRegistry);
        logFindings(report);
        log.info("Validation complete: {} (coverage {}%)",
                report.isConvertible() ? "convertible" : "not convertible",
                Math.round(report.coverage().coverage() * 100));
        return report;
    }

    private void logFindings(ConversionReport report) {
        log.info("Analysis: {} findings, coverage {}/{} nodes, complexity {}",
                report.findings().size(),
                report.coverage().supportedNodeCount(),
                report.coverage().totalNodeCount(),
                report.complexity());
        report.findings().forEach(this::logFinding);
    }

    private void logFinding(Finding finding) {
        switch (finding.severity()) {
            case BLOCKER, ERROR -> log.error("  {}", finding.format());
            case WARN -> log.warn("  {}", finding.format());
            case INFO -> log.debug("  {}", finding.format());
        }
    }
}
