package com.vidnyan.flowc.application.port.in;

import com.vidnyan.flowc.application.emit.EmittedProgram;
import com.vidnyan.flowc.domain.analysis.ConversionReport;
import com.vidnyan.flowc.domain.analysis.Severity;
import com.vidnyan.flowc.domain.codegen.GenerationContext;
import com.vidnyan.flowc.domain.document.FlowDocument;

import java.util.Optional;

/**
 * Primary use case: compile a flow document into source code.
 * This is the main entry point to the application.
 */
public interface ConvertFlowUseCase {

    /**
     * Run the full pipeline: IR, analysis, lowering, emission.
     * Structural errors stop the run before lowering; the result then carries no program.
     * @param request Conversion request parameters
     * @return Conversion result with the report and, on success, the emitted program
     */
    ConversionResult convert(ConversionRequest request);

    /**
     * Build the IR and analyze it without generating code.
     */
    ConversionReport validate(FlowDocument document);

    /**
     * Conversion request parameters.
     */
    record ConversionRequest(
        FlowDocument document,
        GenerationContext context
    ) {
        public static ConversionRequest withDefaults(FlowDocument document) {
            return new ConversionRequest(document, GenerationContext.defaults());
        }
    }

    /**
     * Conversion result. Success means structural validity held, not zero warnings.
     */
    record ConversionResult(
        ConversionReport report,
        EmittedProgram program,      // null when structural validation failed
        ConversionStats stats
    ) {
        public boolean isSuccess() {
            return program != null;
        }

        public Optional<EmittedProgram> programIfPresent() {
            return Optional.ofNullable(program);
        }

        public int findingCount(Severity severity) {
            return report.count(severity);
        }
    }

    /**
     * Conversion statistics.
     */
    record ConversionStats(
        int nodeCount,
        int edgeCount,
        int loweredNodes,
        int fragmentCount,
        long totalDurationMs
    ) {}
}
