package com.vidnyan.flowc.adapter.in.cli;

import com.vidnyan.flowc.CompilerProperties;
import com.vidnyan.flowc.application.port.in.ConvertFlowUseCase;
import com.vidnyan.flowc.application.port.in.ConvertFlowUseCase.ConversionRequest;
import com.vidnyan.flowc.application.port.in.ConvertFlowUseCase.ConversionResult;
import com.vidnyan.flowc.application.port.out.FlowDocumentLoader;
import com.vidnyan.flowc.application.port.out.OutputWriter;
import com.vidnyan.flowc.domain.analysis.ConversionReport;
import com.vidnyan.flowc.domain.analysis.Finding;
import com.vidnyan.flowc.domain.analysis.Severity;
import com.vidnyan.flowc.domain.document.FlowDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * CLI Runner for standalone flow conversion.
 * Runs a conversion when the flowc.convert.input property is set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConversionCliRunner implements CommandLineRunner {

    private final ConvertFlowUseCase convertFlowUseCase;
    private final FlowDocumentLoader documentLoader;
    private final OutputWriter outputWriter;
    private final CompilerProperties properties;
    private final ConfigurableApplicationContext context;

    @Override
    public void run(String... args) throws Exception {
        CompilerProperties.Convert convert = properties.getConvert();
        if (convert.getInput() == null || convert.getInput().isBlank()) {
            log.info("No input flow specified. Set flowc.convert.input property.");
            return;
        }

        int exitCode = 0;
        try {
            log.info("╔══════════════════════════════════════════════════════════════╗");
            log.info("║              flowc - Flow to LangChain compiler               ║");
            log.info("╠══════════════════════════════════════════════════════════════╣");
            log.info("║ Converting: {}", truncatePath(convert.getInput(), 50));
            log.info("╚══════════════════════════════════════════════════════════════╝");

            FlowDocument document = documentLoader.load(Path.of(convert.getInput()));
            ConversionResult result = convertFlowUseCase.convert(
                    new ConversionRequest(document, properties.getGeneration().toContext()));

            printReport(result);

            if (result.isSuccess()) {
                List<Path> files = outputWriter.write(result.program(), Path.of(convert.getOutput()),
                        convert.isOverwrite());
                log.info("");
                log.info("Generated files:");
                files.forEach(f -> log.info("  {}", f));
            } else {
                exitCode = 1;
            }

            log.info("");
            log.info(result.isSuccess() ? "Conversion complete!" : "Conversion failed.");
        } finally {
            int code = exitCode;
            SpringApplication.exit(context, () -> code);
        }
    }

    private void printReport(ConversionResult result) {
        ConversionReport report = result.report();
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" CONVERSION REPORT");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Nodes:          {}", result.stats().nodeCount());
        log.info(" Edges:          {}", result.stats().edgeCount());
        log.info(" Lowered nodes:  {}", result.stats().loweredNodes());
        log.info(" Fragments:      {}", result.stats().fragmentCount());
        log.info(" Coverage:       {}%", Math.round(report.coverage().coverage() * 100));
        log.info(" Complexity:     {}", report.complexity());
        log.info(" Duration:       {}ms", result.stats().totalDurationMs());
        log.info("───────────────────────────────────────────────────────────────");
        log.info(" FINDINGS:");
        log.info("   🔴 Blockers: {}", report.count(Severity.BLOCKER));
        log.info("   🟠 Errors:   {}", report.count(Severity.ERROR));
        log.info("   🟡 Warnings: {}", report.count(Severity.WARN));
        log.info("   🔵 Info:     {}", report.count(Severity.INFO));
        log.info("═══════════════════════════════════════════════════════════════");

        if (report.findings().isEmpty()) {
            log.info("");
            log.info("✅ No findings.");
            return;
        }

        log.info("");
        for (Finding finding : report.findings()) {
            String severity = switch (finding.severity()) {
                case BLOCKER -> "🔴 BLOCKER";
                case ERROR -> "🟠 ERROR";
                case WARN -> "🟡 WARN";
                case INFO -> "🔵 INFO";
            };
            log.info(" {} [{}] {}", severity, finding.kind(), finding.message());
        }
    }

    private String truncatePath(String path, int maxLen) {
        if (path.length() <= maxLen)
            return path;
        return "..." + path.substring(path.length() - maxLen + 3);
    }
}
