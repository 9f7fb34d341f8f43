package com.vidnyan.flowc.adapter.in.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.vidnyan.flowc.CompilerProperties;
import com.vidnyan.flowc.adapter.out.document.FlowDocumentException;
import com.vidnyan.flowc.application.emit.EmittedProgram;
import com.vidnyan.flowc.application.port.in.ConvertFlowUseCase;
import com.vidnyan.flowc.application.port.in.ConvertFlowUseCase.ConversionRequest;
import com.vidnyan.flowc.application.port.in.ConvertFlowUseCase.ConversionResult;
import com.vidnyan.flowc.application.port.in.ConvertFlowUseCase.ConversionStats;
import com.vidnyan.flowc.application.port.out.FlowDocumentLoader;
import com.vidnyan.flowc.domain.analysis.ConversionReport;
import com.vidnyan.flowc.domain.codegen.CodeStyle;
import com.vidnyan.flowc.domain.codegen.GenerationContext;
import com.vidnyan.flowc.domain.codegen.ModuleStyle;
import com.vidnyan.flowc.domain.codegen.TargetLanguage;
import com.vidnyan.flowc.domain.document.FlowDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST API for converting flows.
 */
@Slf4j
@RestController
@RequestMapping("/api/convert")
@RequiredArgsConstructor
public class ConversionController {

    private final ConvertFlowUseCase convertFlowUseCase;
    private final FlowDocumentLoader documentLoader;
    private final CompilerProperties properties;

    @PostMapping
    public ConvertResponse convert(@RequestBody ConvertRequest request) {
        log.info("Received conversion request: {}", request.name());
        FlowDocument document = document(request);
        ConversionResult result = convertFlowUseCase.convert(
                new ConversionRequest(document, context(request.options())));

        EmittedProgram program = result.program();
        return new ConvertResponse(
                result.isSuccess(),
                program != null ? program.source() : null,
                program != null ? program.testSource() : null,
                program != null ? program.dependencies() : List.of(),
                result.report(),
                result.stats()
        );
    }

    @PostMapping("/validate")
    public ConversionReport validate(@RequestBody ConvertRequest request) {
        log.info("Received validation request: {}", request.name());
        return convertFlowUseCase.validate(document(request));
    }

    @ExceptionHandler({FlowDocumentException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(RuntimeException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("error", String.valueOf(e.getMessage())));
    }

    private FlowDocument document(ConvertRequest request) {
        if (request.flow() == null || request.flow().isNull()) {
            throw new FlowDocumentException("Request carries no flow");
        }
        return documentLoader.parse(request.flow().toString(), request.name() != null ? request.name() : "flow");
    }

    /**
     * Request options override the configured generation defaults.
     */
    private GenerationContext context(GenerationOptions options) {
        CompilerProperties.Generation defaults = properties.getGeneration();
        if (options == null) {
            return defaults.toContext();
        }
        CodeStyle style = new CodeStyle(
                options.indentSize() != null ? options.indentSize() : defaults.getIndentSize(),
                CodeStyle.QuoteStyle.fromTag(options.quoteStyle() != null ? options.quoteStyle() : defaults.getQuoteStyle()),
                options.semicolons() != null ? options.semicolons() : defaults.isSemicolons(),
                options.trailingCommas() != null ? options.trailingCommas() : defaults.isTrailingCommas());

        GenerationContext.Builder builder = defaults.toBuilder().style(style);
        if (options.target() != null) builder.target(TargetLanguage.fromTag(options.target()));
        if (options.moduleStyle() != null) builder.moduleStyle(ModuleStyle.fromTag(options.moduleStyle()));
        if (options.includeTests() != null) builder.includeTests(options.includeTests());
        if (options.includeDocs() != null) builder.includeDocs(options.includeDocs());
        if (options.tracing() != null) builder.tracing(options.tracing());
        if (options.projectName() != null) builder.projectName(options.projectName());
        if (options.environment() != null) builder.environment(options.environment());
        return builder.build();
    }

    public record ConvertRequest(
        String name,
        JsonNode flow,              // the editor's exported flow JSON
        GenerationOptions options   // null = configured defaults
    ) {}

    public record GenerationOptions(
        String target,
        String moduleStyle,
        Boolean includeTests,
        Boolean includeDocs,
        Boolean tracing,
        Integer indentSize,
        String quoteStyle,
        Boolean semicolons,
        Boolean trailingCommas,
        String projectName,
        Map<String, String> environment
    ) {}

    public record ConvertResponse(
        boolean success,
        String source,
        String testSource,
        List<String> dependencies,
        ConversionReport report,
        ConversionStats stats
    ) {}
}
