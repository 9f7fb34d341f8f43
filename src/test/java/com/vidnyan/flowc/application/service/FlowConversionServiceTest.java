package com.vidnyan.flowc.application.service;

import com.vidnyan.flowc.TestFlows;
import com.vidnyan.flowc.application.emit.CodeEmitter;
import com.vidnyan.flowc.application.emit.EmittedProgram;
import com.vidnyan.flowc.application.lowering.LoweringEngine;
import com.vidnyan.flowc.application.port.in.ConvertFlowUseCase.ConversionRequest;
import com.vidnyan.flowc.application.port.in.ConvertFlowUseCase.ConversionResult;
import com.vidnyan.flowc.domain.analysis.ConversionReport;
import com.vidnyan.flowc.domain.analysis.Finding;
import com.vidnyan.flowc.domain.analysis.FindingKind;
import com.vidnyan.flowc.domain.analysis.Severity;
import com.vidnyan.flowc.domain.analysis.GraphAnalyzer;
import com.vidnyan.flowc.domain.codegen.GenerationContext;
import com.vidnyan.flowc.domain.codegen.ModuleStyle;
import com.vidnyan.flowc.domain.codegen.TargetLanguage;
import com.vidnyan.flowc.domain.converter.ConverterRegistry;
import com.vidnyan.flowc.domain.document.FlowDocument;
import com.vidnyan.flowc.domain.ir.FlowGraphBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.vidnyan.flowc.TestFlows.docEdge;
import static com.vidnyan.flowc.TestFlows.docNode;
import static org.junit.jupiter.api.Assertions.*;

class FlowConversionServiceTest {

    private static final String LLM_CHAIN_SOURCE = String.join("\n",
            "import { PromptTemplate } from '@langchain/core/prompts';",
            "import { ChatOpenAI } from '@langchain/openai';",
            "import { LLMChain } from 'langchain/chains';",
            "",
            "const chatOpenAI_0 = new ChatOpenAI({",
            "  model: 'gpt-4o-mini',",
            "  temperature: 0.7,",
            "  apiKey: process.env.OPENAI_API_KEY,",
            "});",
            "",
            "const promptTemplate_0 = PromptTemplate.fromTemplate('Tell me about {topic}');",
            "",
            "const llmChain_0 = new LLMChain({",
            "  llm: chatOpenAI_0,",
            "  prompt: promptTemplate_0,",
            "});",
            "",
            "async function runLlmChain0(input: Record<string, unknown>) {",
            "  return llmChain_0.invoke(input);",
            "}",
            "",
            "export { chatOpenAI_0, promptTemplate_0, llmChain_0, runLlmChain0 };",
            "");

    private FlowConversionService service;

    @BeforeEach
    void setUp() {
        ConverterRegistry registry = TestFlows.registry();
        service = new FlowConversionService(new FlowGraphBuilder(), new GraphAnalyzer(), registry,
                new LoweringEngine(registry), new CodeEmitter());
    }

    private ConversionResult convert(FlowDocument document) {
        return service.convert(ConversionRequest.withDefaults(document));
    }

    @Test
    void convert_ShouldEmitChainAfterItsInputs() {
        // Act
        ConversionResult result = convert(TestFlows.llmChainFlow());

        // Assert
        assertTrue(result.isSuccess());
        assertTrue(result.report().findings().isEmpty(), () -> result.report().findings().toString());
        EmittedProgram program = result.program();
        assertEquals(LLM_CHAIN_SOURCE, program.source());
        assertEquals(List.of("@langchain/core", "@langchain/openai", "langchain"), program.dependencies());
        assertEquals(3, result.stats().nodeCount());
        assertEquals(3, result.stats().loweredNodes());
    }

    @Test
    void convert_ShouldPassToolsInDocumentOrder() {
        // Act
        ConversionResult result = convert(TestFlows.agentFlow());

        // Assert
        assertTrue(result.isSuccess());
        assertEquals(0, result.findingCount(Severity.WARN));
        String source = result.program().source();
        assertTrue(source.contains("tools: [calculator_0, serpAPI_0]"), source);
        assertTrue(source.indexOf("const calculator_0") < source.indexOf("const serpAPI_0"));
        assertTrue(source.indexOf("const serpAPI_0") < source.indexOf("const toolAgent_0"));
        assertTrue(source.indexOf("const chatOpenAI_0") < source.indexOf("const toolAgent_0"));
        assertTrue(source.contains(
                "import { AgentExecutor, createToolCallingAgent } from 'langchain/agents';"), source);
        assertTrue(result.program().dependencies().contains("@langchain/community"));
    }

    @Test
    void convert_ShouldWarnOnCycleAndStillEmitBothNodes() {
        // Act
        ConversionResult result = convert(TestFlows.cycleFlow());

        // Assert
        assertTrue(result.isSuccess());
        ConversionReport report = result.report();
        assertEquals(List.of("A", "B", "A"), report.cycles().get(0).path());
        assertEquals(1, report.byKind(FindingKind.CYCLE).size());
        assertEquals(1, report.byKind(FindingKind.CYCLE_FALLBACK).size());
        assertEquals(List.of("A", "B"), report.fallbackNodeIds());
        String source = result.program().source();
        assertTrue(source.contains("const A = wrap(B);"), source);
        assertTrue(source.indexOf("const A = wrap(B);") < source.indexOf("const B = wrap(A);"));
    }

    @Test
    void convert_ShouldStopOnMissingEdgeTarget() {
        // Arrange
        FlowDocument document = TestFlows.extend(TestFlows.llmChainFlow(), List.of(),
                List.of(docEdge("chatOpenAI_0", "ghost", "model")));

        // Act
        ConversionResult result = convert(document);

        // Assert
        assertFalse(result.isSuccess());
        assertNull(result.program());
        assertTrue(result.programIfPresent().isEmpty());
        List<Finding> fatal = result.report().structuralErrors();
        assertEquals(1, fatal.size());
        assertEquals(FindingKind.DANGLING_EDGE, fatal.get(0).kind());
        assertEquals(0, result.stats().loweredNodes());
    }

    @Test
    void convert_ShouldSucceedPartiallyWithUnsupportedNodes() {
        // Arrange
        FlowDocument document = TestFlows.extend(TestFlows.llmChainFlow(),
                List.of(docNode("mystery_0", "mysteryNode", "Misc", List.of(), Map.of()),
                        docNode("mystery_1", "mysteryNode", "Misc", List.of(), Map.of())),
                List.of());

        // Act
        ConversionResult result = convert(document);

        // Assert
        assertTrue(result.isSuccess());
        List<Finding> warnings = result.report().warnings();
        assertEquals(1, warnings.size());
        assertEquals(FindingKind.UNSUPPORTED_NODE_TYPE, warnings.get(0).kind());
        assertEquals("mysteryNode", warnings.get(0).context().get("type"));
        assertEquals(LLM_CHAIN_SOURCE, result.program().source());
        assertEquals(3, result.stats().loweredNodes());
    }

    @Test
    void convert_ShouldGiveCaseVariantChainsDistinctRunFunctions() {
        // Arrange
        FlowDocument document = TestFlows.extend(TestFlows.llmChainFlow(),
                List.of(docNode("LlmChain_0", "llmChain", "Chains",
                        List.of(TestFlows.docAnchor("LlmChain_0", "model", false, false),
                                TestFlows.docAnchor("LlmChain_0", "prompt", false, false)),
                        Map.of())),
                List.of(docEdge("chatOpenAI_0", "LlmChain_0", "model"),
                        docEdge("promptTemplate_0", "LlmChain_0", "prompt")));

        // Act
        ConversionResult result = convert(document);

        // Assert
        assertTrue(result.isSuccess());
        assertTrue(result.report().findings().isEmpty(), () -> result.report().findings().toString());
        String source = result.program().source();
        String first = "async function runLlmChain0(";
        assertEquals(source.indexOf(first), source.lastIndexOf(first), source);
        assertTrue(source.contains("const LlmChain_0_2 = new LLMChain({"), source);
        assertTrue(source.contains("async function runLlmChain02("), source);
        String exports = source.substring(source.indexOf("export {"));
        assertTrue(exports.contains("runLlmChain0,") || exports.contains("runLlmChain0 }"), exports);
        assertTrue(exports.contains("runLlmChain02"), exports);
    }

    @Test
    void convert_ShouldRenameNodesNamedLikeImportedClasses() {
        // Arrange
        FlowDocument document = TestFlows.llmChainFlow("llmChain_0", "ChatOpenAI", "PromptTemplate");

        // Act
        ConversionResult result = convert(document);

        // Assert
        assertTrue(result.isSuccess());
        assertTrue(result.report().findings().isEmpty(), () -> result.report().findings().toString());
        String source = result.program().source();
        assertTrue(source.contains("import { ChatOpenAI } from '@langchain/openai';"), source);
        assertTrue(source.contains("const ChatOpenAINode = new ChatOpenAI({"), source);
        assertTrue(source.contains("const PromptTemplateNode = PromptTemplate.fromTemplate("), source);
        assertTrue(source.contains("  llm: ChatOpenAINode,\n  prompt: PromptTemplateNode,"), source);
        assertFalse(source.contains("const ChatOpenAI ="), source);
        assertFalse(source.contains("const PromptTemplate ="), source);
    }

    @Test
    void convert_ShouldBeDeterministic() {
        // Act
        ConversionResult first = convert(TestFlows.agentFlow());
        ConversionResult second = convert(TestFlows.agentFlow());

        // Assert
        assertEquals(first.program(), second.program());
        assertEquals(first.report(), second.report());
    }

    @Test
    void convert_ShouldRecordLoweringFailureWithoutAborting() {
        // Arrange
        FlowDocument document = TestFlows.extend(TestFlows.llmChainFlow(),
                List.of(docNode("legacy_0", "OpenAIFunctionAgent", "Agents", List.of(), Map.of())),
                List.of());
        GenerationContext commonJs = GenerationContext.builder()
                .target(TargetLanguage.JAVASCRIPT)
                .moduleStyle(ModuleStyle.CJS)
                .build();

        // Act
        ConversionResult result = service.convert(new ConversionRequest(document, commonJs));

        // Assert
        assertTrue(result.isSuccess());
        List<Finding> failures = result.report().byKind(FindingKind.LOWERING_FAILURE);
        assertEquals(1, failures.size());
        assertEquals("legacy_0", failures.get(0).nodeId());
        assertEquals(1, result.report().byKind(FindingKind.DEPRECATED_NODE_TYPE).size());
        assertTrue(result.program().source().contains("module.exports = {"));
        assertFalse(result.program().source().contains("legacy_0"));
    }

    @Test
    void validate_ShouldAnalyzeWithoutGenerating() {
        // Act
        ConversionReport report = service.validate(TestFlows.cycleFlow());

        // Assert
        assertTrue(report.isConvertible());
        assertEquals(1, report.cycles().size());
        assertTrue(report.fallbackNodeIds().isEmpty());
        assertEquals(1.0, report.coverage().coverage());
    }
}
