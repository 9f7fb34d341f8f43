package com.vidnyan.flowc.application.lowering;

import com.vidnyan.flowc.TestFlows;
import com.vidnyan.flowc.domain.analysis.Finding;
import com.vidnyan.flowc.domain.analysis.FindingKind;
import com.vidnyan.flowc.domain.analysis.Severity;
import com.vidnyan.flowc.domain.codegen.CodeFragment;
import com.vidnyan.flowc.domain.codegen.FragmentPriority;
import com.vidnyan.flowc.domain.codegen.GenerationContext;
import com.vidnyan.flowc.domain.codegen.TargetLanguage;
import com.vidnyan.flowc.domain.converter.ConversionContext;
import com.vidnyan.flowc.domain.converter.ConverterRegistry;
import com.vidnyan.flowc.domain.ir.FlowGraph;
import com.vidnyan.flowc.domain.ir.IrNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.vidnyan.flowc.TestFlows.agent;
import static com.vidnyan.flowc.TestFlows.chain;
import static com.vidnyan.flowc.TestFlows.edge;
import static com.vidnyan.flowc.TestFlows.generic;
import static com.vidnyan.flowc.TestFlows.llm;
import static com.vidnyan.flowc.TestFlows.prompt;
import static com.vidnyan.flowc.TestFlows.tool;
import static org.junit.jupiter.api.Assertions.*;

class LoweringEngineTest {

    private final LoweringEngine engine = new LoweringEngine(TestFlows.registry());

    private FlowGraph chainGraph() {
        return FlowGraph.of(
                List.of(chain("chain"), llm("llm"), prompt("prompt")),
                List.of(edge("llm", "chain", "model"), edge("prompt", "chain", "prompt")));
    }

    @Test
    void lower_ShouldPlaceFragmentsInEmissionOrder() {
        // Act
        LoweringResult result = engine.lower(chainGraph(), GenerationContext.defaults());

        // Assert
        assertEquals(List.of("llm", "prompt", "chain"), result.order().nodeIds());
        assertEquals(List.of("llm", "prompt", "chain"), result.loweredNodeIds());
        assertFalse(result.hasFailures());
        assertTrue(result.findings().isEmpty());

        CodeFragment chainInit = result.fragmentsOf("chain").stream()
                .filter(f -> f.id().equals("chain:init"))
                .findFirst()
                .orElseThrow();
        assertEquals(2, chainInit.emissionIndex());
        assertEquals(FragmentPriority.CHAIN.value(), chainInit.priority());
        assertTrue(chainInit.content().contains("llm: llm,"));
        assertTrue(chainInit.content().contains("prompt: prompt,"));

        assertEquals(List.of("@langchain/core", "@langchain/openai", "langchain"),
                List.copyOf(result.dependencies()));
    }

    @Test
    void lower_ShouldRenameNodesThatShadowImportedSymbols() {
        // Arrange
        FlowGraph graph = FlowGraph.of(
                List.of(generic("wrap", TestFlows.PASS_THROUGH), generic("next", TestFlows.PASS_THROUGH)),
                List.of(edge("wrap", "next", "in")));

        // Act
        LoweringResult result = engine.lower(graph, GenerationContext.defaults());

        // Assert
        assertEquals("wrapNode", result.identifiers().identifierFor("wrap"));
        assertEquals("const wrapNode = wrap(undefined);", TestFlows.content(result.fragmentsOf("wrap"), ":init"));
        assertEquals("const next = wrap(wrapNode);", TestFlows.content(result.fragmentsOf("next"), ":init"));
        assertTrue(result.findings().isEmpty());
    }

    @Test
    void lower_ShouldBindListInputsInDocumentOrder() {
        // Arrange
        FlowGraph graph = FlowGraph.of(
                List.of(agent("agent"), llm("llm"), tool("calc", "calculator"), tool("search", "serpAPI")),
                List.of(edge("search", "agent", "tools"), edge("calc", "agent", "tools"),
                        edge("llm", "agent", "model")));

        // Act
        LoweringResult result = engine.lower(graph, GenerationContext.defaults());

        // Assert
        String executor = result.fragmentsOf("agent").stream()
                .filter(f -> f.id().equals("agent:init"))
                .findFirst()
                .orElseThrow()
                .content();
        assertTrue(executor.contains("tools: [calc, search]"), executor);
        assertTrue(executor.contains("llm: llm,"), executor);
        assertFalse(executor.contains("memory"), executor);
    }

    @Test
    void lower_ShouldLiftConsumerPriorityAboveProducers() {
        // Arrange
        FlowGraph graph = FlowGraph.of(
                List.of(generic("after", TestFlows.PASS_THROUGH), chain("chain"), llm("llm"), prompt("prompt")),
                List.of(edge("llm", "chain", "model"), edge("prompt", "chain", "prompt"),
                        edge("chain", "after", "in")));

        // Act
        LoweringResult result = engine.lower(graph, GenerationContext.defaults());

        // Assert
        CodeFragment after = result.fragmentsOf("after").stream()
                .filter(f -> !f.isImport())
                .findFirst()
                .orElseThrow();
        assertEquals(FragmentPriority.EXECUTION.value(), after.priority());
        assertTrue(after.content().contains("wrap(chain)"));
        CodeFragment afterImport = result.fragmentsOf("after").stream()
                .filter(CodeFragment::isImport)
                .findFirst()
                .orElseThrow();
        assertEquals(FragmentPriority.IMPORT.value(), afterImport.priority());
    }

    @Test
    void lower_ShouldRecordConverterFailureAndContinue() {
        // Arrange
        ConverterRegistry registry = ConverterRegistry.builder()
                .registerAll(TestFlows.catalogue())
                .register(new TestFlows.PassThroughConverter() {
                    @Override
                    public List<CodeFragment> convert(IrNode node, ConversionContext context) {
                        throw new IllegalArgumentException("bad template");
                    }
                })
                .build();
        FlowGraph graph = FlowGraph.of(
                List.of(llm("llm"), generic("broken", TestFlows.PASS_THROUGH)),
                List.of(edge("llm", "broken", "in")));

        // Act
        LoweringResult result = new LoweringEngine(registry).lower(graph, GenerationContext.defaults());

        // Assert
        assertEquals(List.of("llm"), result.loweredNodeIds());
        assertEquals(List.of("broken"), result.failedNodeIds());
        Finding failure = result.findings().get(0);
        assertEquals(FindingKind.LOWERING_FAILURE, failure.kind());
        assertEquals(Severity.ERROR, failure.severity());
        assertEquals("broken", failure.nodeId());
        assertEquals("Failed to lower node: bad template", failure.message());
        assertTrue(result.fragmentsOf("broken").isEmpty());
    }

    @Test
    void lower_ShouldSkipNodesWithoutConverter() {
        // Arrange
        FlowGraph graph = FlowGraph.of(List.of(llm("llm"), generic("m", "mystery")), List.of());

        // Act
        LoweringResult result = engine.lower(graph, GenerationContext.defaults());

        // Assert
        assertEquals(List.of("llm"), result.loweredNodeIds());
        assertTrue(result.failedNodeIds().isEmpty());
        assertTrue(result.findings().isEmpty());
    }

    @Test
    void lower_ShouldReportScriptOnlyConvertersForPython() {
        // Arrange
        GenerationContext python = GenerationContext.builder().target(TargetLanguage.PYTHON).build();

        // Act
        LoweringResult result = engine.lower(chainGraph(), python);

        // Assert
        assertEquals(List.of("llm", "prompt", "chain"), result.failedNodeIds());
        assertEquals(3, result.findings().size());
        assertTrue(result.findings().get(0).message().contains("python"));
    }

    @Test
    void lower_ShouldAddFallbackFindingForCycles() {
        // Arrange
        FlowGraph graph = FlowGraph.of(
                List.of(generic("A", TestFlows.PASS_THROUGH), generic("B", TestFlows.PASS_THROUGH)),
                List.of(edge("A", "B", "in"), edge("B", "A", "in")));

        // Act
        LoweringResult result = engine.lower(graph, GenerationContext.defaults());

        // Assert
        assertEquals(List.of("A", "B"), result.loweredNodeIds());
        Finding fallback = result.findings().get(0);
        assertEquals(FindingKind.CYCLE_FALLBACK, fallback.kind());
        assertEquals(Severity.WARN, fallback.severity());
        assertEquals(List.of("A", "B"), fallback.context().get("nodeIds"));
    }

    @Test
    void lower_ShouldPrependCrossCuttingFragments() {
        // Arrange
        GenerationContext context = GenerationContext.builder()
                .tracing(true)
                .environment(Map.of("OPENAI_API_KEY", ""))
                .build();

        // Act
        LoweringResult result = engine.lower(chainGraph(), context);

        // Assert
        List<String> firstIds = result.fragments().subList(0, 4).stream().map(CodeFragment::id).toList();
        assertEquals(List.of("env:import", "env:config", "tracing:import", "tracing:init"), firstIds);
        assertTrue(result.fragments().get(0).isCrossCutting());
        assertTrue(result.dependencies().contains("dotenv"));
        assertTrue(result.dependencies().contains("langfuse-langchain"));
        String run = result.fragmentsOf("chain").stream()
                .filter(f -> f.id().equals("chain:run"))
                .findFirst()
                .orElseThrow()
                .content();
        assertTrue(run.contains("{ callbacks: [langfuseHandler] }"), run);
    }

    @Test
    void lower_ShouldProduceSameFragmentsWhenParallel() {
        // Arrange
        FlowGraph graph = FlowGraph.of(
                List.of(agent("agent"), llm("llm"), tool("calc", "calculator"), tool("search", "serpAPI"),
                        chain("chain"), prompt("prompt")),
                List.of(edge("search", "agent", "tools"), edge("calc", "agent", "tools"),
                        edge("llm", "agent", "model"), edge("llm", "chain", "model"),
                        edge("prompt", "chain", "prompt")));
        LoweringEngine parallel = new LoweringEngine(TestFlows.registry(), 4);

        // Act
        LoweringResult sequentialResult = engine.lower(graph, GenerationContext.defaults());
        LoweringResult parallelResult = parallel.lower(graph, GenerationContext.defaults());

        // Assert
        assertEquals(sequentialResult.fragments(), parallelResult.fragments());
        assertEquals(sequentialResult.dependencies(), parallelResult.dependencies());
    }
}
