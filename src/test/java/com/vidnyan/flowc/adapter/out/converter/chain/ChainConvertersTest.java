package com.vidnyan.flowc.adapter.out.converter.chain;

import com.vidnyan.flowc.TestFlows;
import com.vidnyan.flowc.domain.codegen.CodeFragment;
import com.vidnyan.flowc.domain.codegen.FragmentKind;
import com.vidnyan.flowc.domain.codegen.GenerationContext;
import com.vidnyan.flowc.domain.codegen.TargetLanguage;
import com.vidnyan.flowc.domain.converter.ConversionContext;
import com.vidnyan.flowc.domain.converter.InputBindings;
import com.vidnyan.flowc.domain.ir.IrNode;
import com.vidnyan.flowc.domain.ir.Parameter;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ChainConvertersTest {

    @Test
    void llmChain_ShouldWireBoundInputs() {
        // Arrange
        IrNode node = TestFlows.chain("chain");
        ConversionContext context = TestFlows.context("chain", Map.of(
                "model", List.of("llm"),
                "prompt", List.of("prompt"),
                "outputParser", List.of("parser")));

        // Act
        List<CodeFragment> fragments = new LlmChainConverter().convert(node, context);

        // Assert
        assertEquals(String.join("\n",
                "const chain = new LLMChain({",
                "  llm: llm,",
                "  prompt: prompt,",
                "  outputParser: parser,",
                "});"), TestFlows.content(fragments, ":init"));
        CodeFragment run = fragments.get(2);
        assertEquals(FragmentKind.EXECUTION, run.kind());
        assertEquals(List.of("runChain"), run.exportedNames());
    }

    @Test
    void llmChain_ShouldRenderUndefinedForMissingInputs() {
        // Arrange
        IrNode node = new IrNode("chain", "llmChain", "chain", null, null,
                List.of(Parameter.of("chainName", "summary")), List.of(), List.of());

        // Act
        String content = TestFlows.content(
                new LlmChainConverter().convert(node, TestFlows.context("chain", Map.of())), ":init");

        // Assert
        assertTrue(content.contains("llm: undefined,"), content);
        assertTrue(content.contains("name: 'summary',"), content);
    }

    @Test
    void llmChain_ShouldUseUntypedRunFunctionForJavaScript() {
        // Arrange
        ConversionContext context = new ConversionContext(
                GenerationContext.builder().target(TargetLanguage.JAVASCRIPT).build(),
                "chain", InputBindings.empty());

        // Act
        String run = TestFlows.content(new LlmChainConverter().convert(TestFlows.chain("chain"), context), ":run");

        // Assert
        assertEquals(String.join("\n",
                "async function runChain(input) {",
                "  return chain.invoke(input);",
                "}"), run);
    }

    @Test
    void conversationChain_ShouldPassMemoryAndPrompt() {
        // Arrange
        IrNode node = TestFlows.node("conv", "conversationChain", "chain", List.of(), List.of());
        ConversionContext context = TestFlows.context("conv", Map.of(
                "model", List.of("llm"),
                "memory", List.of("memory"),
                "chatPromptTemplate", List.of("chat")));

        // Act
        String content = TestFlows.content(new ConversationChainConverter().convert(node, context), ":init");

        // Assert
        assertEquals(String.join("\n",
                "const conv = new ConversationChain({",
                "  llm: llm,",
                "  memory: memory,",
                "  prompt: chat,",
                "});"), content);
    }
}
