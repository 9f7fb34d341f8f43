package com.vidnyan.flowc.adapter.out.converter.tool;

import com.vidnyan.flowc.TestFlows;
import com.vidnyan.flowc.domain.codegen.CodeFragment;
import com.vidnyan.flowc.domain.ir.IrNode;
import com.vidnyan.flowc.domain.ir.Parameter;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ToolConvertersTest {

    @Test
    void calculator_ShouldImportFromCommunityPackage() {
        // Act
        List<CodeFragment> fragments = new CalculatorConverter()
                .convert(TestFlows.tool("calc", "calculator"), TestFlows.context("calc", Map.of()));

        // Assert
        assertEquals("@langchain/community/tools/calculator", fragments.get(0).importSpecs().get(0).module());
        assertEquals(List.of("@langchain/community"), fragments.get(0).requiredPackages());
        assertEquals("const calc = new Calculator();", TestFlows.content(fragments, ":init"));
    }

    @Test
    void serpApi_ShouldReadKeyFromEnvironment() {
        // Act
        String content = TestFlows.content(new SerpApiConverter()
                .convert(TestFlows.tool("search", "serpAPI"), TestFlows.context("search", Map.of())), ":init");

        // Assert
        assertEquals("const search = new SerpAPI(process.env.SERPAPI_API_KEY);", content);
    }

    @Test
    void customTool_ShouldWrapFunctionBody() {
        // Arrange
        IrNode node = TestFlows.node("lookup", "customTool", "tool", List.of(), List.of(
                Parameter.of("toolName", "lookup_order"),
                Parameter.of("toolDesc", "Finds an order by id"),
                Parameter.of("func", "const id = input.trim();\nreturn `order ${id}`;")));

        // Act
        String content = TestFlows.content(
                new CustomToolConverter().convert(node, TestFlows.context("lookup", Map.of())), ":init");

        // Assert
        assertEquals(String.join("\n",
                "const lookup = new DynamicTool({",
                "  name: 'lookup_order',",
                "  description: 'Finds an order by id',",
                "  func: async (input: string) => {",
                "    const id = input.trim();",
                "    return `order ${id}`;",
                "  },",
                "});"), content);
    }

    @Test
    void customTool_ShouldDefaultNameToVariable() {
        // Act
        String content = TestFlows.content(new CustomToolConverter()
                .convert(TestFlows.tool("echo", "customTool"), TestFlows.context("echo", Map.of())), ":init");

        // Assert
        assertTrue(content.contains("name: 'echo',"), content);
        assertTrue(content.contains("description: 'Custom tool echo',"), content);
        assertTrue(content.contains("    return input;"), content);
    }
}
