package com.vidnyan.flowc.domain.converter;

import com.vidnyan.flowc.TestFlows;
import com.vidnyan.flowc.adapter.out.converter.llm.ChatOpenAIConverter;
import com.vidnyan.flowc.adapter.out.converter.tool.CalculatorConverter;
import com.vidnyan.flowc.domain.ir.IrNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConverterRegistryTest {

    @Test
    void find_ShouldPreferExactTypeOverAlias() {
        // Arrange
        ConverterRegistry registry = TestFlows.registry();

        // Act & Assert
        assertEquals("ChatOpenAIConverter", registry.find("chatOpenAI").orElseThrow().getName());
        assertEquals("ChatOpenAIConverter", registry.find("ChatOpenAI").orElseThrow().getName());
        assertEquals("chatOpenAI", registry.resolveType("ChatOpenAI").orElseThrow());
        assertTrue(registry.isAlias("ChatOpenAI"));
        assertTrue(registry.find("mystery").isEmpty());
        assertTrue(registry.find(null).isEmpty());
    }

    @Test
    void accepts_ShouldAdmitAliasedNodes() {
        // Arrange
        ConverterRegistry registry = TestFlows.registry();
        IrNode aliased = TestFlows.llm("llm");
        aliased = new IrNode(aliased.id(), "ChatOpenAI", aliased.category(), aliased.label(), null,
                aliased.parameters(), aliased.inputs(), aliased.outputs());
        NodeConverter converter = registry.find("ChatOpenAI").orElseThrow();

        // Act & Assert
        assertFalse(converter.canConvert(aliased));
        assertTrue(registry.accepts(converter, aliased));
    }

    @Test
    void build_ShouldRejectDuplicateTypes() {
        // Arrange
        ConverterRegistry.Builder builder = ConverterRegistry.builder()
                .register(new ChatOpenAIConverter())
                .register(new ChatOpenAIConverter());

        // Act & Assert
        RegistryConfigurationException e = assertThrows(RegistryConfigurationException.class, builder::build);
        assertTrue(e.getMessage().contains("chatOpenAI"));
    }

    @Test
    void build_ShouldRejectAliasShadowingType() {
        // Arrange
        ConverterRegistry.Builder builder = ConverterRegistry.builder()
                .register(new ChatOpenAIConverter())
                .register(new CalculatorConverter())
                .alias("calculator", "chatOpenAI");

        // Act & Assert
        assertThrows(RegistryConfigurationException.class, builder::build);
    }

    @Test
    void build_ShouldRejectAliasToUnknownType() {
        // Arrange
        ConverterRegistry.Builder builder = ConverterRegistry.builder()
                .register(new ChatOpenAIConverter())
                .alias("Calc", "calculator");

        // Act & Assert
        assertThrows(RegistryConfigurationException.class, builder::build);
    }

    @Test
    void alias_ShouldRejectConflictingTargets() {
        // Arrange
        ConverterRegistry.Builder builder = ConverterRegistry.builder().alias("LLM", "chatOpenAI");

        // Act & Assert
        assertThrows(RegistryConfigurationException.class, () -> builder.alias("LLM", "chatAnthropic"));
        assertDoesNotThrow(() -> builder.alias("LLM", "chatOpenAI"));
    }

    @Test
    void stats_ShouldCountConvertersAliasesAndDeprecations() {
        // Act
        ConverterRegistry.Stats stats = TestFlows.registry().stats();

        // Assert
        assertEquals(17, stats.converterCount());
        assertEquals(17, stats.typeCount());
        assertEquals(2, stats.aliasCount());
        assertEquals(1, stats.deprecatedCount());
        assertEquals(2, stats.byCategory().get("agent"));
    }

    @Test
    void converters_ShouldBeSortedByType() {
        // Act
        List<String> types = TestFlows.registry().converters().stream().map(NodeConverter::type).toList();

        // Assert
        assertEquals(types.stream().sorted().toList(), types);
        assertEquals(types.size(), types.stream().distinct().count());
    }
}
