package com.vidnyan.flowc.domain.converter;

import com.vidnyan.flowc.domain.codegen.CodeStyle;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConverterSupportTest {

    private final CodeStyle style = CodeStyle.defaults();

    @Test
    void literal_ShouldRenderTargetLiterals() {
        assertEquals("'it\\'s'", ConverterSupport.literal("it's", style));
        assertEquals("0.7", ConverterSupport.literal(0.7, style));
        assertEquals("1", ConverterSupport.literal(1.0, style));
        assertEquals("42", ConverterSupport.literal(42, style));
        assertEquals("true", ConverterSupport.literal(true, style));
        assertEquals("undefined", ConverterSupport.literal(null, style));
        assertEquals("['a', 2]", ConverterSupport.literal(List.of("a", 2), style));
        assertEquals("{ key: 'v', 'odd-key': 1 }",
                ConverterSupport.literal(orderedMap("key", "v", "odd-key", 1), style));
    }

    @Test
    void objectLiteral_ShouldHonorTrailingCommas() {
        // Arrange
        Map<String, String> entries = orderedMap("a", "1", "b", "2");
        CodeStyle noTrailing = new CodeStyle(4, CodeStyle.QuoteStyle.DOUBLE, false, false);

        // Act & Assert
        assertEquals("{\n  a: 1,\n  b: 2,\n}", ConverterSupport.objectLiteral(entries, style, 0));
        assertEquals("{\n    a: 1,\n    b: 2\n}", ConverterSupport.objectLiteral(entries, noTrailing, 0));
        assertEquals("{}", ConverterSupport.objectLiteral(Map.of(), style, 0));
    }

    @Test
    void packageOf_ShouldResolveScopedAndRelativeModules() {
        assertEquals("@langchain/core", ConverterSupport.packageOf("@langchain/core/prompts"));
        assertEquals("langchain", ConverterSupport.packageOf("langchain/chains"));
        assertEquals("dotenv", ConverterSupport.packageOf("dotenv"));
        assertNull(ConverterSupport.packageOf("./local"));
    }

    @Test
    void pascalCase_ShouldDropSeparators() {
        assertEquals("LlmChain0", ConverterSupport.pascalCase("llmChain_0"));
        assertEquals("MyAgent", ConverterSupport.pascalCase("my-agent"));
    }

    @SuppressWarnings("unchecked")
    private static <V> Map<String, V> orderedMap(Object... keyValues) {
        Map<String, V> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], (V) keyValues[i + 1]);
        }
        return map;
    }
}
