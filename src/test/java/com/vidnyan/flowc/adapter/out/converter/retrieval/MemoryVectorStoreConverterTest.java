package com.vidnyan.flowc.adapter.out.converter.retrieval;

import com.vidnyan.flowc.TestFlows;
import com.vidnyan.flowc.domain.codegen.CodeFragment;
import com.vidnyan.flowc.domain.codegen.FragmentPriority;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MemoryVectorStoreConverterTest {

    private final MemoryVectorStoreConverter converter = new MemoryVectorStoreConverter();

    @Test
    void convert_ShouldBuildStoreFromEmbeddings() {
        // Act
        List<CodeFragment> fragments = converter.convert(TestFlows.tool("store", "memoryVectorStore"),
                TestFlows.context("store", Map.of("embeddings", List.of("embeddings"))));

        // Assert
        assertEquals(2, fragments.size());
        assertEquals("const store = new MemoryVectorStore(embeddings);", TestFlows.content(fragments, ":init"));
        assertEquals(FragmentPriority.RETRIEVAL.value(), fragments.get(1).priority());
    }

    @Test
    void convert_ShouldAddLoaderForConnectedDocuments() {
        // Act
        List<CodeFragment> fragments = converter.convert(TestFlows.tool("store", "memoryVectorStore"),
                TestFlows.context("store", Map.of(
                        "embeddings", List.of("embeddings"),
                        "document", List.of("docsA", "docsB"))));

        // Assert
        assertEquals(String.join("\n",
                "async function loadStore() {",
                "  await store.addDocuments([...docsA, ...docsB]);",
                "  return store;",
                "}"), TestFlows.content(fragments, ":load"));
        assertEquals(List.of("loadStore"), fragments.get(2).exportedNames());
    }
}
