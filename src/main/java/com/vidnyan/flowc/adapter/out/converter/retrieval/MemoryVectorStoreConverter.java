package com.vidnyan.flowc.adapter.out.converter.retrieval;

import com.vidnyan.flowc.domain.codegen.CodeFragment;
import com.vidnyan.flowc.domain.codegen.CodeStyle;
import com.vidnyan.flowc.domain.codegen.FragmentKind;
import com.vidnyan.flowc.domain.codegen.FragmentPriority;
import com.vidnyan.flowc.domain.codegen.GenerationContext;
import com.vidnyan.flowc.domain.converter.ConversionContext;
import com.vidnyan.flowc.domain.converter.ConverterSupport;
import com.vidnyan.flowc.domain.converter.NodeConverter;
import com.vidnyan.flowc.domain.ir.IrNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * In-memory vector store. Connected documents are loaded by a generated load function.
 */
@Component
public class MemoryVectorStoreConverter implements NodeConverter {

    @Override
    public String type() {
        return "memoryVectorStore";
    }

    @Override
    public String category() {
        return "vectorstore";
    }

    @Override
    public List<CodeFragment> convert(IrNode node, ConversionContext context) {
        ConverterSupport.requireScriptTarget(node, context);
        String embeddings = context.inputs().single("embeddings").orElse(ConverterSupport.MISSING_INPUT);

        List<CodeFragment> fragments = new ArrayList<>();
        fragments.add(ConverterSupport.importFragment(node, "langchain/vectorstores/memory", "MemoryVectorStore"));
        fragments.add(ConverterSupport.initialization(node, context, FragmentPriority.RETRIEVAL,
                "new MemoryVectorStore(" + embeddings + ")"));

        List<String> documents = context.inputs().all("document");
        if (!documents.isEmpty()) {
            fragments.add(loadFunction(node, context, documents));
        }
        return fragments;
    }

    private static CodeFragment loadFunction(IrNode node, ConversionContext context, List<String> documents) {
        CodeStyle style = context.style();
        String functionName = ConverterSupport.LOAD_PREFIX + ConverterSupport.pascalCase(context.variableName());
        String spread = ConverterSupport.arrayLiteral(documents.stream().map(d -> "..." + d).toList());
        String content = "async function " + functionName + "() {\n"
                + style.indent() + "await " + context.variableName() + ".addDocuments(" + spread + ")"
                + style.terminator() + "\n"
                + style.indent() + "return " + context.variableName() + style.terminator() + "\n"
                + "}";
        return CodeFragment.builder(node.id() + ":load", FragmentKind.EXECUTION)
                .sourceNodeId(node.id())
                .priority(FragmentPriority.EXECUTION)
                .content(content)
                .exportedName(functionName)
                .build();
    }

    @Override
    public List<String> dependencies(IrNode node, GenerationContext context) {
        return List.of("langchain");
    }
}
