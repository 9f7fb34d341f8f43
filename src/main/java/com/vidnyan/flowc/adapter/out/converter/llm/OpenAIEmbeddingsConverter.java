package com.vidnyan.flowc.adapter.out.converter.llm;

import com.vidnyan.flowc.domain.codegen.CodeFragment;
import com.vidnyan.flowc.domain.codegen.CodeStyle;
import com.vidnyan.flowc.domain.codegen.FragmentPriority;
import com.vidnyan.flowc.domain.codegen.GenerationContext;
import com.vidnyan.flowc.domain.converter.ConversionContext;
import com.vidnyan.flowc.domain.converter.ConverterSupport;
import com.vidnyan.flowc.domain.converter.NodeConverter;
import com.vidnyan.flowc.domain.ir.IrNode;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI embeddings; consumed by vector stores.
 */
@Component
public class OpenAIEmbeddingsConverter implements NodeConverter {

    @Override
    public String type() {
        return "openAIEmbeddings";
    }

    @Override
    public String category() {
        return "embeddings";
    }

    @Override
    public List<CodeFragment> convert(IrNode node, ConversionContext context) {
        ConverterSupport.requireScriptTarget(node, context);
        CodeStyle style = context.style();
        Map<String, String> options = new LinkedHashMap<>();
        options.put("model", style.quote(node.stringParam("modelName").orElse("text-embedding-3-small")));
        ConverterSupport.putIfPresent(options, "dimensions", node.intParam("dimensions"), style);
        ConverterSupport.putIfPresent(options, "batchSize", node.intParam("batchSize"), style);
        options.put("apiKey", ConverterSupport.envReference("OPENAI_API_KEY"));
        return List.of(
                ConverterSupport.importFragment(node, ChatOpenAIConverter.MODULE, "OpenAIEmbeddings"),
                ConverterSupport.initialization(node, context, FragmentPriority.MODEL,
                        "new OpenAIEmbeddings(" + ConverterSupport.objectLiteral(options, style, 0) + ")")
        );
    }

    @Override
    public List<String> dependencies(IrNode node, GenerationContext context) {
        return List.of(ChatOpenAIConverter.MODULE);
    }
}
