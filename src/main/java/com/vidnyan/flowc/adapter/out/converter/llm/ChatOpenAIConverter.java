package com.vidnyan.flowc.adapter.out.converter.llm;

import com.vidnyan.flowc.domain.codegen.CodeFragment;
import com.vidnyan.flowc.domain.codegen.FragmentPriority;
import com.vidnyan.flowc.domain.codegen.GenerationContext;
import com.vidnyan.flowc.domain.converter.ConversionContext;
import com.vidnyan.flowc.domain.converter.ConverterSupport;
import com.vidnyan.flowc.domain.converter.NodeConverter;
import com.vidnyan.flowc.domain.ir.IrNode;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * OpenAI chat model.
 */
@Component
public class ChatOpenAIConverter implements NodeConverter {

    static final String MODULE = "@langchain/openai";

    @Override
    public String type() {
        return "chatOpenAI";
    }

    @Override
    public String category() {
        return "llm";
    }

    @Override
    public List<String> supportedVersions() {
        return List.of("6", "7", "8");
    }

    @Override
    public List<CodeFragment> convert(IrNode node, ConversionContext context) {
        ConverterSupport.requireScriptTarget(node, context);
        String options = ModelOptions.render(node, context, "gpt-4o-mini", "OPENAI_API_KEY");
        return List.of(
                ConverterSupport.importFragment(node, MODULE, "ChatOpenAI"),
                ConverterSupport.initialization(node, context, FragmentPriority.MODEL,
                        "new ChatOpenAI(" + options + ")")
        );
    }

    @Override
    public List<String> dependencies(IrNode node, GenerationContext context) {
        return List.of(MODULE, "@langchain/core");
    }
}
