package com.vidnyan.flowc.adapter.out.converter.prompt;

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
 * Plain string prompt template.
 */
@Component
public class PromptTemplateConverter implements NodeConverter {

    static final String MODULE = "@langchain/core/prompts";
    static final String DEFAULT_TEMPLATE = "{input}";

    @Override
    public String type() {
        return "promptTemplate";
    }

    @Override
    public String category() {
        return "prompt";
    }

    @Override
    public List<CodeFragment> convert(IrNode node, ConversionContext context) {
        ConverterSupport.requireScriptTarget(node, context);
        String template = node.stringParam("template").orElse(DEFAULT_TEMPLATE);
        return List.of(
                ConverterSupport.importFragment(node, MODULE, "PromptTemplate"),
                ConverterSupport.initialization(node, context, FragmentPriority.UTILITY,
                        "PromptTemplate.fromTemplate(" + context.style().quote(template) + ")")
        );
    }

    @Override
    public List<String> dependencies(IrNode node, GenerationContext context) {
        return List.of("@langchain/core");
    }
}
