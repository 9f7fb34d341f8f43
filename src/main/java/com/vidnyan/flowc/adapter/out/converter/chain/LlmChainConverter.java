package com.vidnyan.flowc.adapter.out.converter.chain;

import com.vidnyan.flowc.domain.codegen.CodeFragment;
import com.vidnyan.flowc.domain.codegen.FragmentPriority;
import com.vidnyan.flowc.domain.codegen.GenerationContext;
import com.vidnyan.flowc.domain.converter.ConversionContext;
import com.vidnyan.flowc.domain.converter.ConverterSupport;
import com.vidnyan.flowc.domain.converter.InputBindings;
import com.vidnyan.flowc.domain.converter.NodeConverter;
import com.vidnyan.flowc.domain.ir.IrNode;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Model + prompt chain with an optional output parser.
 */
@Component
public class LlmChainConverter implements NodeConverter {

    static final String MODULE = "langchain/chains";

    @Override
    public String type() {
        return "llmChain";
    }

    @Override
    public String category() {
        return "chain";
    }

    @Override
    public List<String> supportedVersions() {
        return List.of("1", "2", "3");
    }

    @Override
    public List<CodeFragment> convert(IrNode node, ConversionContext context) {
        ConverterSupport.requireScriptTarget(node, context);
        InputBindings inputs = context.inputs();

        Map<String, String> options = new LinkedHashMap<>();
        options.put("llm", inputs.single("model").orElse(ConverterSupport.MISSING_INPUT));
        options.put("prompt", inputs.single("prompt").orElse(ConverterSupport.MISSING_INPUT));
        inputs.single("outputParser").ifPresent(parser -> options.put("outputParser", parser));
        node.stringParam("chainName").toOptional()
                .ifPresent(name -> options.put("name", context.style().quote(name)));

        return List.of(
                ConverterSupport.importFragment(node, MODULE, "LLMChain"),
                ConverterSupport.initialization(node, context, FragmentPriority.CHAIN,
                        "new LLMChain(" + ConverterSupport.objectLiteral(options, context.style(), 0) + ")"),
                ConverterSupport.runFunction(node, context, context.variableName())
        );
    }

    @Override
    public List<String> dependencies(IrNode node, GenerationContext context) {
        return List.of("langchain", "@langchain/core");
    }
}
