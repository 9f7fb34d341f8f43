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

@Component
public class ConversationChainConverter implements NodeConverter {

    @Override
    public String type() {
        return "conversationChain";
    }

    @Override
    public String category() {
        return "chain";
    }

    @Override
    public List<CodeFragment> convert(IrNode node, ConversionContext context) {
        ConverterSupport.requireScriptTarget(node, context);
        InputBindings inputs = context.inputs();

        Map<String, String> options = new LinkedHashMap<>();
        options.put("llm", inputs.single("model").orElse(ConverterSupport.MISSING_INPUT));
        inputs.single("memory").ifPresent(memory -> options.put("memory", memory));
        inputs.single("chatPromptTemplate").ifPresent(prompt -> options.put("prompt", prompt));

        return List.of(
                ConverterSupport.importFragment(node, LlmChainConverter.MODULE, "ConversationChain"),
                ConverterSupport.initialization(node, context, FragmentPriority.CHAIN,
                        "new ConversationChain(" + ConverterSupport.objectLiteral(options, context.style(), 0) + ")"),
                ConverterSupport.runFunction(node, context, context.variableName())
        );
    }

    @Override
    public List<String> dependencies(IrNode node, GenerationContext context) {
        return List.of("langchain", "@langchain/core");
    }
}
