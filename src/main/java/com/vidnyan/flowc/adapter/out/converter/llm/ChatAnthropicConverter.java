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

@Component
public class ChatAnthropicConverter implements NodeConverter {

    static final String MODULE = "@langchain/anthropic";

    @Override
    public String type() {
        return "chatAnthropic";
    }

    @Override
    public String category() {
        return "llm";
    }

    @Override
    public List<CodeFragment> convert(IrNode node, ConversionContext context) {
        ConverterSupport.requireScriptTarget(node, context);
        String options = ModelOptions.render(node, context, "claude-3-5-sonnet-latest", "ANTHROPIC_API_KEY");
        return List.of(
                ConverterSupport.importFragment(node, MODULE, "ChatAnthropic"),
                ConverterSupport.initialization(node, context, FragmentPriority.MODEL,
                        "new ChatAnthropic(" + options + ")")
        );
    }

    @Override
    public List<String> dependencies(IrNode node, GenerationContext context) {
        return List.of(MODULE, "@langchain/core");
    }
}
