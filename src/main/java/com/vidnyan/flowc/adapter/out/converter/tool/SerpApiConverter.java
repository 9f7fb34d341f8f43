package com.vidnyan.flowc.adapter.out.converter.tool;

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
 * SerpAPI web search tool. The API key is read from the environment.
 */
@Component
public class SerpApiConverter implements NodeConverter {

    @Override
    public String type() {
        return "serpAPI";
    }

    @Override
    public String category() {
        return "tool";
    }

    @Override
    public List<CodeFragment> convert(IrNode node, ConversionContext context) {
        ConverterSupport.requireScriptTarget(node, context);
        return List.of(
                ConverterSupport.importFragment(node, CalculatorConverter.PACKAGE + "/tools/serpapi", "SerpAPI"),
                ConverterSupport.initialization(node, context, FragmentPriority.UTILITY,
                        "new SerpAPI(" + ConverterSupport.envReference("SERPAPI_API_KEY") + ")")
        );
    }

    @Override
    public List<String> dependencies(IrNode node, GenerationContext context) {
        return List.of(CalculatorConverter.PACKAGE);
    }
}
