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

@Component
public class CalculatorConverter implements NodeConverter {

    static final String PACKAGE = "@langchain/community";

    @Override
    public String type() {
        return "calculator";
    }

    @Override
    public String category() {
        return "tool";
    }

    @Override
    public List<CodeFragment> convert(IrNode node, ConversionContext context) {
        ConverterSupport.requireScriptTarget(node, context);
        return List.of(
                ConverterSupport.importFragment(node, PACKAGE + "/tools/calculator", "Calculator"),
                ConverterSupport.initialization(node, context, FragmentPriority.UTILITY, "new Calculator()")
        );
    }

    @Override
    public List<String> dependencies(IrNode node, GenerationContext context) {
        return List.of(PACKAGE);
    }
}
