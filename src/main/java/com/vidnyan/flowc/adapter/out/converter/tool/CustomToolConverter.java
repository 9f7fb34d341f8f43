package com.vidnyan.flowc.adapter.out.converter.tool;

import com.vidnyan.flowc.domain.codegen.CodeFragment;
import com.vidnyan.flowc.domain.codegen.CodeStyle;
import com.vidnyan.flowc.domain.codegen.FragmentPriority;
import com.vidnyan.flowc.domain.codegen.GenerationContext;
import com.vidnyan.flowc.domain.codegen.TargetLanguage;
import com.vidnyan.flowc.domain.converter.ConversionContext;
import com.vidnyan.flowc.domain.converter.ConverterSupport;
import com.vidnyan.flowc.domain.converter.NodeConverter;
import com.vidnyan.flowc.domain.ir.IrNode;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * User-defined tool. The node's function body is copied into a DynamicTool.
 */
@Component
public class CustomToolConverter implements NodeConverter {

    static final String MODULE = "@langchain/core/tools";

    @Override
    public String type() {
        return "customTool";
    }

    @Override
    public String category() {
        return "tool";
    }

    @Override
    public List<CodeFragment> convert(IrNode node, ConversionContext context) {
        ConverterSupport.requireScriptTarget(node, context);
        CodeStyle style = context.style();

        String name = node.stringParam("toolName").orElse(context.variableName());
        String description = node.stringParam("toolDesc").orElse("Custom tool " + name);
        String body = node.stringParam("func").orElse("return input" + style.terminator());

        Map<String, String> options = new LinkedHashMap<>();
        options.put("name", style.quote(name));
        options.put("description", style.quote(description));
        options.put("func", function(body, context));

        return List.of(
                ConverterSupport.importFragment(node, MODULE, "DynamicTool"),
                ConverterSupport.initialization(node, context, FragmentPriority.UTILITY,
                        "new DynamicTool(" + ConverterSupport.objectLiteral(options, style, 0) + ")")
        );
    }

    private static String function(String body, ConversionContext context) {
        CodeStyle style = context.style();
        String parameter = context.target() == TargetLanguage.TYPESCRIPT ? "input: string" : "input";
        StringBuilder sb = new StringBuilder("async (").append(parameter).append(") => {\n");
        for (String line : body.strip().split("\\R")) {
            sb.append(style.indent(2)).append(line).append('\n');
        }
        return sb.append(style.indent()).append('}').toString();
    }

    @Override
    public List<String> dependencies(IrNode node, GenerationContext context) {
        return List.of("@langchain/core");
    }
}
