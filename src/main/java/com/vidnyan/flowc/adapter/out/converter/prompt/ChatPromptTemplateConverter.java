package com.vidnyan.flowc.adapter.out.converter.prompt;

import com.vidnyan.flowc.domain.codegen.CodeFragment;
import com.vidnyan.flowc.domain.codegen.CodeStyle;
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
 * Chat prompt built from a system and a human message.
 */
@Component
public class ChatPromptTemplateConverter implements NodeConverter {

    @Override
    public String type() {
        return "chatPromptTemplate";
    }

    @Override
    public String category() {
        return "prompt";
    }

    @Override
    public List<CodeFragment> convert(IrNode node, ConversionContext context) {
        ConverterSupport.requireScriptTarget(node, context);
        CodeStyle style = context.style();

        List<String> messages = new ArrayList<>();
        node.stringParam("systemMessagePrompt").toOptional()
                .ifPresent(system -> messages.add(message("system", system, style)));
        messages.add(message("human",
                node.stringParam("humanMessagePrompt").orElse(PromptTemplateConverter.DEFAULT_TEMPLATE), style));

        StringBuilder expression = new StringBuilder("ChatPromptTemplate.fromMessages([\n");
        for (int i = 0; i < messages.size(); i++) {
            expression.append(style.indent()).append(messages.get(i));
            if (i < messages.size() - 1 || style.trailingCommas()) {
                expression.append(',');
            }
            expression.append('\n');
        }
        expression.append("])");

        return List.of(
                ConverterSupport.importFragment(node, PromptTemplateConverter.MODULE, "ChatPromptTemplate"),
                ConverterSupport.initialization(node, context, FragmentPriority.UTILITY, expression.toString())
        );
    }

    private static String message(String role, String text, CodeStyle style) {
        return "[" + style.quote(role) + ", " + style.quote(text) + "]";
    }

    @Override
    public List<String> dependencies(IrNode node, GenerationContext context) {
        return List.of("@langchain/core");
    }
}
