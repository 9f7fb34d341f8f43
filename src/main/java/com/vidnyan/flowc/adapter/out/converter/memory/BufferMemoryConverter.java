package com.vidnyan.flowc.adapter.out.converter.memory;

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
 * In-process chat history.
 */
@Component
public class BufferMemoryConverter implements NodeConverter {

    static final String MODULE = "langchain/memory";
    static final String DEFAULT_MEMORY_KEY = "chat_history";

    @Override
    public String type() {
        return "bufferMemory";
    }

    @Override
    public String category() {
        return "memory";
    }

    @Override
    public List<CodeFragment> convert(IrNode node, ConversionContext context) {
        ConverterSupport.requireScriptTarget(node, context);
        return List.of(
                ConverterSupport.importFragment(node, MODULE, "BufferMemory"),
                ConverterSupport.initialization(node, context, FragmentPriority.UTILITY,
                        "new BufferMemory(" + options(node, context.style()) + ")")
        );
    }

    private static String options(IrNode node, CodeStyle style) {
        Map<String, String> options = new LinkedHashMap<>();
        options.put("memoryKey", style.quote(node.stringParam("memoryKey").orElse(DEFAULT_MEMORY_KEY)));
        options.put("returnMessages", "true");
        return ConverterSupport.objectLiteral(options, style, 0);
    }

    @Override
    public List<String> dependencies(IrNode node, GenerationContext context) {
        return List.of("langchain");
    }
}
