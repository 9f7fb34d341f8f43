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
 * Chat history limited to the last k exchanges.
 */
@Component
public class BufferWindowMemoryConverter implements NodeConverter {

    static final int DEFAULT_WINDOW = 5;

    @Override
    public String type() {
        return "bufferWindowMemory";
    }

    @Override
    public String category() {
        return "memory";
    }

    @Override
    public List<CodeFragment> convert(IrNode node, ConversionContext context) {
        ConverterSupport.requireScriptTarget(node, context);
        CodeStyle style = context.style();
        Map<String, String> options = new LinkedHashMap<>();
        options.put("memoryKey", style.quote(
                node.stringParam("memoryKey").orElse(BufferMemoryConverter.DEFAULT_MEMORY_KEY)));
        options.put("returnMessages", "true");
        options.put("k", ConverterSupport.literal(node.intParam("k").orElse(DEFAULT_WINDOW), style));
        return List.of(
                ConverterSupport.importFragment(node, BufferMemoryConverter.MODULE, "BufferWindowMemory"),
                ConverterSupport.initialization(node, context, FragmentPriority.UTILITY,
                        "new BufferWindowMemory(" + ConverterSupport.objectLiteral(options, style, 0) + ")")
        );
    }

    @Override
    public List<String> dependencies(IrNode node, GenerationContext context) {
        return List.of("langchain");
    }
}
