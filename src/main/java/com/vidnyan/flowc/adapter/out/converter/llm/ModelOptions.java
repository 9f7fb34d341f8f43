package com.vidnyan.flowc.adapter.out.converter.llm;

import com.vidnyan.flowc.domain.codegen.CodeStyle;
import com.vidnyan.flowc.domain.converter.ConversionContext;
import com.vidnyan.flowc.domain.converter.ConverterSupport;
import com.vidnyan.flowc.domain.ir.IrNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Constructor options shared by the chat model converters.
 */
final class ModelOptions {

    static final double DEFAULT_TEMPERATURE = 0.7;

    private ModelOptions() {
    }

    static String render(IrNode node, ConversionContext context, String defaultModel, String apiKeyEnv) {
        CodeStyle style = context.style();
        Map<String, String> options = new LinkedHashMap<>();
        options.put("model", style.quote(node.stringParam("modelName").orElse(defaultModel)));
        ConverterSupport.putIfPresent(options, "temperature",
                node.numberParam("temperature").withDefault(DEFAULT_TEMPERATURE), style);
        ConverterSupport.putIfPresent(options, "maxTokens", node.intParam("maxTokens"), style);
        ConverterSupport.putIfPresent(options, "topP", node.numberParam("topP"), style);
        ConverterSupport.putIfPresent(options, "streaming", node.boolParam("streaming"), style);
        options.put("apiKey", ConverterSupport.envReference(apiKeyEnv));
        return ConverterSupport.objectLiteral(options, style, 0);
    }
}
