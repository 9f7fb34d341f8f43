package com.vidnyan.flowc.adapter.out.converter.parser;

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
 * Output parser from field names and descriptions.
 * The structure parameter is either a name-to-description object or a list of
 * {@code {property, description}} rows as the editor's grid produces them.
 */
@Component
public class StructuredOutputParserConverter implements NodeConverter {

    @Override
    public String type() {
        return "structuredOutputParser";
    }

    @Override
    public String category() {
        return "outputparser";
    }

    @Override
    public List<CodeFragment> convert(IrNode node, ConversionContext context) {
        ConverterSupport.requireScriptTarget(node, context);
        CodeStyle style = context.style();

        Map<String, String> fields = new LinkedHashMap<>();
        fields(node.parameter("jsonStructure", Object.class).orElse(null))
                .forEach((name, description) -> fields.put(name, style.quote(description)));
        if (fields.isEmpty()) {
            fields.put("answer", style.quote("answer to the user's question"));
        }

        return List.of(
                ConverterSupport.importFragment(node, "@langchain/core/output_parsers", "StructuredOutputParser"),
                ConverterSupport.initialization(node, context, FragmentPriority.UTILITY,
                        "StructuredOutputParser.fromNamesAndDescriptions("
                                + ConverterSupport.objectLiteral(fields, style, 0) + ")")
        );
    }

    private static Map<String, String> fields(Object structure) {
        Map<String, String> fields = new LinkedHashMap<>();
        if (structure instanceof Map<?, ?> map) {
            map.forEach((k, v) -> fields.put(String.valueOf(k), v == null ? "" : String.valueOf(v)));
        } else if (structure instanceof List<?> rows) {
            for (Object row : rows) {
                if (row instanceof Map<?, ?> entry && entry.get("property") != null) {
                    Object description = entry.get("description");
                    fields.put(String.valueOf(entry.get("property")),
                            description == null ? "" : String.valueOf(description));
                }
            }
        } else if (structure != null) {
            throw new IllegalArgumentException("Unreadable jsonStructure: " + structure);
        }
        return fields;
    }

    @Override
    public List<String> dependencies(IrNode node, GenerationContext context) {
        return List.of("@langchain/core");
    }
}
