package com.vidnyan.flowc.domain.converter;

import com.vidnyan.flowc.domain.codegen.CodeStyle;
import com.vidnyan.flowc.domain.codegen.GenerationContext;
import com.vidnyan.flowc.domain.codegen.TargetLanguage;

/**
 * Everything a converter may see while lowering one node:
 * the run-wide generation context, the identifier assigned to the node,
 * and the identifiers of the nodes wired into its inputs.
 */
public record ConversionContext(
    GenerationContext generation,
    String variableName,
    InputBindings inputs
) {

    public ConversionContext {
        inputs = inputs != null ? inputs : InputBindings.empty();
    }

    public static ConversionContext of(GenerationContext generation, String variableName) {
        return new ConversionContext(generation, variableName, InputBindings.empty());
    }

    public CodeStyle style() {
        return generation.style();
    }

    public TargetLanguage target() {
        return generation.target();
    }
}
