package com.vidnyan.flowc.domain.converter;

import com.vidnyan.flowc.domain.codegen.CodeFragment;
import com.vidnyan.flowc.domain.codegen.GenerationContext;
import com.vidnyan.flowc.domain.ir.IrNode;

import java.util.List;
import java.util.Optional;

/**
 * Lowers one node type into code fragments.
 * Implementations must be pure functions of the node and the context they are given.
 */
public interface NodeConverter {

    /**
     * Primary node-type identifier this converter is registered under.
     */
    String type();

    /**
     * Coarse grouping (llm, chain, agent, tool, ...), used for statistics only.
     */
    String category();

    /**
     * Every type identifier this converter claims. Defaults to the primary type.
     */
    default List<String> handledTypes() {
        return List.of(type());
    }

    /**
     * Check if this converter accepts the given node.
     */
    default boolean canConvert(IrNode node) {
        return handledTypes().contains(node.type());
    }

    /**
     * Produce the fragments for a node.
     * @throws UnsupportedTargetException if the context's target language has no template
     */
    List<CodeFragment> convert(IrNode node, ConversionContext context);

    /**
     * Packages the generated code depends on.
     */
    List<String> dependencies(IrNode node, GenerationContext context);

    /**
     * Node versions this converter understands; "*" accepts every version.
     */
    default List<String> supportedVersions() {
        return List.of("*");
    }

    default boolean isDeprecated() {
        return false;
    }

    default Optional<String> replacementType() {
        return Optional.empty();
    }

    /**
     * Get the converter name for logging.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
