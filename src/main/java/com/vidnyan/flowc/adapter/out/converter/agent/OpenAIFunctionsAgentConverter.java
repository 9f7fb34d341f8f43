package com.vidnyan.flowc.adapter.out.converter.agent;

import com.vidnyan.flowc.domain.codegen.CodeFragment;
import com.vidnyan.flowc.domain.codegen.GenerationContext;
import com.vidnyan.flowc.domain.codegen.ModuleStyle;
import com.vidnyan.flowc.domain.converter.ConversionContext;
import com.vidnyan.flowc.domain.converter.ConverterSupport;
import com.vidnyan.flowc.domain.converter.NodeConverter;
import com.vidnyan.flowc.domain.ir.IrNode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Legacy OpenAI functions agent, superseded by the tool-calling agent.
 * Its factory is async, so the generated module relies on top-level await.
 */
@Component
public class OpenAIFunctionsAgentConverter implements NodeConverter {

    @Override
    public String type() {
        return "openAIFunctionsAgent";
    }

    @Override
    public String category() {
        return "agent";
    }

    @Override
    public boolean isDeprecated() {
        return true;
    }

    @Override
    public Optional<String> replacementType() {
        return Optional.of("toolAgent");
    }

    @Override
    public List<CodeFragment> convert(IrNode node, ConversionContext context) {
        ConverterSupport.requireScriptTarget(node, context);
        if (context.generation().moduleStyle() == ModuleStyle.CJS) {
            throw new IllegalStateException(type() + " needs ES module output for top-level await");
        }
        return AgentTemplates.executor(node, context, "createOpenAIFunctionsAgent", true);
    }

    @Override
    public List<String> dependencies(IrNode node, GenerationContext context) {
        return List.of("langchain", "@langchain/core", "@langchain/openai");
    }
}
