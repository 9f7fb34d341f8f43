package com.vidnyan.flowc.adapter.out.converter.agent;

import com.vidnyan.flowc.domain.codegen.CodeFragment;
import com.vidnyan.flowc.domain.codegen.GenerationContext;
import com.vidnyan.flowc.domain.converter.ConversionContext;
import com.vidnyan.flowc.domain.converter.ConverterSupport;
import com.vidnyan.flowc.domain.converter.NodeConverter;
import com.vidnyan.flowc.domain.ir.IrNode;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Tool-calling agent. Tools connected to the list input are passed in document order.
 */
@Component
public class ToolAgentConverter implements NodeConverter {

    @Override
    public String type() {
        return "toolAgent";
    }

    @Override
    public String category() {
        return "agent";
    }

    @Override
    public List<String> supportedVersions() {
        return List.of("1", "2");
    }

    @Override
    public List<CodeFragment> convert(IrNode node, ConversionContext context) {
        ConverterSupport.requireScriptTarget(node, context);
        return AgentTemplates.executor(node, context, "createToolCallingAgent", false);
    }

    @Override
    public List<String> dependencies(IrNode node, GenerationContext context) {
        return List.of("langchain", "@langchain/core");
    }
}
