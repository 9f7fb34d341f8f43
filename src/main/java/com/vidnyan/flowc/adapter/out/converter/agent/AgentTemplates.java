package com.vidnyan.flowc.adapter.out.converter.agent;

import com.vidnyan.flowc.domain.codegen.CodeFragment;
import com.vidnyan.flowc.domain.codegen.CodeStyle;
import com.vidnyan.flowc.domain.codegen.FragmentPriority;
import com.vidnyan.flowc.domain.converter.ConversionContext;
import com.vidnyan.flowc.domain.converter.ConverterSupport;
import com.vidnyan.flowc.domain.converter.InputBindings;
import com.vidnyan.flowc.domain.ir.IrNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Code shared by the agent converters: prompt, tool list and executor wiring.
 */
final class AgentTemplates {

    static final String AGENTS_MODULE = "langchain/agents";
    static final String PROMPTS_MODULE = "@langchain/core/prompts";
    static final String DEFAULT_SYSTEM_MESSAGE = "You are a helpful AI assistant.";

    private AgentTemplates() {
    }

    /**
     * Import, executor initialization and run function for an agent created by {@code factory}.
     */
    static List<CodeFragment> executor(IrNode node, ConversionContext context,
                                       String factory, boolean awaitFactory) {
        CodeStyle style = context.style();
        InputBindings inputs = context.inputs();
        String tools = ConverterSupport.arrayLiteral(inputs.all("tools"));
        String llm = inputs.single("model").orElse(ConverterSupport.MISSING_INPUT);
        boolean withMemory = inputs.has("memory");

        Map<String, String> agentOptions = new LinkedHashMap<>();
        agentOptions.put("llm", llm);
        agentOptions.put("tools", tools);
        agentOptions.put("prompt", prompt(node, style, withMemory, 2));
        String agent = (awaitFactory ? "await " : "") + factory + "("
                + ConverterSupport.objectLiteral(agentOptions, style, 1) + ")";

        Map<String, String> executorOptions = new LinkedHashMap<>();
        executorOptions.put("agent", agent);
        executorOptions.put("tools", tools);
        inputs.single("memory").ifPresent(memory -> executorOptions.put("memory", memory));
        ConverterSupport.putIfPresent(executorOptions, "maxIterations", node.intParam("maxIterations"), style);

        List<CodeFragment> fragments = new ArrayList<>();
        fragments.add(ConverterSupport.importFragment(node, AGENTS_MODULE, "AgentExecutor", factory));
        fragments.add(ConverterSupport.importFragment(node, PROMPTS_MODULE, "ChatPromptTemplate", "MessagesPlaceholder"));
        fragments.add(ConverterSupport.initialization(node, context, FragmentPriority.AGENT,
                "new AgentExecutor(" + ConverterSupport.objectLiteral(executorOptions, style, 0) + ")"));
        fragments.add(ConverterSupport.runFunction(node, context, context.variableName()));
        return fragments;
    }

    static String prompt(IrNode node, CodeStyle style, boolean withMemory, int depth) {
        String system = node.stringParam("systemMessage").orElse(DEFAULT_SYSTEM_MESSAGE);
        List<String> messages = new ArrayList<>();
        messages.add("[" + style.quote("system") + ", " + style.quote(system) + "]");
        if (withMemory) {
            messages.add(placeholder("chat_history", style));
        }
        messages.add("[" + style.quote("human") + ", " + style.quote("{input}") + "]");
        messages.add(placeholder("agent_scratchpad", style));

        StringBuilder sb = new StringBuilder("ChatPromptTemplate.fromMessages([\n");
        for (int i = 0; i < messages.size(); i++) {
            sb.append(style.indent(depth + 1)).append(messages.get(i));
            if (i < messages.size() - 1 || style.trailingCommas()) {
                sb.append(',');
            }
            sb.append('\n');
        }
        return sb.append(style.indent(depth)).append("])").toString();
    }

    private static String placeholder(String variable, CodeStyle style) {
        return "new MessagesPlaceholder(" + style.quote(variable) + ")";
    }
}
