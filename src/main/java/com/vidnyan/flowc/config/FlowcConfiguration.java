package com.vidnyan.flowc.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.flowc.CompilerProperties;
import com.vidnyan.flowc.application.emit.CodeEmitter;
import com.vidnyan.flowc.application.lowering.LoweringEngine;
import com.vidnyan.flowc.domain.analysis.GraphAnalyzer;
import com.vidnyan.flowc.domain.converter.ConverterRegistry;
import com.vidnyan.flowc.domain.converter.NodeConverter;
import com.vidnyan.flowc.domain.ir.FlowGraphBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Spring configuration for flowc components.
 * Wires together the clean architecture components.
 */
@Slf4j
@Configuration
public class FlowcConfiguration {

    /**
     * ObjectMapper for JSON parsing.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    /**
     * Registry built once from every converter component plus the configured aliases.
     */
    @Bean
    public ConverterRegistry converterRegistry(List<NodeConverter> converters, CompilerProperties properties) {
        ConverterRegistry registry = ConverterRegistry.builder()
                .registerAll(converters)
                .aliases(properties.getRegistry().getAliases())
                .build();

        ConverterRegistry.Stats stats = registry.stats();
        log.info("Registered {} node converters ({} aliases, {} deprecated):",
                stats.converterCount(), stats.aliasCount(), stats.deprecatedCount());
        registry.converters().forEach(c -> log.info("  - {} [{}] {}", c.type(), c.category(), c.getName()));
        return registry;
    }

    @Bean
    public FlowGraphBuilder flowGraphBuilder() {
        return new FlowGraphBuilder();
    }

    @Bean
    public GraphAnalyzer graphAnalyzer() {
        return new GraphAnalyzer();
    }

    @Bean
    public LoweringEngine loweringEngine(ConverterRegistry registry, CompilerProperties properties) {
        return new LoweringEngine(registry, properties.getLowering().getParallelism());
    }

    @Bean
    public CodeEmitter codeEmitter() {
        return new CodeEmitter();
    }
}
