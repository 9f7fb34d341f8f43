package com.vidnyan.flowc.adapter.in.web;

import com.vidnyan.flowc.CompilerProperties;
import com.vidnyan.flowc.TestFlows;
import com.vidnyan.flowc.adapter.out.document.JsonFlowDocumentLoader;
import com.vidnyan.flowc.application.emit.CodeEmitter;
import com.vidnyan.flowc.application.lowering.LoweringEngine;
import com.vidnyan.flowc.application.service.FlowConversionService;
import com.vidnyan.flowc.config.FlowcConfiguration;
import com.vidnyan.flowc.domain.analysis.GraphAnalyzer;
import com.vidnyan.flowc.domain.converter.ConverterRegistry;
import com.vidnyan.flowc.domain.ir.FlowGraphBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ConversionControllerTest {

    private MockMvc mockMvc;
    private String flowJson;

    @BeforeEach
    void setUp() throws Exception {
        ConverterRegistry registry = TestFlows.registry();
        FlowConversionService service = new FlowConversionService(new FlowGraphBuilder(), new GraphAnalyzer(),
                registry, new LoweringEngine(registry), new CodeEmitter());
        JsonFlowDocumentLoader loader = new JsonFlowDocumentLoader(new FlowcConfiguration().objectMapper());
        mockMvc = MockMvcBuilders
                .standaloneSetup(new ConversionController(service, loader, new CompilerProperties()))
                .build();
        flowJson = Files.readString(Path.of(getClass().getResource("/flows/llm-chain.json").toURI()));
    }

    @Test
    void convert_ShouldReturnGeneratedSource() throws Exception {
        // Arrange
        String body = "{\"name\": \"summary\", \"flow\": " + flowJson + "}";

        // Act & Assert
        mockMvc.perform(post("/api/convert").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.source", containsString("import { LLMChain } from 'langchain/chains';")))
                .andExpect(jsonPath("$.dependencies[0]").value("@langchain/core"))
                .andExpect(jsonPath("$.stats.loweredNodes").value(3))
                .andExpect(jsonPath("$.report.findings").isEmpty());
    }

    @Test
    void convert_ShouldApplyRequestOptions() throws Exception {
        // Arrange
        String body = "{\"flow\": " + flowJson + ", \"options\": {"
                + "\"target\": \"javascript\", \"moduleStyle\": \"cjs\", \"semicolons\": false, \"includeTests\": true}}";

        // Act & Assert
        mockMvc.perform(post("/api/convert").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source", containsString("const { LLMChain } = require('langchain/chains')\n")))
                .andExpect(jsonPath("$.source", not(containsString(";"))))
                .andExpect(jsonPath("$.testSource", containsString("require('./index')")));
    }

    @Test
    void validate_ShouldReturnReport() throws Exception {
        // Arrange
        String body = "{\"flow\": " + flowJson + "}";

        // Act & Assert
        mockMvc.perform(post("/api/convert/validate").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.complexity").value("SIMPLE"))
                .andExpect(jsonPath("$.coverage.supportedNodeCount").value(3));
    }

    @Test
    void validate_ShouldAcceptNullNodeEntries() throws Exception {
        // Arrange
        String body = "{\"flow\": {\"nodes\": [null], \"edges\": [null]}}";

        // Act & Assert
        mockMvc.perform(post("/api/convert/validate").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.complexity").value("SIMPLE"))
                .andExpect(jsonPath("$.coverage.supportedNodeCount").value(0));
    }

    @Test
    void convert_ShouldRejectMissingFlow() throws Exception {
        // Act & Assert
        mockMvc.perform(post("/api/convert").contentType(MediaType.APPLICATION_JSON).content("{\"name\": \"empty\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Request carries no flow"));
    }

    @Test
    void convert_ShouldRejectUnknownTarget() throws Exception {
        // Arrange
        String body = "{\"flow\": " + flowJson + ", \"options\": {\"target\": \"cobol\"}}";

        // Act & Assert
        mockMvc.perform(post("/api/convert").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("cobol")));
    }
}
