package com.vidnyan.flowc.adapter.out.document;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.flowc.application.port.out.FlowDocumentLoader;
import com.vidnyan.flowc.domain.document.FlowDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads flow documents exported by the visual editor as JSON.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonFlowDocumentLoader implements FlowDocumentLoader {

    private final ObjectMapper objectMapper;

    @Override
    public FlowDocument load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new FlowDocumentException("Flow file not found: " + path);
        }
        try {
            String content = Files.readString(path);
            FlowDocument document = parse(content, baseName(path));
            log.info("Loaded flow {}: {} nodes, {} edges", path, document.nodes().size(), document.edges().size());
            return document;
        } catch (IOException e) {
            throw new FlowDocumentException("Failed to read flow file " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public FlowDocument parse(String content, String name) {
        if (content == null || content.isBlank()) {
            throw new FlowDocumentException("Flow document is empty");
        }
        FlowDto dto;
        try {
            dto = objectMapper.readValue(content, FlowDto.class);
        } catch (JsonProcessingException e) {
            throw new FlowDocumentException("Invalid flow JSON: " + e.getOriginalMessage(), e);
        }
        if (dto == null) {
            throw new FlowDocumentException("Flow document is empty");
        }
        return mapToDocument(dto, dto.name != null && !dto.name.isBlank() ? dto.name : name);
    }

    private FlowDocument mapToDocument(FlowDto dto, String name) {
        List<FlowDocument.NodeEntry> nodes = dto.nodes == null ? List.of() : dto.nodes.stream()
                .filter(Objects::nonNull)
                .map(this::mapNode)
                .toList();
        List<FlowDocument.EdgeEntry> edges = dto.edges == null ? List.of() : dto.edges.stream()
                .filter(Objects::nonNull)
                .map(e -> new FlowDocument.EdgeEntry(e.id, e.source, e.sourceHandle, e.target, e.targetHandle))
                .toList();
        return new FlowDocument(name, nodes, edges);
    }

    private FlowDocument.NodeEntry mapNode(NodeDto dto) {
        FlowDocument.Position position = dto.position != null
                ? new FlowDocument.Position(dto.position.x, dto.position.y)
                : null;
        return new FlowDocument.NodeEntry(dto.id, dto.type, position, mapData(dto.data));
    }

    private FlowDocument.NodeData mapData(NodeDataDto dto) {
        if (dto == null) return null;
        return new FlowDocument.NodeData(
                dto.id,
                dto.label,
                dto.name,
                dto.type,
                dto.category,
                dto.version,
                dto.inputParams == null ? List.of() : dto.inputParams.stream()
                        .filter(Objects::nonNull)
                        .map(p -> new FlowDocument.InputParam(p.name, p.label, p.type, p.optional, p.defaultValue))
                        .toList(),
                mapAnchors(dto.inputAnchors),
                mapAnchors(dto.outputAnchors),
                dto.inputs != null ? dto.inputs : Map.of()
        );
    }

    private List<FlowDocument.AnchorEntry> mapAnchors(List<AnchorDto> anchors) {
        if (anchors == null) return List.of();
        return anchors.stream()
                .filter(Objects::nonNull)
                .map(a -> new FlowDocument.AnchorEntry(a.id, a.name, a.label, a.type, a.optional, a.list))
                .toList();
    }

    private static String baseName(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    // DTO classes for JSON deserialization
    static class FlowDto {
        public String name;
        public List<NodeDto> nodes;
        public List<EdgeDto> edges;
    }

    static class NodeDto {
        public String id;
        public String type;
        public PositionDto position;
        public NodeDataDto data;
    }

    static class PositionDto {
        public double x;
        public double y;
    }

    static class NodeDataDto {
        public String id;
        public String label;
        public String name;
        public String type;
        public String category;
        public Object version;
        public List<InputParamDto> inputParams;
        public List<AnchorDto> inputAnchors;
        public List<AnchorDto> outputAnchors;
        public Map<String, Object> inputs;
    }

    static class InputParamDto {
        public String name;
        public String label;
        public String type;
        public Boolean optional;
        @JsonProperty("default")
        public Object defaultValue;
    }

    static class AnchorDto {
        public String id;
        public String name;
        public String label;
        public String type;
        public Boolean optional;
        public Boolean list;
    }

    static class EdgeDto {
        public String id;
        public String source;
        public String sourceHandle;
        public String target;
        public String targetHandle;
    }
}
