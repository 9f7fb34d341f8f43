package com.vidnyan.flowc.domain.ir;

import com.vidnyan.flowc.domain.document.FlowDocument;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the IR from a parsed flow document.
 * Never fails on odd input: missing optional fields get defaults and validity is left to the analyzer.
 */
public class FlowGraphBuilder {

    private static final String DEFAULT_CATEGORY = "utility";

    /**
     * Build the graph, preserving the document's node order.
     */
    public FlowGraph build(FlowDocument document) {
        List<IrNode> nodes = new ArrayList<>();
        int index = 0;
        for (FlowDocument.NodeEntry entry : document.nodes()) {
            if (entry != null) {
                nodes.add(toNode(entry, index++));
            }
        }

        List<Edge> edges = new ArrayList<>();
        for (FlowDocument.EdgeEntry entry : document.edges()) {
            if (entry != null) {
                edges.add(toEdge(entry));
            }
        }

        String name = document.name() != null && !document.name().isBlank() ? document.name() : "flow";
        return FlowGraph.of(name, nodes, edges);
    }

    private IrNode toNode(FlowDocument.NodeEntry entry, int index) {
        FlowDocument.NodeData data = entry.data();
        String id = firstNonBlank(entry.id(), data != null ? data.id() : null, "node_" + index);
        if (data == null) {
            return new IrNode(id, firstNonBlank(entry.type(), "unknown"), DEFAULT_CATEGORY, id,
                    null, List.of(), List.of(), List.of());
        }

        List<Anchor> inputs = toAnchors(data.inputAnchors(), true);
        List<Anchor> outputs = toAnchors(data.outputAnchors(), false);

        return new IrNode(
                id,
                firstNonBlank(data.name(), data.type(), entry.type(), "unknown"),
                firstNonBlank(data.category(), DEFAULT_CATEGORY),
                firstNonBlank(data.label(), data.name(), id),
                formatVersion(data.version()),
                toParameters(data, inputs),
                inputs,
                outputs
        );
    }

    private List<Anchor> toAnchors(List<FlowDocument.AnchorEntry> entries, boolean input) {
        if (entries == null) {
            return List.of();
        }
        List<Anchor> anchors = new ArrayList<>();
        for (FlowDocument.AnchorEntry entry : entries) {
            if (entry == null) {
                continue;
            }
            String name = firstNonBlank(entry.name(), entry.id(), "anchor" + anchors.size());
            String anchorId = firstNonBlank(entry.id(), name);
            if (input) {
                anchors.add(Anchor.input(anchorId, name, entry.type(),
                        !Boolean.TRUE.equals(entry.optional()),
                        Boolean.TRUE.equals(entry.list())));
            } else {
                anchors.add(Anchor.output(anchorId, name, entry.type()));
            }
        }
        return anchors;
    }

    /**
     * Declared parameters first (user value, else declared default), then undeclared inputs.
     * Inputs that name an anchor or hold a {{...}} reference are wiring, not settings.
     */
    private List<Parameter> toParameters(FlowDocument.NodeData data, List<Anchor> inputAnchors) {
        Map<String, Object> inputs = data.inputs() != null ? data.inputs() : Map.of();
        Set<String> anchorNames = new HashSet<>();
        inputAnchors.forEach(a -> anchorNames.add(a.name()));

        List<Parameter> parameters = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        if (data.inputParams() != null) {
            for (FlowDocument.InputParam param : data.inputParams()) {
                if (param == null || param.name() == null || !seen.add(param.name())) {
                    continue;
                }
                Object value = inputs.get(param.name());
                if (isSet(value) && !isReference(value)) {
                    parameters.add(new Parameter(param.name(), value, param.type(), false));
                } else if (param.defaultValue() != null) {
                    parameters.add(new Parameter(param.name(), param.defaultValue(), param.type(), true));
                }
            }
        }

        for (Map.Entry<String, Object> input : inputs.entrySet()) {
            String name = input.getKey();
            if (seen.contains(name) || anchorNames.contains(name)) {
                continue;
            }
            Object value = input.getValue();
            if (isSet(value) && !isReference(value)) {
                parameters.add(Parameter.of(name, value));
                seen.add(name);
            }
        }
        return parameters;
    }

    private static boolean isSet(Object value) {
        return value != null && !(value instanceof String s && s.isBlank());
    }

    private static boolean isReference(Object value) {
        if (value instanceof String s) {
            String trimmed = s.trim();
            return trimmed.startsWith("{{") && trimmed.endsWith("}}");
        }
        if (value instanceof List<?> list) {
            return !list.isEmpty() && list.stream().allMatch(FlowGraphBuilder::isReference);
        }
        return false;
    }

    private Edge toEdge(FlowDocument.EdgeEntry entry) {
        String source = firstNonBlank(entry.source(), "");
        String target = firstNonBlank(entry.target(), "");
        String sourceHandle = firstNonBlank(entry.sourceHandle(), "");
        String targetHandle = firstNonBlank(entry.targetHandle(), "");
        String id = firstNonBlank(entry.id(), source + ":" + sourceHandle + "->" + target + ":" + targetHandle);
        return new Edge(id, source, sourceHandle, target, targetHandle);
    }

    private static String formatVersion(Object version) {
        if (version == null) {
            return null;
        }
        if (version instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue())) {
            return String.valueOf(n.longValue());
        }
        return String.valueOf(version);
    }

    private static String firstNonBlank(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                return candidate;
            }
        }
        return null;
    }
}
