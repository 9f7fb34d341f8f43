package com.vidnyan.flowc.domain.analysis;

import com.vidnyan.flowc.domain.converter.ConverterRegistry;
import com.vidnyan.flowc.domain.converter.NodeConverter;
import com.vidnyan.flowc.domain.graph.DependencyGraph;
import com.vidnyan.flowc.domain.ir.Anchor;
import com.vidnyan.flowc.domain.ir.Edge;
import com.vidnyan.flowc.domain.ir.FlowGraph;
import com.vidnyan.flowc.domain.ir.IrNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static analysis over the IR: reference integrity, arity, cycles,
 * converter coverage, required-input completeness and version metadata.
 * Stateless; one instance serves concurrent runs.
 */
@Slf4j
public class GraphAnalyzer {

    /**
     * Run every check and assemble the full report.
     */
    public ConversionReport analyze(FlowGraph graph, ConverterRegistry registry) {
        log.debug("Analyzing graph '{}': {} nodes, {} edges",
                graph.name(), graph.nodeCount(), graph.edgeCount());

        ConversionReport.Builder report = ConversionReport.builder();
        report.findings(validateStructure(graph).findings());

        List<Cycle> cycles = detectCycles(graph);
        report.cycles(cycles);
        for (Cycle cycle : cycles) {
            report.finding(Finding.builder(FindingKind.CYCLE)
                    .message("Cycle detected: " + cycle.format())
                    .nodeId(cycle.path().get(0))
                    .context("path", cycle.path())
                    .build());
        }

        CoverageReport coverage = resolveConverters(graph, registry);
        report.coverage(coverage);
        for (String type : coverage.unsupportedTypes()) {
            List<String> nodeIds = graph.nodeList().stream()
                    .filter(n -> type.equals(n.type()))
                    .map(IrNode::id)
                    .toList();
            report.finding(Finding.builder(FindingKind.UNSUPPORTED_NODE_TYPE)
                    .message("No converter registered for node type '" + type + "'")
                    .nodeId(nodeIds.get(0))
                    .context("type", type)
                    .context("nodeIds", nodeIds)
                    .build());
        }

        report.findings(checkRequiredInputs(graph, registry));
        report.findings(checkVersions(graph, registry));

        GraphStats stats = computeStats(graph);
        report.stats(stats);
        if (graph.nodeCount() > 1) {
            for (String isolated : stats.isolatedNodes()) {
                report.finding(Finding.builder(FindingKind.ISOLATED_NODE)
                        .message("Node is not connected to any other node")
                        .nodeId(isolated)
                        .build());
            }
        }

        report.complexity(classifyComplexity(graph));
        ConversionReport result = report.build();
        log.debug("Analysis of '{}' produced {} findings ({} structural)",
                graph.name(), result.findings().size(), result.structuralErrors().size());
        return result;
    }

    /**
     * Edge-endpoint resolution, anchor existence and direction, and list/single arity.
     * Every finding here is structural.
     */
    public ConversionReport validateStructure(FlowGraph graph) {
        List<Finding> findings = new ArrayList<>();

        for (String duplicate : graph.duplicateNodeIds()) {
            findings.add(Finding.builder(FindingKind.DUPLICATE_NODE_ID)
                    .message("Node id '" + duplicate + "' is declared more than once")
                    .nodeId(duplicate)
                    .build());
        }

        for (Edge edge : graph.edges()) {
            validateSourceEndpoint(graph, edge).ifPresent(findings::add);
            validateTargetEndpoint(graph, edge).ifPresent(findings::add);
        }

        for (IrNode node : graph.nodeList()) {
            for (Anchor input : node.inputs()) {
                if (input.list()) {
                    continue;
                }
                List<Edge> incoming = graph.incomingEdges(node.id(), input.id());
                if (incoming.size() > 1) {
                    findings.add(Finding.builder(FindingKind.ARITY_VIOLATION)
                            .message("Input '" + input.name() + "' accepts one connection but has "
                                    + incoming.size())
                            .nodeId(node.id())
                            .edgeId(incoming.get(1).id())
                            .context("anchor", input.id())
                            .context("edges", incoming.stream().map(Edge::id).toList())
                            .build());
                }
            }
        }

        return ConversionReport.builder()
                .findings(findings)
                .complexity(classifyComplexity(graph))
                .build();
    }

    private Optional<Finding> validateSourceEndpoint(FlowGraph graph, Edge edge) {
        if (isBlank(edge.sourceNodeId())) {
            return Optional.of(edgeFinding(FindingKind.DANGLING_EDGE, edge,
                    "Edge has no source node"));
        }
        Optional<IrNode> source = graph.getNode(edge.sourceNodeId());
        if (source.isEmpty()) {
            return Optional.of(edgeFinding(FindingKind.DANGLING_EDGE, edge,
                    "Edge references missing source node '" + edge.sourceNodeId() + "'"));
        }
        IrNode node = source.get();
        if (node.findOutput(edge.sourceAnchorId()).isPresent()) {
            return Optional.empty();
        }
        if (node.findInput(edge.sourceAnchorId()).isPresent()) {
            return Optional.of(edgeFinding(FindingKind.ANCHOR_DIRECTION, edge,
                    "Source anchor '" + edge.sourceAnchorId() + "' on node '" + node.id()
                            + "' is an input anchor"));
        }
        return Optional.of(edgeFinding(FindingKind.UNKNOWN_ANCHOR, edge,
                "Node '" + node.id() + "' declares no output anchor '" + edge.sourceAnchorId() + "'"));
    }

    private Optional<Finding> validateTargetEndpoint(FlowGraph graph, Edge edge) {
        if (isBlank(edge.targetNodeId())) {
            return Optional.of(edgeFinding(FindingKind.DANGLING_EDGE, edge,
                    "Edge has no target node"));
        }
        Optional<IrNode> target = graph.getNode(edge.targetNodeId());
        if (target.isEmpty()) {
            return Optional.of(edgeFinding(FindingKind.DANGLING_EDGE, edge,
                    "Edge references missing target node '" + edge.targetNodeId() + "'"));
        }
        IrNode node = target.get();
        if (node.findInput(edge.targetAnchorId()).isPresent()) {
            return Optional.empty();
        }
        if (node.findOutput(edge.targetAnchorId()).isPresent()) {
            return Optional.of(edgeFinding(FindingKind.ANCHOR_DIRECTION, edge,
                    "Target anchor '" + edge.targetAnchorId() + "' on node '" + node.id()
                            + "' is an output anchor"));
        }
        return Optional.of(edgeFinding(FindingKind.UNKNOWN_ANCHOR, edge,
                "Node '" + node.id() + "' declares no input anchor '" + edge.targetAnchorId() + "'"));
    }

    /**
     * Every back-edge found by a three-color DFS, as a path from the repeated node back to itself.
     */
    public List<Cycle> detectCycles(FlowGraph graph) {
        return DependencyGraph.build(graph).findCycles().stream()
                .map(Cycle::new)
                .toList();
    }

    /**
     * Coverage of node types by registered converters, counted per node.
     */
    public CoverageReport resolveConverters(FlowGraph graph, ConverterRegistry registry) {
        Set<String> supported = new LinkedHashSet<>();
        Set<String> unsupported = new LinkedHashSet<>();
        int supportedNodes = 0;
        for (IrNode node : graph.nodeList()) {
            if (registry.hasConverter(node.type())) {
                supported.add(node.type());
                supportedNodes++;
            } else {
                unsupported.add(node.type());
            }
        }
        return new CoverageReport(graph.nodeCount(), supportedNodes,
                List.copyOf(supported), List.copyOf(unsupported));
    }

    /**
     * Required inputs with nothing connected, on nodes a converter would lower.
     */
    public List<Finding> checkRequiredInputs(FlowGraph graph, ConverterRegistry registry) {
        List<Finding> findings = new ArrayList<>();
        for (IrNode node : graph.nodeList()) {
            if (!registry.hasConverter(node.type())) {
                continue;
            }
            for (Anchor input : node.inputs()) {
                if (input.required() && graph.incomingEdges(node.id(), input.id()).isEmpty()) {
                    findings.add(Finding.builder(FindingKind.MISSING_REQUIRED_INPUT)
                            .message("Required input '" + input.name() + "' is not connected")
                            .nodeId(node.id())
                            .context("anchor", input.id())
                            .build());
                }
            }
        }
        return findings;
    }

    /**
     * Deprecated converters and declared versions outside a converter's supported list.
     */
    public List<Finding> checkVersions(FlowGraph graph, ConverterRegistry registry) {
        List<Finding> findings = new ArrayList<>();
        for (IrNode node : graph.nodeList()) {
            Optional<NodeConverter> found = registry.find(node.type());
            if (found.isEmpty()) {
                continue;
            }
            NodeConverter converter = found.get();
            if (converter.isDeprecated()) {
                Map<String, Object> context = new LinkedHashMap<>();
                converter.replacementType().ifPresent(r -> context.put("replacementType", r));
                String hint = converter.replacementType()
                        .map(r -> "; use '" + r + "' instead")
                        .orElse("");
                findings.add(Finding.builder(FindingKind.DEPRECATED_NODE_TYPE)
                        .message("Node type '" + node.type() + "' is deprecated" + hint)
                        .nodeId(node.id())
                        .context(context)
                        .build());
            }
            List<String> versions = converter.supportedVersions();
            if (node.version() != null && !versions.contains("*") && !versions.contains(node.version())) {
                findings.add(Finding.builder(FindingKind.UNSUPPORTED_VERSION)
                        .message("Version " + node.version() + " of '" + node.type()
                                + "' is not supported (supported: " + String.join(", ", versions) + ")")
                        .nodeId(node.id())
                        .context("version", node.version())
                        .context("supportedVersions", versions)
                        .build());
            }
        }
        return findings;
    }

    public Complexity classifyComplexity(FlowGraph graph) {
        return Complexity.classify(graph.nodeCount(), graph.edgeCount());
    }

    public GraphStats computeStats(FlowGraph graph) {
        Map<String, Integer> types = new LinkedHashMap<>();
        Map<String, Integer> categories = new LinkedHashMap<>();
        List<String> entryPoints = new ArrayList<>();
        List<String> exitPoints = new ArrayList<>();
        List<String> isolated = new ArrayList<>();

        DependencyGraph dependencies = DependencyGraph.build(graph);
        for (IrNode node : graph.nodeList()) {
            types.merge(node.type(), 1, Integer::sum);
            categories.merge(node.category(), 1, Integer::sum);
            boolean hasIn = !dependencies.getPredecessors(node.id()).isEmpty();
            boolean hasOut = !dependencies.getSuccessors(node.id()).isEmpty();
            if (!hasIn && !hasOut) {
                isolated.add(node.id());
            } else if (!hasIn) {
                entryPoints.add(node.id());
            } else if (!hasOut) {
                exitPoints.add(node.id());
            }
        }

        double averageDegree = graph.nodeCount() == 0
                ? 0.0
                : (2.0 * graph.edgeCount()) / graph.nodeCount();
        return new GraphStats(graph.nodeCount(), graph.edgeCount(), averageDegree,
                types, categories, entryPoints, exitPoints, isolated);
    }

    private static Finding edgeFinding(FindingKind kind, Edge edge, String message) {
        return Finding.builder(kind)
                .message(message)
                .edgeId(edge.id())
                .context("edge", edge.format())
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
