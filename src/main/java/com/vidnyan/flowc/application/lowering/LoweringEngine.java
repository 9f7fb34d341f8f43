package com.vidnyan.flowc.application.lowering;

import com.vidnyan.flowc.domain.analysis.Finding;
import com.vidnyan.flowc.domain.analysis.FindingKind;
import com.vidnyan.flowc.domain.codegen.CodeFragment;
import com.vidnyan.flowc.domain.codegen.GenerationContext;
import com.vidnyan.flowc.domain.converter.ConversionContext;
import com.vidnyan.flowc.domain.converter.ConverterRegistry;
import com.vidnyan.flowc.domain.converter.InputBindings;
import com.vidnyan.flowc.domain.converter.NodeConverter;
import com.vidnyan.flowc.domain.graph.DependencyGraph;
import com.vidnyan.flowc.domain.ir.Anchor;
import com.vidnyan.flowc.domain.ir.Edge;
import com.vidnyan.flowc.domain.ir.FlowGraph;
import com.vidnyan.flowc.domain.ir.IrNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Stream;

/**
 * Lowers every node of a flow graph into placed code fragments.
 * <p>
 * Nodes are dispatched in emission order. A node without a converter contributes nothing;
 * a converter that throws is recorded as a lowering failure and the run continues.
 * Lowering may run on a worker pool, results are always joined in emission order.
 */
@Slf4j
public class LoweringEngine {

    private final ConverterRegistry registry;
    private final int parallelism;

    public LoweringEngine(ConverterRegistry registry) {
        this(registry, 1);
    }

    public LoweringEngine(ConverterRegistry registry, int parallelism) {
        this.registry = registry;
        this.parallelism = Math.max(1, parallelism);
    }

    public LoweringResult lower(FlowGraph graph, GenerationContext context) {
        DependencyGraph dependencies = DependencyGraph.build(graph);
        EmissionOrder order = EmissionOrder.compute(dependencies);
        IdentifierTable identifiers = IdentifierTable.assign(graph);
        List<Finding> findings = new ArrayList<>();

        if (order.hasFallback()) {
            List<String> fallback = List.copyOf(order.fallbackNodeIds());
            log.warn("Nodes on a cycle are emitted in document order: {}", fallback);
            findings.add(Finding.builder(FindingKind.CYCLE_FALLBACK)
                    .message("Nodes " + fallback + " form a cycle and are emitted in document order")
                    .nodeId(fallback.get(0))
                    .context("nodeIds", fallback)
                    .build());
        }

        List<CodeFragment> crossCutting = CrossCuttingFragments.create(context);
        List<NodeOutcome> outcomes = dispatch(graph, context, order, identifiers);

        // converters pick their imports independently of variable names, one renaming pass settles
        Set<String> imported = importedSymbols(crossCutting, outcomes);
        if (identifiers.clashesWith(imported)) {
            Set<String> shadowed = new TreeSet<>(identifiers.declaredNames());
            shadowed.retainAll(imported);
            log.debug("Renaming identifiers that shadow imported symbols {}", shadowed);
            identifiers = IdentifierTable.assign(graph, imported);
            outcomes = dispatch(graph, context, order, identifiers);
        }

        List<CodeFragment> placed = new ArrayList<>(crossCutting);
        Set<String> packages = new TreeSet<>();
        List<String> lowered = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        Map<String, Integer> highestPriority = new HashMap<>();

        for (int index = 0; index < outcomes.size(); index++) {
            NodeOutcome outcome = outcomes.get(index);
            String nodeId = outcome.nodeId();
            // a consumer never sorts ahead of anything its producers emitted
            int floor = dependencies.getPredecessors(nodeId).stream()
                    .filter(highestPriority::containsKey)
                    .mapToInt(highestPriority::get)
                    .max()
                    .orElse(0);
            int highest = floor;
            int sequence = 0;
            for (CodeFragment fragment : outcome.fragments()) {
                int priority = fragment.isImport() ? fragment.priority() : Math.max(fragment.priority(), floor);
                if (!fragment.isImport()) {
                    highest = Math.max(highest, priority);
                }
                placed.add(fragment.placed(index, sequence++, priority));
            }
            highestPriority.put(nodeId, highest);
            packages.addAll(outcome.packages());

            if (outcome.failure() != null) {
                failed.add(nodeId);
                findings.add(outcome.failure());
            } else if (outcome.converted()) {
                lowered.add(nodeId);
            }
        }

        for (CodeFragment fragment : placed) {
            packages.addAll(fragment.requiredPackages());
        }

        log.debug("Lowered {} of {} nodes into {} fragments ({} failed)",
                lowered.size(), graph.nodeCount(), placed.size(), failed.size());
        return new LoweringResult(placed, packages, findings, order, identifiers, lowered, failed);
    }

    private static Set<String> importedSymbols(List<CodeFragment> crossCutting, List<NodeOutcome> outcomes) {
        Set<String> symbols = new HashSet<>();
        Stream.concat(crossCutting.stream(), outcomes.stream().flatMap(o -> o.fragments().stream()))
                .filter(CodeFragment::isImport)
                .flatMap(fragment -> fragment.importSpecs().stream())
                .forEach(spec -> symbols.addAll(spec.symbols()));
        return symbols;
    }

    private List<NodeOutcome> dispatch(FlowGraph graph, GenerationContext context,
                                       EmissionOrder order, IdentifierTable identifiers) {
        List<IrNode> nodes = order.nodeIds().stream()
                .map(id -> graph.getNode(id).orElseThrow())
                .toList();

        if (parallelism == 1 || nodes.size() < 2) {
            return nodes.stream()
                    .map(node -> lowerNode(graph, node, context, identifiers))
                    .toList();
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(parallelism, nodes.size()));
        try {
            List<CompletableFuture<NodeOutcome>> futures = nodes.stream()
                    .map(node -> CompletableFuture.supplyAsync(
                            () -> lowerNode(graph, node, context, identifiers), pool))
                    .toList();
            return futures.stream().map(CompletableFuture::join).toList();
        } finally {
            pool.shutdown();
        }
    }

    private NodeOutcome lowerNode(FlowGraph graph, IrNode node, GenerationContext context,
                                  IdentifierTable identifiers) {
        Optional<NodeConverter> found = registry.find(node.type());
        if (found.isEmpty()) {
            log.debug("No converter for node {} ({}), skipping", node.id(), node.type());
            return NodeOutcome.skipped(node.id());
        }

        NodeConverter converter = found.get();
        if (!registry.accepts(converter, node)) {
            log.warn("{} declined node {} ({})", converter.getName(), node.id(), node.type());
            return NodeOutcome.failed(node.id(), failure(node, converter,
                    converter.getName() + " cannot convert node of type '" + node.type() + "'"));
        }

        ConversionContext conversion = new ConversionContext(
                context, identifiers.identifierFor(node.id()), bindings(graph, node, identifiers));
        try {
            List<CodeFragment> fragments = converter.convert(node, conversion);
            List<String> packages = converter.dependencies(node, context);
            log.debug("  {} -> {} fragments via {}", node.id(), fragments.size(), converter.getName());
            return new NodeOutcome(node.id(), true, fragments, packages, null);
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Error lowering node {} ({}): {}", node.id(), node.type(), message);
            return NodeOutcome.failed(node.id(), failure(node, converter, message));
        }
    }

    /**
     * Upstream identifiers per input anchor name, ordered by the source node's document position.
     */
    private InputBindings bindings(FlowGraph graph, IrNode node, IdentifierTable identifiers) {
        Map<String, List<Edge>> byAnchor = new LinkedHashMap<>();
        for (Edge edge : graph.incomingEdges(node.id())) {
            if (!graph.containsNode(edge.sourceNodeId())) {
                continue;
            }
            String anchorName = node.findInput(edge.targetAnchorId())
                    .map(Anchor::name)
                    .orElse(edge.targetAnchorId());
            byAnchor.computeIfAbsent(anchorName, k -> new ArrayList<>()).add(edge);
        }

        Map<String, List<String>> bindings = new LinkedHashMap<>();
        byAnchor.forEach((anchor, edges) -> {
            Set<String> names = new LinkedHashSet<>();
            edges.stream()
                    .sorted(Comparator.comparingInt(e -> graph.documentIndex(e.sourceNodeId())))
                    .forEach(e -> names.add(identifiers.identifierFor(e.sourceNodeId())));
            bindings.put(anchor, List.copyOf(names));
        });
        return InputBindings.of(bindings);
    }

    private static Finding failure(IrNode node, NodeConverter converter, String message) {
        return Finding.builder(FindingKind.LOWERING_FAILURE)
                .message("Failed to lower node: " + message)
                .nodeId(node.id())
                .context("type", node.type())
                .context("converter", converter.getName())
                .build();
    }

    private record NodeOutcome(
        String nodeId,
        boolean converted,
        List<CodeFragment> fragments,
        List<String> packages,
        Finding failure
    ) {
        static NodeOutcome skipped(String nodeId) {
            return new NodeOutcome(nodeId, false, List.of(), List.of(), null);
        }

        static NodeOutcome failed(String nodeId, Finding failure) {
            return new NodeOutcome(nodeId, false, List.of(), List.of(), failure);
        }
    }
}
