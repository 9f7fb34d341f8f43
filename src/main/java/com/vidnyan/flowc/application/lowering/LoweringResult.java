package com.vidnyan.flowc.application.lowering;

import com.vidnyan.flowc.domain.analysis.Finding;
import com.vidnyan.flowc.domain.codegen.CodeFragment;

import java.util.List;
import java.util.Set;

/**
 * Placed fragments of one run, plus what lowering learned along the way.
 */
public record LoweringResult(
    List<CodeFragment> fragments,     // cross-cutting first, then nodes in emission order
    Set<String> dependencies,         // sorted
    List<Finding> findings,
    EmissionOrder order,
    IdentifierTable identifiers,
    List<String> loweredNodeIds,
    List<String> failedNodeIds
) {

    public LoweringResult {
        fragments = List.copyOf(fragments);
        findings = List.copyOf(findings);
        loweredNodeIds = List.copyOf(loweredNodeIds);
        failedNodeIds = List.copyOf(failedNodeIds);
    }

    public List<CodeFragment> fragmentsOf(String nodeId) {
        return fragments.stream()
                .filter(f -> nodeId.equals(f.sourceNodeId()))
                .toList();
    }

    public boolean hasFailures() {
        return !failedNodeIds.isEmpty();
    }
}
