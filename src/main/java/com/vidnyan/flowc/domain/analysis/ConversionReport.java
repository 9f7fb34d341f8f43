package com.vidnyan.flowc.domain.analysis;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Findings and metrics of one conversion run.
 * Produced by the analyzer and extended through lowering via {@link #toBuilder()}.
 */
public record ConversionReport(
    List<Finding> findings,
    CoverageReport coverage,
    Complexity complexity,
    GraphStats stats,
    List<Cycle> cycles,
    List<String> fallbackNodeIds     // nodes placed in document order because of a cycle
) {

    public ConversionReport {
        findings = List.copyOf(findings);
        coverage = coverage != null ? coverage : CoverageReport.empty();
        complexity = complexity != null ? complexity : Complexity.SIMPLE;
        stats = stats != null ? stats : GraphStats.empty();
        cycles = List.copyOf(cycles);
        fallbackNodeIds = List.copyOf(fallbackNodeIds);
    }

    public static ConversionReport empty() {
        return builder().build();
    }

    /**
     * Structural findings; any of them makes the graph unconvertible.
     */
    public List<Finding> structuralErrors() {
        return findings.stream().filter(Finding::isStructural).toList();
    }

    public boolean hasStructuralErrors() {
        return findings.stream().anyMatch(Finding::isStructural);
    }

    /**
     * Conversion may proceed when structural validity holds.
     */
    public boolean isConvertible() {
        return !hasStructuralErrors();
    }

    /**
     * BLOCKER and ERROR findings.
     */
    public List<Finding> errors() {
        return findings.stream()
                .filter(f -> f.severity() == Severity.BLOCKER || f.severity() == Severity.ERROR)
                .toList();
    }

    public List<Finding> warnings() {
        return bySeverity(Severity.WARN);
    }

    public List<Finding> infos() {
        return bySeverity(Severity.INFO);
    }

    public List<Finding> bySeverity(Severity severity) {
        return findings.stream().filter(f -> f.severity() == severity).toList();
    }

    public List<Finding> byKind(FindingKind kind) {
        return findings.stream().filter(f -> f.kind() == kind).toList();
    }

    public int count(Severity severity) {
        return (int) findings.stream().filter(f -> f.severity() == severity).count();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.findings.addAll(findings);
        builder.coverage = coverage;
        builder.complexity = complexity;
        builder.stats = stats;
        builder.cycles.addAll(cycles);
        builder.fallbackNodeIds.addAll(fallbackNodeIds);
        return builder;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<Finding> findings = new ArrayList<>();
        private CoverageReport coverage = CoverageReport.empty();
        private Complexity complexity = Complexity.SIMPLE;
        private GraphStats stats = GraphStats.empty();
        private final List<Cycle> cycles = new ArrayList<>();
        private final List<String> fallbackNodeIds = new ArrayList<>();

        public Builder finding(Finding finding) { findings.add(finding); return this; }
        public Builder findings(Collection<Finding> all) { findings.addAll(all); return this; }
        public Builder coverage(CoverageReport report) { this.coverage = report; return this; }
        public Builder complexity(Complexity value) { this.complexity = value; return this; }
        public Builder stats(GraphStats value) { this.stats = value; return this; }
        public Builder cycles(Collection<Cycle> all) { cycles.addAll(all); return this; }
        public Builder fallbackNodeIds(Collection<String> ids) { fallbackNodeIds.addAll(ids); return this; }

        public ConversionReport build() {
            return new ConversionReport(findings, coverage, complexity, stats, cycles, fallbackNodeIds);
        }
    }
}
