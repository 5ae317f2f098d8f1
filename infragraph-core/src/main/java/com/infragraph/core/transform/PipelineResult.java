package com.infragraph.core.transform;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.model.Diagnostic;
import com.infragraph.core.model.ProviderDetection;
import com.infragraph.core.rules.RuleConfiguration;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a pipeline run.
 *
 * @param graph rewritten graph
 * @param detection providers the run used
 * @param rules merged rules of those providers
 * @param diagnostics validator findings, empty when validation was off
 */
public record PipelineResult(
    ResourceGraph graph,
    ProviderDetection detection,
    RuleConfiguration rules,
    List<Diagnostic> diagnostics
) {
    /**
     * Compact constructor with validation.
     */
    public PipelineResult {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(detection, "detection must not be null");
        Objects.requireNonNull(rules, "rules must not be null");
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }
}
