package com.infragraph.core.transform;

import com.infragraph.core.graph.ResourceGraph;

/**
 * One step of the rewrite pipeline.
 *
 * <p>Passes run in a fixed order on a graph owned by the pipeline run. Each pass snapshots the
 * nodes it iterates over before it mutates the graph.
 */
public interface GraphPass {

    /**
     * Returns the pass name used in logs.
     *
     * @return pass name
     */
    String name();

    /**
     * Rewrites the graph in place.
     *
     * @param graph graph owned by the current run
     * @param context shared run inputs
     */
    void apply(ResourceGraph graph, PipelineContext context);
}
