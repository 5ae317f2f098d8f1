package com.infragraph.core.transform.pass;

import com.infragraph.core.detect.MultiInstanceDetector;
import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.transform.GraphPass;
import com.infragraph.core.transform.PipelineContext;

/**
 * Runs the {@link MultiInstanceDetector} when expansion is enabled.
 */
public class MultiInstanceDetectionPass implements GraphPass {

    @Override
    public String name() {
        return "detect-multi-instance";
    }

    @Override
    public void apply(ResourceGraph graph, PipelineContext context) {
        if (context.options().expandMultiInstance()) {
            new MultiInstanceDetector(context.rules()).detect(context.inventory(), graph);
        }
    }
}
