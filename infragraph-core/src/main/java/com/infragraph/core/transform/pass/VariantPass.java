package com.infragraph.core.transform.pass;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.rules.RuleConfiguration;
import com.infragraph.core.transform.GraphPass;
import com.infragraph.core.transform.PipelineContext;
import com.infragraph.core.util.ResourceIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Renames resources to their variant type, {@code aws_rds.db} to {@code aws_rds_aurora.db} for
 * instance, by the first variant keyword found in their attributes.
 *
 * <p>Types dispatched to a provider handler resolve their own variants and are skipped.
 */
public class VariantPass implements GraphPass {

    private static final Logger log = LoggerFactory.getLogger(VariantPass.class);

    @Override
    public String name() {
        return "variants";
    }

    @Override
    public void apply(ResourceGraph graph, PipelineContext context) {
        RuleConfiguration rules = context.rules();
        for (String node : graph.nodeSnapshot()) {
            if (!graph.contains(node) || graph.isHidden(node)) {
                continue;
            }
            String type = ResourceIds.typeOf(node);
            if (rules.isSpecialType(type)) {
                continue;
            }
            Optional<String> variant = rules.variantFor(node, attributeText(graph, node));
            if (variant.isEmpty() || variant.get().equals(type)) {
                continue;
            }
            String renamed = rename(node, type, variant.get());
            graph.renameNode(node, renamed);
            log.debug("Resolved variant {} -> {}", node, renamed);
        }
    }

    static String rename(String node, String type, String variantType) {
        int index = node.lastIndexOf(type + ".");
        return node.substring(0, index) + variantType + node.substring(index + type.length());
    }

    private static String attributeText(ResourceGraph graph, String node) {
        Map<String, Object> working = graph.hasMetadata(node) ? graph.metadata(node) : Map.of();
        return working + " " + graph.originalMetadata(node);
    }
}
