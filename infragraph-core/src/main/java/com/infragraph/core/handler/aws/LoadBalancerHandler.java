package com.infragraph.core.handler.aws;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.handler.AbstractResourceHandler;
import com.infragraph.core.rules.RuleConfiguration;
import com.infragraph.core.util.ResourceIds;

import java.util.Map;
import java.util.Optional;

/**
 * Resolves generic load balancers to their variant.
 *
 * <p>An {@code aws_lb} node becomes, for instance, {@code aws_alb.elb} when its attributes
 * mention {@code application}. With no keyword match the first declared variant is used.
 * Classic {@code aws_elb} nodes fold into {@code aws_elb.elb}. The variant node takes over
 * the generic node's connections (shared services excepted) and its container parents, and
 * carries the largest count found among its targets.
 */
public class LoadBalancerHandler extends AbstractResourceHandler {

    private static final String LB_TYPE = "aws_lb";
    private static final String CLASSIC_TYPE = "aws_elb";
    private static final String CLASSIC_NODE = "aws_elb.elb";
    private static final String VPC_TYPE = "aws_vpc";
    private static final String SECURITY_GROUP_TYPE = "aws_security_group";

    @Override
    public String getId() {
        return "aws-load-balancer";
    }

    @Override
    public void apply(ResourceGraph graph, RuleConfiguration rules) {
        for (String lb : graph.findNodes(id -> hasType(id, LB_TYPE))) {
            Optional<String> variant = resolveVariant(graph, rules, lb);
            if (variant.isEmpty()) {
                log.warn("No variant declared for {}, leaving it generic", lb);
                continue;
            }
            fold(graph, rules, lb, variant.get() + "." + ResourceIds.nameOf(lb));
        }
        for (String lb : graph.findNodes(id -> hasType(id, CLASSIC_TYPE))) {
            if (!lb.equals(CLASSIC_NODE)) {
                fold(graph, rules, lb, CLASSIC_NODE);
            }
        }
    }

    private static Optional<String> resolveVariant(ResourceGraph graph, RuleConfiguration rules, String lb) {
        String text = String.valueOf(graph.hasMetadata(lb) ? graph.metadata(lb) : Map.of())
            + String.valueOf(graph.originalMetadata(lb));
        Optional<String> variant = rules.variantFor(lb, text);
        if (variant.isPresent()) {
            return variant;
        }
        Map<String, String> declared = rules.nodeVariants().getOrDefault(LB_TYPE, Map.of());
        return declared.values().stream().findFirst();
    }

    private void fold(ResourceGraph graph, RuleConfiguration rules, String lb, String renamed) {
        foldInto(graph, lb, renamed,
            connection -> !rules.isSharedService(connection),
            parent -> isGroup(parent, rules) && !rules.isSharedService(parent) && !hasType(parent, VPC_TYPE));

        int count = graph.connections(renamed).stream().mapToInt(graph::count).max().orElse(0);
        if (count > 1 && count > graph.count(renamed)) {
            graph.setCount(renamed, count);
            for (String parent : graph.parentsOf(renamed)) {
                if (hasType(parent, SECURITY_GROUP_TYPE) && graph.count(parent) < count) {
                    graph.setCount(parent, count);
                }
            }
        }
        log.debug("Resolved load balancer {} to {}", lb, renamed);
    }
}
