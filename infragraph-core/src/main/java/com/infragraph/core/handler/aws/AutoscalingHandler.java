package com.infragraph.core.handler.aws;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.handler.AbstractResourceHandler;
import com.infragraph.core.rules.RuleConfiguration;

import java.util.List;

/**
 * Places application autoscaling targets inside the subnets of the services they scale.
 *
 * <p>A service both scaled by a target and contained in a subnet takes the subnet's count, as
 * does the target. The target then replaces the service in the subnet. Targets with no
 * matching service are left alone.
 */
public class AutoscalingHandler extends AbstractResourceHandler {

    private static final String TARGET_TYPE = "aws_appautoscaling_target";
    private static final String SUBNET_TYPE = "aws_subnet";

    @Override
    public String getId() {
        return "aws-autoscaling";
    }

    @Override
    public void apply(ResourceGraph graph, RuleConfiguration rules) {
        List<String> targets = graph.findNodes(id -> hasType(id, TARGET_TYPE));
        if (targets.isEmpty()) {
            return;
        }
        List<String> scaled = List.copyOf(graph.connections(targets.get(0)));
        List<String> subnets = graph.findNodes(id -> hasType(id, SUBNET_TYPE));

        for (String target : targets) {
            inheritSubnetCount(graph, target, scaled, subnets);
            for (String service : List.copyOf(graph.connections(target))) {
                for (String parent : graph.parentsOf(service)) {
                    if (!hasType(parent, SUBNET_TYPE)) {
                        continue;
                    }
                    graph.connect(parent, target);
                    graph.disconnect(parent, service);
                    log.debug("Autoscaling target {} replaces {} in {}", target, service, parent);
                }
            }
        }
    }

    private void inheritSubnetCount(ResourceGraph graph, String target, List<String> scaled, List<String> subnets) {
        for (String subnet : subnets) {
            int count = graph.count(subnet);
            if (count <= 0) {
                continue;
            }
            for (String service : scaled) {
                if (graph.hasConnection(subnet, service) && graph.count(target) == 0) {
                    graph.setCount(target, count);
                    graph.setCount(service, count);
                }
            }
        }
    }
}
