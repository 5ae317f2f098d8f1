package com.infragraph.core.handler.aws;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.handler.AbstractResourceHandler;
import com.infragraph.core.rules.RuleConfiguration;

import java.util.List;

/**
 * Links resources that reference a queue policy directly to the queue the policy governs,
 * so producers point at the queue rather than at its policy.
 */
public class SqsQueuePolicyHandler extends AbstractResourceHandler {

    private static final String POLICY_TYPE = "aws_sqs_queue_policy";
    private static final String QUEUE_TYPE = "aws_sqs_queue";

    @Override
    public String getId() {
        return "aws-sqs-queue-policy";
    }

    @Override
    public void apply(ResourceGraph graph, RuleConfiguration rules) {
        for (String node : graph.nodeSnapshot()) {
            for (String connection : List.copyOf(graph.connections(node))) {
                if (!connection.contains(POLICY_TYPE)) {
                    continue;
                }
                for (String queue : graph.connections(connection)) {
                    if (queue.contains(QUEUE_TYPE) && !queue.contains("policy") && !queue.equals(node)) {
                        if (graph.connect(node, queue)) {
                            log.debug("Linked {} to queue {} via {}", node, queue, connection);
                        }
                    }
                }
            }
        }
    }
}
