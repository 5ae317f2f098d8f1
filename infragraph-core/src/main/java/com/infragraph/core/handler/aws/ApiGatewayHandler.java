package com.infragraph.core.handler.aws;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.handler.AbstractResourceHandler;
import com.infragraph.core.rules.RuleConfiguration;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Links the API Gateway to the Lambda functions it invokes.
 *
 * <p>The gateway and a function never reference each other directly: both point at the same
 * {@code aws_lambda_permission}. Any such shared connection yields {@code gateway -> function};
 * the shared node stays.
 */
public class ApiGatewayHandler extends AbstractResourceHandler {

    private static final String GATEWAY_PREFIX = "aws_api_gateway";
    private static final String FUNCTION_PREFIX = "aws_lambda_function";

    @Override
    public String getId() {
        return "aws-api-gateway";
    }

    @Override
    public void apply(ResourceGraph graph, RuleConfiguration rules) {
        List<String> gateways = sorted(graph.nodesStartingWith(GATEWAY_PREFIX));
        List<String> functions = sorted(graph.nodesStartingWith(FUNCTION_PREFIX));
        for (String gateway : gateways) {
            Set<String> gatewayConnections = new HashSet<>(graph.connections(gateway));
            for (String function : functions) {
                boolean shared = graph.connections(function).stream().anyMatch(gatewayConnections::contains);
                if (shared && graph.connect(gateway, function)) {
                    log.debug("Linked {} to {}", gateway, function);
                }
            }
        }
    }
}
