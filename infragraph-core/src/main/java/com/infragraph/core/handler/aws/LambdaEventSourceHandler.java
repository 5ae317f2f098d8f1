package com.infragraph.core.handler.aws;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.handler.AbstractResourceHandler;
import com.infragraph.core.rules.RuleConfiguration;

import java.util.List;

/**
 * Replaces Lambda event source mappings by direct edges from the source to the function.
 *
 * <p>A mapping connected to both an event source (queue, stream, table, broker) and a function
 * yields {@code source -> function} and is removed. A mapping lacking one side is kept.
 */
public class LambdaEventSourceHandler extends AbstractResourceHandler {

    private static final String MAPPING_TYPE = "aws_lambda_event_source_mapping";
    private static final String FUNCTION_PREFIX = "aws_lambda_function";
    private static final List<String> SOURCE_PREFIXES = List.of(
        "aws_sqs_queue", "aws_kinesis_stream", "aws_dynamodb_table", "aws_msk_cluster", "aws_mq_broker");

    @Override
    public String getId() {
        return "aws-lambda-event-source";
    }

    @Override
    public void apply(ResourceGraph graph, RuleConfiguration rules) {
        for (String mapping : sorted(graph.findNodes(id -> hasType(id, MAPPING_TYPE)))) {
            List<String> connections = List.copyOf(graph.connections(mapping));
            List<String> sources = connections.stream()
                .filter(c -> SOURCE_PREFIXES.stream().anyMatch(prefix -> startsWith(c, prefix)))
                .toList();
            List<String> functions = connections.stream()
                .filter(c -> startsWith(c, FUNCTION_PREFIX))
                .toList();
            if (sources.isEmpty() || functions.isEmpty()) {
                continue;
            }
            for (String source : sources) {
                functions.forEach(function -> graph.connect(source, function));
            }
            graph.removeNode(mapping);
            log.debug("Linked {} to {} in place of {}", sources, functions, mapping);
        }
    }
}
