package com.infragraph.core.handler.aws;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.handler.AbstractResourceHandler;
import com.infragraph.core.rules.RuleConfiguration;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Links S3 bucket notifications to the functions, topics and queues they trigger.
 *
 * <p>The notification's {@code lambda_function}, {@code topic} and {@code queue} blocks are
 * searched for references to existing nodes of the matching type. Each bucket pointing at the
 * notification is then linked to the same targets, so the diagram shows the bucket driving
 * them. The notification node stays.
 */
public class S3NotificationHandler extends AbstractResourceHandler {

    private static final String NOTIFICATION_TYPE = "aws_s3_bucket_notification";
    private static final String BUCKET_TYPE = "aws_s3_bucket";
    // Notification block -> target resource type.
    private static final Map<String, String> TARGETS = new TreeMap<>(Map.of(
        "lambda_function", "aws_lambda_function",
        "topic", "aws_sns_topic",
        "queue", "aws_sqs_queue"));

    @Override
    public String getId() {
        return "aws-s3-notification";
    }

    @Override
    public void apply(ResourceGraph graph, RuleConfiguration rules) {
        for (String notification : sorted(graph.findNodes(id -> hasType(id, NOTIFICATION_TYPE)))) {
            linkTargets(graph, notification);
            List<String> targets = graph.connections(notification).stream()
                .filter(target -> TARGETS.values().stream().anyMatch(type -> hasType(target, type)))
                .toList();
            for (String bucket : graph.parentsOf(notification)) {
                if (hasType(bucket, BUCKET_TYPE)) {
                    targets.forEach(target -> graph.connect(bucket, target));
                }
            }
        }
    }

    private void linkTargets(ResourceGraph graph, String notification) {
        for (Map.Entry<String, String> entry : TARGETS.entrySet()) {
            Object block = graph.attribute(notification, entry.getKey());
            if (block == null) {
                continue;
            }
            String text = String.valueOf(block);
            for (String target : sorted(graph.findNodes(id -> hasType(id, entry.getValue())))) {
                if (refersTo(text, target)) {
                    graph.connect(notification, target);
                    log.debug("Linked {} to {}", notification, target);
                }
            }
        }
    }
}
